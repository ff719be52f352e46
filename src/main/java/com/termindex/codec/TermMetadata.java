package com.termindex.codec;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 词项 schema：默认词项类型 + 按字段ID覆盖的类型。
 *
 * <p>同时提供词项比较器，范围扫描的边界判断一律经由 {@link #compare} 完成，
 * 不直接比较逻辑词项的原始字节。
 */
public final class TermMetadata {
    private final TermType defaultType;
    private final Map<Integer, TermType> fieldTypes;

    public TermMetadata(TermType defaultType, Map<Integer, TermType> fieldTypes) {
        if (defaultType == null) {
            throw new IllegalArgumentException("默认词项类型不能为null");
        }
        this.defaultType = defaultType;
        this.fieldTypes = fieldTypes == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(fieldTypes));
    }

    /**
     * 所有字段均为 STRING 类型的 schema。
     */
    public static TermMetadata strings() {
        return new TermMetadata(TermType.STRING, Map.of());
    }

    /**
     * 返回一个在当前 schema 基础上覆盖指定字段类型的新实例。
     */
    public TermMetadata withField(int fieldId, TermType type) {
        Map<Integer, TermType> merged = new LinkedHashMap<>(fieldTypes);
        merged.put(fieldId, type);
        return new TermMetadata(defaultType, merged);
    }

    public TermType typeOf(int fieldId) {
        return fieldTypes.getOrDefault(fieldId, defaultType);
    }

    public TermType defaultType() {
        return defaultType;
    }

    public Map<Integer, TermType> fieldTypes() {
        return fieldTypes;
    }

    /**
     * 按字段类型比较两个逻辑词项。
     *
     * @return 负数、零或正数，分别表示 left 小于、等于或大于 right
     */
    public int compare(int fieldId, byte[] left, byte[] right) {
        if (typeOf(fieldId) == TermType.INT64) {
            return Long.compare(Terms.toLong(left), Terms.toLong(right));
        }
        return Arrays.compareUnsigned(left, right);
    }

    @Override
    public String toString() {
        return "TermMetadata{default=" + defaultType + ", fields=" + fieldTypes + "}";
    }
}
