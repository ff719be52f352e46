package com.termindex.codec;

import java.util.Arrays;
import java.util.Objects;

/**
 * 查询或存储单元：字段标识 + 词项 + 可选条目ID。
 *
 * <p>词项以逻辑字节表示，STRING 为原始 UTF-8 字节，INT64 为 8 字节大端补码，
 * 可通过 {@link Terms} 构造。value 仅在解码存储键时有意义。
 */
public final class Field {
    private final FieldKey key;
    private final byte[] term;
    private final Long value;

    private Field(FieldKey key, byte[] term, Long value) {
        if (key == null) {
            throw new IllegalArgumentException("FieldKey不能为null");
        }
        if (term == null) {
            throw new IllegalArgumentException("term不能为null, key=" + key);
        }
        this.key = key;
        this.term = Arrays.copyOf(term, term.length);
        this.value = value;
    }

    /**
     * 构造不带条目ID的字段，用于精确匹配与范围边界。
     */
    public static Field of(FieldKey key, byte[] term) {
        return new Field(key, term, null);
    }

    /**
     * 构造带条目ID的字段，对应一条存储记录。
     */
    public static Field of(FieldKey key, byte[] term, long itemId) {
        return new Field(key, term, itemId);
    }

    public FieldKey key() {
        return key;
    }

    public byte[] term() {
        return Arrays.copyOf(term, term.length);
    }

    /**
     * 返回内部词项数组，调用方不得修改。
     */
    byte[] rawTerm() {
        return term;
    }

    public boolean hasValue() {
        return value != null;
    }

    /**
     * @return 条目ID
     * @throws IllegalStateException 字段不含条目ID时抛出
     */
    public long value() {
        if (value == null) {
            throw new IllegalStateException("字段不含条目ID: " + this);
        }
        return value;
    }

    /**
     * 与另一个词项做字节级比较。
     */
    public boolean termEquals(byte[] otherTerm) {
        return Arrays.equals(term, otherTerm);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof Field field)) {
            return false;
        }
        return key.equals(field.key) && Arrays.equals(term, field.term) && Objects.equals(value, field.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(key, Arrays.hashCode(term), value);
    }

    @Override
    public String toString() {
        return "Field{key=" + key + ", term=" + Arrays.toString(term) + (value == null ? "" : ", value=" + Long.toUnsignedString(value)) + "}";
    }
}
