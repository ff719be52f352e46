package com.termindex.codec;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;

/**
 * 逻辑词项与 Java 值之间的转换工具。
 */
public final class Terms {

    private Terms() {
        // 工具类，禁止实例化
    }

    public static byte[] of(String value) {
        if (value == null) {
            throw new IllegalArgumentException("词项字符串不能为null");
        }
        return value.getBytes(StandardCharsets.UTF_8);
    }

    public static byte[] of(long value) {
        return ByteBuffer.allocate(Long.BYTES).putLong(value).array();
    }

    public static String toStringValue(byte[] term) {
        return new String(term, StandardCharsets.UTF_8);
    }

    /**
     * @throws IllegalArgumentException 词项长度不是 8 字节时抛出
     */
    public static long toLong(byte[] term) {
        if (term == null || term.length != Long.BYTES) {
            throw new IllegalArgumentException("INT64 词项必须为 8 字节: " + (term == null ? "null" : term.length));
        }
        return ByteBuffer.wrap(term).getLong();
    }

    /**
     * 按类型渲染词项，供日志与 CLI 输出使用。
     */
    public static String render(TermType type, byte[] term) {
        if (type == TermType.INT64 && term.length == Long.BYTES) {
            return Long.toString(toLong(term));
        }
        return toStringValue(term);
    }
}
