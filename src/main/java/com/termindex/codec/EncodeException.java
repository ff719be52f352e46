package com.termindex.codec;

/**
 * 字段与 schema 不兼容，无法编码为存储键。
 */
public class EncodeException extends IllegalArgumentException {
    private final transient Field field;

    public EncodeException(String message, Field field) {
        super(message + ", field=" + field);
        this.field = field;
    }

    public Field getField() {
        return field;
    }
}
