package com.termindex.codec;

/**
 * 索引内字段标识：分片ID + 字段ID。
 *
 * @param shardId 分片ID（按无符号大端编码）
 * @param fieldId 字段ID（按无符号大端编码）
 */
public record FieldKey(int shardId, int fieldId) {

    public static FieldKey of(int shardId, int fieldId) {
        return new FieldKey(shardId, fieldId);
    }

    @Override
    public String toString() {
        return shardId + "/" + fieldId;
    }
}
