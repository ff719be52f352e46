package com.termindex.config;

/**
 * 全局常量定义
 *
 * 包含键编码布局、存储文件魔数与查询默认参数
 */
public final class Constants {
    private Constants() {
        // 工具类，禁止实例化
    }

    // ==================== 键编码布局 ====================
    /** FieldKey 编码长度：shardId(4B) + fieldId(4B) */
    public static final int FIELD_KEY_BYTES = Integer.BYTES * 2;
    /** 条目ID编码长度（大端 uint64） */
    public static final int ITEM_ID_BYTES = Long.BYTES;
    /** 字符串词项中 0x00 的引导字节，后随 TERM_ESCAPE 或 TERM_TERMINATOR */
    public static final byte TERM_ESCAPE_LEAD = 0x00;
    /** 0x00 0xFF 表示词项内的 0x00 */
    public static final byte TERM_ESCAPE = (byte) 0xFF;
    /** 0x00 0x01 表示词项结束 */
    public static final byte TERM_TERMINATOR = 0x01;

    // ==================== 存储格式魔数 ====================
    /** 有序KV文件魔数 "TIKV" */
    public static final int SORTED_FILE_MAGIC = 0x54494B56;
    /** 文件格式版本号 */
    public static final short FORMAT_VERSION = 1;

    // ==================== 查询参数 ====================
    /** CLI 默认输出的词项数量上限 */
    public static final int DEFAULT_TERM_LIMIT = 100;
    /** CLI 允许的词项数量上限 */
    public static final int MAX_TERM_LIMIT = 100_000;
    /** 单个词项最大字节数 */
    public static final int MAX_TERM_BYTES = 64 * 1024;
}
