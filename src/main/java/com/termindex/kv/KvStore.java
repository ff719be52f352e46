package com.termindex.kv;

import java.io.Closeable;
import java.io.IOException;

/**
 * 有序 KV 存储的只读能力：游标扫描与按键前缀的批量取值。
 */
public interface KvStore extends Closeable {

    /**
     * 打开一个新游标，初始位置为前缀范围起点。
     */
    KvIterator newIterator(ScanOptions options);

    /**
     * 按键升序访问所有以 key 为前缀的条目的值，visitor 抛出异常时立即停止并向上传播。
     *
     * @param key 键前缀
     * @param visitor 值访问回调
     * @throws KeyNotFoundException 不存在任何匹配条目时抛出
     * @throws IOException 读取失败或 visitor 失败时抛出
     */
    void getAll(byte[] key, ValueVisitor visitor) throws IOException;

    /**
     * 值访问回调。
     */
    @FunctionalInterface
    interface ValueVisitor {
        void visit(byte[] value) throws IOException;
    }
}
