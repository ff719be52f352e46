package com.termindex.kv;

import java.io.Closeable;
import java.io.IOException;

/**
 * 有序存储游标，按无符号字节字典序在前缀范围内正向或反向遍历。
 *
 * <p>实例非线程安全，持有者必须在所有退出路径上调用 {@link #close()}。
 */
public interface KvIterator extends Closeable {

    /**
     * 正向定位到首个不小于 key 的键；反向定位到最后一个不大于 key 的键。
     */
    void seek(byte[] key);

    /**
     * 定位到前缀范围的起点（正向为首键，反向为末键）。
     */
    void rewind();

    /**
     * @return 当前位置有效且仍在前缀范围内时返回 true
     */
    boolean valid();

    void next();

    /**
     * @throws IllegalStateException 游标无效时抛出
     */
    byte[] key();

    /**
     * @throws IllegalStateException 游标无效时抛出
     */
    byte[] val();

    @Override
    void close() throws IOException;
}
