package com.termindex.index;

import java.io.Closeable;
import java.io.IOException;

/**
 * 单次遍历的字段游标，每个词项产出一个 {@link PostingValue}。
 *
 * <p>同一次遍历中词项不重复，升序时严格递增、降序时严格递减。
 * 实例非线程安全，持有者必须在所有退出路径上关闭它以释放底层存储游标。
 */
public interface FieldIterator extends Closeable {

    /**
     * 前进到下一个词项。
     *
     * @return 产出新值时返回 true；遍历结束后始终返回 false
     * @throws IOException 键解码失败时抛出，此后迭代器进入结束状态
     */
    boolean next() throws IOException;

    /**
     * @return 当前词项的倒排值
     * @throws IllegalStateException 尚未成功调用 {@link #next()} 时抛出
     */
    PostingValue value();

    /**
     * 释放底层游标，重复调用为空操作。
     */
    @Override
    void close() throws IOException;
}
