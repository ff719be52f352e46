package com.termindex.posting;

import java.util.PrimitiveIterator;

/**
 * 倒排列表：有序、去重的 64 位条目ID集合。
 *
 * <p>条目ID按无符号 64 位比较，枚举顺序为升序。insert 与 union 幂等且满足交换律，
 * 重复合并同一贡献不会改变结果。实例非线程安全。
 */
public interface PostingList {

    /**
     * 插入条目ID，已存在时为空操作。
     */
    void insert(long itemId);

    /**
     * 将 other 并入当前集合。
     */
    void union(PostingList other);

    boolean contains(long itemId);

    boolean isEmpty();

    /**
     * @return 集合基数
     */
    long len();

    /**
     * @return 升序迭代器
     */
    PrimitiveIterator.OfLong iterator();

    /**
     * @return 升序数组快照
     */
    long[] toArray();
}
