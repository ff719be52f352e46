package com.termindex.posting;

import org.roaringbitmap.longlong.LongIterator;
import org.roaringbitmap.longlong.Roaring64NavigableMap;

import java.util.NoSuchElementException;
import java.util.PrimitiveIterator;

/**
 * 基于 Roaring 64 位位图的倒排列表。
 *
 * 高 32 位划分桶，每个桶内按局部密度选择位图、有序数组或游程容器，
 * 插入与并集的摊还代价为每元素 O(1)，枚举天然有序。
 */
public final class RoaringPostingList implements PostingList {
    private final Roaring64NavigableMap bitmap;

    private RoaringPostingList(Roaring64NavigableMap bitmap) {
        this.bitmap = bitmap;
    }

    /**
     * 创建空集合。
     */
    public static RoaringPostingList create() {
        return new RoaringPostingList(new Roaring64NavigableMap());
    }

    /**
     * 创建仅含一个条目ID的集合。
     */
    public static RoaringPostingList of(long itemId) {
        RoaringPostingList postingList = create();
        postingList.insert(itemId);
        return postingList;
    }

    /**
     * 创建包含给定条目ID的集合，重复值自动去重。
     */
    public static RoaringPostingList of(long... itemIds) {
        RoaringPostingList postingList = create();
        for (long itemId : itemIds) {
            postingList.insert(itemId);
        }
        return postingList;
    }

    @Override
    public void insert(long itemId) {
        bitmap.addLong(itemId);
    }

    @Override
    public void union(PostingList other) {
        if (other == this) {
            return;
        }
        if (other instanceof RoaringPostingList roaring) {
            bitmap.or(roaring.bitmap);
            return;
        }
        PrimitiveIterator.OfLong iterator = other.iterator();
        while (iterator.hasNext()) {
            bitmap.addLong(iterator.nextLong());
        }
    }

    @Override
    public boolean contains(long itemId) {
        return bitmap.contains(itemId);
    }

    @Override
    public boolean isEmpty() {
        return bitmap.isEmpty();
    }

    @Override
    public long len() {
        return bitmap.getLongCardinality();
    }

    @Override
    public PrimitiveIterator.OfLong iterator() {
        LongIterator delegate = bitmap.getLongIterator();
        return new PrimitiveIterator.OfLong() {
            @Override
            public boolean hasNext() {
                return delegate.hasNext();
            }

            @Override
            public long nextLong() {
                if (!delegate.hasNext()) {
                    throw new NoSuchElementException();
                }
                return delegate.next();
            }
        };
    }

    @Override
    public long[] toArray() {
        return bitmap.toArray();
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof RoaringPostingList roaring)) {
            return false;
        }
        // 按内容比较，容器类型与空桶不影响相等性
        if (len() != roaring.len()) {
            return false;
        }
        PrimitiveIterator.OfLong left = iterator();
        PrimitiveIterator.OfLong right = roaring.iterator();
        while (left.hasNext()) {
            if (left.nextLong() != right.nextLong()) {
                return false;
            }
        }
        return true;
    }

    @Override
    public int hashCode() {
        int hash = 1;
        PrimitiveIterator.OfLong iterator = iterator();
        while (iterator.hasNext()) {
            hash = 31 * hash + Long.hashCode(iterator.nextLong());
        }
        return hash;
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder("{");
        PrimitiveIterator.OfLong iterator = iterator();
        while (iterator.hasNext()) {
            builder.append(Long.toUnsignedString(iterator.nextLong()));
            if (iterator.hasNext()) {
                builder.append(',');
            }
        }
        return builder.append('}').toString();
    }
}
