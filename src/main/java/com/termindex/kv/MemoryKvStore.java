package com.termindex.kv;

import java.io.IOException;
import java.util.Arrays;
import java.util.Collections;
import java.util.Map;
import java.util.NavigableMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 基于跳表的内存有序存储，支持并发读取。
 *
 * 键按无符号字节字典序排列，同一个键只保留最后写入的值。
 */
public final class MemoryKvStore implements KvStore {
    private final ConcurrentSkipListMap<byte[], byte[]> entries = new ConcurrentSkipListMap<>(KeyBytes.UNSIGNED_ORDER);
    private final AtomicInteger openIterators = new AtomicInteger();
    private volatile boolean closed;

    /**
     * 写入或覆盖一个条目。
     */
    public void put(byte[] key, byte[] value) {
        ensureOpen();
        if (key == null || value == null) {
            throw new IllegalArgumentException("key与value不能为null");
        }
        entries.put(Arrays.copyOf(key, key.length), Arrays.copyOf(value, value.length));
    }

    /**
     * @return 条目数量
     */
    public int size() {
        return entries.size();
    }

    /**
     * @return 尚未关闭的游标数量
     */
    public int openIterators() {
        return openIterators.get();
    }

    /**
     * 返回按键升序排列的只读视图。
     */
    NavigableMap<byte[], byte[]> view() {
        return Collections.unmodifiableNavigableMap(entries);
    }

    @Override
    public KvIterator newIterator(ScanOptions options) {
        ensureOpen();
        MapIterator iterator = new MapIterator(options.prefix(), options.reverse());
        openIterators.incrementAndGet();
        iterator.rewind();
        return iterator;
    }

    @Override
    public void getAll(byte[] key, ValueVisitor visitor) throws IOException {
        ensureOpen();
        boolean found = false;
        for (Map.Entry<byte[], byte[]> entry : entries.tailMap(key, true).entrySet()) {
            if (!KeyBytes.startsWith(entry.getKey(), key)) {
                break;
            }
            found = true;
            visitor.visit(entry.getValue());
        }
        if (!found) {
            throw new KeyNotFoundException(key);
        }
    }

    @Override
    public void close() {
        closed = true;
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("MemoryKvStore 已关闭");
        }
    }

    /**
     * 基于 floor/ceiling 导航的游标，每步 O(log n)，不持有快照。
     */
    private final class MapIterator implements KvIterator {
        private final byte[] prefix;
        private final boolean reverse;
        private Map.Entry<byte[], byte[]> current;
        private boolean released;

        private MapIterator(byte[] prefix, boolean reverse) {
            this.prefix = prefix;
            this.reverse = reverse;
        }

        @Override
        public void seek(byte[] key) {
            ensureUsable();
            current = reverse ? entries.floorEntry(key) : entries.ceilingEntry(key);
        }

        @Override
        public void rewind() {
            ensureUsable();
            if (!reverse) {
                current = entries.ceilingEntry(prefix);
                return;
            }
            byte[] successor = KeyBytes.successor(prefix);
            current = successor == null ? entries.lastEntry() : entries.lowerEntry(successor);
        }

        @Override
        public boolean valid() {
            return !released && current != null && KeyBytes.startsWith(current.getKey(), prefix);
        }

        @Override
        public void next() {
            ensureUsable();
            if (current == null) {
                return;
            }
            current = reverse ? entries.lowerEntry(current.getKey()) : entries.higherEntry(current.getKey());
        }

        @Override
        public byte[] key() {
            ensureValid();
            return Arrays.copyOf(current.getKey(), current.getKey().length);
        }

        @Override
        public byte[] val() {
            ensureValid();
            return Arrays.copyOf(current.getValue(), current.getValue().length);
        }

        @Override
        public void close() {
            if (released) {
                return;
            }
            released = true;
            current = null;
            openIterators.decrementAndGet();
        }

        private void ensureUsable() {
            if (released) {
                throw new IllegalStateException("游标已关闭");
            }
        }

        private void ensureValid() {
            if (!valid()) {
                throw new IllegalStateException("游标无效");
            }
        }
    }
}
