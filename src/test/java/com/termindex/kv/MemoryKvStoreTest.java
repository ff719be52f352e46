package com.termindex.kv;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class MemoryKvStoreTest {
    private MemoryKvStore store;

    @BeforeEach
    void setUp() {
        store = new MemoryKvStore();
        store.put(bytes(1, 0), bytes(10));
        store.put(bytes(1, 1), bytes(11));
        store.put(bytes(1, 0xFF), bytes(12));
        store.put(bytes(2), bytes(20));
        store.put(bytes(0, 9), bytes(9));
        store.put(bytes(1), bytes(1));
    }

    @Test
    @DisplayName("正向游标按无符号字节序遍历前缀")
    void testForwardPrefixScan() throws IOException {
        try (KvIterator iterator = store.newIterator(ScanOptions.forward(bytes(1)))) {
            List<byte[]> keys = collectKeys(iterator);
            List<byte[]> expected = List.of(bytes(1), bytes(1, 0), bytes(1, 1), bytes(1, 0xFF));
            assertEquals(expected.size(), keys.size());
            for (int i = 0; i < expected.size(); i++) {
                assertArrayEquals(expected.get(i), keys.get(i));
            }
        }
    }

    @Test
    void testReversePrefixScan() throws IOException {
        try (KvIterator iterator = store.newIterator(ScanOptions.reverse(bytes(1)))) {
            List<byte[]> keys = collectKeys(iterator);
            assertEquals(4, keys.size());
            assertArrayEquals(bytes(1, 0xFF), keys.get(0));
            assertArrayEquals(bytes(1), keys.get(3));
        }
    }

    @Test
    @DisplayName("全 0xFF 前缀的反向游标从末尾开始")
    void testReverseScanWithMaxPrefix() throws IOException {
        store.put(bytes(0xFF, 0xFF), bytes(1));
        store.put(bytes(0xFF, 0xFF, 3), bytes(2));

        try (KvIterator iterator = store.newIterator(ScanOptions.reverse(bytes(0xFF, 0xFF)))) {
            List<byte[]> keys = collectKeys(iterator);
            assertEquals(2, keys.size());
            assertArrayEquals(bytes(0xFF, 0xFF, 3), keys.get(0));
        }
        try (KvIterator iterator = store.newIterator(ScanOptions.reverse(new byte[0]))) {
            assertEquals(8, collectKeys(iterator).size());
        }
    }

    @Test
    void testSeekAndRewind() throws IOException {
        try (KvIterator forward = store.newIterator(ScanOptions.forward(bytes(1)))) {
            forward.seek(bytes(1, 0x80));
            assertTrue(forward.valid());
            assertArrayEquals(bytes(1, 0xFF), forward.key());
            assertArrayEquals(bytes(12), forward.val());

            forward.seek(bytes(1, 0xFF, 0));
            assertFalse(forward.valid(), "越过前缀后游标失效");

            forward.rewind();
            assertArrayEquals(bytes(1), forward.key());
        }

        try (KvIterator reverse = store.newIterator(ScanOptions.reverse(bytes(1)))) {
            reverse.seek(bytes(1, 0x80));
            assertArrayEquals(bytes(1, 1), reverse.key());
            reverse.seek(bytes(0, 0xFF));
            assertFalse(reverse.valid());
        }
    }

    @Test
    void testGetAllVisitsPrefixInOrder() throws IOException {
        List<byte[]> values = new ArrayList<>();
        store.getAll(bytes(1), values::add);

        assertEquals(4, values.size());
        assertArrayEquals(bytes(1), values.get(0));
        assertArrayEquals(bytes(12), values.get(3));
    }

    @Test
    void testGetAllMissingKey() {
        assertThrows(KeyNotFoundException.class, () -> store.getAll(bytes(3), value -> { }));
        assertThrows(KeyNotFoundException.class, () -> store.getAll(bytes(1, 2), value -> { }));
    }

    @Test
    @DisplayName("visitor 抛出异常时停止访问并向上传播")
    void testGetAllStopsOnVisitorFailure() {
        List<byte[]> visited = new ArrayList<>();
        IOException exception = assertThrows(IOException.class, () -> store.getAll(bytes(1), value -> {
            visited.add(value);
            throw new IOException("stop");
        }));

        assertEquals("stop", exception.getMessage());
        assertEquals(1, visited.size());
    }

    @Test
    void testIteratorAccounting() throws IOException {
        KvIterator first = store.newIterator(ScanOptions.forward(bytes(1)));
        KvIterator second = store.newIterator(ScanOptions.reverse(bytes(2)));
        assertEquals(2, store.openIterators());

        first.close();
        first.close();
        assertEquals(1, store.openIterators());
        assertFalse(first.valid());
        assertThrows(IllegalStateException.class, first::next);

        second.close();
        assertEquals(0, store.openIterators());
    }

    @Test
    void testPutOverwritesAndCopies() throws IOException {
        byte[] key = bytes(5);
        byte[] value = bytes(50);
        store.put(key, value);
        value[0] = 0;
        store.put(bytes(5), bytes(51));

        assertEquals(7, store.size());
        List<byte[]> values = new ArrayList<>();
        store.getAll(bytes(5), values::add);
        assertArrayEquals(bytes(51), values.get(0));
    }

    @Test
    void testClosedStoreRejectsAccess() {
        store.close();
        assertThrows(IllegalStateException.class, () -> store.put(bytes(9), bytes(9)));
        assertThrows(IllegalStateException.class, () -> store.newIterator(ScanOptions.forward(null)));
    }

    @Test
    void testInvalidCursorAccessThrows() throws IOException {
        try (KvIterator iterator = store.newIterator(ScanOptions.forward(bytes(7)))) {
            assertFalse(iterator.valid());
            assertThrows(IllegalStateException.class, iterator::key);
            iterator.next();
            assertFalse(iterator.valid());
        }
    }

    @Test
    void testSuccessor() {
        assertArrayEquals(bytes(1, 3), KeyBytes.successor(bytes(1, 2)));
        assertArrayEquals(bytes(2), KeyBytes.successor(bytes(1, 0xFF)));
        assertNull(KeyBytes.successor(bytes(0xFF, 0xFF)));
        assertNull(KeyBytes.successor(new byte[0]));
    }

    static byte[] bytes(int... values) {
        byte[] result = new byte[values.length];
        for (int i = 0; i < values.length; i++) {
            result[i] = (byte) values[i];
        }
        return result;
    }

    private static List<byte[]> collectKeys(KvIterator iterator) {
        List<byte[]> keys = new ArrayList<>();
        while (iterator.valid()) {
            keys.add(iterator.key());
            iterator.next();
        }
        return keys;
    }
}
