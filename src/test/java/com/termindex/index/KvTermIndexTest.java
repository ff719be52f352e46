package com.termindex.index;

import com.termindex.codec.DecodeException;
import com.termindex.codec.Field;
import com.termindex.codec.FieldCodec;
import com.termindex.codec.FieldKey;
import com.termindex.codec.Terms;
import com.termindex.kv.MemoryKvStore;
import com.termindex.posting.PostingList;
import com.termindex.posting.RoaringPostingList;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static com.termindex.index.IndexFixtures.LATENCY;
import static com.termindex.index.IndexFixtures.METADATA;
import static com.termindex.index.IndexFixtures.METHOD;
import static com.termindex.index.IndexFixtures.STATUS;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class KvTermIndexTest {
    private MemoryKvStore store;
    private KvTermIndex index;

    @BeforeEach
    void setUp() {
        store = IndexFixtures.httpStore();
        index = new KvTermIndex(store, METADATA);
    }

    @Test
    @DisplayName("精确匹配返回词项的全部条目")
    void testMatchTerms() throws IOException {
        assertEquals(RoaringPostingList.of(1, 2, 3), index.matchTerms(Field.of(METHOD, Terms.of("GET"))));
        assertEquals(RoaringPostingList.of(4, 5), index.matchTerms(Field.of(METHOD, Terms.of("POST"))));
        assertEquals(RoaringPostingList.of(3, 5), index.matchTerms(Field.of(STATUS, Terms.of("500"))));
    }

    @Test
    @DisplayName("不存在的词项返回空集合而非异常")
    void testMatchTermsMissingTermIsEmpty() throws IOException {
        assertTrue(index.matchTerms(Field.of(METHOD, Terms.of("PUT"))).isEmpty());
        assertTrue(index.matchTerms(Field.of(METHOD, Terms.of("GE"))).isEmpty(), "词项前缀不应命中");
        assertTrue(index.matchTerms(Field.of(FieldKey.of(2, 7), Terms.of("GET"))).isEmpty());
    }

    @Test
    void testMatchTermsIgnoresFieldValue() throws IOException {
        assertEquals(RoaringPostingList.of(1, 2, 3), index.matchTerms(Field.of(METHOD, Terms.of("GET"), 42)));
    }

    @Test
    @DisplayName("值损坏时精确匹配抛出解码异常")
    void testMatchTermsCorruptValue() {
        store.put(FieldCodec.marshal(Field.of(METHOD, Terms.of("PATCH"), 9), METADATA), new byte[] {1, 2, 3});
        assertThrows(DecodeException.class, () -> index.matchTerms(Field.of(METHOD, Terms.of("PATCH"))));
    }

    @Test
    void testMatchFieldUnionsAllTerms() throws IOException {
        assertEquals(RoaringPostingList.of(1, 2, 3, 4, 5), index.matchField(METHOD));
        assertEquals(RoaringPostingList.of(1, 2, 3, 4, 5), index.matchField(STATUS));
        assertTrue(index.matchField(LATENCY).isEmpty());
        assertEquals(0, store.openIterators());
    }

    @Test
    void testRange() throws IOException {
        KvTermIndex letters = new KvTermIndex(IndexFixtures.letterStore(), METADATA);

        PostingList result = letters.range(STATUS, RangeOpts.between(Terms.of("B"), true, Terms.of("C"), true));
        assertArrayEquals(new long[] {20, 30, 31}, result.toArray());
        assertArrayEquals(new long[] {30, 31, 40, 41},
            letters.range(STATUS, RangeOpts.greaterThan(Terms.of("B"))).toArray());
        assertTrue(letters.range(STATUS, RangeOpts.between(Terms.of("E"), true, Terms.of("Z"), true)).isEmpty());
        assertArrayEquals(new long[] {99}, letters.range(METHOD, null).toArray());
    }

    @Test
    @DisplayName("INT64 范围按有符号数值比较")
    void testNumericRange() throws IOException {
        KvTermIndex latency = new KvTermIndex(IndexFixtures.latencyStore(), METADATA);

        // 写入顺序 100,-5,3,0,-1 对应条目 1..5
        assertArrayEquals(new long[] {2, 4, 5}, latency.range(LATENCY, RangeOpts.atMost(Terms.of(0L))).toArray());
        assertArrayEquals(new long[] {1, 3}, latency.range(LATENCY, RangeOpts.greaterThan(Terms.of(0L))).toArray());
    }

    @Test
    @DisplayName("仅游标关闭失败时抛出关闭异常")
    void testRangeCloseFailureSurfaces() {
        IndexFixtures.FailingCloseStore failing = new IndexFixtures.FailingCloseStore(store);
        KvTermIndex failingIndex = new KvTermIndex(failing, METADATA);

        IOException exception = assertThrows(IOException.class, () -> failingIndex.matchField(METHOD));
        assertEquals("cursor close failed", exception.getMessage());
        assertEquals(1, failing.closeCalls());
        assertEquals(0, store.openIterators());
    }

    @Test
    @DisplayName("遍历失败为主异常，关闭失败作为附加异常")
    void testRangeAggregatesTraversalAndCloseFailures() {
        byte[] termKey = FieldCodec.marshalTermKey(METHOD, Terms.of("GET"), METADATA);
        byte[] corrupted = new byte[termKey.length + 3];
        System.arraycopy(termKey, 0, corrupted, 0, termKey.length);
        corrupted[termKey.length] = 0x01;
        store.put(corrupted, FieldCodec.encodeItemId(7));
        IndexFixtures.FailingCloseStore failing = new IndexFixtures.FailingCloseStore(store);
        KvTermIndex failingIndex = new KvTermIndex(failing, METADATA);

        DecodeException exception = assertThrows(DecodeException.class, () -> failingIndex.matchField(METHOD));
        assertEquals(1, exception.getSuppressed().length);
        assertEquals("cursor close failed", exception.getSuppressed()[0].getMessage());
        assertEquals(1, failing.closeCalls());
    }

    @Test
    void testIteratorRejectsNullFieldKey() {
        assertThrows(IllegalArgumentException.class, () -> index.iterator(null, RangeOpts.unbounded(), SortOrder.ASC));
        assertThrows(IllegalArgumentException.class, () -> new KvTermIndex(null, METADATA));
    }

    @Test
    void testTermMetadataAccessor() {
        assertSame(METADATA, index.getTermMetadata());
    }
}
