package com.termindex.index;

import com.termindex.codec.Field;
import com.termindex.codec.FieldCodec;
import com.termindex.codec.FieldKey;
import com.termindex.codec.TermMetadata;
import com.termindex.kv.KeyNotFoundException;
import com.termindex.kv.KvStore;
import com.termindex.posting.PostingList;
import com.termindex.posting.RoaringPostingList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * 基于有序 KV 存储的倒排索引查询实现。
 */
public class KvTermIndex implements TermIndex {
    private static final Logger logger = LoggerFactory.getLogger(KvTermIndex.class);

    private final KvStore store;
    private final TermMetadata termMetadata;

    public KvTermIndex(KvStore store, TermMetadata termMetadata) {
        if (store == null || termMetadata == null) {
            throw new IllegalArgumentException("store与termMetadata不能为null");
        }
        this.store = store;
        this.termMetadata = termMetadata;
    }

    public TermMetadata getTermMetadata() {
        return termMetadata;
    }

    @Override
    public PostingList matchField(FieldKey fieldKey) throws IOException {
        return range(fieldKey, RangeOpts.unbounded());
    }

    @Override
    public PostingList matchTerms(Field field) throws IOException {
        byte[] termKey = FieldCodec.marshalTermKey(field.key(), field.term(), termMetadata);
        RoaringPostingList postingList = RoaringPostingList.create();
        try {
            store.getAll(termKey, value -> postingList.insert(FieldCodec.decodeItemId(value)));
        } catch (KeyNotFoundException exception) {
            logger.debug("词项不存在，返回空结果: field={}", field);
            return RoaringPostingList.create();
        }
        logger.debug("精确匹配完成: field={}, hits={}", field, postingList.len());
        return postingList;
    }

    @Override
    public PostingList range(FieldKey fieldKey, RangeOpts range) throws IOException {
        long startNanos = System.nanoTime();
        RoaringPostingList postingList = RoaringPostingList.create();
        int termCount = 0;
        // 遍历异常为主异常，关闭异常作为 suppressed 附加；仅关闭失败时抛出关闭异常
        try (FieldIterator iterator = iterator(fieldKey, range, SortOrder.ASC)) {
            while (iterator.next()) {
                postingList.union(iterator.value().value());
                termCount++;
            }
        } catch (IOException exception) {
            logger.warn("范围查询失败: fieldKey={}, range={}, mergedTerms={}", fieldKey, range, termCount, exception);
            throw exception;
        }
        long elapsedMs = (System.nanoTime() - startNanos) / 1_000_000;
        logger.debug("范围查询完成: fieldKey={}, range={}, terms={}, hits={}, elapsed={}ms",
            fieldKey, range, termCount, postingList.len(), elapsedMs);
        return postingList;
    }

    @Override
    public FieldIterator iterator(FieldKey fieldKey, RangeOpts range, SortOrder order) {
        if (fieldKey == null) {
            throw new IllegalArgumentException("fieldKey不能为null");
        }
        return new KvFieldIterator(store, fieldKey, range == null ? RangeOpts.unbounded() : range,
            order == null ? SortOrder.ASC : order, termMetadata);
    }
}
