package com.termindex.index;

import com.termindex.codec.DecodeException;
import com.termindex.codec.Field;
import com.termindex.codec.FieldCodec;
import com.termindex.codec.FieldKey;
import com.termindex.codec.TermMetadata;
import com.termindex.config.Constants;
import com.termindex.kv.KvIterator;
import com.termindex.kv.KvStore;
import com.termindex.kv.ScanOptions;
import com.termindex.posting.RoaringPostingList;

import java.io.IOException;
import java.util.Arrays;

/**
 * 基于有序存储游标的字段迭代器。
 *
 * 游标限定在 FieldKey 前缀内，每次 next() 以当前条目为种子，
 * 向后合并词项字节相等的相邻条目，遇到不同词项即停止，该条目留作下一次的种子。
 */
final class KvFieldIterator implements FieldIterator {
    private final FieldKey fieldKey;
    private final RangeOpts termRange;
    private final SortOrder order;
    private final TermMetadata termMetadata;
    private final KvIterator delegated;

    private PostingValue current;
    private boolean done;
    private boolean closed;

    KvFieldIterator(KvStore store, FieldKey fieldKey, RangeOpts termRange, SortOrder order, TermMetadata termMetadata) {
        this.fieldKey = fieldKey;
        this.termRange = termRange;
        this.order = order;
        this.termMetadata = termMetadata;
        // 两侧边界都需与字段类型兼容，不兼容时在打开游标前抛出 EncodeException
        if (termRange.hasLower()) {
            FieldCodec.marshalTermKey(fieldKey, termRange.lower(), termMetadata);
        }
        if (termRange.hasUpper()) {
            FieldCodec.marshalTermKey(fieldKey, termRange.upper(), termMetadata);
        }
        byte[] seekKey = startKey();
        this.delegated = store.newIterator(new ScanOptions(FieldCodec.marshalFieldKey(fieldKey), order == SortOrder.DESC));
        if (seekKey != null) {
            delegated.seek(seekKey);
        }
    }

    /**
     * 计算起始定位键：升序取下界词项前缀，降序取上界词项前缀拼接最大 itemId。
     *
     * @return 定位键；对应方向无边界时返回 null，游标保持在前缀起点
     */
    private byte[] startKey() {
        if (order == SortOrder.ASC) {
            return termRange.hasLower() ? FieldCodec.marshalTermKey(fieldKey, termRange.lower(), termMetadata) : null;
        }
        if (!termRange.hasUpper()) {
            return null;
        }
        byte[] termKey = FieldCodec.marshalTermKey(fieldKey, termRange.upper(), termMetadata);
        byte[] seekKey = Arrays.copyOf(termKey, termKey.length + Constants.ITEM_ID_BYTES);
        Arrays.fill(seekKey, termKey.length, seekKey.length, (byte) 0xFF);
        return seekKey;
    }

    @Override
    public boolean next() throws IOException {
        if (done || closed) {
            return false;
        }
        Field head;
        while (true) {
            if (!delegated.valid()) {
                done = true;
                return false;
            }
            head = decodeCurrent();
            int position = termRange.locate(fieldKey.fieldId(), head.term(), termMetadata);
            int direction = order == SortOrder.ASC ? 1 : -1;
            if (position * direction < 0) {
                // 被排除的起始边界词项
                delegated.next();
                continue;
            }
            if (position != 0) {
                done = true;
                return false;
            }
            break;
        }

        byte[] term = head.term();
        RoaringPostingList postingList = RoaringPostingList.of(itemIdOf(head));
        delegated.next();
        while (delegated.valid()) {
            Field candidate = decodeCurrent();
            if (!candidate.termEquals(term)) {
                break;
            }
            postingList.insert(itemIdOf(candidate));
            delegated.next();
        }
        current = new PostingValue(term, postingList);
        return true;
    }

    private Field decodeCurrent() throws DecodeException {
        try {
            return FieldCodec.unmarshal(termMetadata, delegated.key());
        } catch (DecodeException exception) {
            done = true;
            current = null;
            throw exception;
        }
    }

    /**
     * 条目ID优先取自键尾部，键不含条目ID时取自值。
     */
    private long itemIdOf(Field field) throws DecodeException {
        if (field.hasValue()) {
            return field.value();
        }
        try {
            return FieldCodec.decodeItemId(delegated.val());
        } catch (DecodeException exception) {
            done = true;
            current = null;
            throw exception;
        }
    }

    @Override
    public PostingValue value() {
        if (current == null) {
            throw new IllegalStateException("当前没有可用的倒排值，需先成功调用 next()");
        }
        return current;
    }

    @Override
    public void close() throws IOException {
        if (closed) {
            return;
        }
        closed = true;
        done = true;
        delegated.close();
    }
}
