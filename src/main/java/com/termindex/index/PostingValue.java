package com.termindex.index;

import com.termindex.posting.PostingList;

import java.util.Arrays;

/**
 * 遍历产出的单元：词项及其倒排列表。
 *
 * @param term 逻辑词项
 * @param value 该词项下的条目ID集合
 */
public record PostingValue(byte[] term, PostingList value) {

    public PostingValue {
        if (term == null || value == null) {
            throw new IllegalArgumentException("term与value不能为null");
        }
        term = Arrays.copyOf(term, term.length);
    }

    @Override
    public byte[] term() {
        return Arrays.copyOf(term, term.length);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof PostingValue postingValue)) {
            return false;
        }
        return Arrays.equals(term, postingValue.term) && value.equals(postingValue.value);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(term) + value.hashCode();
    }

    @Override
    public String toString() {
        return "PostingValue{term=" + Arrays.toString(term) + ", value=" + value + "}";
    }
}
