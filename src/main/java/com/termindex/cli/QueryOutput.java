package com.termindex.cli;

import com.termindex.posting.PostingList;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.PrimitiveIterator;

/**
 * 查询结果的 JSON 输出结构，条目ID按无符号十进制渲染。
 */
public record QueryOutput(String query, String fieldKey, long hits, List<String> itemIds, List<TermOutput> terms,
                          long elapsedMs, Instant executedAt) {

    /**
     * 单个词项的输出结构。
     */
    public record TermOutput(String term, long hits, List<String> itemIds) {
    }

    static List<String> render(PostingList postingList) {
        List<String> itemIds = new ArrayList<>();
        PrimitiveIterator.OfLong iterator = postingList.iterator();
        while (iterator.hasNext()) {
            itemIds.add(Long.toUnsignedString(iterator.nextLong()));
        }
        return itemIds;
    }
}
