package com.termindex.index;

import com.termindex.codec.Field;
import com.termindex.codec.FieldKey;
import com.termindex.posting.PostingList;

import java.io.IOException;

/**
 * 倒排索引查询入口。
 *
 * <p>所有查询要么返回完整的倒排列表，要么抛出异常，不返回部分结果；
 * 词项不存在不视为错误，返回空列表。
 */
public interface TermIndex {

    /**
     * 字段级通配匹配：返回字段下所有词项的条目ID并集。
     */
    PostingList matchField(FieldKey fieldKey) throws IOException;

    /**
     * 精确匹配字段词项，field 的条目ID（若有）被忽略。
     */
    PostingList matchTerms(Field field) throws IOException;

    /**
     * 返回词项落在 range 内的条目ID并集。
     *
     * @throws IOException 遍历或关闭游标失败时抛出；两者都失败时关闭异常作为 suppressed 附加
     */
    PostingList range(FieldKey fieldKey, RangeOpts range) throws IOException;

    /**
     * 打开字段迭代器，调用方负责关闭。
     */
    FieldIterator iterator(FieldKey fieldKey, RangeOpts range, SortOrder order);
}
