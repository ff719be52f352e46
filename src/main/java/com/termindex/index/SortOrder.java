package com.termindex.index;

/**
 * 词项遍历顺序。
 */
public enum SortOrder {
    ASC,
    DESC
}
