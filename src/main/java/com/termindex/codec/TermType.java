package com.termindex.codec;

/**
 * 词项类型，决定编码方式与比较语义。
 */
public enum TermType {
    /** 任意字节串，按无符号字节字典序比较 */
    STRING,
    /** 8 字节大端补码整数，按有符号数值比较 */
    INT64
}
