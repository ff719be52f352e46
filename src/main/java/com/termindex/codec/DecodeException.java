package com.termindex.codec;

import java.io.IOException;
import java.util.HexFormat;

/**
 * 存储键字节损坏或与 schema 不匹配。
 */
public class DecodeException extends IOException {
    private final byte[] key;

    public DecodeException(String message, byte[] key) {
        super(message + ", key=" + HexFormat.of().formatHex(key));
        this.key = key.clone();
    }

    public byte[] getKey() {
        return key.clone();
    }
}
