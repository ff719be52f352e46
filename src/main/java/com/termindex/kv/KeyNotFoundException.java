package com.termindex.kv;

import java.io.IOException;
import java.util.HexFormat;

/**
 * 存储中不存在指定键。
 */
public class KeyNotFoundException extends IOException {

    public KeyNotFoundException(byte[] key) {
        super("键不存在: " + HexFormat.of().formatHex(key));
    }
}
