package com.termindex.kv;

import java.util.Arrays;
import java.util.Comparator;

/**
 * 字节键工具方法。
 */
final class KeyBytes {
    static final Comparator<byte[]> UNSIGNED_ORDER = Arrays::compareUnsigned;

    private KeyBytes() {
    }

    static boolean startsWith(byte[] key, byte[] prefix) {
        if (key.length < prefix.length) {
            return false;
        }
        return Arrays.equals(key, 0, prefix.length, prefix, 0, prefix.length);
    }

    /**
     * 计算大于所有以 prefix 开头的键的最小键。
     *
     * @return 后继键；prefix 为空或全为 0xFF 时返回 null
     */
    static byte[] successor(byte[] prefix) {
        int index = prefix.length - 1;
        while (index >= 0 && prefix[index] == (byte) 0xFF) {
            index--;
        }
        if (index < 0) {
            return null;
        }
        byte[] successor = Arrays.copyOf(prefix, index + 1);
        successor[index]++;
        return successor;
    }
}
