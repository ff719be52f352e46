package com.termindex.kv;

import java.util.Arrays;

/**
 * 游标扫描参数。
 *
 * @param prefix 限定的键前缀，空数组表示全量
 * @param reverse 是否反向遍历
 */
public record ScanOptions(byte[] prefix, boolean reverse) {

    public ScanOptions {
        prefix = prefix == null ? new byte[0] : Arrays.copyOf(prefix, prefix.length);
    }

    public static ScanOptions forward(byte[] prefix) {
        return new ScanOptions(prefix, false);
    }

    public static ScanOptions reverse(byte[] prefix) {
        return new ScanOptions(prefix, true);
    }

    @Override
    public byte[] prefix() {
        return Arrays.copyOf(prefix, prefix.length);
    }
}
