package com.termindex.kv;

import java.io.IOException;
import java.nio.ByteBuffer;

/**
 * 有序文件中键长与值长的 VarInt 编解码
 *
 * 每字节低 7 位承载数据，最高位为 1 表示后续还有字节，小端分组
 */
final class VarIntCodec {
    /** int 最多占用的 VarInt 字节数 */
    static final int MAX_BYTES = 5;

    private VarIntCodec() {
        // 工具类，禁止实例化
    }

    /**
     * 编码非负长度值。
     *
     * @throws IllegalArgumentException value 为负数时抛出
     */
    static byte[] encode(int value) {
        if (value < 0) {
            throw new IllegalArgumentException("VarInt不支持负数: " + value);
        }
        byte[] scratch = new byte[MAX_BYTES];
        int size = 0;
        while ((value & ~0x7F) != 0) {
            scratch[size++] = (byte) ((value & 0x7F) | 0x80);
            value >>>= 7;
        }
        scratch[size++] = (byte) value;
        byte[] encoded = new byte[size];
        System.arraycopy(scratch, 0, encoded, 0, size);
        return encoded;
    }

    /**
     * 从缓冲区当前位置解码一个长度值。
     *
     * @throws IOException 数据截断、超出 int 范围或结果为负时抛出
     */
    static int decode(ByteBuffer buffer) throws IOException {
        int start = buffer.position();
        int result = 0;
        for (int index = 0; index < MAX_BYTES; index++) {
            if (!buffer.hasRemaining()) {
                throw new IOException("VarInt被截断: offset=" + start);
            }
            int current = buffer.get() & 0xFF;
            result |= (current & 0x7F) << (7 * index);
            if ((current & 0x80) == 0) {
                if (result < 0) {
                    throw new IOException("VarInt解码结果为负数: offset=" + start);
                }
                return result;
            }
        }
        throw new IOException("VarInt超过32位范围: offset=" + start);
    }
}
