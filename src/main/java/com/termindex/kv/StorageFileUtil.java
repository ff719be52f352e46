package com.termindex.kv;

import java.io.IOException;
import java.io.RandomAccessFile;
import java.nio.ByteBuffer;
import java.util.zip.CRC32;

/**
 * 有序文件的 VarInt 写入与 CRC32 页脚处理。
 *
 * 页脚为数据区 CRC32 的低 32 位，大端 4 字节，位于文件末尾。
 */
final class StorageFileUtil {
    static final int CRC32_FOOTER_BYTES = Integer.BYTES;

    private StorageFileUtil() {
    }

    static void writeVarInt(RandomAccessFile randomAccessFile, int value) throws IOException {
        randomAccessFile.write(VarIntCodec.encode(value));
    }

    /**
     * 对当前文件全部内容计算 CRC32 并追加到末尾。
     *
     * @throws IOException 读取或写入失败时抛出
     */
    static void appendCrc32Footer(RandomAccessFile randomAccessFile) throws IOException {
        long dataLength = randomAccessFile.length();
        CRC32 crc32 = new CRC32();
        byte[] chunk = new byte[8 * 1024];
        randomAccessFile.seek(0L);
        long consumed = 0;
        while (consumed < dataLength) {
            int readBytes = randomAccessFile.read(chunk, 0, (int) Math.min(chunk.length, dataLength - consumed));
            if (readBytes < 0) {
                throw new IOException("计算 CRC32 时文件被截断: consumed=" + consumed + ", expected=" + dataLength);
            }
            crc32.update(chunk, 0, readBytes);
            consumed += readBytes;
        }
        randomAccessFile.seek(dataLength);
        randomAccessFile.writeInt((int) crc32.getValue());
    }

    /**
     * 校验内存中完整文件镜像的 CRC32 页脚。
     *
     * @param fileBytes 文件全部字节
     * @param fileName 文件名（用于错误消息）
     * @return 不含页脚的数据区视图
     * @throws IOException 文件过短或 CRC 不匹配时抛出
     */
    static ByteBuffer checkCrc32Footer(byte[] fileBytes, String fileName) throws IOException {
        if (fileBytes.length < CRC32_FOOTER_BYTES) {
            throw new IOException("文件过短，缺少 CRC32 页脚: " + fileName);
        }
        int dataLength = fileBytes.length - CRC32_FOOTER_BYTES;
        long expected = Integer.toUnsignedLong(ByteBuffer.wrap(fileBytes, dataLength, CRC32_FOOTER_BYTES).getInt());
        CRC32 crc32 = new CRC32();
        crc32.update(fileBytes, 0, dataLength);
        if (crc32.getValue() != expected) {
            throw new IOException("CRC32 校验失败: " + fileName + ", expected=" + expected + ", actual=" + crc32.getValue());
        }
        return ByteBuffer.wrap(fileBytes, 0, dataLength).slice();
    }
}
