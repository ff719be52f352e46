package com.termindex.kv;

import com.termindex.config.Constants;

import java.io.File;
import java.io.IOException;
import java.io.RandomAccessFile;
import java.util.Arrays;
import java.util.Map;

/**
 * 有序KV文件写入器，按严格递增键序写入条目并在关闭时追加 CRC32。
 *
 * 文件布局：magic(4B) | version(2B) | entryCount(4B) | {VarInt keyLen, key, VarInt valLen, value}* | CRC32(4B)
 */
public final class SortedFileWriter implements AutoCloseable {
    private static final long ENTRY_COUNT_OFFSET = Integer.BYTES + Short.BYTES;

    private final RandomAccessFile randomAccessFile;
    private final String storeFileName;
    private int entryCount;
    private byte[] lastKey;
    private boolean closed;

    /**
     * 创建写入器并写入文件头。
     *
     * @param file 目标文件
     * @throws IOException 初始化失败时抛出
     */
    public SortedFileWriter(File file) throws IOException {
        if (file == null) {
            throw new IllegalArgumentException("存储文件不能为空");
        }
        this.randomAccessFile = new RandomAccessFile(file, "rw");
        this.storeFileName = file.getName();
        this.randomAccessFile.setLength(0L);
        this.randomAccessFile.writeInt(Constants.SORTED_FILE_MAGIC);
        this.randomAccessFile.writeShort(Constants.FORMAT_VERSION);
        this.randomAccessFile.writeInt(0);
    }

    /**
     * 写入一个条目，要求 key 按无符号字节序严格递增。
     *
     * @throws IOException 写入失败时抛出
     */
    public void write(byte[] key, byte[] value) throws IOException {
        ensureOpen();
        if (key == null || key.length == 0) {
            throw new IllegalArgumentException("key 不能为空");
        }
        if (value == null) {
            throw new IllegalArgumentException("value 不能为null");
        }
        if (lastKey != null && Arrays.compareUnsigned(key, lastKey) <= 0) {
            throw new IllegalArgumentException("key 必须严格递增，当前条目序号=" + entryCount);
        }

        StorageFileUtil.writeVarInt(randomAccessFile, key.length);
        randomAccessFile.write(key);
        StorageFileUtil.writeVarInt(randomAccessFile, value.length);
        randomAccessFile.write(value);

        entryCount++;
        lastKey = Arrays.copyOf(key, key.length);
    }

    /**
     * 将内存存储的全部条目按序写出。
     */
    public void writeAll(MemoryKvStore store) throws IOException {
        for (Map.Entry<byte[], byte[]> entry : store.view().entrySet()) {
            write(entry.getKey(), entry.getValue());
        }
    }

    public int getEntryCount() {
        return entryCount;
    }

    /**
     * 回填 entryCount 并写入 CRC32 页脚。
     *
     * @throws IOException 关闭失败时抛出
     */
    @Override
    public void close() throws IOException {
        if (closed) {
            return;
        }
        try {
            randomAccessFile.seek(ENTRY_COUNT_OFFSET);
            randomAccessFile.writeInt(entryCount);
            StorageFileUtil.appendCrc32Footer(randomAccessFile);
        } catch (IOException exception) {
            throw new IOException("关闭有序文件写入器失败: file=" + storeFileName + ", entryCount=" + entryCount, exception);
        } finally {
            randomAccessFile.close();
            closed = true;
        }
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("SortedFileWriter 已关闭");
        }
    }
}
