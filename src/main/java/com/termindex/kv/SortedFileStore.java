package com.termindex.kv;

import com.termindex.config.Constants;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.file.Files;
import java.util.Arrays;

/**
 * 只读有序文件存储，打开时校验 CRC 并全量加载条目，之后的游标与取值均在内存中完成。
 */
public final class SortedFileStore implements KvStore {
    private static final Logger logger = LoggerFactory.getLogger(SortedFileStore.class);

    private final MemoryKvStore entries = new MemoryKvStore();
    private final String storeFileName;

    /**
     * 打开并加载有序文件。
     *
     * @param file 由 {@link SortedFileWriter} 生成的文件
     * @throws IOException 文件损坏、版本不兼容或键序错误时抛出
     */
    public SortedFileStore(File file) throws IOException {
        if (file == null) {
            throw new IllegalArgumentException("存储文件不能为空");
        }
        this.storeFileName = file.getName();
        long startNanos = System.nanoTime();
        byte[] fileBytes = Files.readAllBytes(file.toPath());
        load(StorageFileUtil.checkCrc32Footer(fileBytes, storeFileName));
        long elapsedMs = (System.nanoTime() - startNanos) / 1_000_000;
        logger.debug("已加载有序文件 {}，条目数={}，用时={}ms", storeFileName, entries.size(), elapsedMs);
    }

    private void load(ByteBuffer buffer) throws IOException {
        if (buffer.remaining() < Integer.BYTES + Short.BYTES + Integer.BYTES) {
            throw new IOException("有序文件头不完整: " + storeFileName);
        }
        int magic = buffer.getInt();
        if (magic != Constants.SORTED_FILE_MAGIC) {
            throw new IOException("有序文件 magic 不匹配: " + storeFileName);
        }
        short version = buffer.getShort();
        if (version != Constants.FORMAT_VERSION) {
            throw new IOException("有序文件版本不支持: " + version);
        }
        int entryCount = buffer.getInt();
        if (entryCount < 0) {
            throw new IOException("有序文件entryCount非法: " + entryCount + ", file=" + storeFileName);
        }

        byte[] previousKey = null;
        for (int index = 0; index < entryCount; index++) {
            byte[] key = readChunk(buffer, "key", index);
            byte[] value = readChunk(buffer, "value", index);
            if (previousKey != null && Arrays.compareUnsigned(key, previousKey) <= 0) {
                throw new IOException("有序文件键序损坏，key 未严格递增: index=" + index);
            }
            entries.put(key, value);
            previousKey = key;
        }

        if (buffer.hasRemaining()) {
            throw new IOException("有序文件包含未解析字节，可能已损坏: " + storeFileName);
        }
    }

    private byte[] readChunk(ByteBuffer buffer, String label, int index) throws IOException {
        int length = VarIntCodec.decode(buffer);
        if (length > buffer.remaining()) {
            throw new IOException(label + " 长度越界: index=" + index + ", length=" + length + ", file=" + storeFileName);
        }
        byte[] chunk = new byte[length];
        buffer.get(chunk);
        return chunk;
    }

    /**
     * @return 条目数量
     */
    public int size() {
        return entries.size();
    }

    @Override
    public KvIterator newIterator(ScanOptions options) {
        return entries.newIterator(options);
    }

    @Override
    public void getAll(byte[] key, ValueVisitor visitor) throws IOException {
        entries.getAll(key, visitor);
    }

    @Override
    public void close() {
        entries.close();
    }
}
