package com.termindex.codec;

import com.termindex.config.Constants;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.util.Arrays;

/**
 * 字段键编解码器
 *
 * 编码布局：shardId(4B) | fieldId(4B) | 词项 | [itemId(8B)]，整数均为大端。
 * - STRING 词项：0x00 转义为 0x00 0xFF，以 0x00 0x01 结尾，自定界且字节序等于字典序
 * - INT64 词项：翻转符号位，无符号字节序等于有符号数值序
 *
 * 因此同一字段内键的字节序与 (词项, itemId) 的逻辑序一致，范围扫描可直接作用于字节。
 */
public final class FieldCodec {

    private static final byte SIGN_FLIP = (byte) 0x80;

    private FieldCodec() {
        // 工具类，禁止实例化
    }

    /**
     * 编码完整字段；字段带 value 时追加 itemId。
     *
     * @param field 字段
     * @param termMetadata 词项 schema
     * @return 保序字节键
     * @throws EncodeException 词项与 schema 不兼容时抛出
     */
    public static byte[] marshal(Field field, TermMetadata termMetadata) {
        if (field == null) {
            throw new IllegalArgumentException("field不能为null");
        }
        ByteArrayOutputStream out = new ByteArrayOutputStream(Constants.FIELD_KEY_BYTES + field.rawTerm().length + 2 + Constants.ITEM_ID_BYTES);
        writeFieldKey(field.key(), out);
        writeTerm(field, termMetadata.typeOf(field.key().fieldId()), out);
        if (field.hasValue()) {
            out.writeBytes(encodeItemId(field.value()));
        }
        return out.toByteArray();
    }

    /**
     * 编码字段前缀，覆盖该字段下全部词项。
     */
    public static byte[] marshalFieldKey(FieldKey fieldKey) {
        ByteArrayOutputStream out = new ByteArrayOutputStream(Constants.FIELD_KEY_BYTES);
        writeFieldKey(fieldKey, out);
        return out.toByteArray();
    }

    /**
     * 编码词项前缀（不含 itemId），覆盖该词项下全部条目。
     */
    public static byte[] marshalTermKey(FieldKey fieldKey, byte[] term, TermMetadata termMetadata) {
        return marshal(Field.of(fieldKey, term), termMetadata);
    }

    /**
     * 解码存储键。
     *
     * @param termMetadata 词项 schema
     * @param key 存储键
     * @return 字段；键末尾含 8 字节时带 value
     * @throws DecodeException 长度或结构不合法时抛出
     */
    public static Field unmarshal(TermMetadata termMetadata, byte[] key) throws DecodeException {
        if (key == null) {
            throw new IllegalArgumentException("key不能为null");
        }
        if (key.length < Constants.FIELD_KEY_BYTES) {
            throw new DecodeException("键长度不足以容纳FieldKey: " + key.length, key);
        }
        ByteBuffer buffer = ByteBuffer.wrap(key);
        FieldKey fieldKey = new FieldKey(buffer.getInt(), buffer.getInt());
        TermType type = termMetadata.typeOf(fieldKey.fieldId());

        byte[] term;
        int position = Constants.FIELD_KEY_BYTES;
        if (type == TermType.INT64) {
            if (key.length < position + Long.BYTES) {
                throw new DecodeException("INT64 词项被截断", key);
            }
            term = Arrays.copyOfRange(key, position, position + Long.BYTES);
            term[0] ^= SIGN_FLIP;
            position += Long.BYTES;
        } else {
            ByteArrayOutputStream termOut = new ByteArrayOutputStream();
            boolean terminated = false;
            while (position < key.length) {
                byte current = key[position++];
                if (current != Constants.TERM_ESCAPE_LEAD) {
                    termOut.write(current);
                    continue;
                }
                if (position >= key.length) {
                    break;
                }
                byte marker = key[position++];
                if (marker == Constants.TERM_ESCAPE) {
                    termOut.write(Constants.TERM_ESCAPE_LEAD);
                    continue;
                }
                if (marker != Constants.TERM_TERMINATOR) {
                    throw new DecodeException("STRING 词项转义序列非法: 0x00 0x" + String.format("%02X", marker & 0xFF), key);
                }
                terminated = true;
                break;
            }
            if (!terminated) {
                throw new DecodeException("STRING 词项缺少终止符", key);
            }
            term = termOut.toByteArray();
        }

        int remaining = key.length - position;
        if (remaining == 0) {
            return Field.of(fieldKey, term);
        }
        if (remaining != Constants.ITEM_ID_BYTES) {
            throw new DecodeException("词项之后的剩余字节数非法: " + remaining, key);
        }
        return Field.of(fieldKey, term, ByteBuffer.wrap(key, position, Constants.ITEM_ID_BYTES).getLong());
    }

    public static byte[] encodeItemId(long itemId) {
        return ByteBuffer.allocate(Constants.ITEM_ID_BYTES).putLong(itemId).array();
    }

    /**
     * @throws DecodeException 长度不是 8 字节时抛出
     */
    public static long decodeItemId(byte[] value) throws DecodeException {
        if (value == null || value.length != Constants.ITEM_ID_BYTES) {
            throw new DecodeException("itemId 必须为 8 字节", value == null ? new byte[0] : value);
        }
        return ByteBuffer.wrap(value).getLong();
    }

    private static void writeFieldKey(FieldKey fieldKey, ByteArrayOutputStream out) {
        if (fieldKey == null) {
            throw new IllegalArgumentException("fieldKey不能为null");
        }
        out.writeBytes(ByteBuffer.allocate(Constants.FIELD_KEY_BYTES)
            .putInt(fieldKey.shardId())
            .putInt(fieldKey.fieldId())
            .array());
    }

    private static void writeTerm(Field field, TermType type, ByteArrayOutputStream out) {
        byte[] term = field.rawTerm();
        if (term.length > Constants.MAX_TERM_BYTES) {
            throw new EncodeException("词项超过最大长度 " + Constants.MAX_TERM_BYTES + ": " + term.length, field);
        }
        if (type == TermType.INT64) {
            if (term.length != Long.BYTES) {
                throw new EncodeException("INT64 词项必须为 8 字节，实际 " + term.length, field);
            }
            out.write(term[0] ^ SIGN_FLIP);
            out.write(term, 1, term.length - 1);
            return;
        }
        for (byte current : term) {
            out.write(current);
            if (current == Constants.TERM_ESCAPE_LEAD) {
                out.write(Constants.TERM_ESCAPE);
            }
        }
        out.write(Constants.TERM_ESCAPE_LEAD);
        out.write(Constants.TERM_TERMINATOR);
    }
}
