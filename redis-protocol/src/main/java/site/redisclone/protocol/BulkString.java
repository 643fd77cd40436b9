package site.redisclone.protocol;

import io.netty.buffer.ByteBuf;
import lombok.Getter;

import java.nio.charset.StandardCharsets;

/**
 * Redis批量字符串类型
 *
 * <p>二进制安全的字符串，既用作GET的回复，也用作解码后请求中的每个参数。
 * 内容为null时表示空值回复（"$-1\r\n"）。
 *
 * <p>使用建议：
 * <ul>
 *     <li>解码器和GET回复使用 {@link #wrapTrusted(byte[])}，不复制</li>
 *     <li>空值回复使用 {@link #NULL_BULK} 常量</li>
 * </ul>
 *
 * @since 1.0.0
 */
@Getter
public class BulkString extends Resp {
    /** 空值的RESP编码 */
    public static final byte[] NULL_BYTES = "$-1\r\n".getBytes(StandardCharsets.US_ASCII);

    /** 空字符串的RESP编码 */
    public static final byte[] EMPTY_BULK = "$0\r\n\r\n".getBytes(StandardCharsets.US_ASCII);

    /** 空值回复 */
    public static final BulkString NULL_BULK = new BulkString(null);

    /** 字符串内容，null表示空值 */
    private final byte[] content;

    private BulkString(final byte[] content) {
        this.content = content;
    }

    /**
     * 零拷贝工厂方法
     *
     * <p>警告：调用者必须保证bytes数组不会被修改！仅在解码器等可信代码中使用。</p>
     *
     * @param trustedBytes 受信任的字节数组
     * @return BulkString实例
     */
    public static BulkString wrapTrusted(final byte[] trustedBytes) {
        if (trustedBytes == null) {
            return NULL_BULK;
        }
        return new BulkString(trustedBytes);
    }

    /**
     * 从字符串创建，使用UTF-8编码
     *
     * @param str 字符串内容
     * @return BulkString实例
     */
    public static BulkString fromString(final String str) {
        if (str == null) {
            return NULL_BULK;
        }
        return new BulkString(str.getBytes(StandardCharsets.UTF_8));
    }

    public boolean isNull() {
        return content == null;
    }

    @Override
    public void encode(final Resp resp, final ByteBuf byteBuf) {
        final byte[] bytes = ((BulkString) resp).content;
        if (bytes == null) {
            byteBuf.writeBytes(NULL_BYTES);
            return;
        }

        final int length = bytes.length;
        if (length == 0) {
            byteBuf.writeBytes(EMPTY_BULK);
            return;
        }

        // '$' + 长度数字 + '\r\n' + 内容 + '\r\n'
        byteBuf.ensureWritable(length + 16);

        byteBuf.writeByte('$');
        writeIntegerAsBytes(byteBuf, length);
        byteBuf.writeBytes(CRLF);
        byteBuf.writeBytes(bytes);
        byteBuf.writeBytes(CRLF);
    }

    /**
     * 获取字符串内容
     *
     * @return 字符串内容，如果是空值则返回 null
     */
    @Override
    public String toString() {
        return content != null ? new String(content, StandardCharsets.UTF_8) : null;
    }
}
