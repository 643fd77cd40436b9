package site.redisclone.protocol;

import io.netty.buffer.ByteBuf;
import lombok.Getter;

import java.nio.charset.StandardCharsets;

/**
 * Redis数组类型
 *
 * <p>解码后的客户端请求是由批量字符串组成的数组，第0个元素为命令名。
 * 作为回复时元素可以是任意RESP类型，包括嵌套数组（COMMAND命令的元数据）。
 *
 * <p>预定义实例：
 * <ul>
 *     <li>EMPTY - 空数组，对应"*0\r\n"</li>
 * </ul>
 *
 * @since 1.0.0
 */
@Getter
public class RespArray extends Resp {
    /** 空数组的RESP编码 */
    private static final byte[] EMPTY_ARRAY_BYTES = "*0\r\n".getBytes(StandardCharsets.US_ASCII);

    /** 预定义的空数组实例 */
    public static final RespArray EMPTY = new RespArray(new Resp[0]);

    /** 数组内容 */
    private final Resp[] content;

    public RespArray(final Resp[] content) {
        this.content = content;
    }

    /**
     * 工厂方法：空数组和null数组返回缓存实例
     *
     * @param content 数组内容
     * @return RespArray 实例
     */
    public static RespArray valueOf(final Resp... content) {
        if (content.length == 0) {
            return EMPTY;
        }
        return new RespArray(content);
    }

    /**
     * 由字符串构造简单字符串数组，用于命令元数据中的标志位列表
     *
     * @param values 字符串列表
     * @return 简单字符串数组
     */
    public static RespArray ofSimpleStrings(final String... values) {
        final Resp[] elements = new Resp[values.length];
        for (int i = 0; i < values.length; i++) {
            elements[i] = SimpleString.valueOf(values[i]);
        }
        return valueOf(elements);
    }

    /**
     * 由字符串构造批量字符串数组，常用于构造请求
     *
     * @param values 字符串列表
     * @return 批量字符串数组
     */
    public static RespArray ofBulkStrings(final String... values) {
        final Resp[] elements = new Resp[values.length];
        for (int i = 0; i < values.length; i++) {
            elements[i] = BulkString.fromString(values[i]);
        }
        return valueOf(elements);
    }

    public int size() {
        return content.length;
    }

    @Override
    public void encode(final Resp resp, final ByteBuf byteBuf) {
        final Resp[] arrayContent = ((RespArray) resp).getContent();
        // 1. 处理空数组
        if (arrayContent.length == 0) {
            byteBuf.writeBytes(EMPTY_ARRAY_BYTES);
            return;
        }

        // 2. 写入数组头
        byteBuf.writeByte('*');
        writeIntegerAsBytes(byteBuf, arrayContent.length);
        byteBuf.writeBytes(CRLF);

        // 3. 递归编码所有元素
        for (final Resp element : arrayContent) {
            element.encode(element, byteBuf);
        }
    }

    @Override
    public String toString() {
        final StringBuilder sb = new StringBuilder("[");
        for (int i = 0; i < content.length; i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(content[i]);
        }
        return sb.append(']').toString();
    }
}
