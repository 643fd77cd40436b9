package site.redisclone.protocol;

import io.netty.buffer.ByteBuf;

import java.nio.charset.StandardCharsets;

/**
 * Redis协议回复基础类
 *
 * <p>所有RESP回复类型的基类，定义统一的编码接口和共享的数字写入工具。
 * 服务端只负责编码回复，请求的解析由 {@link site.redisclone.protocol.handler.RespDecoder} 完成。
 *
 * <p>支持的回复类型：
 * <ul>
 *     <li>简单字符串 - 以"+"开头</li>
 *     <li>错误消息 - 以"-"开头</li>
 *     <li>整数 - 以":"开头</li>
 *     <li>批量字符串 - 以"$"开头，"$-1"表示空值</li>
 *     <li>数组 - 以"*"开头，元素可以嵌套</li>
 * </ul>
 *
 * @since 1.0.0
 */
public abstract class Resp {
    /** 行结束符 */
    public static final byte[] CRLF = "\r\n".getBytes(StandardCharsets.US_ASCII);

    /** 数字的字节表示缓存 */
    protected static final byte[][] NUMBERS = new byte[512][];

    /** 最大缓存数字 */
    protected static final int MAX_CACHED_NUMBER = 255;

    static {
        for (int i = 0; i <= MAX_CACHED_NUMBER; i++) {
            NUMBERS[i] = String.valueOf(i).getBytes(StandardCharsets.US_ASCII);
        }
        // 缓存负数
        for (int i = 1; i <= MAX_CACHED_NUMBER; i++) {
            NUMBERS[i + 256] = String.valueOf(-i).getBytes(StandardCharsets.US_ASCII);
        }
    }

    /**
     * 写入十进制数字，小数字走缓存
     *
     * @param buf 目标缓冲区
     * @param value 要写入的数值
     */
    protected static void writeIntegerAsBytes(ByteBuf buf, long value) {
        if (value >= 0 && value <= MAX_CACHED_NUMBER) {
            buf.writeBytes(NUMBERS[(int) value]);
        } else if (value < 0 && value >= -MAX_CACHED_NUMBER) {
            buf.writeBytes(NUMBERS[(int) -value + 256]);
        } else {
            buf.writeBytes(Long.toString(value).getBytes(StandardCharsets.US_ASCII));
        }
    }

    /**
     * 将回复编码到缓冲区，由子类实现具体的编码逻辑
     *
     * @param resp 响应对象
     * @param byteBuf 输出缓冲区
     */
    public abstract void encode(Resp resp, ByteBuf byteBuf);
}
