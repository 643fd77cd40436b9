package site.redisclone.protocol.handler;

import io.netty.buffer.ByteBuf;
import lombok.extern.slf4j.Slf4j;
import site.redisclone.protocol.BulkString;
import site.redisclone.protocol.ProtocolException;
import site.redisclone.protocol.Resp;
import site.redisclone.protocol.RespArray;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * RESP请求解码器
 *
 * <p>从客户端累积的输入缓冲区头部解析出一条完整的命令，只消费属于这条命令的字节。
 * 根据第一个字节选择帧格式：
 * <ul>
 *     <li>'*' - 多批量格式："*N\r\n" 后跟N个 "$len\r\n内容\r\n"</li>
 *     <li>其他 - INLINE格式：以空白分隔的单词，直到一个或连续多个 \r\n、\r、\n</li>
 * </ul>
 *
 * <p>返回约定：
 * <ul>
 *     <li>返回命令数组 - 读索引前移到该命令之后</li>
 *     <li>返回null - 数据不完整，读索引保持不变，等待更多数据</li>
 *     <li>抛出 {@link ProtocolException} - 长度非法或帧标记错误，连接应当关闭</li>
 * </ul>
 *
 * <p>空行和 "*0\r\n" 会被直接消费，不产生命令。解码器本身无状态，可以被多个连接共享。
 *
 * @since 1.0.0
 */
@Slf4j
public class RespDecoder {

    /** 最大内联命令长度限制 */
    private static final int MAX_INLINE_LENGTH = 64 * 1024;

    /** 批量字符串的最大长度 */
    private static final long PROTO_MAX_BULK_LEN = 512L * 1024 * 1024;

    /** 数组的最大元素数量 */
    private static final long PROTO_MAX_ARRAY_LEN = 1024L * 1024;

    /** 元素列表的初始容量上限，声明的元素数量更大时随解析逐步扩容 */
    private static final int MAX_INITIAL_ELEMENTS = 1024;

    /**
     * 尝试从缓冲区头部解码一条命令
     *
     * @param in 客户端输入缓冲区
     * @return 由批量字符串组成的非空命令数组，数据不完整时返回null
     * @throws ProtocolException 当数据不符合协议格式时
     */
    public RespArray decode(final ByteBuf in) {
        while (in.isReadable()) {
            final byte firstByte = in.getByte(in.readerIndex());
            final RespArray command = firstByte == '*'
                    ? decodeMultiBulk(in)
                    : decodeInline(in);
            if (command == null) {
                return null;
            }
            if (command.size() > 0) {
                return command;
            }
            // 空行或空数组已被消费，继续解析后面的数据
        }
        return null;
    }

    /**
     * 解码多批量格式命令
     *
     * @param in 输入缓冲区，当前读位置为'*'
     * @return 命令数组，数据不完整时返回null
     */
    private RespArray decodeMultiBulk(final ByteBuf in) {
        final int initialIndex = in.readerIndex();
        try {
            in.skipBytes(1);
            final long count = readLength(in, "invalid multibulk length", PROTO_MAX_ARRAY_LEN);
            if (count < 0) {
                in.readerIndex(initialIndex);
                return null;
            }

            final List<Resp> elements = new ArrayList<>((int) Math.min(count, MAX_INITIAL_ELEMENTS));
            for (int i = 0; i < count; i++) {
                // 1. 元素头尚未到达
                if (!in.isReadable()) {
                    in.readerIndex(initialIndex);
                    return null;
                }

                // 2. 每个元素必须是批量字符串
                final byte type = in.readByte();
                if (type != '$') {
                    throw new ProtocolException("expected '$', got '" + (char) type + "'");
                }

                // 3. 读取长度
                final long length = readLength(in, "invalid bulk length", PROTO_MAX_BULK_LEN);
                if (length < 0) {
                    in.readerIndex(initialIndex);
                    return null;
                }

                // 4. 内容及结尾的\r\n必须完整到达
                if (in.readableBytes() < length + 2) {
                    in.readerIndex(initialIndex);
                    return null;
                }
                final byte[] content = new byte[(int) length];
                in.readBytes(content);
                in.skipBytes(2);
                elements.add(BulkString.wrapTrusted(content));
            }
            return RespArray.valueOf(elements.toArray(new Resp[0]));
        } catch (ProtocolException e) {
            in.readerIndex(initialIndex);
            throw e;
        }
    }

    /**
     * 读取以\r\n结尾的非负十进制长度
     *
     * @param in 输入缓冲区
     * @param errorMessage 格式错误时的协议错误描述
     * @param max 允许的最大值
     * @return 解析出的长度，数据不完整时返回-1
     */
    private static long readLength(final ByteBuf in, final String errorMessage, final long max) {
        // 1. 查找CR位置
        final int startIndex = in.readerIndex();
        final int endIndex = in.indexOf(startIndex, in.writerIndex(), (byte) '\r');
        if (endIndex < 0 || endIndex + 1 >= in.writerIndex()) {
            return -1;
        }
        if (in.getByte(endIndex + 1) != '\n' || endIndex == startIndex) {
            throw new ProtocolException(errorMessage);
        }

        // 2. 逐字节解析，负数和非数字都是协议错误
        long value = 0;
        for (int i = startIndex; i < endIndex; i++) {
            final byte b = in.getByte(i);
            if (b < '0' || b > '9') {
                throw new ProtocolException(errorMessage);
            }
            value = value * 10 + (b - '0');
            if (value > max) {
                throw new ProtocolException(errorMessage);
            }
        }

        // 3. 跳过数字和\r\n
        in.readerIndex(endIndex + 2);
        return value;
    }

    /**
     * 解码INLINE格式命令（如：GET key\r\n）
     *
     * @param in 输入缓冲区
     * @return 命令数组；空行返回空数组；数据不完整时返回null
     */
    private RespArray decodeInline(final ByteBuf in) {
        final int startIndex = in.readerIndex();
        final int writerIndex = in.writerIndex();

        // 1. 查找第一个行结束符
        int lineEnd = -1;
        for (int i = startIndex; i < writerIndex; i++) {
            final byte b = in.getByte(i);
            if (b == '\r' || b == '\n') {
                lineEnd = i;
                break;
            }
        }
        if (lineEnd < 0) {
            if (writerIndex - startIndex > MAX_INLINE_LENGTH) {
                throw new ProtocolException("too big inline request");
            }
            return null;
        }

        // 2. 连续的行结束符一并消费
        int next = lineEnd;
        while (next < writerIndex && (in.getByte(next) == '\r' || in.getByte(next) == '\n')) {
            next++;
        }

        final String line = in.toString(startIndex, lineEnd - startIndex, StandardCharsets.UTF_8);
        in.readerIndex(next);

        final List<String> parts = splitWords(line);
        if (parts.isEmpty()) {
            return RespArray.EMPTY;
        }
        log.debug("解析INLINE命令: {}", parts);

        final Resp[] result = new Resp[parts.size()];
        for (int i = 0; i < parts.size(); i++) {
            result[i] = BulkString.fromString(parts.get(i));
        }
        return RespArray.valueOf(result);
    }

    /**
     * 按空白字符分割命令行
     *
     * @param commandLine 命令行
     * @return 单词列表，可能为空
     */
    private static List<String> splitWords(final String commandLine) {
        final List<String> parts = new ArrayList<>(8);
        final StringBuilder current = new StringBuilder();
        for (int i = 0; i < commandLine.length(); i++) {
            final char c = commandLine.charAt(i);
            if (Character.isWhitespace(c)) {
                if (current.length() > 0) {
                    parts.add(current.toString());
                    current.setLength(0);
                }
            } else {
                current.append(c);
            }
        }
        if (current.length() > 0) {
            parts.add(current.toString());
        }
        return parts;
    }
}
