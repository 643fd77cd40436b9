package site.redisclone.protocol.handler;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufAllocator;
import lombok.extern.slf4j.Slf4j;
import site.redisclone.protocol.BulkString;
import site.redisclone.protocol.Resp;
import site.redisclone.protocol.RespArray;

/**
 * RESP回复编码器
 *
 * <p>将命令执行结果编码为RESP字节，写入连接的输出缓冲区。编码前先估算大小并
 * 预分配容量，减少ByteBuf扩容。
 *
 * @since 1.0.0
 */
@Slf4j
public final class RespEncoder {

    private RespEncoder() {
    }

    /**
     * 将回复追加编码到目标缓冲区
     *
     * @param msg 回复
     * @param out 目标缓冲区
     */
    public static void encode(final Resp msg, final ByteBuf out) {
        out.ensureWritable(estimateMessageSize(msg));
        msg.encode(msg, out);
        if (log.isDebugEnabled()) {
            log.debug("编码RESP响应: {} (缓冲区大小: {} bytes)",
                    msg.getClass().getSimpleName(), out.readableBytes());
        }
    }

    /**
     * 使用给定的分配器编码回复，调用方负责释放返回的缓冲区
     *
     * @param msg 回复
     * @param allocator 缓冲区分配器
     * @return 包含编码结果的缓冲区
     */
    public static ByteBuf encode(final Resp msg, final ByteBufAllocator allocator) {
        final ByteBuf buf = allocator.buffer(estimateMessageSize(msg));
        try {
            msg.encode(msg, buf);
            return buf;
        } catch (RuntimeException e) {
            buf.release();
            throw e;
        }
    }

    /**
     * 编码为字节数组
     *
     * @param msg 回复
     * @return 编码后的字节
     */
    public static byte[] encodeToBytes(final Resp msg) {
        final ByteBuf buf = encode(msg, ByteBufAllocator.DEFAULT);
        try {
            final byte[] bytes = new byte[buf.readableBytes()];
            buf.readBytes(bytes);
            return bytes;
        } finally {
            buf.release();
        }
    }

    /**
     * 估算RESP消息编码后的大小
     *
     * @param msg RESP消息对象
     * @return 估算的编码大小（字节数）
     */
    static int estimateMessageSize(final Resp msg) {
        if (msg instanceof BulkString) {
            final BulkString bulkString = (BulkString) msg;
            if (bulkString.isNull()) {
                return 5; // "$-1\r\n"
            }
            return bulkString.getContent().length + 20;
        } else if (msg instanceof RespArray) {
            final Resp[] content = ((RespArray) msg).getContent();
            if (content == null) {
                return 5; // "*-1\r\n"
            }
            int totalSize = 16;
            for (final Resp element : content) {
                totalSize += estimateMessageSize(element);
            }
            return totalSize;
        }
        return 64;
    }
}
