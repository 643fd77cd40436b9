package site.redisclone.server.reactor;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import site.redisclone.protocol.Resp;
import site.redisclone.protocol.handler.RespEncoder;

import java.io.IOException;
import java.net.SocketAddress;
import java.nio.channels.SelectionKey;
import java.nio.channels.SocketChannel;

/**
 * 客户端连接
 *
 * <p>每个已接受的套接字对应一个实例，持有：
 * <ul>
 *   <li>queryBuffer - 尚未解析成完整命令的输入字节，读索引即已消费位置
 *   <li>replyBuffer - 尚未写出的回复字节
 * </ul>
 *
 * <p>输入缓冲区只丢弃已成功解析的前缀，从不整体清空。
 */
@Slf4j
@Getter
public class ClientConnection {

    private static final int INITIAL_BUFFER_SIZE = 1024;

    private final long id;

    private final SocketChannel channel;

    private final SelectionKey selectionKey;

    private final ByteBuf queryBuffer = Unpooled.buffer(INITIAL_BUFFER_SIZE);

    private final ByteBuf replyBuffer = Unpooled.buffer(INITIAL_BUFFER_SIZE);

    private SocketAddress remoteAddress;

    private boolean closed;

    /** 回复缓冲区写完后关闭连接，此时不再读取输入 */
    private boolean closeAfterReply;

    public ClientConnection(long id, SocketChannel channel, SelectionKey selectionKey) {
        this.id = id;
        this.channel = channel;
        this.selectionKey = selectionKey;
        try {
            this.remoteAddress = channel.getRemoteAddress();
        } catch (IOException e) {
            log.debug("无法获取客户端地址: {}", e.getMessage());
        }
    }

    /**
     * 一次非阻塞读取，追加到输入缓冲区
     *
     * @param maxBytes 最多读取的字节数
     * @return 读取的字节数；0表示暂无数据；-1表示对端已关闭
     * @throws IOException 连接被重置等传输错误
     */
    public int readFromSocket(int maxBytes) throws IOException {
        queryBuffer.ensureWritable(maxBytes);
        return queryBuffer.writeBytes(channel, maxBytes);
    }

    /**
     * 丢弃输入缓冲区中已解析的前缀
     */
    public void discardConsumedInput() {
        queryBuffer.discardReadBytes();
    }

    /**
     * 编码回复并立即尝试写出
     *
     * @param reply 回复
     * @throws IOException 写出失败
     */
    public void writeReply(Resp reply) throws IOException {
        RespEncoder.encode(reply, replyBuffer);
        flush();
    }

    /**
     * 尽可能多地写出回复缓冲区。写不完时注册写事件，等待下次可写时继续。
     *
     * @return 是否已全部写出
     * @throws IOException 写出失败
     */
    public boolean flush() throws IOException {
        while (replyBuffer.isReadable()) {
            final int written = replyBuffer.readBytes(channel, replyBuffer.readableBytes());
            if (written <= 0) {
                break;
            }
        }

        final boolean drained = !replyBuffer.isReadable();
        if (drained) {
            replyBuffer.clear();
        } else {
            replyBuffer.discardReadBytes();
        }
        if (selectionKey.isValid()) {
            final int ops = selectionKey.interestOps();
            selectionKey.interestOps(drained ? ops & ~SelectionKey.OP_WRITE : ops | SelectionKey.OP_WRITE);
        }
        return drained;
    }

    /**
     * 标记为写完剩余回复后关闭，并停止监听读事件
     */
    public void markCloseAfterReply() {
        closeAfterReply = true;
        if (selectionKey.isValid()) {
            selectionKey.interestOps(selectionKey.interestOps() & ~SelectionKey.OP_READ);
        }
    }

    /**
     * 注销并关闭连接，释放缓冲区。重复调用无副作用。
     */
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        selectionKey.cancel();
        try {
            channel.close();
        } catch (IOException e) {
            log.debug("关闭客户端连接失败: {}", e.getMessage());
        }
        queryBuffer.release();
        replyBuffer.release();
    }

    @Override
    public String toString() {
        return "Client{id=" + id + ", addr=" + remoteAddress + '}';
    }
}
