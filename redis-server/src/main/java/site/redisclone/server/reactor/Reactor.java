package site.redisclone.server.reactor;

import lombok.extern.slf4j.Slf4j;
import site.redisclone.protocol.ProtocolException;
import site.redisclone.protocol.Resp;
import site.redisclone.protocol.RespArray;
import site.redisclone.protocol.handler.RespDecoder;
import site.redisclone.server.config.RedisServerConfig;
import site.redisclone.server.handler.RespCommandHandler;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.InetSocketAddress;
import java.nio.channels.ClosedSelectorException;
import java.nio.channels.SelectionKey;
import java.nio.channels.Selector;
import java.nio.channels.ServerSocketChannel;
import java.nio.channels.SocketChannel;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * 单线程事件循环
 *
 * <p>在一个线程上多路复用监听套接字和所有客户端套接字，并调度定时事件。每次循环：
 * <ol>
 *   <li>根据最近的定时事件计算select超时时间
 *   <li>等待套接字就绪
 *   <li>接受新连接
 *   <li>读取客户端数据，解码并执行其中所有完整的命令，按顺序写回回复
 *   <li>执行所有到期的定时事件
 * </ol>
 *
 * <p>客户端列表、定时事件列表以及命令访问的存储只在循环线程中修改，因此不需要加锁。
 * 只有 {@link #stop()} 可以从其他线程调用。
 */
@Slf4j
public class Reactor {

    private final RedisServerConfig config;

    private final RespCommandHandler commandHandler;

    private final Clock clock;

    private final RespDecoder decoder = new RespDecoder();

    private final Map<SocketChannel, ClientConnection> clients = new HashMap<>();

    private final List<TimeEvent> timeEvents = new ArrayList<>();

    private long nextTimeEventId;

    private long nextClientId;

    private Selector selector;

    private ServerSocketChannel serverChannel;

    private volatile boolean running;

    public Reactor(RedisServerConfig config, RespCommandHandler commandHandler, Clock clock) {
        this.config = config;
        this.commandHandler = commandHandler;
        this.clock = clock;
    }

    /**
     * 打开选择器并绑定监听端口
     *
     * @throws IOException 绑定失败
     */
    public void open() throws IOException {
        selector = Selector.open();
        serverChannel = ServerSocketChannel.open();
        serverChannel.configureBlocking(false);
        serverChannel.bind(new InetSocketAddress(config.getHost(), config.getPort()), config.getBacklogSize());
        serverChannel.register(selector, SelectionKey.OP_ACCEPT);
        running = true;
        log.info("Redis server listening on {}", serverChannel.getLocalAddress());
    }

    /**
     * 实际监听的端口，配置端口为0时由系统分配
     *
     * @return 端口号
     */
    public int getLocalPort() {
        try {
            return ((InetSocketAddress) serverChannel.getLocalAddress()).getPort();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * 注册定时事件
     *
     * @param processAt 首次执行时间（毫秒时间戳）
     * @param handler 回调
     * @return 事件id
     */
    public long addTimeEvent(long processAt, TimeEventHandler handler) {
        final long id = nextTimeEventId++;
        timeEvents.add(new TimeEvent(id, processAt, handler));
        return id;
    }

    public boolean deleteTimeEvent(long id) {
        return timeEvents.removeIf(event -> event.getId() == id);
    }

    /**
     * 运行事件循环直到 {@link #stop()} 被调用
     */
    public void run() {
        try {
            while (running) {
                processEvents();
            }
        } catch (ClosedSelectorException e) {
            log.debug("选择器已关闭，退出事件循环");
        } catch (IOException e) {
            log.error("事件循环异常退出", e);
            throw new UncheckedIOException(e);
        } finally {
            closeAll();
        }
    }

    /**
     * 执行一次完整的循环迭代
     *
     * @throws IOException 选择器失败
     */
    void processEvents() throws IOException {
        final long timeout = selectTimeout();
        log.debug("select with a timeout of {} ms", timeout);
        if (timeout < 0) {
            selector.select();
        } else if (timeout == 0) {
            selector.selectNow();
        } else {
            selector.select(timeout);
        }
        processPollEvents();
        processTimeEvents();
    }

    /**
     * 停止事件循环，可以在任意线程调用
     */
    public void stop() {
        running = false;
        if (selector != null) {
            selector.wakeup();
        }
    }

    public int getClientCount() {
        return clients.size();
    }

    /**
     * 线性查找最近的定时事件
     *
     * @return 最近的事件，没有事件时返回null
     */
    private TimeEvent nearestTimeEvent() {
        TimeEvent nearest = null;
        for (final TimeEvent event : timeEvents) {
            if (nearest == null || event.getProcessAt() < nearest.getProcessAt()) {
                nearest = event;
            }
        }
        return nearest;
    }

    /**
     * select超时时间
     *
     * <p>没有定时事件时返回-1，循环阻塞到有套接字就绪为止，不做空轮询。
     * 服务器启动时总会注册serverCron，所以只有单独使用Reactor时才会出现这种情况。
     *
     * @return 毫秒数；0表示立即返回；-1表示没有定时事件，一直等待
     */
    long selectTimeout() {
        final TimeEvent nearest = nearestTimeEvent();
        if (nearest == null) {
            return -1;
        }
        return Math.max(0, nearest.getProcessAt() - clock.millis());
    }

    private void processPollEvents() {
        final Iterator<SelectionKey> it = selector.selectedKeys().iterator();
        while (it.hasNext()) {
            final SelectionKey key = it.next();
            it.remove();

            if (!key.isValid()) {
                continue;
            }
            if (key.isAcceptable()) {
                acceptClient();
                continue;
            }

            final ClientConnection client = (ClientConnection) key.attachment();
            if (key.isReadable() && !client.isCloseAfterReply()) {
                readFromClient(client);
            }
            if (!client.isClosed() && key.isValid() && key.isWritable()) {
                try {
                    if (client.flush() && client.isCloseAfterReply()) {
                        freeClient(client);
                    }
                } catch (IOException e) {
                    log.debug("写出失败，关闭连接 {}: {}", client, e.getMessage());
                    freeClient(client);
                }
            }
        }
    }

    private void acceptClient() {
        try {
            final SocketChannel channel = serverChannel.accept();
            if (channel == null) {
                return;
            }
            channel.configureBlocking(false);
            channel.socket().setTcpNoDelay(true);
            final SelectionKey key = channel.register(selector, SelectionKey.OP_READ);
            final ClientConnection client = new ClientConnection(nextClientId++, channel, key);
            key.attach(client);
            clients.put(channel, client);
            log.debug("Accepted {}", client);
        } catch (IOException e) {
            log.warn("接受连接失败: {}", e.getMessage());
        }
    }

    /**
     * 读取一次，然后解码并执行缓冲区中所有完整的命令
     *
     * @param client 客户端连接
     */
    private void readFromClient(final ClientConnection client) {
        final int read;
        try {
            read = client.readFromSocket(config.getReadBufferSize());
        } catch (IOException e) {
            log.debug("连接被重置 {}: {}", client, e.getMessage());
            freeClient(client);
            return;
        }
        if (read < 0) {
            log.debug("客户端断开 {}", client);
            freeClient(client);
            return;
        }
        if (read == 0) {
            return;
        }

        try {
            RespArray command;
            while ((command = decoder.decode(client.getQueryBuffer())) != null) {
                final Resp reply = commandHandler.processCommand(command);
                log.debug("Response: {}", reply);
                client.writeReply(reply);
            }
            client.discardConsumedInput();
        } catch (ProtocolException e) {
            log.warn("协议错误，关闭连接 {}: {}", client, e.getMessage());
            try {
                client.writeReply(e.toResp());
                if (!client.getReplyBuffer().isReadable()) {
                    freeClient(client);
                    return;
                }
                client.markCloseAfterReply();
            } catch (IOException writeError) {
                log.debug("协议错误回复写出失败 {}: {}", client, writeError.getMessage());
                freeClient(client);
            }
        } catch (IOException e) {
            log.debug("写出失败，关闭连接 {}: {}", client, e.getMessage());
            freeClient(client);
        }
    }

    private void freeClient(final ClientConnection client) {
        clients.remove(client.getChannel());
        client.close();
    }

    /**
     * 执行所有到期的定时事件，按返回值重新调度或移除
     */
    private void processTimeEvents() {
        for (final TimeEvent event : new ArrayList<>(timeEvents)) {
            if (event.getProcessAt() > clock.millis()) {
                continue;
            }

            final long next;
            try {
                next = event.getHandler().onTimeEvent();
            } catch (RuntimeException e) {
                log.error("定时事件执行失败，移除事件 {}", event, e);
                timeEvents.remove(event);
                continue;
            }

            if (next == TimeEventHandler.NOMORE) {
                timeEvents.remove(event);
            } else {
                event.setProcessAt(clock.millis() + next);
                log.debug("Rescheduling time event {} at {}", event.getId(), event.getProcessAt());
            }
        }
    }

    private void closeAll() {
        for (final ClientConnection client : new ArrayList<>(clients.values())) {
            client.close();
        }
        clients.clear();
        try {
            if (serverChannel != null) {
                serverChannel.close();
            }
            if (selector != null) {
                selector.close();
            }
        } catch (IOException e) {
            log.warn("关闭监听套接字失败: {}", e.getMessage());
        }
        log.info("Redis server stopped");
    }
}
