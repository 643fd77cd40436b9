package site.redisclone.server;

import io.netty.util.concurrent.DefaultThreadFactory;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import site.redisclone.database.RedisDB;
import site.redisclone.expire.ExpirationManager;
import site.redisclone.protocol.Resp;
import site.redisclone.protocol.RespArray;
import site.redisclone.server.config.RedisServerConfig;
import site.redisclone.server.context.RedisContext;
import site.redisclone.server.context.RedisContextImpl;
import site.redisclone.server.handler.RespCommandHandler;
import site.redisclone.server.reactor.Reactor;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Clock;
import java.util.concurrent.ThreadFactory;

/**
 * 单线程Redis服务器
 *
 * <p>组装存储、过期管理、命令处理器和事件循环：
 * <ul>
 *   <li>{@link RedisDB} 保存键值和过期索引
 *   <li>{@link ExpirationManager} 负责惰性检查和周期清理
 *   <li>{@link Reactor} 处理网络IO和定时事件
 * </ul>
 *
 * <p>启动时注册 {@link ServerCron}，首次执行时间为当前时间，之后按 hz 周期执行。
 *
 * @since 1.0
 */
@Slf4j
@Getter
public class RedisCloneServer implements RedisServer {

    private static final long STOP_TIMEOUT_MILLIS = 5000;

    private final RedisServerConfig config;

    private final RedisDB db;

    private final ExpirationManager expirationManager;

    private final RedisContext redisContext;

    private final RespCommandHandler commandHandler;

    private final Reactor reactor;

    private Thread eventLoopThread;

    public RedisCloneServer(RedisServerConfig config) {
        this(config, Clock.systemUTC());
    }

    public RedisCloneServer(RedisServerConfig config, Clock clock) {
        config.validate();
        this.config = config;
        this.db = new RedisDB();
        this.expirationManager = new ExpirationManager(db, clock);
        this.redisContext = new RedisContextImpl(expirationManager);
        this.commandHandler = new RespCommandHandler(redisContext);
        this.reactor = new Reactor(config, commandHandler, clock);
        this.reactor.addTimeEvent(clock.millis(), new ServerCron(expirationManager, config));
    }

    @Override
    public synchronized void start() {
        if (eventLoopThread != null) {
            throw new IllegalStateException("服务器已经在运行");
        }
        try {
            reactor.open();
        } catch (IOException e) {
            log.error("端口绑定失败: {}:{}", config.getHost(), config.getPort(), e);
            throw new UncheckedIOException(e);
        }

        final ThreadFactory threadFactory = new DefaultThreadFactory("redis-event-loop");
        eventLoopThread = threadFactory.newThread(reactor::run);
        eventLoopThread.start();
        log.info("Redis服务器已启动, 端口: {}", getPort());
    }

    @Override
    public synchronized void stop() {
        if (eventLoopThread == null) {
            return;
        }
        log.info("正在停止Redis服务器...");
        reactor.stop();
        try {
            eventLoopThread.join(STOP_TIMEOUT_MILLIS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("等待事件循环退出时被中断");
        }
        eventLoopThread = null;
        log.info("Redis服务器已停止");
    }

    @Override
    public int getPort() {
        return reactor.getLocalPort();
    }

    @Override
    public Resp executeCommand(RespArray command) {
        return commandHandler.processCommand(command);
    }
}
