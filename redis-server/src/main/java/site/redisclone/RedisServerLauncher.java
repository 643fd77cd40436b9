package site.redisclone;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.LoggerFactory;
import site.redisclone.server.RedisCloneServer;
import site.redisclone.server.RedisServer;
import site.redisclone.server.config.RedisServerConfig;

@Slf4j
public class RedisServerLauncher {
    public static void main(String[] args) {
        final RedisServerConfig config = RedisServerConfig.fromEnvironment(System.getenv());
        config.validate();
        applyLogLevel(config);

        final RedisServer redisServer = new RedisCloneServer(config);

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("正在关闭服务器...");
            redisServer.stop();
        }, "redis-shutdown"));

        redisServer.start();
    }

    static void applyLogLevel(RedisServerConfig config) {
        final org.slf4j.Logger root = LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
        if (root instanceof Logger) {
            ((Logger) root).setLevel(config.isDebug() ? Level.DEBUG : Level.INFO);
        }
    }
}
