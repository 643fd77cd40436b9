package site.redisclone.server;

import site.redisclone.expire.ExpirationManager;
import site.redisclone.server.config.RedisServerConfig;
import site.redisclone.server.reactor.TimeEventHandler;

/**
 * 周期性后台任务，目前只负责主动清理过期键
 *
 * @since 1.0
 */
public class ServerCron implements TimeEventHandler {

    private final ExpirationManager expirationManager;

    private final RedisServerConfig config;

    public ServerCron(ExpirationManager expirationManager, RedisServerConfig config) {
        this.expirationManager = expirationManager;
        this.config = config;
    }

    @Override
    public long onTimeEvent() {
        expirationManager.activeSweep(config.getActiveExpireLookups());
        return config.cronIntervalMillis();
    }
}
