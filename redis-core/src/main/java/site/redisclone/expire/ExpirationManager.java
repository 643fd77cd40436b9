package site.redisclone.expire;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import site.redisclone.database.RedisDB;
import site.redisclone.datastructure.RedisBytes;

import java.time.Clock;
import java.util.Iterator;
import java.util.Map;

/**
 * 过期键管理器
 *
 * <p>提供两种淘汰方式：
 * <ul>
 *   <li>惰性删除 - 命令访问键之前调用 {@link #checkExpired(RedisBytes)}，客户端永远看不到已过期的值
 *   <li>主动删除 - 定时任务调用 {@link #activeSweep(int)}，每次最多检查固定数量的过期索引项
 * </ul>
 *
 * <p>主动删除只是一个有上限的启发式扫描，不保证一次清理干净，剩余的过期键留给下一个周期
 * 或下一次访问处理。
 */
@Slf4j
public class ExpirationManager {

    /** 每个周期最多检查的过期索引项数量 */
    public static final int MAX_EXPIRE_LOOKUPS_PER_CYCLE = 20;

    @Getter
    private final RedisDB db;

    private final Clock clock;

    public ExpirationManager(RedisDB db, Clock clock) {
        this.db = db;
        this.clock = clock;
    }

    public ExpirationManager(RedisDB db) {
        this(db, Clock.systemUTC());
    }

    /**
     * 当前时间
     *
     * @return 毫秒时间戳
     */
    public long now() {
        return clock.millis();
    }

    /**
     * 如果键已过期（过期时间不晚于当前时间），从存储和过期索引中删除
     *
     * @param key 键
     * @return 键是否被淘汰
     */
    public boolean checkExpired(RedisBytes key) {
        return evictIfExpired(key, now());
    }

    private boolean evictIfExpired(RedisBytes key, long now) {
        final Long expireAt = db.getExpire(key);
        if (expireAt == null || expireAt > now) {
            return false;
        }
        log.debug("evicting {}", key);
        db.delete(key);
        return true;
    }

    /**
     * 主动扫描过期索引
     *
     * @param budget 最多检查的索引项数量
     * @return 本次淘汰的键数量
     */
    public int activeSweep(int budget) {
        final long startNanos = System.nanoTime();
        final long now = now();
        int keysFetched = 0;
        int evicted = 0;

        final Iterator<Map.Entry<RedisBytes, Long>> it = db.expiresIterator();
        while (keysFetched < budget && it.hasNext()) {
            final Map.Entry<RedisBytes, Long> entry = it.next();
            if (entry.getValue() <= now) {
                log.debug("Evicting {}", entry.getKey());
                it.remove();
                evicted++;
            }
            keysFetched++;
        }

        if (log.isDebugEnabled()) {
            log.debug("Processed {} keys in {} ms, evicted {}",
                    keysFetched, String.format("%.3f", (System.nanoTime() - startNanos) / 1_000_000.0), evicted);
        }
        return evicted;
    }

    /**
     * 剩余生存时间，包含惰性检查
     *
     * <p>过期判断和剩余时间使用同一个时间点，返回的剩余毫秒数总是大于0。
     *
     * @param key 键
     * @return 剩余毫秒数；键不存在或已过期返回-2；没有过期时间返回-1
     */
    public long remainingMillis(RedisBytes key) {
        final long now = now();
        evictIfExpired(key, now);
        if (!db.exist(key)) {
            return -2;
        }
        final Long expireAt = db.getExpire(key);
        if (expireAt == null) {
            return -1;
        }
        return expireAt - now;
    }
}
