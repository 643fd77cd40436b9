package site.redisclone.server.context;

import lombok.Getter;
import site.redisclone.database.RedisDB;
import site.redisclone.datastructure.RedisBytes;
import site.redisclone.expire.ExpirationManager;

/**
 * 基于 {@link RedisDB} 和 {@link ExpirationManager} 的上下文实现
 */
@Getter
public class RedisContextImpl implements RedisContext {

    private final RedisDB db;

    private final ExpirationManager expirationManager;

    public RedisContextImpl(ExpirationManager expirationManager) {
        this.expirationManager = expirationManager;
        this.db = expirationManager.getDb();
    }

    @Override
    public boolean checkExpired(RedisBytes key) {
        return expirationManager.checkExpired(key);
    }

    @Override
    public RedisBytes get(RedisBytes key) {
        return db.get(key);
    }

    @Override
    public boolean exist(RedisBytes key) {
        return db.exist(key);
    }

    @Override
    public void put(RedisBytes key, RedisBytes value) {
        db.put(key, value);
    }

    @Override
    public long now() {
        return expirationManager.now();
    }

    @Override
    public void expireAt(RedisBytes key, long expireAtMillis) {
        db.setExpire(key, expireAtMillis);
    }

    @Override
    public void persist(RedisBytes key) {
        db.persist(key);
    }

    @Override
    public long remainingMillis(RedisBytes key) {
        return expirationManager.remainingMillis(key);
    }
}
