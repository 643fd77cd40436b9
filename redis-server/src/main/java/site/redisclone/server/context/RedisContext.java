package site.redisclone.server.context;

import site.redisclone.datastructure.RedisBytes;

/**
 * 命令执行上下文
 *
 * <p>命令通过上下文访问键值存储和过期索引，不直接持有全局状态。
 * 所有方法只能在事件循环线程中调用。
 */
public interface RedisContext {

    /**
     * 惰性过期检查，命令访问键之前必须调用
     *
     * @param key 键
     * @return 键是否因过期被删除
     */
    boolean checkExpired(RedisBytes key);

    RedisBytes get(RedisBytes key);

    boolean exist(RedisBytes key);

    void put(RedisBytes key, RedisBytes value);

    /**
     * 当前时间
     *
     * @return 毫秒时间戳
     */
    long now();

    /**
     * 设置键的绝对过期时间
     *
     * @param key 键，必须已经存在
     * @param expireAtMillis 毫秒时间戳
     */
    void expireAt(RedisBytes key, long expireAtMillis);

    /**
     * 清除键的过期时间
     *
     * @param key 键
     */
    void persist(RedisBytes key);

    /**
     * 剩余生存时间，包含惰性检查
     *
     * @param key 键
     * @return 剩余毫秒数；键不存在或已过期返回-2；没有过期时间返回-1
     */
    long remainingMillis(RedisBytes key);
}
