package site.redisclone.database;

import site.redisclone.datastructure.RedisBytes;

import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;

/**
 * 键值存储及过期索引
 *
 * <p>data保存键到值的映射，expires保存键到绝对过期时间（毫秒时间戳）的映射。
 * 键和值都是任意字节，按字节内容比较。
 * 不变式：expires中的每个键在data中都存在，删除键时两者同时移除。
 *
 * <p>该类不是线程安全的，只能在事件循环线程中访问。
 */
public class RedisDB {

    private final Map<RedisBytes, RedisBytes> data = new HashMap<>();

    private final Map<RedisBytes, Long> expires = new HashMap<>();

    public boolean exist(RedisBytes key) {
        return data.containsKey(key);
    }

    public RedisBytes get(RedisBytes key) {
        return data.get(key);
    }

    public void put(RedisBytes key, RedisBytes value) {
        data.put(key, value);
    }

    /**
     * 删除键，同时清除其过期时间
     *
     * @param key 键
     * @return 被删除的值，不存在时返回null
     */
    public RedisBytes delete(RedisBytes key) {
        expires.remove(key);
        return data.remove(key);
    }

    /**
     * 获取键的绝对过期时间
     *
     * @param key 键
     * @return 毫秒时间戳，没有设置过期时间时返回null
     */
    public Long getExpire(RedisBytes key) {
        return expires.get(key);
    }

    /**
     * 设置键的绝对过期时间
     *
     * @param key 键，必须已经存在
     * @param expireAtMillis 毫秒时间戳
     * @throws IllegalStateException 如果键不存在
     */
    public void setExpire(RedisBytes key, long expireAtMillis) {
        if (!data.containsKey(key)) {
            throw new IllegalStateException("不能为不存在的键设置过期时间: " + key);
        }
        expires.put(key, expireAtMillis);
    }

    /**
     * 移除键的过期时间，使其成为永久键
     *
     * @param key 键
     * @return 是否移除了过期时间
     */
    public boolean persist(RedisBytes key) {
        return expires.remove(key) != null;
    }

    /**
     * 遍历过期索引，迭代顺序没有保证。迭代器的remove会同时删除键。
     *
     * @return 过期索引的迭代器
     */
    public Iterator<Map.Entry<RedisBytes, Long>> expiresIterator() {
        final Iterator<Map.Entry<RedisBytes, Long>> it = expires.entrySet().iterator();
        return new Iterator<>() {
            private Map.Entry<RedisBytes, Long> current;

            @Override
            public boolean hasNext() {
                return it.hasNext();
            }

            @Override
            public Map.Entry<RedisBytes, Long> next() {
                current = it.next();
                return current;
            }

            @Override
            public void remove() {
                it.remove();
                data.remove(current.getKey());
            }
        };
    }

    public long size() {
        return data.size();
    }

    public long expiresSize() {
        return expires.size();
    }
}
