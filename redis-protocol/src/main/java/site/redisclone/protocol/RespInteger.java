package site.redisclone.protocol;

import io.netty.buffer.ByteBuf;
import lombok.Getter;

/**
 * Redis整数类型
 *
 * <p>基于享元模式，-10到127之间的整数使用缓存实例。TTL/PTTL的哨兵值
 * -1（无过期时间）和-2（键不存在）都落在缓存范围内。
 *
 * @since 1.0.0
 */
@Getter
public class RespInteger extends Resp {
    /** 缓存范围下限 */
    private static final int CACHE_LOW = -10;

    /** 缓存范围上限 */
    private static final int CACHE_HIGH = 127;

    /** 整数实例缓存数组 */
    private static final RespInteger[] CACHE = new RespInteger[CACHE_HIGH - CACHE_LOW + 1];

    static {
        for (int i = 0; i < CACHE.length; i++) {
            CACHE[i] = new RespInteger(i + CACHE_LOW);
        }
    }

    public static final RespInteger ZERO = CACHE[-CACHE_LOW];
    public static final RespInteger MINUS_ONE = CACHE[-1 - CACHE_LOW];
    public static final RespInteger MINUS_TWO = CACHE[-2 - CACHE_LOW];

    /** 整数值 */
    private final long content;

    private RespInteger(final long content) {
        this.content = content;
    }

    /**
     * 工厂方法：缓存范围内返回共享实例，否则创建新实例
     *
     * @param value 整数值
     * @return RespInteger 实例
     */
    public static RespInteger valueOf(final long value) {
        if (value >= CACHE_LOW && value <= CACHE_HIGH) {
            return CACHE[(int) value - CACHE_LOW];
        }
        return new RespInteger(value);
    }

    @Override
    public void encode(Resp resp, ByteBuf byteBuf) {
        byteBuf.writeByte(':');
        writeIntegerAsBytes(byteBuf, ((RespInteger) resp).getContent());
        byteBuf.writeBytes(CRLF);
    }

    @Override
    public String toString() {
        return Long.toString(content);
    }
}
