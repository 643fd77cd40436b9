package site.redisclone.command.impl.string;

import lombok.extern.slf4j.Slf4j;
import site.redisclone.command.Command;
import site.redisclone.command.CommandType;
import site.redisclone.datastructure.RedisBytes;
import site.redisclone.protocol.BulkString;
import site.redisclone.protocol.Errors;
import site.redisclone.protocol.Resp;
import site.redisclone.protocol.SimpleString;
import site.redisclone.server.context.RedisContext;

import java.util.Locale;

/**
 * SET key value [EX seconds | PX milliseconds | KEEPTTL] [NX | XX]
 *
 * <p>选项分为两类，每类最多出现一次：
 * <ul>
 *   <li>过期类 - EX、PX、KEEPTTL
 *   <li>存在性类 - NX、XX
 * </ul>
 *
 * <p>写入时的过期处理：EX/PX设置新的绝对过期时间，KEEPTTL保留原有过期时间，
 * 没有过期类选项时清除原有过期时间。
 */
@Slf4j
public class Set implements Command {

    private static final Errors SYNTAX_ERROR = new Errors("ERR syntax error");

    private static final Errors NOT_INTEGER_ERROR = new Errors("ERR value is not an integer or out of range");

    private enum OptionKind {
        EXPIRE,
        PRESENCE
    }

    private enum SetOption {
        EX(OptionKind.EXPIRE, 1000L),
        PX(OptionKind.EXPIRE, 1L),
        KEEPTTL(OptionKind.EXPIRE, 0L),
        NX(OptionKind.PRESENCE, 0L),
        XX(OptionKind.PRESENCE, 0L);

        private final OptionKind kind;

        /** 带值选项的单位换算倍数，0表示不带值 */
        private final long multiplier;

        SetOption(OptionKind kind, long multiplier) {
            this.kind = kind;
            this.multiplier = multiplier;
        }

        boolean hasValue() {
            return multiplier > 0;
        }

        static SetOption parse(String token) {
            try {
                return SetOption.valueOf(token.toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                return null;
            }
        }
    }

    private final RedisContext redisContext;
    private Resp[] array;

    public Set(RedisContext redisContext) {
        this.redisContext = redisContext;
    }

    @Override
    public CommandType getType() {
        return CommandType.SET;
    }

    @Override
    public void setContext(Resp[] array) {
        this.array = array;
    }

    @Override
    public Resp handle() {
        if (array.length < 3) {
            return getType().wrongNumberOfArguments();
        }
        final RedisBytes key = RedisBytes.wrapTrusted(((BulkString) array[1]).getContent());
        final RedisBytes value = RedisBytes.wrapTrusted(((BulkString) array[2]).getContent());

        // 1. 解析选项
        SetOption expire = null;
        SetOption presence = null;
        long expireAt = 0;
        int index = 3;
        while (index < array.length) {
            final SetOption option = SetOption.parse(array[index++].toString());
            if (option == null) {
                return SYNTAX_ERROR;
            }

            if (option.hasValue()) {
                final String rawValue = index < array.length ? array[index++].toString() : null;
                try {
                    final long ttlMillis = Math.multiplyExact(Long.parseLong(rawValue), option.multiplier);
                    expireAt = Math.addExact(redisContext.now(), ttlMillis);
                } catch (NumberFormatException | ArithmeticException e) {
                    return NOT_INTEGER_ERROR;
                }
            }

            if (option.kind == OptionKind.EXPIRE) {
                if (expire != null) {
                    return SYNTAX_ERROR;
                }
                expire = option;
            } else {
                if (presence != null) {
                    return SYNTAX_ERROR;
                }
                presence = option;
            }
        }

        // 2. 检查存在性条件
        redisContext.checkExpired(key);
        final boolean exists = redisContext.exist(key);
        if (presence == SetOption.NX && exists) {
            return BulkString.NULL_BULK;
        }
        if (presence == SetOption.XX && !exists) {
            return BulkString.NULL_BULK;
        }

        // 3. 写入并维护过期时间
        redisContext.put(key, value);
        if (expire == null) {
            redisContext.persist(key);
        } else if (expire.hasValue()) {
            redisContext.expireAt(key, expireAt);
        }
        log.debug("set key:{} expire:{} presence:{}", key, expire, presence);
        return SimpleString.OK;
    }
}
