package site.redisclone.command.impl.key;

import site.redisclone.command.Command;
import site.redisclone.command.CommandType;
import site.redisclone.datastructure.RedisBytes;
import site.redisclone.protocol.BulkString;
import site.redisclone.protocol.Resp;
import site.redisclone.protocol.RespInteger;
import site.redisclone.server.context.RedisContext;

/**
 * PTTL key
 *
 * <p>返回剩余毫秒数；键不存在返回-2；键没有过期时间返回-1。
 */
public class Pttl implements Command {
    private final RedisContext context;
    private Resp[] array;

    public Pttl(RedisContext context) {
        this.context = context;
    }

    @Override
    public CommandType getType() {
        return CommandType.PTTL;
    }

    @Override
    public void setContext(Resp[] array) {
        this.array = array;
    }

    @Override
    public Resp handle() {
        if (array.length != 2) {
            return getType().wrongNumberOfArguments();
        }
        final RedisBytes key = RedisBytes.wrapTrusted(((BulkString) array[1]).getContent());
        return RespInteger.valueOf(context.remainingMillis(key));
    }
}
