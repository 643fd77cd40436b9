package site.redisclone.command.impl.key;

import site.redisclone.command.Command;
import site.redisclone.command.CommandType;
import site.redisclone.protocol.Resp;
import site.redisclone.protocol.RespInteger;
import site.redisclone.server.context.RedisContext;

/**
 * TTL key
 *
 * <p>委托给 {@link Pttl}，正数结果换算为秒并四舍五入，-1/-2原样返回。
 */
public class Ttl implements Command {
    private final RedisContext context;
    private Resp[] array;

    public Ttl(RedisContext context) {
        this.context = context;
    }

    @Override
    public CommandType getType() {
        return CommandType.TTL;
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

        final Pttl pttl = new Pttl(context);
        pttl.setContext(array);
        final Resp result = pttl.handle();
        if (!(result instanceof RespInteger)) {
            return result;
        }

        final long millis = ((RespInteger) result).getContent();
        if (millis <= 0) {
            return result;
        }
        return RespInteger.valueOf(Math.round(millis / 1000.0));
    }
}
