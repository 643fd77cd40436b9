package site.redisclone.command.impl.string;

import site.redisclone.command.Command;
import site.redisclone.command.CommandType;
import site.redisclone.datastructure.RedisBytes;
import site.redisclone.protocol.BulkString;
import site.redisclone.protocol.Resp;
import site.redisclone.server.context.RedisContext;

public class Get implements Command {
    private final RedisContext redisContext;
    private Resp[] array;

    public Get(RedisContext redisContext) {
        this.redisContext = redisContext;
    }

    @Override
    public CommandType getType() {
        return CommandType.GET;
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
        redisContext.checkExpired(key);

        final RedisBytes value = redisContext.get(key);
        if (value == null) {
            return BulkString.NULL_BULK;
        }
        return BulkString.wrapTrusted(value.getBytesUnsafe());
    }
}
