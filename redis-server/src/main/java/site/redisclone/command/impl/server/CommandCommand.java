package site.redisclone.command.impl.server;

import site.redisclone.command.Command;
import site.redisclone.command.CommandType;
import site.redisclone.protocol.Resp;
import site.redisclone.protocol.RespArray;
import site.redisclone.server.context.RedisContext;

/**
 * COMMAND
 *
 * <p>返回所有命令的元数据，参数被忽略。
 */
public class CommandCommand implements Command {

    public CommandCommand(RedisContext context) {
    }

    @Override
    public CommandType getType() {
        return CommandType.COMMAND;
    }

    @Override
    public void setContext(Resp[] array) {
    }

    @Override
    public Resp handle() {
        final CommandType[] types = CommandType.values();
        final Resp[] docs = new Resp[types.length];
        for (int i = 0; i < types.length; i++) {
            docs[i] = types[i].describe();
        }
        return RespArray.valueOf(docs);
    }
}
