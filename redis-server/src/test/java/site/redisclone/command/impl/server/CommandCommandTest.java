package site.redisclone.command.impl.server;

import org.junit.jupiter.api.Test;
import site.redisclone.command.CommandType;
import site.redisclone.database.RedisDB;
import site.redisclone.expire.ExpirationManager;
import site.redisclone.protocol.Resp;
import site.redisclone.protocol.RespArray;
import site.redisclone.protocol.RespInteger;
import site.redisclone.server.context.RedisContextImpl;

import static org.assertj.core.api.Assertions.assertThat;

class CommandCommandTest {

    @Test
    void testListsEveryCommand() {
        final CommandCommand command = new CommandCommand(
                new RedisContextImpl(new ExpirationManager(new RedisDB())));
        command.setContext(RespArray.ofBulkStrings("command", "docs").getContent());

        final Resp result = command.handle();

        assertThat(result).isInstanceOf(RespArray.class);
        final Resp[] entries = ((RespArray) result).getContent();
        assertThat(entries).hasSize(CommandType.values().length);

        final Resp[] set = ((RespArray) entries[CommandType.SET.ordinal()]).getContent();
        assertThat(set).hasSize(7);
        assertThat(set[0].toString()).isEqualTo("set");
        assertThat(((RespInteger) set[1]).getContent()).isEqualTo(-3);
        assertThat(set[2].toString()).isEqualTo("[write, denyoom]");
        assertThat(set[6].toString()).isEqualTo("[@write, @string, @slow]");
    }
}
