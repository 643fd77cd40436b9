package site.redisclone.server.handler;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import site.redisclone.database.RedisDB;
import site.redisclone.expire.ExpirationManager;
import site.redisclone.protocol.BulkString;
import site.redisclone.protocol.Errors;
import site.redisclone.protocol.Resp;
import site.redisclone.protocol.RespArray;
import site.redisclone.protocol.SimpleString;
import site.redisclone.server.context.RedisContext;
import site.redisclone.server.context.RedisContextImpl;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RespCommandHandlerTest {

    private RespCommandHandler handler;

    @Mock
    private RedisContext failingContext;

    @BeforeEach
    void setUp() {
        handler = new RespCommandHandler(new RedisContextImpl(new ExpirationManager(new RedisDB())));
    }

    private Resp process(String... args) {
        return handler.processCommand(RespArray.ofBulkStrings(args));
    }

    @Test
    void testSetThenGet() {
        assertThat(process("SET", "test-key", "test-value")).isSameAs(SimpleString.OK);

        final Resp result = process("get", "test-key");

        assertThat(result).isInstanceOf(BulkString.class).hasToString("test-value");
    }

    @Test
    void testCommandNameIsCaseInsensitive() {
        process("sEt", "k", "v");

        assertThat(process("GeT", "k").toString()).isEqualTo("v");
    }

    @Test
    void testUnknownCommand() {
        final Resp result = process("foo", "a", "b");

        assertThat(result).isInstanceOf(Errors.class)
                .hasToString("ERR unknown command `foo`, with args beginning with: `a`, `b`,");
    }

    @Test
    void testUnknownCommandEchoesAtMostTenArgs() {
        final Resp result = process("foo", "1", "2", "3", "4", "5", "6", "7", "8", "9", "10", "11");

        assertThat(result.toString()).endsWith("`9`, `10`,");
    }

    @Test
    void testWrongArity() {
        assertThat(process("get").toString()).isEqualTo("ERR wrong number of arguments for 'GET' command");
    }

    @Test
    void testEmptyCommand() {
        assertThat(handler.processCommand(RespArray.EMPTY)).isInstanceOf(Errors.class);
    }

    @Test
    void testRuntimeExceptionBecomesErrorReply() {
        when(failingContext.checkExpired(any())).thenThrow(new IllegalStateException("boom"));
        final RespCommandHandler failing = new RespCommandHandler(failingContext);

        final Resp result = failing.processCommand(RespArray.ofBulkStrings("get", "k"));

        assertThat(result).isInstanceOf(Errors.class).hasToString("ERR boom");
    }

    @Test
    void testNullContextRejected() {
        assertThatThrownBy(() -> new RespCommandHandler(null)).isInstanceOf(IllegalArgumentException.class);
    }
}
