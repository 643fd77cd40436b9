package site.redisclone.command.impl.string;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import site.redisclone.database.RedisDB;
import site.redisclone.datastructure.RedisBytes;
import site.redisclone.expire.ExpirationManager;
import site.redisclone.protocol.BulkString;
import site.redisclone.protocol.Errors;
import site.redisclone.protocol.Resp;
import site.redisclone.protocol.RespArray;
import site.redisclone.protocol.SimpleString;
import site.redisclone.server.context.RedisContextImpl;

import java.nio.charset.StandardCharsets;
import java.time.Clock;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.lenient;

@ExtendWith(MockitoExtension.class)
class SetTest {

    private static final long NOW = 1_700_000_000_000L;

    @Mock
    private Clock clock;

    private RedisDB db;
    private RedisContextImpl context;

    private static RedisBytes bytes(String s) {
        return RedisBytes.wrapTrusted(s.getBytes(StandardCharsets.UTF_8));
    }

    @BeforeEach
    void setUp() {
        lenient().when(clock.millis()).thenReturn(NOW);
        db = new RedisDB();
        context = new RedisContextImpl(new ExpirationManager(db, clock));
    }

    private Resp set(String... args) {
        final String[] full = new String[args.length + 1];
        full[0] = "set";
        System.arraycopy(args, 0, full, 1, args.length);
        final Set command = new Set(context);
        command.setContext(RespArray.ofBulkStrings(full).getContent());
        return command.handle();
    }

    @Test
    void testPlainSet() {
        assertThat(set("k", "v")).isSameAs(SimpleString.OK);
        assertThat(db.get(bytes("k"))).isEqualTo(bytes("v"));
        assertThat(db.getExpire(bytes("k"))).isNull();
    }

    @Test
    void testSetOverwritesAndClearsTtl() {
        set("k", "v1", "EX", "10");
        assertThat(db.getExpire(bytes("k"))).isEqualTo(NOW + 10_000);

        set("k", "v2");
        assertThat(db.get(bytes("k"))).isEqualTo(bytes("v2"));
        assertThat(db.getExpire(bytes("k"))).isNull();
    }

    @Test
    void testExAndPx() {
        set("a", "1", "ex", "5");
        set("b", "2", "PX", "1500");

        assertThat(db.getExpire(bytes("a"))).isEqualTo(NOW + 5_000);
        assertThat(db.getExpire(bytes("b"))).isEqualTo(NOW + 1_500);
    }

    @Test
    void testKeepTtl() {
        set("k", "v1", "PX", "2000");
        set("k", "v2", "KEEPTTL");

        assertThat(db.get(bytes("k"))).isEqualTo(bytes("v2"));
        assertThat(db.getExpire(bytes("k"))).isEqualTo(NOW + 2_000);
    }

    @Test
    void testNx() {
        assertThat(set("k", "v1", "NX")).isSameAs(SimpleString.OK);
        assertThat(set("k", "v2", "nx")).isSameAs(BulkString.NULL_BULK);
        assertThat(db.get(bytes("k"))).isEqualTo(bytes("v1"));
    }

    @Test
    void testXx() {
        assertThat(set("k", "v1", "XX")).isSameAs(BulkString.NULL_BULK);
        assertThat(db.exist(bytes("k"))).isFalse();

        set("k", "v1");
        assertThat(set("k", "v2", "XX", "EX", "3")).isSameAs(SimpleString.OK);
        assertThat(db.get(bytes("k"))).isEqualTo(bytes("v2"));
        assertThat(db.getExpire(bytes("k"))).isEqualTo(NOW + 3_000);
    }

    @Test
    void testNxTreatsExpiredKeyAsAbsent() {
        db.put(bytes("k"), bytes("old"));
        db.setExpire(bytes("k"), NOW - 1);

        assertThat(set("k", "new", "NX")).isSameAs(SimpleString.OK);
        assertThat(db.get(bytes("k"))).isEqualTo(bytes("new"));
        assertThat(db.getExpire(bytes("k"))).isNull();
    }

    @Test
    void testSyntaxErrors() {
        assertThat(set("k", "v", "FOO").toString()).isEqualTo("ERR syntax error");
        assertThat(set("k", "v", "NX", "XX").toString()).isEqualTo("ERR syntax error");
        assertThat(set("k", "v", "EX", "1", "PX", "1").toString()).isEqualTo("ERR syntax error");
        assertThat(set("k", "v", "EX", "1", "KEEPTTL").toString()).isEqualTo("ERR syntax error");
        assertThat(db.exist(bytes("k"))).isFalse();
    }

    @Test
    void testNotAnInteger() {
        assertThat(set("k", "v", "EX", "abc")).isInstanceOf(Errors.class)
                .hasToString("ERR value is not an integer or out of range");
        assertThat(set("k", "v", "PX").toString()).isEqualTo("ERR value is not an integer or out of range");
        assertThat(set("k", "v", "EX", "9223372036854775807").toString())
                .isEqualTo("ERR value is not an integer or out of range");
        assertThat(db.exist(bytes("k"))).isFalse();
    }

    @Test
    void testWrongNumberOfArguments() {
        assertThat(set("k").toString()).isEqualTo("ERR wrong number of arguments for 'SET' command");
    }

    @Test
    void testBinaryKeyAndValueStoredVerbatim() {
        final byte[] key = {(byte) 0xFF, 0x00, 'k'};
        final byte[] value = {(byte) 0xFF, (byte) 0xFE};
        final Set command = new Set(context);
        command.setContext(new Resp[]{
                BulkString.fromString("SET"), BulkString.wrapTrusted(key), BulkString.wrapTrusted(value)});

        assertThat(command.handle()).isSameAs(SimpleString.OK);
        assertThat(db.get(RedisBytes.wrapTrusted(key.clone())).getBytesUnsafe()).containsExactly(value);
        assertThat(db.exist(RedisBytes.wrapTrusted(new byte[]{(byte) 0xFE, 0x00, 'k'}))).isFalse();
    }
}
