package site.redisclone.expire;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import site.redisclone.database.RedisDB;
import site.redisclone.datastructure.RedisBytes;

import java.nio.charset.StandardCharsets;
import java.time.Clock;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ExpirationManagerTest {

    private static final long NOW = 1_700_000_000_000L;

    @Mock
    private Clock clock;

    private RedisDB db;
    private ExpirationManager manager;

    private static RedisBytes bytes(String s) {
        return RedisBytes.wrapTrusted(s.getBytes(StandardCharsets.UTF_8));
    }

    @BeforeEach
    void setUp() {
        lenient().when(clock.millis()).thenReturn(NOW);
        db = new RedisDB();
        manager = new ExpirationManager(db, clock);
    }

    @Test
    void testCheckExpiredWithoutTtl() {
        db.put(bytes("key"), bytes("value"));

        assertFalse(manager.checkExpired(bytes("key")));
        assertTrue(db.exist(bytes("key")));
    }

    @Test
    void testCheckExpiredMissingKey() {
        assertFalse(manager.checkExpired(bytes("missing")));
    }

    @Test
    void testCheckExpiredFutureTtl() {
        db.put(bytes("key"), bytes("value"));
        db.setExpire(bytes("key"), NOW + 1);

        assertFalse(manager.checkExpired(bytes("key")));
        assertEquals(bytes("value"), db.get(bytes("key")));
    }

    @Test
    void testCheckExpiredAtExactInstant() {
        db.put(bytes("key"), bytes("value"));
        db.setExpire(bytes("key"), NOW);

        assertTrue(manager.checkExpired(bytes("key")));
        assertFalse(db.exist(bytes("key")));
        assertNull(db.getExpire(bytes("key")));
    }

    @Test
    void testCheckExpiredPastTtl() {
        db.put(bytes("key"), bytes("value"));
        db.setExpire(bytes("key"), NOW - 500);

        assertTrue(manager.checkExpired(bytes("key")));
        assertEquals(0, db.size());
        assertEquals(0, db.expiresSize());
    }

    @Test
    void testActiveSweepEvictsExpiredOnly() {
        db.put(bytes("expired"), bytes("1"));
        db.setExpire(bytes("expired"), NOW - 1);
        db.put(bytes("alive"), bytes("2"));
        db.setExpire(bytes("alive"), NOW + 10_000);
        db.put(bytes("persistent"), bytes("3"));

        int evicted = manager.activeSweep(ExpirationManager.MAX_EXPIRE_LOOKUPS_PER_CYCLE);

        assertEquals(1, evicted);
        assertFalse(db.exist(bytes("expired")));
        assertTrue(db.exist(bytes("alive")));
        assertTrue(db.exist(bytes("persistent")));
        assertEquals(1, db.expiresSize());
    }

    @Test
    void testActiveSweepRespectsBudget() {
        for (int i = 0; i < 50; i++) {
            db.put(bytes("key" + i), bytes("v"));
            db.setExpire(bytes("key" + i), NOW - 1);
        }

        assertEquals(20, manager.activeSweep(20));
        assertEquals(30, db.size());
        assertEquals(30, db.expiresSize());

        assertEquals(20, manager.activeSweep(20));
        assertEquals(10, manager.activeSweep(20));
        assertEquals(0, db.size());
    }

    @Test
    void testActiveSweepBudgetCountsLiveEntries() {
        for (int i = 0; i < 5; i++) {
            db.put(bytes("key" + i), bytes("v"));
            db.setExpire(bytes("key" + i), NOW + 1000);
        }

        assertEquals(0, manager.activeSweep(3));
        assertEquals(5, db.size());
    }

    @Test
    void testRemainingMillis() {
        db.put(bytes("ttl"), bytes("v"));
        db.setExpire(bytes("ttl"), NOW + 1500);
        db.put(bytes("persistent"), bytes("v"));

        assertEquals(1500, manager.remainingMillis(bytes("ttl")));
        assertEquals(-1, manager.remainingMillis(bytes("persistent")));
        assertEquals(-2, manager.remainingMillis(bytes("missing")));
    }

    @Test
    void testLazyExpiryAfterTimePasses() {
        db.put(bytes("key"), bytes("value"));
        db.setExpire(bytes("key"), NOW + 100);
        assertFalse(manager.checkExpired(bytes("key")));

        when(clock.millis()).thenReturn(NOW + 100);

        assertTrue(manager.checkExpired(bytes("key")));
        assertEquals(-2, manager.remainingMillis(bytes("key")));
    }

    @Test
    void testRemainingMillisReadsClockOnce() {
        db.put(bytes("key"), bytes("value"));
        db.setExpire(bytes("key"), NOW + 1);
        when(clock.millis()).thenReturn(NOW, NOW + 2);

        assertEquals(1, manager.remainingMillis(bytes("key")));
        assertEquals(-2, manager.remainingMillis(bytes("key")));
        assertFalse(db.exist(bytes("key")));
    }

    @Test
    void testRemainingMillisStrictlyDecreases() {
        db.put(bytes("key"), bytes("value"));
        db.setExpire(bytes("key"), NOW + 1000);
        when(clock.millis()).thenReturn(NOW + 10, NOW + 11, NOW + 400);

        final long first = manager.remainingMillis(bytes("key"));
        final long second = manager.remainingMillis(bytes("key"));
        final long third = manager.remainingMillis(bytes("key"));

        assertEquals(990, first);
        assertTrue(second < first);
        assertTrue(third < second);
        assertEquals(600, third);
    }

    @Test
    void testRemainingMillisEvictsExpiredKey() {
        db.put(bytes("key"), bytes("value"));
        db.setExpire(bytes("key"), NOW);

        assertEquals(-2, manager.remainingMillis(bytes("key")));
        assertEquals(0, db.size());
        assertEquals(0, db.expiresSize());
    }
}
