package com.trade.gateway.balance;

import com.trade.gateway.core.ManualClock;
import com.trade.gateway.core.RecordingSleeper;
import com.trade.gateway.core.UnifiedBalance;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 共享余额缓存测试
 */
class SharedBalanceCacheTest {

    private static final long NOW = 1_700_000_000_000L;

    private ManualClock clock;
    private RecordingSleeper sleeper;
    private InMemorySharedStore store;
    private SharedBalanceCache cache;

    @BeforeEach
    void setUp() {
        clock = new ManualClock(NOW);
        sleeper = new RecordingSleeper(clock);
        store = new InMemorySharedStore(clock);
        cache = new SharedBalanceCache(SharedBalanceConfig.builder().enabled(true).build(), store, clock, sleeper);
    }

    static UnifiedBalance balance(String free) {
        return new UnifiedBalance(Map.of("USDT", new BigDecimal("1000.5")), Map.of("USDT", new BigDecimal(free)),
                Map.of("USDT", new BigDecimal("200")), "binance", NOW, null);
    }

    @Test
    void testKeys() {
        assertEquals("quant:balance:shared:binance", cache.balanceKey("Binance"));
        assertEquals("quant:lock:balance:binance", cache.lockKey("binance"));
        assertEquals("unknown", SharedBalanceCache.exchangeKey(" "));
        assertEquals("unknown", SharedBalanceCache.exchangeKey(null));

        SharedBalanceCache bare = new SharedBalanceCache(
                SharedBalanceConfig.builder().keyPrefix("").lockPrefix("locks").build(), store, clock, sleeper);
        assertEquals("balance:shared:okx", bare.balanceKey("okx"));
        assertEquals("locks:okx", bare.lockKey("okx"));
    }

    @Test
    void testSetThenGetFromStore() throws Exception {
        UnifiedBalance original = balance("800.50");
        cache.set("binance", original);

        SharedBalanceCache otherProcess = new SharedBalanceCache(cache.getConfig(), store, clock, sleeper);
        clock.advance(300);
        Optional<CachedBalance> read = otherProcess.get("binance");

        assertTrue(read.isPresent());
        assertEquals(original, read.get().balance());
        assertEquals(NOW, read.get().cachedAt());
        assertEquals(300, read.get().ageMs(clock.getAsLong()));
        assertTrue(store.get(cache.balanceKey("binance")).contains("\"cachedAt\":" + NOW));
    }

    @Test
    void testStoreRecordExpiresAfterStaleMax() throws Exception {
        cache.set("binance", balance("800"));
        cache.clearLocal();

        clock.advance(15000);
        assertTrue(cache.get("binance").isEmpty());
    }

    @Test
    void testLocalCopyServedWithinTtl() throws Exception {
        cache.set("binance", balance("800"));
        store.setFailing(true);

        clock.advance(4000);
        assertTrue(cache.get("binance").isPresent());

        clock.advance(2000);
        assertThrows(SharedStoreException.class, () -> cache.get("binance"));
    }

    @Test
    void testUnparseableRecordIsAbsent() throws Exception {
        store.put(cache.balanceKey("binance"), "not json");
        assertTrue(cache.get("binance").isEmpty());

        store.put(cache.balanceKey("binance"), "{\"balance\":{}}");
        assertTrue(cache.get("binance").isEmpty());
    }

    @Test
    void testLock() throws Exception {
        String token = cache.acquireLock("binance");
        assertNotNull(token);
        assertNull(cache.acquireLock("binance"));

        assertFalse(cache.releaseLock("binance", "someone-else"));
        assertNull(cache.acquireLock("binance"));

        assertTrue(cache.releaseLock("binance", token));
        assertNotNull(cache.acquireLock("binance"));
    }

    @Test
    void testLockExpires() throws Exception {
        String token = cache.acquireLock("binance");
        clock.advance(cache.getConfig().getLockTtlMs());

        String next = cache.acquireLock("binance");
        assertNotNull(next);
        assertFalse(cache.releaseLock("binance", token));
        assertTrue(cache.releaseLock("binance", next));
    }

    @Test
    void testWaitForFreshTimesOut() throws Exception {
        Optional<CachedBalance> result = cache.waitForFresh("binance");

        assertTrue(result.isEmpty());
        assertEquals(10, sleeper.count());
        assertEquals(NOW + 2000, clock.getAsLong());
    }

    @Test
    void testWaitForFreshFindsRecord() throws Exception {
        cache.set("binance", balance("800"));
        Optional<CachedBalance> result = cache.waitForFresh("binance");

        assertTrue(result.isPresent());
        assertEquals(0, sleeper.count());
    }
}
