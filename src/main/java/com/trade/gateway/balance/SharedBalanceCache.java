package com.trade.gateway.balance;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.trade.gateway.core.Sleeper;
import com.trade.gateway.core.UnifiedBalance;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.SecureRandom;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.LongSupplier;

/**
 * 共享存储中的余额记录与锁，前面加一层进程内副本
 * <p>
 * 键：{@code {prefix}{dataPrefix}:{exchange}} 存 JSON {@code {balance, cachedAt}}，
 * {@code staleMaxMs} 后过期；{@code {prefix}{lockPrefix}:{exchange}} 存锁令牌，
 * {@code lockTtlMs} 后过期。本地副本只在 {@code ttlMs} 内有效。
 */
public class SharedBalanceCache {

    private static final Logger logger = LoggerFactory.getLogger(SharedBalanceCache.class);

    private static final SecureRandom RANDOM = new SecureRandom();

    private final SharedBalanceConfig config;
    private final SharedStore store;
    private final LongSupplier clock;
    private final Sleeper sleeper;
    private final ObjectMapper mapper;
    private final Map<String, CachedBalance> local = new ConcurrentHashMap<>();

    /**
     * 存储记录的格式，按 POJO 读写以保留小数位数
     */
    record StoredBalance(UnifiedBalance balance, Long cachedAt) {}

    public SharedBalanceCache(SharedBalanceConfig config, SharedStore store) {
        this(config, store, System::currentTimeMillis, Sleeper.SYSTEM);
    }

    public SharedBalanceCache(SharedBalanceConfig config, SharedStore store, LongSupplier clock, Sleeper sleeper) {
        this.config = config;
        this.store = store;
        this.clock = clock;
        this.sleeper = sleeper;
        this.mapper = new ObjectMapper()
                .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    public SharedBalanceConfig getConfig() {
        return config;
    }

    public long now() {
        return clock.getAsLong();
    }

    public String balanceKey(String exchange) {
        return config.getKeyPrefix() + config.getDataPrefix() + ":" + exchangeKey(exchange);
    }

    public String lockKey(String exchange) {
        return config.getKeyPrefix() + config.getLockPrefix() + ":" + exchangeKey(exchange);
    }

    static String exchangeKey(String exchange) {
        return exchange == null || exchange.isBlank() ? "unknown" : exchange.toLowerCase();
    }

    /**
     * ttl 内返回本地副本，否则读存储；无法解析的记录视为不存在
     */
    public Optional<CachedBalance> get(String exchange) throws SharedStoreException {
        String key = exchangeKey(exchange);
        CachedBalance cached = local.get(key);
        if (cached != null && cached.isWithin(config.getTtlMs(), now())) {
            return Optional.of(cached);
        }

        String payload = store.get(balanceKey(key));
        if (payload == null || payload.isEmpty()) {
            return Optional.empty();
        }
        CachedBalance parsed = parse(payload);
        if (parsed == null) {
            logger.warn("[{}] 共享余额记录无法解析，视为缺失", key);
            return Optional.empty();
        }
        local.put(key, parsed);
        return Optional.of(parsed);
    }

    private CachedBalance parse(String payload) {
        try {
            StoredBalance stored = mapper.readValue(payload, StoredBalance.class);
            if (stored == null || stored.balance() == null || stored.cachedAt() == null) {
                return null;
            }
            return new CachedBalance(stored.balance(), stored.cachedAt());
        } catch (JsonProcessingException e) {
            logger.debug("共享余额 JSON 解析失败: {}", e.getMessage());
            return null;
        }
    }

    /**
     * 发布刚拉取的余额，时间戳取当前时间
     */
    public CachedBalance set(String exchange, UnifiedBalance balance) throws SharedStoreException {
        String key = exchangeKey(exchange);
        CachedBalance record = new CachedBalance(balance, now());
        store.setWithExpiry(balanceKey(key), serialize(record), config.getStaleMaxMs());
        local.put(key, record);
        return record;
    }

    private String serialize(CachedBalance record) throws SharedStoreException {
        try {
            return mapper.writeValueAsString(new StoredBalance(record.balance(), record.cachedAt()));
        } catch (JsonProcessingException e) {
            throw new SharedStoreException("无法序列化余额: " + e.getMessage(), e);
        }
    }

    /**
     * @return 锁令牌；锁被他人持有时为 null
     */
    public String acquireLock(String exchange) throws SharedStoreException {
        String token = now() + "-" + Long.toString(RANDOM.nextLong() & Long.MAX_VALUE, 36);
        if (store.setIfAbsent(lockKey(exchange), token, config.getLockTtlMs())) {
            return token;
        }
        return null;
    }

    /**
     * 令牌不匹配（锁已过期或被他人重新获取）时不删除
     */
    public boolean releaseLock(String exchange, String token) throws SharedStoreException {
        return store.compareAndDelete(lockKey(exchange), token);
    }

    public Optional<CachedBalance> waitForFresh(String exchange) throws SharedStoreException {
        return waitForFresh(exchange, config.getWaitTimeoutMs(), config.getTtlMs());
    }

    /**
     * 每 {@value SharedBalanceConfig#POLL_INTERVAL_MS} ms 轮询一次，直到出现比
     * {@code freshMs} 新的记录或超过 {@code waitMs}
     */
    public Optional<CachedBalance> waitForFresh(String exchange, long waitMs, long freshMs)
            throws SharedStoreException {
        long deadline = now() + Math.max(0, waitMs);
        while (now() < deadline) {
            Optional<CachedBalance> record = get(exchange);
            if (record.isPresent() && record.get().isWithin(freshMs, now())) {
                return record;
            }
            try {
                sleeper.sleep(SharedBalanceConfig.POLL_INTERVAL_MS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                logger.warn("[{}] 等待共享余额被中断", exchangeKey(exchange));
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    /**
     * 只清除进程内副本，不动存储中的记录
     */
    public void clearLocal() {
        local.clear();
    }
}
