package com.trade.gateway.balance;

import com.trade.gateway.core.ConfigManager;

/**
 * 共享余额配置
 * 未设置的过期上限与锁 TTL 由 {@code ttlMs} 推导：
 * {@code staleMaxMs = max(ttl*3, 15000)}, {@code lockTtlMs = max(ttl*2, 8000)}.
 */
public final class SharedBalanceConfig {

    public static final long DEFAULT_TTL_MS = 5000;
    public static final long MIN_STALE_MAX_MS = 15000;
    public static final long MIN_LOCK_TTL_MS = 8000;
    public static final long DEFAULT_WAIT_TIMEOUT_MS = 2000;
    public static final long POLL_INTERVAL_MS = 200;
    public static final String DEFAULT_KEY_PREFIX = "quant:";
    public static final String DEFAULT_DATA_PREFIX = "balance:shared";
    public static final String DEFAULT_LOCK_PREFIX = "lock:balance";

    private final boolean enabled;
    private final SharedBalanceRole role;
    private final long ttlMs;
    private final long staleMaxMs;
    private final long lockTtlMs;
    private final long waitTimeoutMs;
    private final String keyPrefix;
    private final String dataPrefix;
    private final String lockPrefix;
    private final StaleFallbackMode fallback;
    private final RedisConfig redis;

    private SharedBalanceConfig(Builder builder) {
        this.enabled = builder.enabled;
        this.role = builder.role == null ? SharedBalanceRole.AUTO : builder.role;
        this.ttlMs = builder.ttlMs == null ? DEFAULT_TTL_MS : builder.ttlMs;
        this.staleMaxMs = builder.staleMaxMs == null ? Math.max(ttlMs * 3, MIN_STALE_MAX_MS) : builder.staleMaxMs;
        this.lockTtlMs = builder.lockTtlMs == null ? Math.max(ttlMs * 2, MIN_LOCK_TTL_MS) : builder.lockTtlMs;
        this.waitTimeoutMs = builder.waitTimeoutMs == null ? DEFAULT_WAIT_TIMEOUT_MS : builder.waitTimeoutMs;
        this.keyPrefix = normalizePrefix(builder.keyPrefix == null ? DEFAULT_KEY_PREFIX : builder.keyPrefix);
        this.dataPrefix = isBlank(builder.dataPrefix) ? DEFAULT_DATA_PREFIX : builder.dataPrefix;
        this.lockPrefix = isBlank(builder.lockPrefix) ? DEFAULT_LOCK_PREFIX : builder.lockPrefix;
        this.fallback = builder.fallback == null ? StaleFallbackMode.LENIENT : builder.fallback;
        this.redis = builder.redis == null ? RedisConfig.defaults() : builder.redis;
    }

    public static SharedBalanceConfig disabled() {
        return builder().build();
    }

    public static SharedBalanceConfig fromConfig(ConfigManager config) {
        String redisPrefix = config.getProperty("redis.prefix", DEFAULT_KEY_PREFIX, "REDIS_PREFIX");
        return builder()
                .enabled(config.getBooleanProperty("shared-balance.enabled", false, "SHARED_BALANCE_ENABLED"))
                .role(SharedBalanceRole.fromCode(
                        config.getProperty("shared-balance.role", null, "SHARED_BALANCE_ROLE")))
                .ttlMs(optionalLong(config, "shared-balance.ttl-ms", "SHARED_BALANCE_TTL_MS"))
                .staleMaxMs(optionalLong(config, "shared-balance.stale-max-ms", "SHARED_BALANCE_STALE_MS"))
                .lockTtlMs(optionalLong(config, "shared-balance.lock-ttl-ms", "SHARED_BALANCE_LOCK_TTL_MS"))
                .waitTimeoutMs(optionalLong(config, "shared-balance.wait-timeout-ms", "SHARED_BALANCE_WAIT_MS"))
                .keyPrefix(config.getProperty("shared-balance.key-prefix", redisPrefix, "SHARED_BALANCE_KEY_PREFIX"))
                .dataPrefix(config.getProperty("shared-balance.data-prefix", null))
                .lockPrefix(config.getProperty("shared-balance.lock-prefix", null, "SHARED_BALANCE_LOCK_PREFIX"))
                .fallback(StaleFallbackMode.fromCode(
                        config.getProperty("shared-balance.fallback", null, "SHARED_BALANCE_FALLBACK")))
                .redis(RedisConfig.fromConfig(config))
                .build();
    }

    private static Long optionalLong(ConfigManager config, String key, String envName) {
        long value = config.getLongProperty(key, -1L, envName);
        return value < 0 ? null : value;
    }

    /**
     * 空前缀保持为空，其余补上结尾冒号
     */
    static String normalizePrefix(String prefix) {
        if (prefix == null || prefix.isEmpty()) {
            return "";
        }
        return prefix.endsWith(":") ? prefix : prefix + ":";
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    public boolean isEnabled() {
        return enabled;
    }

    public SharedBalanceRole getRole() {
        return role;
    }

    public long getTtlMs() {
        return ttlMs;
    }

    public long getStaleMaxMs() {
        return staleMaxMs;
    }

    public long getLockTtlMs() {
        return lockTtlMs;
    }

    public long getWaitTimeoutMs() {
        return waitTimeoutMs;
    }

    public String getKeyPrefix() {
        return keyPrefix;
    }

    public String getDataPrefix() {
        return dataPrefix;
    }

    public String getLockPrefix() {
        return lockPrefix;
    }

    public StaleFallbackMode getFallback() {
        return fallback;
    }

    public RedisConfig getRedis() {
        return redis;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "SharedBalanceConfig[enabled=" + enabled + " role=" + role.getCode() + " ttl=" + ttlMs
                + " staleMax=" + staleMaxMs + " lockTtl=" + lockTtlMs + " wait=" + waitTimeoutMs
                + " prefix=" + keyPrefix + " fallback=" + fallback + "]";
    }

    public static class Builder {
        private boolean enabled;
        private SharedBalanceRole role;
        private Long ttlMs;
        private Long staleMaxMs;
        private Long lockTtlMs;
        private Long waitTimeoutMs;
        private String keyPrefix;
        private String dataPrefix;
        private String lockPrefix;
        private StaleFallbackMode fallback;
        private RedisConfig redis;

        public Builder enabled(boolean enabled) { this.enabled = enabled; return this; }
        public Builder role(SharedBalanceRole role) { this.role = role; return this; }
        public Builder ttlMs(Long ttlMs) { this.ttlMs = ttlMs; return this; }
        public Builder staleMaxMs(Long staleMaxMs) { this.staleMaxMs = staleMaxMs; return this; }
        public Builder lockTtlMs(Long lockTtlMs) { this.lockTtlMs = lockTtlMs; return this; }
        public Builder waitTimeoutMs(Long waitTimeoutMs) { this.waitTimeoutMs = waitTimeoutMs; return this; }
        public Builder keyPrefix(String keyPrefix) { this.keyPrefix = keyPrefix; return this; }
        public Builder dataPrefix(String dataPrefix) { this.dataPrefix = dataPrefix; return this; }
        public Builder lockPrefix(String lockPrefix) { this.lockPrefix = lockPrefix; return this; }
        public Builder fallback(StaleFallbackMode fallback) { this.fallback = fallback; return this; }
        public Builder redis(RedisConfig redis) { this.redis = redis; return this; }

        public SharedBalanceConfig build() {
            if (ttlMs != null && ttlMs <= 0) {
                throw new IllegalArgumentException("ttlMs 必须为正: " + ttlMs);
            }
            return new SharedBalanceConfig(this);
        }
    }
}
