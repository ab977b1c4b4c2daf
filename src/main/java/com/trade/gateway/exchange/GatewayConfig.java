package com.trade.gateway.exchange;

import com.trade.gateway.balance.SharedBalanceConfig;
import com.trade.gateway.connector.ConnectorSettings;
import com.trade.gateway.core.ConfigManager;
import com.trade.gateway.core.MarketType;

/**
 * 单个网关的配置（密钥、环境、超时、重试、共享余额）
 */
public final class GatewayConfig {

    public static final long DEFAULT_TIMEOUT_MS = 30000;

    private final String apiKey;
    private final String secret;
    private final String passphrase;
    private final boolean sandbox;
    private final MarketType defaultType;
    private final long timeoutMs;
    private final RetryPolicy retryPolicy;
    private final SharedBalanceConfig sharedBalance;

    private GatewayConfig(Builder builder) {
        this.apiKey = builder.apiKey;
        this.secret = builder.secret;
        this.passphrase = builder.passphrase;
        this.sandbox = builder.sandbox;
        this.defaultType = builder.defaultType == null ? MarketType.SWAP : builder.defaultType;
        this.timeoutMs = builder.timeoutMs <= 0 ? DEFAULT_TIMEOUT_MS : builder.timeoutMs;
        this.retryPolicy = builder.retryPolicy == null ? RetryPolicy.defaults() : builder.retryPolicy;
        this.sharedBalance = builder.sharedBalance == null ? SharedBalanceConfig.disabled() : builder.sharedBalance;
    }

    /**
     * 读取 {@code {exchange}.*} 配置项和 {@code {EXCHANGE}_*} 环境变量，
     * 以及公共的 {@code exchange.*}、{@code shared-balance.*}、{@code redis.*} 配置
     */
    public static GatewayConfig fromConfig(ConfigManager config, String exchangeName) {
        String key = exchangeName.toLowerCase();
        String env = exchangeName.toUpperCase();
        return builder()
                .apiKey(config.getProperty(key + ".api-key", null, env + "_API_KEY"))
                .secret(config.getProperty(key + ".secret", null, env + "_SECRET", env + "_API_SECRET"))
                .passphrase(config.getProperty(key + ".passphrase", null, env + "_PASSPHRASE", env + "_PASSWORD"))
                .sandbox(config.getBooleanProperty(key + ".sandbox", false, env + "_SANDBOX", env + "_TESTNET"))
                .defaultType(MarketType.fromCode(
                        config.getProperty("exchange.default-type", null, "DEFAULT_MARKET_TYPE")))
                .timeoutMs(config.getLongProperty("exchange.timeout-ms", DEFAULT_TIMEOUT_MS, "EXCHANGE_TIMEOUT_MS"))
                .retryPolicy(new RetryPolicy(
                        config.getIntProperty("exchange.max-retries", RetryPolicy.DEFAULT_MAX_RETRIES,
                                "EXCHANGE_MAX_RETRIES"),
                        config.getLongProperty("exchange.retry-delay-ms", RetryPolicy.DEFAULT_BASE_DELAY_MS,
                                "EXCHANGE_RETRY_DELAY_MS")))
                .sharedBalance(SharedBalanceConfig.fromConfig(config))
                .build();
    }

    public ConnectorSettings toConnectorSettings() {
        return new ConnectorSettings(apiKey, secret, passphrase, sandbox, defaultType, timeoutMs);
    }

    public boolean hasCredentials() {
        return apiKey != null && !apiKey.isBlank() && secret != null && !secret.isBlank();
    }

    public String getApiKey() {
        return apiKey;
    }

    public String getSecret() {
        return secret;
    }

    public String getPassphrase() {
        return passphrase;
    }

    public boolean isSandbox() {
        return sandbox;
    }

    public MarketType getDefaultType() {
        return defaultType;
    }

    public long getTimeoutMs() {
        return timeoutMs;
    }

    public RetryPolicy getRetryPolicy() {
        return retryPolicy;
    }

    public SharedBalanceConfig getSharedBalance() {
        return sharedBalance;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String apiKey;
        private String secret;
        private String passphrase;
        private boolean sandbox;
        private MarketType defaultType;
        private long timeoutMs = DEFAULT_TIMEOUT_MS;
        private RetryPolicy retryPolicy;
        private SharedBalanceConfig sharedBalance;

        public Builder apiKey(String apiKey) { this.apiKey = apiKey; return this; }
        public Builder secret(String secret) { this.secret = secret; return this; }
        public Builder passphrase(String passphrase) { this.passphrase = passphrase; return this; }
        public Builder sandbox(boolean sandbox) { this.sandbox = sandbox; return this; }
        public Builder defaultType(MarketType defaultType) { this.defaultType = defaultType; return this; }
        public Builder timeoutMs(long timeoutMs) { this.timeoutMs = timeoutMs; return this; }
        public Builder retryPolicy(RetryPolicy retryPolicy) { this.retryPolicy = retryPolicy; return this; }
        public Builder sharedBalance(SharedBalanceConfig sharedBalance) { this.sharedBalance = sharedBalance; return this; }

        public GatewayConfig build() {
            return new GatewayConfig(this);
        }
    }
}
