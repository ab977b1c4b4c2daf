package com.trade.gateway.balance;

import com.trade.gateway.core.ConfigManager;

/**
 * 共享存储的 Redis 连接配置
 *
 * @param password 服务端未开启 AUTH 时为 null
 */
public record RedisConfig(String host, int port, String password, int database, int timeoutMs) {

    public static final String DEFAULT_HOST = "localhost";
    public static final int DEFAULT_PORT = 6379;
    public static final int DEFAULT_TIMEOUT_MS = 2000;

    public RedisConfig {
        host = host == null || host.isBlank() ? DEFAULT_HOST : host;
        port = port <= 0 ? DEFAULT_PORT : port;
        password = password == null || password.isBlank() ? null : password;
        database = Math.max(0, database);
        timeoutMs = timeoutMs <= 0 ? DEFAULT_TIMEOUT_MS : timeoutMs;
    }

    public static RedisConfig defaults() {
        return new RedisConfig(DEFAULT_HOST, DEFAULT_PORT, null, 0, DEFAULT_TIMEOUT_MS);
    }

    public static RedisConfig fromConfig(ConfigManager config) {
        return new RedisConfig(
                config.getProperty("redis.host", DEFAULT_HOST, "REDIS_HOST"),
                config.getIntProperty("redis.port", DEFAULT_PORT, "REDIS_PORT"),
                config.getProperty("redis.password", null, "REDIS_PASSWORD"),
                config.getIntProperty("redis.db", 0, "REDIS_DB"),
                config.getIntProperty("redis.timeout-ms", DEFAULT_TIMEOUT_MS, "REDIS_TIMEOUT_MS"));
    }

    @Override
    public String toString() {
        return "RedisConfig[" + host + ":" + port + "/" + database + (password == null ? "" : " auth") + "]";
    }
}
