package com.trade.gateway.balance;

import redis.clients.jedis.DefaultJedisClientConfig;
import redis.clients.jedis.HostAndPort;
import redis.clients.jedis.JedisClientConfig;
import redis.clients.jedis.JedisPooled;
import redis.clients.jedis.exceptions.JedisException;
import redis.clients.jedis.params.SetParams;

import java.util.List;

/**
 * 基于 Jedis 连接池的 {@link SharedStore}
 */
public class RedisSharedStore implements SharedStore {

    static final String COMPARE_AND_DELETE_SCRIPT =
            "if redis.call('get', KEYS[1]) == ARGV[1] then "
                    + "return redis.call('del', KEYS[1]) "
                    + "else return 0 end";

    private final JedisPooled jedis;
    private final String endpoint;

    public RedisSharedStore(RedisConfig config) {
        JedisClientConfig clientConfig = DefaultJedisClientConfig.builder()
                .password(config.password())
                .database(config.database())
                .timeoutMillis(config.timeoutMs())
                .build();
        this.jedis = new JedisPooled(new HostAndPort(config.host(), config.port()), clientConfig);
        this.endpoint = config.host() + ":" + config.port();
    }

    /**
     * 往返一次，确认服务端可达
     */
    public void ping() throws SharedStoreException {
        try {
            jedis.ping();
        } catch (JedisException e) {
            throw new SharedStoreException("Redis 无法连接 " + endpoint + ": " + e.getMessage(), e);
        }
    }

    @Override
    public String get(String key) throws SharedStoreException {
        try {
            return jedis.get(key);
        } catch (JedisException e) {
            throw failure("GET", key, e);
        }
    }

    @Override
    public void setWithExpiry(String key, String value, long ttlMs) throws SharedStoreException {
        try {
            jedis.set(key, value, SetParams.setParams().px(ttlMs));
        } catch (JedisException e) {
            throw failure("SET", key, e);
        }
    }

    @Override
    public boolean setIfAbsent(String key, String value, long ttlMs) throws SharedStoreException {
        try {
            return "OK".equals(jedis.set(key, value, SetParams.setParams().nx().px(ttlMs)));
        } catch (JedisException e) {
            throw failure("SET NX", key, e);
        }
    }

    @Override
    public boolean compareAndDelete(String key, String expected) throws SharedStoreException {
        try {
            Object result = jedis.eval(COMPARE_AND_DELETE_SCRIPT, List.of(key), List.of(expected));
            return result instanceof Long deleted && deleted > 0;
        } catch (JedisException e) {
            throw failure("EVAL", key, e);
        }
    }

    @Override
    public void close() {
        jedis.close();
    }

    private SharedStoreException failure(String command, String key, JedisException e) {
        return new SharedStoreException("Redis " + command + " " + key + " failed: " + e.getMessage(), e);
    }
}
