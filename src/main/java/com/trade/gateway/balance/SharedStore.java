package com.trade.gateway.balance;

/**
 * 共享余额协议所需的最小键值存储接口
 * 每个操作在存储端必须是原子的，进程之间只通过它协调
 */
public interface SharedStore extends AutoCloseable {

    /**
     * 打开（或复用）存储连接
     */
    @FunctionalInterface
    interface Opener {
        SharedStore open() throws SharedStoreException;
    }

    /**
     * @return 值；键不存在或已过期时为 null
     */
    String get(String key) throws SharedStoreException;

    void setWithExpiry(String key, String value, long ttlMs) throws SharedStoreException;

    /**
     * SET NX PX.
     *
     * @return 本次调用创建了该键时为 true
     */
    boolean setIfAbsent(String key, String value, long ttlMs) throws SharedStoreException;

    /**
     * 仅当值仍为 {@code expected} 时删除
     *
     * @return 键被删除时为 true
     */
    boolean compareAndDelete(String key, String expected) throws SharedStoreException;

    @Override
    void close();
}
