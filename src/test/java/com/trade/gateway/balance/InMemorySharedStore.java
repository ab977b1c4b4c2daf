package com.trade.gateway.balance;

import java.util.HashMap;
import java.util.Map;
import java.util.function.LongSupplier;

/**
 * 内存版共享存储，按给定时钟处理过期；可切换为全部失败
 */
public class InMemorySharedStore implements SharedStore {

    private record Entry(String value, long expiresAt) {}

    private final Map<String, Entry> entries = new HashMap<>();
    private final LongSupplier clock;
    private volatile boolean failing;
    private volatile boolean closed;
    private int writes;

    public InMemorySharedStore() {
        this(System::currentTimeMillis);
    }

    public InMemorySharedStore(LongSupplier clock) {
        this.clock = clock;
    }

    public void setFailing(boolean failing) {
        this.failing = failing;
    }

    public boolean isClosed() {
        return closed;
    }

    public synchronized int getWrites() {
        return writes;
    }

    public synchronized void put(String key, String value) {
        entries.put(key, new Entry(value, Long.MAX_VALUE));
    }

    @Override
    public synchronized String get(String key) throws SharedStoreException {
        check();
        Entry entry = live(key);
        return entry == null ? null : entry.value();
    }

    @Override
    public synchronized void setWithExpiry(String key, String value, long ttlMs) throws SharedStoreException {
        check();
        writes++;
        entries.put(key, new Entry(value, clock.getAsLong() + ttlMs));
    }

    @Override
    public synchronized boolean setIfAbsent(String key, String value, long ttlMs) throws SharedStoreException {
        check();
        if (live(key) != null) {
            return false;
        }
        entries.put(key, new Entry(value, clock.getAsLong() + ttlMs));
        return true;
    }

    @Override
    public synchronized boolean compareAndDelete(String key, String expected) throws SharedStoreException {
        check();
        Entry entry = live(key);
        if (entry == null || !entry.value().equals(expected)) {
            return false;
        }
        entries.remove(key);
        return true;
    }

    @Override
    public void close() {
        closed = true;
    }

    private Entry live(String key) {
        Entry entry = entries.get(key);
        if (entry != null && entry.expiresAt() <= clock.getAsLong()) {
            entries.remove(key);
            return null;
        }
        return entry;
    }

    private void check() throws SharedStoreException {
        if (failing) {
            throw new SharedStoreException("store unavailable");
        }
    }
}
