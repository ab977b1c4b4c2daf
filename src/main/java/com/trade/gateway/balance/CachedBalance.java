package com.trade.gateway.balance;

import com.trade.gateway.core.UnifiedBalance;

/**
 * 共享缓存中的余额快照
 * age 在读取时由 {@code cachedAt} 计算，不落库
 */
public record CachedBalance(UnifiedBalance balance, long cachedAt) {

    public long ageMs(long now) {
        return now - cachedAt;
    }

    public boolean isWithin(long maxAgeMs, long now) {
        return ageMs(now) <= maxAgeMs;
    }
}
