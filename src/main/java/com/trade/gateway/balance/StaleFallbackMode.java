package com.trade.gateway.balance;

/**
 * AUTO 角色既没抢到锁又没有可用缓存时的兜底策略
 */
public enum StaleFallbackMode {
    LENIENT,    // 返回缓存值，不论多旧
    STRICT;     // 报共享余额不可用

    public static StaleFallbackMode fromCode(String code) {
        if (code != null && "strict".equalsIgnoreCase(code.trim())) {
            return STRICT;
        }
        return LENIENT;
    }
}
