package com.trade.gateway.exchange;

/**
 * 有上限的指数退避，附加最多 25% 的随机抖动
 *
 * @param maxRetries  总尝试次数上限，达到上限的那次不再重试
 * @param baseDelayMs 首次重试前的等待时间，之后每次翻倍
 */
public record RetryPolicy(int maxRetries, long baseDelayMs) {

    public static final long MAX_DELAY_MS = 30_000L;
    public static final double JITTER_RATIO = 0.25;
    public static final int DEFAULT_MAX_RETRIES = 3;
    public static final long DEFAULT_BASE_DELAY_MS = 1000L;

    public RetryPolicy {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries 不能为负: " + maxRetries);
        }
        if (baseDelayMs < 0) {
            throw new IllegalArgumentException("baseDelayMs 不能为负: " + baseDelayMs);
        }
    }

    public static RetryPolicy defaults() {
        return new RetryPolicy(DEFAULT_MAX_RETRIES, DEFAULT_BASE_DELAY_MS);
    }

    /**
     * 操作最多执行的次数，至少一次
     */
    public int maxAttempts() {
        return Math.max(1, maxRetries);
    }

    /**
     * 第 attempt 次（从 1 开始）失败后的基础等待时间，有上限，未含抖动
     */
    public long baseDelay(int attempt) {
        long delay = baseDelayMs;
        for (int i = 1; i < attempt && delay < MAX_DELAY_MS; i++) {
            delay *= 2;
        }
        return Math.min(MAX_DELAY_MS, delay);
    }

    /**
     * @param random [0, 1) 内的随机数
     */
    public long delayFor(int attempt, double random) {
        long exponential = baseDelay(attempt);
        double jitter = exponential * random * JITTER_RATIO;
        return Math.min(MAX_DELAY_MS, Math.round(exponential + jitter));
    }
}
