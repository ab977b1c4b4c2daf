package com.trade.gateway.exchange;

/**
 * 重试操作的终态
 */
public enum RetryOutcome {
    SUCCESS,
    EXHAUSTED,      // 可重试，但次数用尽
    NON_RETRYABLE   // 不可重试，或等待被中断
}
