package com.trade.gateway.exchange;

/**
 * 连接器异常的固定分类
 */
public enum ErrorKind {
    AUTHENTICATION_ERROR(false),
    PERMISSION_DENIED(false),
    INSUFFICIENT_FUNDS(false),
    INVALID_ORDER(false),
    ORDER_NOT_FOUND(false),
    NETWORK_ERROR(true),
    REQUEST_TIMEOUT(true),
    RATE_LIMIT_EXCEEDED(true),
    EXCHANGE_NOT_AVAILABLE(true),
    DDOS_PROTECTION(true),
    EXCHANGE_ERROR(false),
    UNKNOWN_ERROR(false);

    private final boolean retryable;

    ErrorKind(boolean retryable) {
        this.retryable = retryable;
    }

    /**
     * 该类错误本身是否可重试，重试次数另行判断
     */
    public boolean isRetryable() {
        return retryable;
    }
}
