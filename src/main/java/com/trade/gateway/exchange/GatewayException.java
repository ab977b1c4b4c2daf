package com.trade.gateway.exchange;

/**
 * 网关操作抛出的异常
 * 交易所侧的错误以子类 {@link NormalizedError} 抛出
 */
public class GatewayException extends Exception {

    public enum Reason {
        NOT_CONNECTED,
        INVALID_SYMBOL,
        INVALID_SIDE,
        INVALID_TYPE,
        INVALID_AMOUNT,
        INVALID_PRICE,
        INVALID_LEVERAGE,
        UNSUPPORTED,
        CACHE_UNAVAILABLE,
        EXCHANGE
    }

    private final Reason reason;
    private final String exchangeName;
    private final long timestamp;

    public GatewayException(Reason reason, String exchangeName, String message) {
        this(reason, exchangeName, message, null);
    }

    public GatewayException(Reason reason, String exchangeName, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
        this.exchangeName = exchangeName;
        this.timestamp = System.currentTimeMillis();
    }

    public Reason getReason() {
        return reason;
    }

    public String getExchangeName() {
        return exchangeName;
    }

    public long getTimestamp() {
        return timestamp;
    }
}
