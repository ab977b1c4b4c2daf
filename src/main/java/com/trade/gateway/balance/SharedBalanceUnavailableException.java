package com.trade.gateway.balance;

/**
 * 在不违反进程角色的前提下无法提供余额
 */
public class SharedBalanceUnavailableException extends Exception {

    private final String exchange;

    public SharedBalanceUnavailableException(String exchange, String message) {
        super(message);
        this.exchange = exchange;
    }

    public SharedBalanceUnavailableException(String exchange, String message, Throwable cause) {
        super(message, cause);
        this.exchange = exchange;
    }

    public String getExchange() {
        return exchange;
    }
}
