package com.trade.gateway.balance;

/**
 * 共享存储不可达或命令被拒绝
 */
public class SharedStoreException extends Exception {

    public SharedStoreException(String message) {
        super(message);
    }

    public SharedStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
