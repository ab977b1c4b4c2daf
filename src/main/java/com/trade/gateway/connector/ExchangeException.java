package com.trade.gateway.connector;

/**
 * 交易所连接器异常
 * 连接器只抛出此异常，由网关层统一归类
 */
public class ExchangeException extends Exception {

    private final ErrorCode errorCode;
    private final String exchangeCode;   // 交易所原始错误码
    private final Integer httpStatus;    // HTTP 状态码（可选）

    public ExchangeException(ErrorCode errorCode, String message) {
        this(errorCode, message, null, null, null);
    }

    public ExchangeException(ErrorCode errorCode, String message, Throwable cause) {
        this(errorCode, message, null, null, cause);
    }

    public ExchangeException(ErrorCode errorCode, String message, String exchangeCode, Integer httpStatus) {
        this(errorCode, message, exchangeCode, httpStatus, null);
    }

    public ExchangeException(ErrorCode errorCode, String message, String exchangeCode,
                             Integer httpStatus, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.exchangeCode = exchangeCode;
        this.httpStatus = httpStatus;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    public String getExchangeCode() {
        return exchangeCode;
    }

    public Integer getHttpStatus() {
        return httpStatus;
    }

    public enum ErrorCode {
        AUTH_FAILED,            // 认证失败（密钥无效/过期/签名错误）
        PERMISSION_DENIED,      // 权限不足或 IP 不在白名单
        INSUFFICIENT_BALANCE,   // 余额不足
        ORDER_REJECTED,         // 订单参数被拒绝
        ORDER_NOT_FOUND,        // 订单不存在
        INVALID_SYMBOL,         // 无效交易对
        NETWORK_ERROR,          // 网络错误
        TIMEOUT,                // 超时
        RATE_LIMIT,             // 频率限制
        SERVICE_UNAVAILABLE,    // 交易所维护/不可用
        DDOS_PROTECTION,        // 触发风控封禁
        NOT_SUPPORTED,          // 连接器不支持该操作
        API_ERROR,              // 其他交易所业务错误
        UNKNOWN                 // 未知错误
    }
}
