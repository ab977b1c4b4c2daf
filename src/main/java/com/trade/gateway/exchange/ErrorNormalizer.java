package com.trade.gateway.exchange;

import com.trade.gateway.connector.ExchangeException;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;

/**
 * 把连接器原始异常分类并包装为 {@link NormalizedError}
 */
public final class ErrorNormalizer {

    private final String exchangeName;

    public ErrorNormalizer(String exchangeName) {
        this.exchangeName = exchangeName;
    }

    /**
     * 沿 cause 链查找，第一个可识别的异常决定分类
     */
    public static ErrorKind classify(Throwable error) {
        Throwable current = error;
        int depth = 0;
        while (current != null && depth < 8) {
            if (current instanceof NormalizedError normalized) {
                return normalized.getKind();
            }
            if (current instanceof ExchangeException exchangeException) {
                return fromErrorCode(exchangeException.getErrorCode());
            }
            if (current instanceof SocketTimeoutException) {
                return ErrorKind.REQUEST_TIMEOUT;
            }
            if (current instanceof InterruptedIOException
                    && current.getMessage() != null
                    && current.getMessage().toLowerCase().contains("timeout")) {
                return ErrorKind.REQUEST_TIMEOUT;
            }
            if (current instanceof ConnectException
                    || current instanceof UnknownHostException
                    || current instanceof NoRouteToHostException
                    || current instanceof IOException) {
                return ErrorKind.NETWORK_ERROR;
            }
            current = current.getCause();
            depth++;
        }
        return ErrorKind.UNKNOWN_ERROR;
    }

    static ErrorKind fromErrorCode(ExchangeException.ErrorCode code) {
        if (code == null) {
            return ErrorKind.UNKNOWN_ERROR;
        }
        return switch (code) {
            case AUTH_FAILED -> ErrorKind.AUTHENTICATION_ERROR;
            case PERMISSION_DENIED -> ErrorKind.PERMISSION_DENIED;
            case INSUFFICIENT_BALANCE -> ErrorKind.INSUFFICIENT_FUNDS;
            case ORDER_REJECTED -> ErrorKind.INVALID_ORDER;
            case ORDER_NOT_FOUND -> ErrorKind.ORDER_NOT_FOUND;
            case NETWORK_ERROR -> ErrorKind.NETWORK_ERROR;
            case TIMEOUT -> ErrorKind.REQUEST_TIMEOUT;
            case RATE_LIMIT -> ErrorKind.RATE_LIMIT_EXCEEDED;
            case SERVICE_UNAVAILABLE -> ErrorKind.EXCHANGE_NOT_AVAILABLE;
            case DDOS_PROTECTION -> ErrorKind.DDOS_PROTECTION;
            case INVALID_SYMBOL, NOT_SUPPORTED, API_ERROR -> ErrorKind.EXCHANGE_ERROR;
            case UNKNOWN -> ErrorKind.UNKNOWN_ERROR;
        };
    }

    /**
     * 重试判定：次数用尽优先于错误分类
     */
    public static boolean shouldRetry(ErrorKind kind, int attempt, int maxRetries) {
        if (attempt >= maxRetries) {
            return false;
        }
        return kind.isRetryable();
    }

    /**
     * 归一化重试循环之外的异常，按第一次尝试处理
     */
    public NormalizedError normalize(Throwable error) {
        return normalize(error, shouldRetry(classify(error), 0, 1));
    }

    public NormalizedError normalize(Throwable error, boolean retryable) {
        if (error instanceof NormalizedError normalized) {
            if (normalized.isRetryable() == retryable) {
                return normalized;
            }
            return new NormalizedError(normalized.getMessage(), normalized.getKind(), normalized.getCode(),
                    exchangeName, normalized.getHttpStatus(), retryable, normalized.getOriginal());
        }
        String code = null;
        Integer httpStatus = null;
        if (error instanceof ExchangeException exchangeException) {
            code = exchangeException.getExchangeCode();
            httpStatus = exchangeException.getHttpStatus();
        }
        return new NormalizedError(summarize(error), classify(error), code, exchangeName,
                httpStatus, retryable, error);
    }

    /**
     * 取 cause 链上最多三条消息，拼接后用于日志
     */
    public static String summarize(Throwable error) {
        if (error == null) {
            return "未知错误";
        }
        StringBuilder sb = new StringBuilder();
        Throwable current = error;
        int depth = 0;
        while (current != null && depth < 3) {
            if (depth > 0) {
                sb.append(" | ");
            }
            String msg = current.getMessage();
            if (msg == null || msg.isBlank()) {
                sb.append(current.getClass().getSimpleName());
            } else {
                sb.append(msg);
            }
            current = current.getCause();
            depth++;
        }
        return sb.toString();
    }
}
