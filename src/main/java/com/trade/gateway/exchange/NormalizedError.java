package com.trade.gateway.exchange;

/**
 * 分类后的交易所错误
 * 连接器原始异常保留为 cause
 */
public class NormalizedError extends GatewayException {

    private final ErrorKind kind;
    private final String code;
    private final Integer httpStatus;
    private final boolean retryable;

    public NormalizedError(String message, ErrorKind kind, String code, String exchangeName,
                           Integer httpStatus, boolean retryable, Throwable original) {
        super(Reason.EXCHANGE, exchangeName, message, original);
        this.kind = kind;
        this.code = code;
        this.httpStatus = httpStatus;
        this.retryable = retryable;
    }

    public ErrorKind getKind() {
        return kind;
    }

    /**
     * 交易所错误码，可能为 null
     */
    public String getCode() {
        return code;
    }

    public Integer getHttpStatus() {
        return httpStatus;
    }

    /**
     * 产生该错误时的重试判定（已计入重试次数）
     */
    public boolean isRetryable() {
        return retryable;
    }

    public Throwable getOriginal() {
        return getCause();
    }

    @Override
    public String toString() {
        return "NormalizedError[" + kind + (code == null ? "" : " code=" + code)
                + " exchange=" + getExchangeName() + " retryable=" + retryable + "]: " + getMessage();
    }
}
