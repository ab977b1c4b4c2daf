package com.trade.gateway.exchange;

import com.trade.gateway.connector.ExchangeException;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.ConnectException;
import java.net.SocketTimeoutException;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 错误归类测试
 */
class ErrorNormalizerTest {

    private final ErrorNormalizer normalizer = new ErrorNormalizer("okx");

    @Test
    void testClassifyConnectorCodes() {
        assertEquals(ErrorKind.AUTHENTICATION_ERROR, ErrorNormalizer.classify(
                new ExchangeException(ExchangeException.ErrorCode.AUTH_FAILED, "bad key")));
        assertEquals(ErrorKind.PERMISSION_DENIED, ErrorNormalizer.classify(
                new ExchangeException(ExchangeException.ErrorCode.PERMISSION_DENIED, "ip")));
        assertEquals(ErrorKind.INSUFFICIENT_FUNDS, ErrorNormalizer.classify(
                new ExchangeException(ExchangeException.ErrorCode.INSUFFICIENT_BALANCE, "margin")));
        assertEquals(ErrorKind.RATE_LIMIT_EXCEEDED, ErrorNormalizer.classify(
                new ExchangeException(ExchangeException.ErrorCode.RATE_LIMIT, "slow down")));
        assertEquals(ErrorKind.EXCHANGE_NOT_AVAILABLE, ErrorNormalizer.classify(
                new ExchangeException(ExchangeException.ErrorCode.SERVICE_UNAVAILABLE, "maintenance")));
        assertEquals(ErrorKind.EXCHANGE_ERROR, ErrorNormalizer.classify(
                new ExchangeException(ExchangeException.ErrorCode.INVALID_SYMBOL, "no such symbol")));
    }

    @Test
    void testClassifyTransportFailures() {
        assertEquals(ErrorKind.REQUEST_TIMEOUT, ErrorNormalizer.classify(new SocketTimeoutException("read timed out")));
        assertEquals(ErrorKind.NETWORK_ERROR, ErrorNormalizer.classify(new ConnectException("refused")));
        // 运行时异常包装的 IO 异常沿 cause 链识别
        assertEquals(ErrorKind.NETWORK_ERROR, ErrorNormalizer.classify(
                new UncheckedIOException(new IOException("connection reset"))));
        assertEquals(ErrorKind.UNKNOWN_ERROR, ErrorNormalizer.classify(new IllegalStateException("boom")));
        assertEquals(ErrorKind.UNKNOWN_ERROR, ErrorNormalizer.classify(null));
    }

    @Test
    void testShouldRetry() {
        assertTrue(ErrorNormalizer.shouldRetry(ErrorKind.NETWORK_ERROR, 1, 3));
        assertTrue(ErrorNormalizer.shouldRetry(ErrorKind.DDOS_PROTECTION, 2, 3));
        // 预算用尽优先于错误类型
        assertFalse(ErrorNormalizer.shouldRetry(ErrorKind.NETWORK_ERROR, 3, 3));
        assertFalse(ErrorNormalizer.shouldRetry(ErrorKind.AUTHENTICATION_ERROR, 1, 3));
        assertFalse(ErrorNormalizer.shouldRetry(ErrorKind.INVALID_ORDER, 0, 3));
    }

    @Test
    void testNormalizeKeepsCodeAndCause() {
        ExchangeException raw = new ExchangeException(ExchangeException.ErrorCode.PERMISSION_DENIED,
                "IP not whitelisted", "50110", 401);
        NormalizedError error = normalizer.normalize(raw);

        assertEquals(ErrorKind.PERMISSION_DENIED, error.getKind());
        assertEquals("50110", error.getCode());
        assertEquals(401, error.getHttpStatus());
        assertEquals("okx", error.getExchangeName());
        assertFalse(error.isRetryable());
        assertSame(raw, error.getOriginal());
        assertEquals(GatewayException.Reason.EXCHANGE, error.getReason());
    }

    @Test
    void testNormalizeTransientOutsideRetryLoop() {
        NormalizedError error = normalizer.normalize(
                new ExchangeException(ExchangeException.ErrorCode.NETWORK_ERROR, "reset"));
        assertTrue(error.isRetryable());
    }

    @Test
    void testNormalizeIsIdempotent() {
        NormalizedError first = normalizer.normalize(
                new ExchangeException(ExchangeException.ErrorCode.TIMEOUT, "slow"), false);
        assertSame(first, normalizer.normalize(first, false));

        NormalizedError flipped = normalizer.normalize(first, true);
        assertTrue(flipped.isRetryable());
        assertEquals(first.getKind(), flipped.getKind());
        assertSame(first.getOriginal(), flipped.getOriginal());
    }

    @Test
    void testSummarize() {
        Exception error = new RuntimeException("outer", new IOException("inner", new IllegalStateException()));
        assertEquals("outer | inner | IllegalStateException", ErrorNormalizer.summarize(error));
        assertEquals("未知错误", ErrorNormalizer.summarize(null));
    }
}
