package com.trade.gateway.exchange;

import com.trade.gateway.connector.ExchangeException;
import com.trade.gateway.core.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * 按 {@link RetryPolicy} 执行连接器调用
 * 每次执行以一个 {@link RetryOutcome} 结束，尝试次数不超过
 * {@link RetryPolicy#maxAttempts()}.
 */
public class RetryExecutor {

    private static final Logger logger = LoggerFactory.getLogger(RetryExecutor.class);

    @FunctionalInterface
    public interface ConnectorCall<T> {
        T call() throws ExchangeException;
    }

    /**
     * @param value 仅 SUCCESS 时有值
     * @param error 仅 EXHAUSTED / NON_RETRYABLE 时有值
     */
    public record Result<T>(RetryOutcome outcome, T value, NormalizedError error, int attempts) {}

    private final RetryPolicy policy;
    private final ErrorNormalizer normalizer;
    private final GatewayListeners listeners;
    private final Sleeper sleeper;
    private final DoubleSupplier random;

    RetryExecutor(RetryPolicy policy, ErrorNormalizer normalizer, GatewayListeners listeners,
                  Sleeper sleeper, DoubleSupplier random) {
        this.policy = policy;
        this.normalizer = normalizer;
        this.listeners = listeners;
        this.sleeper = sleeper;
        this.random = random;
    }

    public RetryExecutor(RetryPolicy policy, ErrorNormalizer normalizer, Sleeper sleeper) {
        this(policy, normalizer, new GatewayListeners(), sleeper, () -> ThreadLocalRandom.current().nextDouble());
    }

    public RetryPolicy getPolicy() {
        return policy;
    }

    /**
     * 返回结果，或先发出 error 事件再抛出归一化后的错误
     */
    public <T> T execute(ConnectorCall<T> operation, String label) throws NormalizedError {
        Result<T> result = run(operation, label);
        if (result.outcome() == RetryOutcome.SUCCESS) {
            return result.value();
        }
        NormalizedError error = result.error();
        logger.error("[{}] {} 共尝试 {} 次后失败 ({}): {}",
                error.getExchangeName(), label, result.attempts(), result.outcome(), error.getMessage());
        listeners.notify(l -> l.onError(new GatewayListener.ErrorEvent("request", label, error)));
        throw error;
    }

    /**
     * 执行重试循环直到终态，不抛出异常
     */
    public <T> Result<T> run(ConnectorCall<T> operation, String label) {
        int maxRetries = policy.maxRetries();
        for (int attempt = 1; attempt <= policy.maxAttempts(); attempt++) {
            try {
                return new Result<>(RetryOutcome.SUCCESS, operation.call(), null, attempt);
            } catch (ExchangeException | RuntimeException e) {
                ErrorKind kind = ErrorNormalizer.classify(e);
                if (!ErrorNormalizer.shouldRetry(kind, attempt, maxRetries)) {
                    RetryOutcome outcome = kind.isRetryable() ? RetryOutcome.EXHAUSTED : RetryOutcome.NON_RETRYABLE;
                    return new Result<>(outcome, null, normalizer.normalize(e, false), attempt);
                }

                long delay = policy.delayFor(attempt, random.getAsDouble());
                int failedAttempt = attempt;
                logger.warn("{} 第 {}/{} 次尝试失败 ({})，{}ms 后重试: {}",
                        label, attempt, maxRetries, kind, delay, e.getMessage());
                listeners.notify(l -> l.onRetry(
                        new GatewayListener.RetryEvent(label, failedAttempt, maxRetries, delay, e)));
                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException interrupted) {
                    Thread.currentThread().interrupt();
                    return new Result<>(RetryOutcome.NON_RETRYABLE, null, normalizer.normalize(e, false), attempt);
                }
            }
        }
        throw new IllegalStateException("重试循环未进入终态: " + label);
    }
}
