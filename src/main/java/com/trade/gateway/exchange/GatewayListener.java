package com.trade.gateway.exchange;

import com.trade.gateway.core.CancelAllResult;
import com.trade.gateway.core.UnifiedOrder;

/**
 * 网关事件监听器
 * 回调在调用线程上执行，回调抛出的异常只记录日志
 */
public interface GatewayListener {

    default void onConnected(ConnectedEvent event) {}

    default void onDisconnected(String exchange) {}

    default void onError(ErrorEvent event) {}

    default void onRetry(RetryEvent event) {}

    default void onOrderCreated(UnifiedOrder order) {}

    default void onOrderCanceled(UnifiedOrder order) {}

    default void onAllOrdersCanceled(CancelAllResult result) {}

    /**
     * @param lightweight 未加载市场信息时为 true
     */
    record ConnectedEvent(String exchange, boolean lightweight) {}

    /**
     * @param type      connect 或 request
     * @param operation 失败操作的标签
     */
    record ErrorEvent(String type, String operation, NormalizedError error) {}

    /**
     * @param attempt 刚失败的是第几次尝试（从 1 开始）
     * @param delayMs 下次尝试前的等待时间
     */
    record RetryEvent(String operation, int attempt, int maxRetries, long delayMs, Throwable error) {}
}
