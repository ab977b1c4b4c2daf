package com.trade.gateway.exchange;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * 网关与重试执行器共用的监听器列表
 */
final class GatewayListeners {

    private static final Logger logger = LoggerFactory.getLogger(GatewayListeners.class);

    private final List<GatewayListener> listeners = new CopyOnWriteArrayList<>();

    void add(GatewayListener listener) {
        listeners.add(listener);
    }

    void remove(GatewayListener listener) {
        listeners.remove(listener);
    }

    void clear() {
        listeners.clear();
    }

    void notify(Consumer<GatewayListener> action) {
        for (GatewayListener listener : listeners) {
            try {
                action.accept(listener);
            } catch (Exception e) {
                logger.error("监听器回调失败: {}", e.getMessage());
            }
        }
    }
}
