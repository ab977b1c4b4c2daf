package com.trade.gateway.exchange;

import com.trade.gateway.core.CancelAllResult;
import com.trade.gateway.core.UnifiedOrder;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * 记录收到的网关事件
 */
class RecordingListener implements GatewayListener {

    final List<ConnectedEvent> connected = new CopyOnWriteArrayList<>();
    final List<String> disconnected = new CopyOnWriteArrayList<>();
    final List<ErrorEvent> errors = new CopyOnWriteArrayList<>();
    final List<RetryEvent> retries = new CopyOnWriteArrayList<>();
    final List<UnifiedOrder> created = new CopyOnWriteArrayList<>();
    final List<UnifiedOrder> canceled = new CopyOnWriteArrayList<>();
    final List<CancelAllResult> canceledAll = new CopyOnWriteArrayList<>();

    @Override
    public void onConnected(ConnectedEvent event) {
        connected.add(event);
    }

    @Override
    public void onDisconnected(String exchange) {
        disconnected.add(exchange);
    }

    @Override
    public void onError(ErrorEvent event) {
        errors.add(event);
    }

    @Override
    public void onRetry(RetryEvent event) {
        retries.add(event);
    }

    @Override
    public void onOrderCreated(UnifiedOrder order) {
        created.add(order);
    }

    @Override
    public void onOrderCanceled(UnifiedOrder order) {
        canceled.add(order);
    }

    @Override
    public void onAllOrdersCanceled(CancelAllResult result) {
        canceledAll.add(result);
    }
}
