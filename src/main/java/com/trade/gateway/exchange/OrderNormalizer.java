package com.trade.gateway.exchange;

import com.trade.gateway.connector.RawOrder;
import com.trade.gateway.core.Decimal;
import com.trade.gateway.core.OrderSide;
import com.trade.gateway.core.OrderStatus;
import com.trade.gateway.core.OrderType;
import com.trade.gateway.core.UnifiedOrder;

import java.math.BigDecimal;

/**
 * 把连接器订单转换为 {@link UnifiedOrder}
 */
final class OrderNormalizer {

    private OrderNormalizer() {
    }

    /**
     * @param fallbackSymbol 请求的交易对，连接器未返回时使用
     * @param now            连接器未返回时间戳时使用
     */
    static UnifiedOrder normalize(RawOrder raw, String fallbackSymbol, long now) {
        BigDecimal amount = raw.amount();
        BigDecimal filled = raw.filled() == null ? BigDecimal.ZERO : raw.filled();
        BigDecimal remaining = raw.remaining();
        if (remaining == null && amount != null) {
            remaining = amount.subtract(filled).max(BigDecimal.ZERO);
        }
        BigDecimal average = Decimal.firstNonNull(raw.average(), raw.price());
        BigDecimal cost = raw.cost();
        if (cost == null && average != null) {
            cost = average.multiply(filled);
        }

        return UnifiedOrder.builder()
                .id(raw.id())
                .clientOrderId(raw.clientOrderId())
                .symbol(raw.symbol() == null || raw.symbol().isBlank() ? fallbackSymbol : raw.symbol())
                .side(OrderSide.fromCode(raw.side()))
                .type(OrderType.fromCode(raw.type()))
                .amount(amount)
                .price(raw.price())
                .filled(filled)
                .remaining(remaining)
                .cost(cost)
                .average(average)
                .status(OrderStatus.fromExchange(raw.status()))
                .timestamp(raw.timestamp() == null ? now : raw.timestamp())
                .fee(raw.fee(), raw.feeCurrency())
                .trades(raw.trades())
                .raw(raw.raw())
                .build();
    }
}
