package com.trade.gateway.core;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 订单状态映射测试
 */
class OrderStatusTest {

    @Test
    void testFromExchange() {
        assertEquals(OrderStatus.OPEN, OrderStatus.fromExchange("NEW"));
        assertEquals(OrderStatus.OPEN, OrderStatus.fromExchange("live"));
        assertEquals(OrderStatus.OPEN, OrderStatus.fromExchange("PARTIALLY_FILLED"));
        assertEquals(OrderStatus.CLOSED, OrderStatus.fromExchange("FILLED"));
        assertEquals(OrderStatus.CANCELED, OrderStatus.fromExchange("cancelled"));
        assertEquals(OrderStatus.REJECTED, OrderStatus.fromExchange("REJECTED"));
        assertEquals(OrderStatus.EXPIRED, OrderStatus.fromExchange("expired"));
        assertEquals(OrderStatus.OPEN, OrderStatus.fromExchange(null));
    }

    @Test
    void testOrderTypeAndSideCodes() {
        assertEquals(OrderType.STOP_LIMIT, OrderType.fromCode(" STOP_LIMIT "));
        assertNull(OrderType.fromCode("iceberg"));
        assertTrue(OrderType.LIMIT.requiresPrice());
        assertFalse(OrderType.STOP_MARKET.requiresPrice());
        assertEquals(OrderSide.SELL, OrderSide.fromCode("Sell"));
        assertNull(OrderSide.fromCode("hold"));
    }
}
