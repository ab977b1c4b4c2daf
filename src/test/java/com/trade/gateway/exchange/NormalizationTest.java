package com.trade.gateway.exchange;

import com.trade.gateway.connector.RawOrder;
import com.trade.gateway.connector.RawPosition;
import com.trade.gateway.core.MarginMode;
import com.trade.gateway.core.OrderSide;
import com.trade.gateway.core.OrderStatus;
import com.trade.gateway.core.OrderType;
import com.trade.gateway.core.PositionSide;
import com.trade.gateway.core.UnifiedOrder;
import com.trade.gateway.core.UnifiedPosition;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 订单、持仓归一化测试
 */
class NormalizationTest {

    private static final long NOW = 1_700_000_000_000L;

    @Test
    void testOrderDefaults() {
        RawOrder raw = new RawOrder("1", null, null, "buy", "limit", new BigDecimal("2"), new BigDecimal("100"),
                null, null, null, null, null, null, null, null, null, null);
        UnifiedOrder order = OrderNormalizer.normalize(raw, "BTC/USDT:USDT", NOW);

        assertEquals("BTC/USDT:USDT", order.getSymbol());
        assertEquals(OrderSide.BUY, order.getSide());
        assertEquals(OrderType.LIMIT, order.getType());
        assertEquals(0, BigDecimal.ZERO.compareTo(order.getFilled()));
        assertEquals(0, new BigDecimal("2").compareTo(order.getRemaining()));
        assertEquals(0, new BigDecimal("100").compareTo(order.getAverage()));
        assertEquals(0, BigDecimal.ZERO.compareTo(order.getCost()));
        assertEquals(OrderStatus.OPEN, order.getStatus());
        assertEquals(NOW, order.getTimestamp());
        assertTrue(order.isOpen());
    }

    @Test
    void testOrderFilled() {
        RawOrder raw = new RawOrder("2", "c-2", "ETH/USDT:USDT", "sell", "market", new BigDecimal("3"), null,
                new BigDecimal("3"), null, null, new BigDecimal("2000"), "FILLED", 123L, null, null, null, null);
        UnifiedOrder order = OrderNormalizer.normalize(raw, "BTC/USDT:USDT", NOW);

        assertEquals("ETH/USDT:USDT", order.getSymbol());
        assertEquals(0, BigDecimal.ZERO.compareTo(order.getRemaining()));
        assertEquals(0, new BigDecimal("6000").compareTo(order.getCost()));
        assertEquals(OrderStatus.CLOSED, order.getStatus());
        assertEquals(123L, order.getTimestamp());
    }

    @Test
    void testRemainingNeverNegative() {
        RawOrder raw = new RawOrder("3", null, null, "buy", "market", new BigDecimal("1"), null,
                new BigDecimal("1.5"), null, null, null, "closed", null, null, null, null, null);
        assertEquals(0, BigDecimal.ZERO.compareTo(OrderNormalizer.normalize(raw, "X/Y", NOW).getRemaining()));
    }

    private static RawPosition position(String side, String contracts, String notional, String leverage,
                                        String marginMode, String collateral, String initialMargin) {
        return new RawPosition("BTC/USDT:USDT", side, dec(contracts), dec(notional), new BigDecimal("30000"),
                new BigDecimal("30100"), null, dec(leverage), new BigDecimal("10"), null, marginMode,
                dec(collateral), dec(initialMargin), null, null);
    }

    private static BigDecimal dec(String value) {
        return value == null ? null : new BigDecimal(value);
    }

    @Test
    void testPositionSideFromSign() {
        UnifiedPosition position = PositionNormalizer.normalize(
                position(null, "-0.5", "15000", null, null, null, "1500"), NOW);

        assertEquals(PositionSide.SHORT, position.getSide());
        assertEquals(0, new BigDecimal("0.5").compareTo(position.getContracts()));
        assertEquals(0, BigDecimal.ONE.compareTo(position.getLeverage()));
        assertEquals(MarginMode.CROSS, position.getMarginMode());
        assertEquals(0, new BigDecimal("1500").compareTo(position.getCollateral()));
        assertEquals(NOW, position.getTimestamp());
    }

    @Test
    void testPositionExplicitSide() {
        UnifiedPosition position = PositionNormalizer.normalize(
                position("long", "2", "60000", "10", "isolated", "6100", "6000"), NOW);

        assertEquals(PositionSide.LONG, position.getSide());
        assertEquals(0, BigDecimal.TEN.compareTo(position.getLeverage()));
        assertEquals(MarginMode.ISOLATED, position.getMarginMode());
        assertEquals(0, new BigDecimal("6100").compareTo(position.getCollateral()));
    }

    @Test
    void testEmptyPosition() {
        assertTrue(PositionNormalizer.isEmpty(position(null, "0", "0", "10", null, null, null)));
        assertTrue(PositionNormalizer.isEmpty(position(null, null, null, "10", null, null, null)));
        assertFalse(PositionNormalizer.isEmpty(position(null, "0", "5", "10", null, null, null)));
    }
}
