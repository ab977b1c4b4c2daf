package com.trade.gateway.core;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Decimal 工具类单元测试
 */
class DecimalTest {

    @Test
    void testOf_String() {
        BigDecimal value = Decimal.of("123.45678901");
        assertEquals(0, new BigDecimal("123.45678901").compareTo(value));
    }

    @Test
    void testParse() {
        assertEquals(0, new BigDecimal("0.5").compareTo(Decimal.parse(" 0.5 ")));
        assertNull(Decimal.parse(null));
        assertNull(Decimal.parse(""));
        assertNull(Decimal.parse("abc"));
    }

    @Test
    void testFloorToScale() {
        BigDecimal floored = Decimal.floorToScale(new BigDecimal("0.123456"), 3);
        assertEquals("0.123", floored.toPlainString());

        // 不做四舍五入
        assertEquals("1.99", Decimal.floorToScale(new BigDecimal("1.999"), 2).toPlainString());
        assertThrows(IllegalArgumentException.class, () -> Decimal.floorToScale(BigDecimal.ONE, -1));
    }

    @Test
    void testFloorToStep() {
        assertEquals("100.0", Decimal.floorToStep(new BigDecimal("100.37"), new BigDecimal("0.5")).toPlainString());
        assertEquals("7", Decimal.floorToStep(new BigDecimal("7.9"), BigDecimal.ONE).toPlainString());
        assertEquals("120", Decimal.floorToStep(new BigDecimal("129"), BigDecimal.TEN).toPlainString());
        assertThrows(IllegalArgumentException.class, () -> Decimal.floorToStep(BigDecimal.ONE, BigDecimal.ZERO));
    }

    @Test
    void testDivide() {
        BigDecimal result = Decimal.divide(new BigDecimal("10"), new BigDecimal("3"));
        assertEquals(Decimal.DEFAULT_SCALE, result.scale());

        // 除零返回 0
        assertEquals(0, BigDecimal.ZERO.compareTo(Decimal.divide(BigDecimal.TEN, BigDecimal.ZERO)));
    }

    @Test
    void testSubtractAndFirstNonNull() {
        assertNull(Decimal.subtract(null, BigDecimal.ONE));
        assertEquals(0, new BigDecimal("1.5").compareTo(Decimal.subtract(new BigDecimal("2"), new BigDecimal("0.5"))));
        assertEquals(0, BigDecimal.TEN.compareTo(Decimal.firstNonNull(null, BigDecimal.TEN, BigDecimal.ONE)));
        assertNull(Decimal.firstNonNull(null, null));
    }

    @Test
    void testSignChecks() {
        assertTrue(Decimal.isPositive(new BigDecimal("0.0001")));
        assertFalse(Decimal.isPositive(null));
        assertTrue(Decimal.isNegative(new BigDecimal("-1")));
        assertTrue(Decimal.isZero(new BigDecimal("0.000")));
        assertTrue(Decimal.isNullOrZero(null));
        assertFalse(Decimal.isNullOrZero(BigDecimal.ONE));
    }
}
