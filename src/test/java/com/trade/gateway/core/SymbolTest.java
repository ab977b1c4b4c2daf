package com.trade.gateway.core;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 统一交易对单元测试
 */
class SymbolTest {

    @Test
    void testParseDerivative() {
        Symbol symbol = Symbol.parse("btc/usdt:usdt");
        assertNotNull(symbol);
        assertEquals("BTC", symbol.getBase());
        assertEquals("USDT", symbol.getQuote());
        assertEquals("USDT", symbol.getSettle());
        assertTrue(symbol.isDerivative());
        assertEquals("BTC/USDT:USDT", symbol.toString());
        assertEquals("BTCUSDT", symbol.toPairString());
    }

    @Test
    void testParseSpot() {
        Symbol symbol = Symbol.parse("ETH/USDT");
        assertNotNull(symbol);
        assertFalse(symbol.isDerivative());
        assertEquals("ETH/USDT:USDT", symbol.withSettle("USDT").toString());
        assertEquals(symbol, Symbol.parse("ETH/USDT:USDT").toSpot());
    }

    @Test
    void testParseInvalid() {
        assertNull(Symbol.parse(null));
        assertNull(Symbol.parse("BTCUSDT"));
        assertNull(Symbol.parse("/USDT"));
        assertNull(Symbol.parse("A/B/C"));
    }

    @Test
    void testFormHelpers() {
        assertTrue(Symbol.isDerivativeForm("BTC/USDT:USDT"));
        assertFalse(Symbol.isDerivativeForm("BTC/USDT"));
        assertEquals("BTC/USDT", Symbol.toSpotForm("BTC/USDT:USDT"));
        assertEquals("BTC/USDT", Symbol.toSpotForm("BTC/USDT"));
    }
}
