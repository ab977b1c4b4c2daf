package com.trade.gateway.exchange;

import com.trade.gateway.connector.MarketInfo;
import com.trade.gateway.core.MarketType;
import com.trade.gateway.core.PrecisionInfo;
import com.trade.gateway.core.PrecisionValue;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 精度调整测试
 */
class PrecisionAdjusterTest {

    private static MarketInfo market(String symbol, PrecisionInfo precision) {
        return new MarketInfo(symbol, symbol, "BTC", "USDT", "USDT", MarketType.SWAP, true, BigDecimal.ONE, precision);
    }

    private static PrecisionAdjuster adjuster() {
        Map<String, MarketInfo> markets = new LinkedHashMap<>();
        markets.put("BTC/USDT:USDT", market("BTC/USDT:USDT", new PrecisionInfo(
                PrecisionValue.tickSize(new BigDecimal("0.5")), PrecisionValue.decimalPlaces(3),
                null, null, null, null, null)));
        markets.put("ETH/USDT:USDT", market("ETH/USDT:USDT", null));
        return PrecisionAdjuster.fromMarkets(markets);
    }

    @Test
    void testAmountDecimalPlaces() {
        BigDecimal adjusted = adjuster().adjustAmount("BTC/USDT:USDT", new BigDecimal("0.123456"));
        assertEquals(0, new BigDecimal("0.123").compareTo(adjusted));
    }

    @Test
    void testPriceTickSize() {
        BigDecimal adjusted = adjuster().adjustPrice("BTC/USDT:USDT", new BigDecimal("100.37"));
        assertEquals(0, new BigDecimal("100.0").compareTo(adjusted));
    }

    @Test
    void testMissingPrecisionUsesDefaults() {
        PrecisionAdjuster adjuster = adjuster();
        assertEquals(PrecisionInfo.defaults(), adjuster.get("ETH/USDT:USDT").orElseThrow());
        BigDecimal adjusted = adjuster.adjustAmount("ETH/USDT:USDT", new BigDecimal("1.123456789"));
        assertEquals(0, new BigDecimal("1.12345678").compareTo(adjusted));
    }

    @Test
    void testUnknownSymbolPassesThrough() {
        PrecisionAdjuster adjuster = adjuster();
        BigDecimal raw = new BigDecimal("0.123456");
        assertSame(raw, adjuster.adjustAmount("XRP/USDT:USDT", raw));
        assertSame(raw, adjuster.adjustPrice("XRP/USDT:USDT", raw));
        assertNull(adjuster.adjustPrice("BTC/USDT:USDT", null));
        assertTrue(adjuster.get("XRP/USDT:USDT").isEmpty());
    }

    @Test
    void testEmpty() {
        PrecisionAdjuster empty = PrecisionAdjuster.empty();
        assertEquals(0, empty.size());
        assertEquals(2, adjuster().size());
        assertEquals(0, PrecisionAdjuster.fromMarkets(null).size());
    }
}
