package com.trade.gateway.exchange;

import com.trade.gateway.core.MarketType;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 交易对解析测试
 */
class SymbolResolverTest {

    @Test
    void testSpotFormResolvesToLoadedDerivative() {
        SymbolResolver resolver = new SymbolResolver(Set.of("BTC/USDT:USDT"), MarketType.SWAP);
        assertEquals("BTC/USDT:USDT", resolver.resolve("BTC/USDT"));
        assertTrue(resolver.isKnown("BTC/USDT"));
    }

    @Test
    void testDerivativeFormResolvesToLoadedSpot() {
        SymbolResolver resolver = new SymbolResolver(Set.of("ETH/USDT"), MarketType.SPOT);
        assertEquals("ETH/USDT", resolver.resolve("ETH/USDT:USDT"));
    }

    @Test
    void testInverseSettleSuffix() {
        SymbolResolver resolver = new SymbolResolver(Set.of("BTC/USD:USD"), MarketType.SWAP);
        assertEquals("BTC/USD:USD", resolver.resolve("BTC/USD"));
    }

    @Test
    void testExactMatchWins() {
        SymbolResolver resolver = new SymbolResolver(Set.of("BTC/USDT", "BTC/USDT:USDT"), MarketType.SWAP);
        assertEquals("BTC/USDT", resolver.resolve("BTC/USDT"));
        assertEquals("BTC/USDT:USDT", resolver.resolve("BTC/USDT:USDT"));
    }

    @Test
    void testUnknownPassesThrough() {
        SymbolResolver resolver = new SymbolResolver(Set.of("BTC/USDT:USDT"), MarketType.SWAP);
        assertEquals("DOGE/USDT", resolver.resolve("DOGE/USDT"));
        assertFalse(resolver.isKnown("DOGE/USDT"));
        assertFalse(resolver.isKnown(null));
        assertNull(resolver.resolve(null));
    }

    @Test
    void testResolveIsIdempotent() {
        SymbolResolver resolver = new SymbolResolver(Set.of("BTC/USDT:USDT", "ETH/USDT"), MarketType.SWAP);
        for (String input : new String[]{"BTC/USDT", "BTC/USDT:USDT", "ETH/USDT:USDT", "XRP/USDT"}) {
            String once = resolver.resolve(input);
            assertEquals(once, resolver.resolve(once), input);
        }
    }

    @Test
    void testLightweightAppliesConvention() {
        SymbolResolver swap = SymbolResolver.lightweight(MarketType.SWAP);
        assertTrue(swap.isLightweight());
        assertEquals("BTC/USDT:USDT", swap.resolve("BTC/USDT"));
        assertEquals("BTC/USDT:USDT", swap.resolve("BTC/USDT:USDT"));
        assertTrue(swap.isKnown("ANY/THING"));

        SymbolResolver spot = SymbolResolver.lightweight(MarketType.SPOT);
        assertEquals("BTC/USDT", spot.resolve("BTC/USDT:USDT"));
        assertEquals("BTC/USDT", spot.resolve("BTC/USDT"));
    }
}
