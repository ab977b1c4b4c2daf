package com.trade.gateway.exchange;

import com.trade.gateway.connector.ConnectorOperation;
import com.trade.gateway.connector.FakeConnector;
import com.trade.gateway.core.MarketType;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 交易所注册表测试
 */
class ExchangeRegistryTest {

    private final GatewayConfig swapConfig = GatewayConfig.builder().build();

    @Test
    void testBuiltins() {
        ExchangeRegistry registry = ExchangeRegistry.withBuiltins();
        assertEquals(List.of("binance", "binanceusdm", "okx"), registry.getSupportedExchanges());
        assertTrue(registry.isSupported("OKX"));
        assertFalse(registry.isSupported("kraken"));
        assertFalse(registry.isSupported(null));

        assertTrue(registry.getCapability("binance").supports(ConnectorOperation.CANCEL_ALL_ORDERS));
        assertFalse(registry.getCapability("okx").supports(ConnectorOperation.CANCEL_ALL_ORDERS));
        assertTrue(registry.getCapability("okx").supports(ConnectorOperation.FETCH_POSITIONS));
        assertEquals("binanceusdm", registry.getCapability("binanceusdm").name());
    }

    @Test
    void testUnknownExchange() {
        ExchangeRegistry registry = ExchangeRegistry.withBuiltins();
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> registry.getCapability("kraken"));
        assertTrue(e.getMessage().contains("kraken"));
    }

    @Test
    void testCapabilityNameIsLowerCase() {
        ExchangeCapability capability = new ExchangeCapability("MyEx", c -> new FakeConnector(),
                EnumSet.of(ConnectorOperation.FETCH_TICKER));
        assertEquals("myex", capability.name());
        assertTrue(capability.supports(ConnectorOperation.FETCH_TICKER));
        assertFalse(capability.supports(ConnectorOperation.SET_LEVERAGE));
        assertFalse(new ExchangeCapability("none", c -> new FakeConnector(), null)
                .supports(ConnectorOperation.FETCH_TICKER));
    }

    @Test
    void testInstancesAreCachedByKey() {
        ExchangeRegistry registry = ExchangeRegistry.withBuiltins();
        ExchangeGateway first = registry.getInstance("okx", swapConfig);
        assertSame(first, registry.getInstance("OKX", swapConfig));
        assertTrue(registry.hasInstance("okx", swapConfig, ExchangeRegistry.DEFAULT_INSTANCE_ID));

        assertNotSame(first, registry.getInstance("okx", swapConfig, "bot-2"));
        GatewayConfig spotConfig = GatewayConfig.builder().defaultType(MarketType.SPOT).build();
        assertNotSame(first, registry.getInstance("okx", spotConfig));
        assertNotSame(first, registry.create("okx", swapConfig));
    }

    @Test
    void testInstanceKey() {
        assertEquals("okx_swap_default", ExchangeRegistry.instanceKey("OKX", swapConfig, null));
        assertEquals("binance_swap_main", ExchangeRegistry.instanceKey("binance", swapConfig, "main"));
    }

    @Test
    void testDestroyClosesGateway() throws Exception {
        FakeConnector connector = new FakeConnector("custom");
        ExchangeRegistry registry = new ExchangeRegistry();
        registry.register(new ExchangeCapability("custom", c -> connector, EnumSet.allOf(ConnectorOperation.class)));

        ExchangeGateway gateway = registry.getInstance("custom", swapConfig);
        gateway.connect(ConnectOptions.lightweight());
        assertTrue(gateway.isConnected());

        registry.destroyInstance("custom", swapConfig, ExchangeRegistry.DEFAULT_INSTANCE_ID);
        assertFalse(gateway.isConnected());
        assertTrue(connector.isClosed());
        assertFalse(registry.hasInstance("custom", swapConfig, ExchangeRegistry.DEFAULT_INSTANCE_ID));
    }

    @Test
    void testDestroyAll() {
        ExchangeRegistry registry = ExchangeRegistry.withBuiltins();
        registry.getInstance("okx", swapConfig);
        registry.getInstance("binance", swapConfig);
        registry.destroyAll();
        assertFalse(registry.hasInstance("okx", swapConfig, null));
        assertFalse(registry.hasInstance("binance", swapConfig, null));
    }
}
