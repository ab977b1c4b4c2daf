package com.trade.gateway.exchange;

import com.trade.gateway.balance.SharedBalanceRole;
import com.trade.gateway.connector.ConnectorSettings;
import com.trade.gateway.core.ConfigManager;
import com.trade.gateway.core.MarketType;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 网关配置测试
 */
class GatewayConfigTest {

    @Test
    void testBuilderDefaults() {
        GatewayConfig config = GatewayConfig.builder().build();
        assertEquals(MarketType.SWAP, config.getDefaultType());
        assertEquals(GatewayConfig.DEFAULT_TIMEOUT_MS, config.getTimeoutMs());
        assertEquals(RetryPolicy.defaults(), config.getRetryPolicy());
        assertFalse(config.getSharedBalance().isEnabled());
        assertFalse(config.isSandbox());
        assertFalse(config.hasCredentials());
    }

    @Test
    void testFromConfig() {
        Properties properties = new Properties();
        properties.setProperty("okx.api-key", "file-key");
        properties.setProperty("okx.secret", "file-secret");
        properties.setProperty("okx.sandbox", "true");
        properties.setProperty("exchange.default-type", "spot");
        properties.setProperty("exchange.max-retries", "5");
        properties.setProperty("exchange.retry-delay-ms", "250");
        properties.setProperty("shared-balance.enabled", "true");
        properties.setProperty("shared-balance.role", "follower");
        ConfigManager manager = new ConfigManager(properties, Map.of("OKX_PASSWORD", "env-pass"));

        GatewayConfig config = GatewayConfig.fromConfig(manager, "OKX");
        assertEquals("file-key", config.getApiKey());
        assertEquals("env-pass", config.getPassphrase());
        assertTrue(config.isSandbox());
        assertEquals(MarketType.SPOT, config.getDefaultType());
        assertEquals(new RetryPolicy(5, 250), config.getRetryPolicy());
        assertTrue(config.getSharedBalance().isEnabled());
        assertEquals(SharedBalanceRole.FOLLOWER, config.getSharedBalance().getRole());

        ConnectorSettings settings = config.toConnectorSettings();
        assertEquals("env-pass", settings.passphrase());
        assertEquals(MarketType.SPOT, settings.defaultType());
        assertTrue(settings.hasCredentials());
    }

    @Test
    void testPlaceholderCredentialsAreMissing() {
        Properties properties = new Properties();
        properties.setProperty("binance.api-key", "YOUR_BINANCE_API_KEY");
        properties.setProperty("binance.secret", "YOUR_BINANCE_SECRET");
        GatewayConfig config = GatewayConfig.fromConfig(new ConfigManager(properties, Map.of()), "binance");

        assertNull(config.getApiKey());
        assertFalse(config.hasCredentials());
    }

    @Test
    void testEnvironmentAliases() {
        ConfigManager manager = new ConfigManager(new Properties(), Map.of(
                "BINANCE_API_KEY", "env-key",
                "BINANCE_API_SECRET", "env-secret",
                "BINANCE_TESTNET", "true"));
        GatewayConfig config = GatewayConfig.fromConfig(manager, "binance");

        assertEquals("env-secret", config.getSecret());
        assertTrue(config.isSandbox());
        assertTrue(config.hasCredentials());
    }
}
