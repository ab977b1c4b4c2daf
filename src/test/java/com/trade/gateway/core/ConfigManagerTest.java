package com.trade.gateway.core;

import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 配置管理器单元测试
 */
class ConfigManagerTest {

    @Test
    void testParseEnvValue() {
        assertEquals("abc", ConfigManager.parseEnvValue("abc"));
        assertEquals("abc", ConfigManager.parseEnvValue("\"abc\""));
        assertEquals("5000", ConfigManager.parseEnvValue("5000"));
        assertEquals("true", ConfigManager.parseEnvValue("true"));
        assertEquals("{\"a\":1}", ConfigManager.parseEnvValue("{\"a\":1}"));
        assertNull(ConfigManager.parseEnvValue("null"));
        // 非法 JSON 原样返回
        assertEquals("{broken", ConfigManager.parseEnvValue("{broken"));
    }

    @Test
    void testEnvironmentOverridesFile() {
        Properties properties = new Properties();
        properties.setProperty("okx.api-key", "from-file");
        ConfigManager config = new ConfigManager(properties, Map.of("OKX_API_KEY", "from-env"));

        assertEquals("from-env", config.getProperty("okx.api-key", null, "OKX_API_KEY"));
        assertEquals("from-file", config.getProperty("okx.api-key", null, "MISSING_ENV"));
    }

    @Test
    void testFirstEnvNameWins() {
        ConfigManager config = new ConfigManager(new Properties(),
                Map.of("OKX_SECRET", "", "OKX_API_SECRET", "second"));
        assertEquals("second", config.getProperty("okx.secret", null, "OKX_SECRET", "OKX_API_SECRET"));
    }

    @Test
    void testPlaceholderTreatedAsUnset() {
        Properties properties = new Properties();
        properties.setProperty("binance.api-key", "YOUR_API_KEY");
        ConfigManager config = new ConfigManager(properties, Map.of());

        assertFalse(config.hasProperty("binance.api-key"));
        assertEquals("fallback", config.getProperty("binance.api-key", "fallback"));
        assertThrows(RuntimeException.class, () -> config.getProperty("binance.api-key"));
    }

    @Test
    void testTypedValues() {
        Properties properties = new Properties();
        properties.setProperty("exchange.max-retries", "5");
        properties.setProperty("exchange.timeout-ms", "not-a-number");
        properties.setProperty("okx.sandbox", "1");
        ConfigManager config = new ConfigManager(properties, Map.of());

        assertEquals(5, config.getIntProperty("exchange.max-retries", 3));
        assertEquals(30000L, config.getLongProperty("exchange.timeout-ms", 30000L));
        assertTrue(config.getBooleanProperty("okx.sandbox", false));
        assertFalse(config.getBooleanProperty("binance.sandbox", false));
    }
}
