package com.trade.gateway.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;
import java.util.Properties;

/**
 * 配置管理器
 * 读取顺序：环境变量 > 项目根目录/config.properties > classpath:config.properties
 * 环境变量的值先按 JSON 解析，失败则按原始字符串使用
 */
public class ConfigManager {

    private static final Logger logger = LoggerFactory.getLogger(ConfigManager.class);

    private static final String CONFIG_FILE = "config.properties";
    private static final ObjectReader JSON = new ObjectMapper()
            .readerFor(JsonNode.class)
            .with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    private static ConfigManager instance;

    private final Map<String, String> environment;
    private Properties properties;

    private ConfigManager() {
        this.environment = System.getenv();
        loadConfiguration();
    }

    /**
     * 测试或嵌入场景下直接指定配置来源
     */
    public ConfigManager(Properties properties, Map<String, String> environment) {
        this.properties = properties == null ? new Properties() : properties;
        this.environment = environment == null ? Map.of() : environment;
    }

    public static synchronized ConfigManager getInstance() {
        if (instance == null) {
            instance = new ConfigManager();
        }
        return instance;
    }

    /**
     * 加载配置文件
     * 文件不存在时只依赖环境变量
     */
    private void loadConfiguration() {
        Properties loaded = new Properties();
        Path configPath = Paths.get(CONFIG_FILE);

        if (Files.exists(configPath)) {
            try (InputStreamReader reader = new InputStreamReader(
                    new FileInputStream(configPath.toFile()),
                    StandardCharsets.UTF_8
            )) {
                loaded.load(reader);
            } catch (IOException e) {
                throw new RuntimeException("无法加载配置文件: " + CONFIG_FILE, e);
            }
        } else {
            try (InputStream in = ConfigManager.class.getClassLoader().getResourceAsStream(CONFIG_FILE)) {
                if (in != null) {
                    loaded.load(new InputStreamReader(in, StandardCharsets.UTF_8));
                } else {
                    logger.warn("配置文件 {} 不存在，仅使用环境变量和默认值", CONFIG_FILE);
                }
            } catch (IOException e) {
                throw new RuntimeException("无法加载配置文件: classpath:" + CONFIG_FILE, e);
            }
        }
        this.properties = loaded;
    }

    /**
     * 获取配置属性，缺失时抛出异常
     */
    public String getProperty(String key) {
        String value = getProperty(key, (String) null);
        if (value == null) {
            throw new RuntimeException("配置项缺失: " + key);
        }
        return value;
    }

    /**
     * 获取配置属性，缺失或为占位符时返回默认值
     */
    public String getProperty(String key, String defaultValue) {
        String value = properties.getProperty(key);
        if (!isSet(value)) {
            return defaultValue;
        }
        return value.trim();
    }

    /**
     * 先查环境变量（按顺序取第一个有值的），再查配置文件
     */
    public String getProperty(String key, String defaultValue, String... envNames) {
        for (String envName : envNames) {
            String raw = environment.get(envName);
            if (isSet(raw)) {
                return parseEnvValue(raw);
            }
        }
        return getProperty(key, defaultValue);
    }

    /**
     * 检查属性是否存在（YOUR_ 开头的占位符视为未配置）
     */
    public boolean hasProperty(String key) {
        return isSet(properties.getProperty(key));
    }

    public int getIntProperty(String key, int defaultValue, String... envNames) {
        String value = getProperty(key, null, envNames);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            logger.warn("配置项 {} 不是整数: {}，使用默认值 {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    public long getLongProperty(String key, long defaultValue, String... envNames) {
        String value = getProperty(key, null, envNames);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            logger.warn("配置项 {} 不是整数: {}，使用默认值 {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    /**
     * 获取布尔配置，true / 1 视为开启
     */
    public boolean getBooleanProperty(String key, boolean defaultValue, String... envNames) {
        String value = getProperty(key, null, envNames);
        if (value == null) {
            return defaultValue;
        }
        String normalized = value.trim().toLowerCase();
        return "true".equals(normalized) || "1".equals(normalized);
    }

    /**
     * 重新加载配置
     */
    public void reload() {
        loadConfiguration();
    }

    /**
     * 环境变量取值：JSON 标量取其文本，JSON 对象/数组保留原文，非 JSON 原样返回
     */
    static String parseEnvValue(String raw) {
        try {
            JsonNode node = JSON.readTree(raw);
            if (node == null || node.isMissingNode()) {
                return raw;
            }
            if (node.isValueNode()) {
                return node.isNull() ? null : node.asText();
            }
            return node.toString();
        } catch (JsonProcessingException e) {
            return raw;
        }
    }

    private static boolean isSet(String value) {
        return value != null && !value.trim().isEmpty() && !value.trim().startsWith("YOUR_");
    }
}
