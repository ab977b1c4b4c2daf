package com.trade.gateway.exchange;

import com.trade.gateway.connector.BinanceFuturesConnector;
import com.trade.gateway.connector.ConnectorOperation;
import com.trade.gateway.connector.OkxConnector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 交易所注册表
 * 按名称登记交易所能力，创建网关，并按 name_type_instanceId 缓存共享实例
 */
public class ExchangeRegistry {

    private static final Logger logger = LoggerFactory.getLogger(ExchangeRegistry.class);

    public static final String DEFAULT_INSTANCE_ID = "default";

    private final Map<String, ExchangeCapability> capabilities = new ConcurrentHashMap<>();
    private final Map<String, ExchangeGateway> instances = new ConcurrentHashMap<>();

    /**
     * 空注册表，测试或自定义交易所时使用
     */
    public ExchangeRegistry() {
    }

    /**
     * 内置 binance（别名 binanceusdm）与 okx
     */
    public static ExchangeRegistry withBuiltins() {
        ExchangeRegistry registry = new ExchangeRegistry();
        ExchangeCapability binance = new ExchangeCapability("binance",
                config -> new BinanceFuturesConnector(config.toConnectorSettings()),
                EnumSet.allOf(ConnectorOperation.class));
        registry.register(binance);
        registry.register(binance.withName("binanceusdm"));
        registry.register(new ExchangeCapability("okx",
                config -> new OkxConnector(config.toConnectorSettings()),
                EnumSet.complementOf(EnumSet.of(ConnectorOperation.CANCEL_ALL_ORDERS))));
        return registry;
    }

    public void register(ExchangeCapability capability) {
        ExchangeCapability previous = capabilities.put(capability.name(), capability);
        if (previous != null) {
            logger.warn("交易所 {} 已注册，覆盖原有能力声明", capability.name());
        }
    }

    public boolean isSupported(String name) {
        return name != null && capabilities.containsKey(name.toLowerCase());
    }

    public List<String> getSupportedExchanges() {
        List<String> names = new ArrayList<>(capabilities.keySet());
        names.sort(String::compareTo);
        return names;
    }

    public ExchangeCapability getCapability(String name) {
        ExchangeCapability capability = name == null ? null : capabilities.get(name.toLowerCase());
        if (capability == null) {
            throw new IllegalArgumentException("不支持的交易所: " + name + "，可用: " + getSupportedExchanges());
        }
        return capability;
    }

    /**
     * 每次创建新的网关实例（未连接）
     */
    public ExchangeGateway create(String name, GatewayConfig config) {
        return new ExchangeGateway(getCapability(name), config);
    }

    public ExchangeGateway getInstance(String name, GatewayConfig config) {
        return getInstance(name, config, DEFAULT_INSTANCE_ID);
    }

    /**
     * 同一 name + 市场类型 + instanceId 复用同一网关
     */
    public ExchangeGateway getInstance(String name, GatewayConfig config, String instanceId) {
        String key = instanceKey(name, config, instanceId);
        return instances.computeIfAbsent(key, k -> {
            logger.info("创建网关实例: {}", k);
            return create(name, config);
        });
    }

    public boolean hasInstance(String name, GatewayConfig config, String instanceId) {
        return instances.containsKey(instanceKey(name, config, instanceId));
    }

    public void destroyInstance(String name, GatewayConfig config, String instanceId) {
        ExchangeGateway gateway = instances.remove(instanceKey(name, config, instanceId));
        if (gateway != null) {
            gateway.close();
        }
    }

    public void destroyAll() {
        Iterator<Map.Entry<String, ExchangeGateway>> it = instances.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<String, ExchangeGateway> entry = it.next();
            it.remove();
            try {
                entry.getValue().close();
            } catch (RuntimeException e) {
                logger.error("关闭网关 {} 失败: {}", entry.getKey(), e.getMessage());
            }
        }
    }

    static String instanceKey(String name, GatewayConfig config, String instanceId) {
        return name.toLowerCase() + "_" + config.getDefaultType().getCode() + "_"
                + (instanceId == null ? DEFAULT_INSTANCE_ID : instanceId);
    }
}
