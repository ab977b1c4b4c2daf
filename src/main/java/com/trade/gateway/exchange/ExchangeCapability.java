package com.trade.gateway.exchange;

import com.trade.gateway.connector.ConnectorOperation;
import com.trade.gateway.connector.ExchangeConnector;

import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;

/**
 * 交易所能力：连接器的创建方式与支持的操作
 * 不支持的操作由网关走降级路径，不会调用连接器
 */
public record ExchangeCapability(String name,
                                 Function<GatewayConfig, ExchangeConnector> connectorFactory,
                                 Set<ConnectorOperation> supportedOps) {

    public ExchangeCapability {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(connectorFactory, "connectorFactory");
        name = name.toLowerCase();
        supportedOps = supportedOps == null || supportedOps.isEmpty()
                ? Set.of() : Set.copyOf(EnumSet.copyOf(supportedOps));
    }

    public boolean supports(ConnectorOperation operation) {
        return supportedOps.contains(operation);
    }

    public ExchangeConnector createConnector(GatewayConfig config) {
        return connectorFactory.apply(config);
    }

    public ExchangeCapability withName(String alias) {
        return new ExchangeCapability(alias, connectorFactory, supportedOps);
    }
}
