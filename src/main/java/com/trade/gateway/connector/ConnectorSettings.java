package com.trade.gateway.connector;

import com.trade.gateway.core.MarketType;

/**
 * 连接器构造参数
 *
 * @param passphrase OKX 等交易所需要，其余为 null
 * @param timeoutMs  单次 HTTP 请求超时
 */
public record ConnectorSettings(String apiKey,
                                String secret,
                                String passphrase,
                                boolean sandbox,
                                MarketType defaultType,
                                long timeoutMs) {

    public boolean hasCredentials() {
        return apiKey != null && !apiKey.isBlank() && secret != null && !secret.isBlank();
    }
}
