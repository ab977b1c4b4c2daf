package com.trade.gateway.exchange;

/**
 * @param loadMarkets   false 为轻量模式：不加载市场表，交易对按约定转换
 * @param skipPreflight 跳过连通性与密钥检查
 */
public record ConnectOptions(boolean loadMarkets, boolean skipPreflight) {

    public static ConnectOptions defaults() {
        return new ConnectOptions(true, false);
    }

    public static ConnectOptions lightweight() {
        return new ConnectOptions(false, false);
    }
}
