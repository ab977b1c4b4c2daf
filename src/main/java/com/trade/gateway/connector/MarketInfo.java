package com.trade.gateway.connector;

import com.trade.gateway.core.MarketType;
import com.trade.gateway.core.PrecisionInfo;

import java.math.BigDecimal;

/**
 * 交易对元数据
 *
 * @param symbol       统一交易对，如 BTC/USDT:USDT
 * @param id           交易所原生ID，如 BTCUSDT / BTC-USDT-SWAP
 * @param contractSize 每张合约面值，现货为 1
 * @param precision    为 null 时网关使用缺省精度
 */
public record MarketInfo(String symbol,
                         String id,
                         String base,
                         String quote,
                         String settle,
                         MarketType type,
                         boolean active,
                         BigDecimal contractSize,
                         PrecisionInfo precision) {
}
