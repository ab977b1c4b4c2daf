package com.trade.gateway.core;

import java.math.BigDecimal;

/**
 * K线（OHLCV）
 *
 * @param timestamp 开盘时间（毫秒）
 */
public record Candle(long timestamp, BigDecimal open, BigDecimal high,
                     BigDecimal low, BigDecimal close, BigDecimal volume) {
}
