package com.trade.gateway.core;

import com.fasterxml.jackson.databind.JsonNode;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * 实时行情快照
 */
public class Ticker {
    private final String symbol;
    private final BigDecimal bidPrice;       // 最优买一价
    private final BigDecimal askPrice;       // 最优卖一价
    private final BigDecimal lastPrice;      // 最新成交价
    private final BigDecimal volume24h;      // 24h成交量
    private final BigDecimal high24h;        // 24h最高价
    private final BigDecimal low24h;         // 24h最低价
    private final long timestamp;            // 时间戳（毫秒）
    private final JsonNode raw;

    public Ticker(String symbol, BigDecimal bidPrice, BigDecimal askPrice,
                  BigDecimal lastPrice, BigDecimal volume24h,
                  BigDecimal high24h, BigDecimal low24h, long timestamp, JsonNode raw) {
        this.symbol = symbol;
        this.bidPrice = bidPrice;
        this.askPrice = askPrice;
        this.lastPrice = lastPrice;
        this.volume24h = volume24h;
        this.high24h = high24h;
        this.low24h = low24h;
        this.timestamp = timestamp;
        this.raw = raw;
    }

    public String getSymbol() { return symbol; }
    public BigDecimal getBidPrice() { return bidPrice; }
    public BigDecimal getAskPrice() { return askPrice; }
    public BigDecimal getLastPrice() { return lastPrice; }
    public BigDecimal getVolume24h() { return volume24h; }
    public BigDecimal getHigh24h() { return high24h; }
    public BigDecimal getLow24h() { return low24h; }
    public long getTimestamp() { return timestamp; }
    public JsonNode getRaw() { return raw; }

    /**
     * 获取中间价
     */
    public BigDecimal getMidPrice() {
        if (bidPrice == null || askPrice == null) {
            return lastPrice;
        }
        return bidPrice.add(askPrice).divide(BigDecimal.valueOf(2), Decimal.DEFAULT_SCALE, RoundingMode.HALF_UP);
    }

    @Override
    public String toString() {
        return "Ticker[" + symbol + " last=" + lastPrice + " bid=" + bidPrice + " ask=" + askPrice + "]";
    }
}
