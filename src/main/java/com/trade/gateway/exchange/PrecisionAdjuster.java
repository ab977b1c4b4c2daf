package com.trade.gateway.exchange;

import com.trade.gateway.connector.MarketInfo;
import com.trade.gateway.core.PrecisionInfo;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * 按交易对的精度表，加载市场时构建一次，之后只读
 * 一律向下截断，订单不会超过请求的数量或价格
 */
public final class PrecisionAdjuster {

    private final Map<String, PrecisionInfo> precisions;

    private PrecisionAdjuster(Map<String, PrecisionInfo> precisions) {
        this.precisions = Collections.unmodifiableMap(precisions);
    }

    public static PrecisionAdjuster empty() {
        return new PrecisionAdjuster(new LinkedHashMap<>());
    }

    public static PrecisionAdjuster fromMarkets(Map<String, MarketInfo> markets) {
        Map<String, PrecisionInfo> table = new LinkedHashMap<>();
        if (markets != null) {
            markets.forEach((symbol, market) -> table.put(symbol,
                    market.precision() == null ? PrecisionInfo.defaults() : market.precision()));
        }
        return new PrecisionAdjuster(table);
    }

    public Optional<PrecisionInfo> get(String symbol) {
        return Optional.ofNullable(precisions.get(symbol));
    }

    public int size() {
        return precisions.size();
    }

    /**
     * 未知交易对原样返回
     */
    public BigDecimal adjustAmount(String symbol, BigDecimal amount) {
        PrecisionInfo info = precisions.get(symbol);
        if (info == null || amount == null) {
            return amount;
        }
        return info.amount().floor(amount);
    }

    public BigDecimal adjustPrice(String symbol, BigDecimal price) {
        PrecisionInfo info = precisions.get(symbol);
        if (info == null || price == null) {
            return price;
        }
        return info.price().floor(price);
    }
}
