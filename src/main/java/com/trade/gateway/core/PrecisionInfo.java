package com.trade.gateway.core;

import java.math.BigDecimal;

/**
 * 交易对精度与下单限制
 *
 * @param maxAmount 为 null 表示不限
 * @param maxPrice  为 null 表示不限
 */
public record PrecisionInfo(PrecisionValue price,
                            PrecisionValue amount,
                            BigDecimal minAmount,
                            BigDecimal maxAmount,
                            BigDecimal minPrice,
                            BigDecimal maxPrice,
                            BigDecimal minCost) {

    /**
     * 交易所未提供精度时的缺省值：8 位小数，无上限
     */
    public static final int DEFAULT_DECIMAL_PLACES = 8;

    public PrecisionInfo {
        price = price == null ? PrecisionValue.decimalPlaces(DEFAULT_DECIMAL_PLACES) : price;
        amount = amount == null ? PrecisionValue.decimalPlaces(DEFAULT_DECIMAL_PLACES) : amount;
        minAmount = minAmount == null ? BigDecimal.ZERO : minAmount;
        minPrice = minPrice == null ? BigDecimal.ZERO : minPrice;
        minCost = minCost == null ? BigDecimal.ZERO : minCost;
    }

    public static PrecisionInfo defaults() {
        return new PrecisionInfo(null, null, null, null, null, null, null);
    }
}
