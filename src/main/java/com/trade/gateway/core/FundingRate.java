package com.trade.gateway.core;

import com.fasterxml.jackson.databind.JsonNode;

import java.math.BigDecimal;

/**
 * 资金费率
 *
 * @param fundingRatePredicted 预测的下一期费率，交易所不提供时为 null
 * @param fundingTimestamp     本期结算时间（毫秒）
 */
public record FundingRate(String symbol,
                          BigDecimal fundingRate,
                          BigDecimal fundingRatePredicted,
                          long fundingTimestamp,
                          BigDecimal markPrice,
                          BigDecimal indexPrice,
                          String exchange,
                          long timestamp,
                          JsonNode raw) {
}
