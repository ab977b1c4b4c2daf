package com.trade.gateway.connector;

import com.fasterxml.jackson.databind.JsonNode;

import java.math.BigDecimal;

/**
 * 连接器返回的资金费率
 */
public record RawFundingRate(String symbol,
                             BigDecimal fundingRate,
                             BigDecimal fundingRatePredicted,
                             long fundingTimestamp,
                             BigDecimal markPrice,
                             BigDecimal indexPrice,
                             JsonNode raw) {
}
