package com.trade.gateway.connector;

import com.fasterxml.jackson.databind.JsonNode;

import java.math.BigDecimal;
import java.util.Map;

/**
 * 连接器返回的余额，按币种分组
 */
public record RawBalance(Map<String, BigDecimal> total,
                         Map<String, BigDecimal> free,
                         Map<String, BigDecimal> used,
                         JsonNode raw) {
}
