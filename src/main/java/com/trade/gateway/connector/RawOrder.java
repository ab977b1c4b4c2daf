package com.trade.gateway.connector;

import com.fasterxml.jackson.databind.JsonNode;

import java.math.BigDecimal;
import java.util.List;

/**
 * 连接器返回的订单，字段保持交易所语义，未归一化
 * 除 id 外的字段都可能为 null
 */
public record RawOrder(String id,
                       String clientOrderId,
                       String symbol,
                       String side,
                       String type,
                       BigDecimal amount,
                       BigDecimal price,
                       BigDecimal filled,
                       BigDecimal remaining,
                       BigDecimal cost,
                       BigDecimal average,
                       String status,
                       Long timestamp,
                       BigDecimal fee,
                       String feeCurrency,
                       List<JsonNode> trades,
                       JsonNode raw) {
}
