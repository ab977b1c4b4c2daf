package com.trade.gateway.connector;

import com.fasterxml.jackson.databind.JsonNode;

import java.math.BigDecimal;

/**
 * 连接器返回的持仓，未归一化
 *
 * @param side      long / short；单向持仓模式下可能为 null，由 contracts 符号推断
 * @param contracts 可能带符号
 */
public record RawPosition(String symbol,
                          String side,
                          BigDecimal contracts,
                          BigDecimal notional,
                          BigDecimal entryPrice,
                          BigDecimal markPrice,
                          BigDecimal liquidationPrice,
                          BigDecimal leverage,
                          BigDecimal unrealizedPnl,
                          BigDecimal realizedPnl,
                          String marginMode,
                          BigDecimal collateral,
                          BigDecimal initialMargin,
                          Long timestamp,
                          JsonNode raw) {
}
