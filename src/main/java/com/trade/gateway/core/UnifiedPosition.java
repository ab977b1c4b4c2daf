package com.trade.gateway.core;

import com.fasterxml.jackson.databind.JsonNode;

import java.math.BigDecimal;

/**
 * 统一持仓
 */
public class UnifiedPosition {
    private final String symbol;
    private final PositionSide side;
    private final BigDecimal contracts;         // 持仓数量（张，绝对值）
    private final BigDecimal notional;          // 名义价值
    private final BigDecimal entryPrice;        // 开仓均价
    private final BigDecimal markPrice;         // 标记价格
    private final BigDecimal liquidationPrice;  // 强平价格
    private final BigDecimal leverage;          // 杠杆倍数
    private final BigDecimal unrealizedPnl;     // 未实现盈亏
    private final BigDecimal realizedPnl;       // 已实现盈亏
    private final MarginMode marginMode;        // 保证金模式
    private final BigDecimal collateral;        // 占用保证金
    private final long timestamp;               // 更新时间（毫秒）
    private final JsonNode raw;

    private UnifiedPosition(Builder builder) {
        this.symbol = builder.symbol;
        this.side = builder.side;
        this.contracts = builder.contracts;
        this.notional = builder.notional;
        this.entryPrice = builder.entryPrice;
        this.markPrice = builder.markPrice;
        this.liquidationPrice = builder.liquidationPrice;
        this.leverage = builder.leverage;
        this.unrealizedPnl = builder.unrealizedPnl;
        this.realizedPnl = builder.realizedPnl;
        this.marginMode = builder.marginMode;
        this.collateral = builder.collateral;
        this.timestamp = builder.timestamp;
        this.raw = builder.raw;
    }

    public String getSymbol() { return symbol; }
    public PositionSide getSide() { return side; }
    public BigDecimal getContracts() { return contracts; }
    public BigDecimal getNotional() { return notional; }
    public BigDecimal getEntryPrice() { return entryPrice; }
    public BigDecimal getMarkPrice() { return markPrice; }
    public BigDecimal getLiquidationPrice() { return liquidationPrice; }
    public BigDecimal getLeverage() { return leverage; }
    public BigDecimal getUnrealizedPnl() { return unrealizedPnl; }
    public BigDecimal getRealizedPnl() { return realizedPnl; }
    public MarginMode getMarginMode() { return marginMode; }
    public BigDecimal getCollateral() { return collateral; }
    public long getTimestamp() { return timestamp; }
    public JsonNode getRaw() { return raw; }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String symbol;
        private PositionSide side;
        private BigDecimal contracts;
        private BigDecimal notional;
        private BigDecimal entryPrice;
        private BigDecimal markPrice;
        private BigDecimal liquidationPrice;
        private BigDecimal leverage;
        private BigDecimal unrealizedPnl;
        private BigDecimal realizedPnl;
        private MarginMode marginMode;
        private BigDecimal collateral;
        private long timestamp;
        private JsonNode raw;

        public Builder symbol(String symbol) { this.symbol = symbol; return this; }
        public Builder side(PositionSide side) { this.side = side; return this; }
        public Builder contracts(BigDecimal contracts) { this.contracts = contracts; return this; }
        public Builder notional(BigDecimal notional) { this.notional = notional; return this; }
        public Builder entryPrice(BigDecimal entryPrice) { this.entryPrice = entryPrice; return this; }
        public Builder markPrice(BigDecimal markPrice) { this.markPrice = markPrice; return this; }
        public Builder liquidationPrice(BigDecimal liquidationPrice) { this.liquidationPrice = liquidationPrice; return this; }
        public Builder leverage(BigDecimal leverage) { this.leverage = leverage; return this; }
        public Builder unrealizedPnl(BigDecimal unrealizedPnl) { this.unrealizedPnl = unrealizedPnl; return this; }
        public Builder realizedPnl(BigDecimal realizedPnl) { this.realizedPnl = realizedPnl; return this; }
        public Builder marginMode(MarginMode marginMode) { this.marginMode = marginMode; return this; }
        public Builder collateral(BigDecimal collateral) { this.collateral = collateral; return this; }
        public Builder timestamp(long timestamp) { this.timestamp = timestamp; return this; }
        public Builder raw(JsonNode raw) { this.raw = raw; return this; }

        public UnifiedPosition build() {
            if (symbol == null) {
                throw new IllegalArgumentException("交易对不能为空");
            }
            return new UnifiedPosition(this);
        }
    }

    @Override
    public String toString() {
        return String.format("UnifiedPosition[%s %s contracts=%s entry=%s mark=%s lev=%s %s]",
                symbol, side, contracts, entryPrice, markPrice, leverage, marginMode);
    }
}
