package com.trade.gateway.core;

import com.fasterxml.jackson.databind.JsonNode;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.List;

/**
 * 统一订单
 * 各交易所返回的订单经归一化后的表示
 */
public class UnifiedOrder {
    private final String id;                // 交易所订单ID
    private final String clientOrderId;     // 客户端订单ID（可选）
    private final String symbol;            // 统一交易对
    private final OrderSide side;           // 方向
    private final OrderType type;           // 订单类型
    private final BigDecimal amount;        // 委托数量
    private final BigDecimal price;         // 委托价格（市价单可为空）
    private final BigDecimal filled;        // 已成交数量
    private final BigDecimal remaining;     // 剩余数量
    private final BigDecimal cost;          // 成交金额
    private final BigDecimal average;       // 成交均价
    private final OrderStatus status;       // 统一状态
    private final long timestamp;           // 创建时间（毫秒）
    private final BigDecimal fee;           // 手续费（可选）
    private final String feeCurrency;       // 手续费币种（可选）
    private final List<JsonNode> trades;    // 成交明细
    private final JsonNode raw;             // 交易所原始数据

    private UnifiedOrder(Builder builder) {
        this.id = builder.id;
        this.clientOrderId = builder.clientOrderId;
        this.symbol = builder.symbol;
        this.side = builder.side;
        this.type = builder.type;
        this.amount = builder.amount;
        this.price = builder.price;
        this.filled = builder.filled;
        this.remaining = builder.remaining;
        this.cost = builder.cost;
        this.average = builder.average;
        this.status = builder.status;
        this.timestamp = builder.timestamp;
        this.fee = builder.fee;
        this.feeCurrency = builder.feeCurrency;
        this.trades = builder.trades == null ? Collections.emptyList() : List.copyOf(builder.trades);
        this.raw = builder.raw;
    }

    public String getId() { return id; }
    public String getClientOrderId() { return clientOrderId; }
    public String getSymbol() { return symbol; }
    public OrderSide getSide() { return side; }
    public OrderType getType() { return type; }
    public BigDecimal getAmount() { return amount; }
    public BigDecimal getPrice() { return price; }
    public BigDecimal getFilled() { return filled; }
    public BigDecimal getRemaining() { return remaining; }
    public BigDecimal getCost() { return cost; }
    public BigDecimal getAverage() { return average; }
    public OrderStatus getStatus() { return status; }
    public long getTimestamp() { return timestamp; }
    public BigDecimal getFee() { return fee; }
    public String getFeeCurrency() { return feeCurrency; }
    public List<JsonNode> getTrades() { return trades; }
    public JsonNode getRaw() { return raw; }

    /**
     * 是否仍在挂单
     */
    public boolean isOpen() {
        return status == OrderStatus.OPEN;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id;
        private String clientOrderId;
        private String symbol;
        private OrderSide side;
        private OrderType type;
        private BigDecimal amount;
        private BigDecimal price;
        private BigDecimal filled;
        private BigDecimal remaining;
        private BigDecimal cost;
        private BigDecimal average;
        private OrderStatus status;
        private long timestamp;
        private BigDecimal fee;
        private String feeCurrency;
        private List<JsonNode> trades;
        private JsonNode raw;

        public Builder id(String id) { this.id = id; return this; }
        public Builder clientOrderId(String clientOrderId) { this.clientOrderId = clientOrderId; return this; }
        public Builder symbol(String symbol) { this.symbol = symbol; return this; }
        public Builder side(OrderSide side) { this.side = side; return this; }
        public Builder type(OrderType type) { this.type = type; return this; }
        public Builder amount(BigDecimal amount) { this.amount = amount; return this; }
        public Builder price(BigDecimal price) { this.price = price; return this; }
        public Builder filled(BigDecimal filled) { this.filled = filled; return this; }
        public Builder remaining(BigDecimal remaining) { this.remaining = remaining; return this; }
        public Builder cost(BigDecimal cost) { this.cost = cost; return this; }
        public Builder average(BigDecimal average) { this.average = average; return this; }
        public Builder status(OrderStatus status) { this.status = status; return this; }
        public Builder timestamp(long timestamp) { this.timestamp = timestamp; return this; }
        public Builder fee(BigDecimal fee, String feeCurrency) {
            this.fee = fee;
            this.feeCurrency = feeCurrency;
            return this;
        }
        public Builder trades(List<JsonNode> trades) { this.trades = trades; return this; }
        public Builder raw(JsonNode raw) { this.raw = raw; return this; }

        public UnifiedOrder build() {
            if (id == null || id.isBlank()) {
                throw new IllegalArgumentException("订单ID不能为空");
            }
            if (symbol == null) {
                throw new IllegalArgumentException("交易对不能为空");
            }
            return new UnifiedOrder(this);
        }
    }

    @Override
    public String toString() {
        return String.format("UnifiedOrder[%s %s %s %s amount=%s price=%s filled=%s status=%s]",
                id, symbol, side, type, amount, price, filled, status);
    }
}
