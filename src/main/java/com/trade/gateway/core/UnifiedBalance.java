package com.trade.gateway.core;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * 统一账户余额
 * 按币种记录总额、可用、占用；可序列化后写入共享缓存
 */
public class UnifiedBalance {
    private final Map<String, BigDecimal> total;    // 总额
    private final Map<String, BigDecimal> free;     // 可用
    private final Map<String, BigDecimal> used;     // 占用
    private final String exchange;                  // 交易所名称
    private final long timestamp;                   // 获取时间（毫秒）
    private final JsonNode raw;                     // 原始数据

    @JsonCreator
    public UnifiedBalance(@JsonProperty("total") Map<String, BigDecimal> total,
                          @JsonProperty("free") Map<String, BigDecimal> free,
                          @JsonProperty("used") Map<String, BigDecimal> used,
                          @JsonProperty("exchange") String exchange,
                          @JsonProperty("timestamp") long timestamp,
                          @JsonProperty("raw") JsonNode raw) {
        this.total = copy(total);
        this.free = copy(free);
        this.used = copy(used);
        this.exchange = exchange;
        this.timestamp = timestamp;
        this.raw = raw == null || raw.isNull() ? null : raw;
    }

    private static Map<String, BigDecimal> copy(Map<String, BigDecimal> source) {
        if (source == null) {
            return Collections.emptyMap();
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }

    public Map<String, BigDecimal> getTotal() { return total; }
    public Map<String, BigDecimal> getFree() { return free; }
    public Map<String, BigDecimal> getUsed() { return used; }
    public String getExchange() { return exchange; }
    public long getTimestamp() { return timestamp; }
    public JsonNode getRaw() { return raw; }

    /**
     * 某币种可用余额，不存在返回 0
     */
    public BigDecimal getFree(String currency) {
        return free.getOrDefault(currency, BigDecimal.ZERO);
    }

    /**
     * 某币种总额，不存在返回 0
     */
    public BigDecimal getTotal(String currency) {
        return total.getOrDefault(currency, BigDecimal.ZERO);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        UnifiedBalance that = (UnifiedBalance) o;
        return timestamp == that.timestamp
                && Objects.equals(total, that.total)
                && Objects.equals(free, that.free)
                && Objects.equals(used, that.used)
                && Objects.equals(exchange, that.exchange)
                && Objects.equals(raw, that.raw);
    }

    @Override
    public int hashCode() {
        return Objects.hash(total, free, used, exchange, timestamp);
    }

    @Override
    public String toString() {
        return "UnifiedBalance[" + exchange + " total=" + total + " free=" + free + "]";
    }
}
