package com.trade.gateway.connector;

import com.trade.gateway.core.OrderSide;
import com.trade.gateway.core.OrderType;

import java.math.BigDecimal;
import java.util.Map;

/**
 * 已校验、已按精度截断的下单请求
 *
 * @param price  市价单为 null
 * @param params 附加参数：clientOrderId、stopPrice、reduceOnly、timeInForce 等
 */
public record OrderRequest(String symbol,
                           OrderSide side,
                           OrderType type,
                           BigDecimal amount,
                           BigDecimal price,
                           Map<String, Object> params) {

    public OrderRequest {
        params = params == null ? Map.of() : Map.copyOf(params);
    }

    public String stringParam(String key) {
        Object value = params.get(key);
        return value == null ? null : value.toString();
    }

    public BigDecimal decimalParam(String key) {
        Object value = params.get(key);
        if (value == null) {
            return null;
        }
        if (value instanceof BigDecimal decimal) {
            return decimal;
        }
        return new BigDecimal(value.toString());
    }

    public boolean booleanParam(String key) {
        Object value = params.get(key);
        return value != null && Boolean.parseBoolean(value.toString());
    }
}
