package com.trade.gateway.core;

/**
 * 订单类型
 */
public enum OrderType {
    MARKET("market"),               // 市价单
    LIMIT("limit"),                 // 限价单
    STOP("stop"),                   // 止损单（触发后按市价）
    STOP_LIMIT("stop_limit"),       // 触发后挂限价
    STOP_MARKET("stop_market");     // 触发后市价

    private final String code;

    OrderType(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    /**
     * 是否必须带价格
     */
    public boolean requiresPrice() {
        return this == LIMIT || this == STOP_LIMIT;
    }

    /**
     * 是否为条件单
     */
    public boolean isConditional() {
        return this == STOP || this == STOP_LIMIT || this == STOP_MARKET;
    }

    /**
     * 不识别返回 null
     */
    public static OrderType fromCode(String code) {
        if (code == null) {
            return null;
        }
        String normalized = code.trim().toLowerCase();
        for (OrderType type : values()) {
            if (type.code.equals(normalized)) {
                return type;
            }
        }
        return null;
    }
}
