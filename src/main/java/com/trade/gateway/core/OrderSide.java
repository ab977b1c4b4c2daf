package com.trade.gateway.core;

/**
 * 订单方向
 */
public enum OrderSide {
    BUY("buy", "买入"),
    SELL("sell", "卖出");

    private final String code;
    private final String chineseName;

    OrderSide(String code, String chineseName) {
        this.code = code;
        this.chineseName = chineseName;
    }

    public OrderSide opposite() {
        return this == BUY ? SELL : BUY;
    }

    public String getCode() {
        return code;
    }

    public String getChineseName() {
        return chineseName;
    }

    /**
     * 不识别返回 null，由调用方决定如何报错
     */
    public static OrderSide fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (OrderSide side : values()) {
            if (side.code.equalsIgnoreCase(code.trim())) {
                return side;
            }
        }
        return null;
    }
}
