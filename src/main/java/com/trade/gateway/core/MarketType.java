package com.trade.gateway.core;

/**
 * 市场类型
 */
public enum MarketType {
    SPOT("spot"),       // 现货
    SWAP("swap"),       // 永续合约
    FUTURE("future");   // 交割合约

    private final String code;

    MarketType(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    /**
     * 是否为衍生品市场
     */
    public boolean isDerivative() {
        return this != SPOT;
    }

    public static MarketType fromCode(String code) {
        if (code == null || code.isBlank()) {
            return SWAP;
        }
        for (MarketType type : values()) {
            if (type.code.equalsIgnoreCase(code.trim())) {
                return type;
            }
        }
        throw new IllegalArgumentException("不支持的市场类型: " + code);
    }
}
