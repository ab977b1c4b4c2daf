package com.trade.gateway.core;

/**
 * 保证金模式
 */
public enum MarginMode {
    CROSS("cross"),         // 全仓
    ISOLATED("isolated");   // 逐仓

    private final String code;

    MarginMode(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    /**
     * 缺省为全仓
     */
    public static MarginMode fromCode(String code) {
        if (code != null && "isolated".equalsIgnoreCase(code.trim())) {
            return ISOLATED;
        }
        return CROSS;
    }
}
