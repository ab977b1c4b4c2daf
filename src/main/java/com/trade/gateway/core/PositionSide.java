package com.trade.gateway.core;

/**
 * 持仓方向
 */
public enum PositionSide {
    LONG("long"),   // 多头持仓
    SHORT("short"); // 空头持仓

    private final String code;

    PositionSide(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public static PositionSide fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (PositionSide side : values()) {
            if (side.code.equalsIgnoreCase(code.trim())) {
                return side;
            }
        }
        return null;
    }
}
