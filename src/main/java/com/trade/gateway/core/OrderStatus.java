package com.trade.gateway.core;

/**
 * 统一订单状态
 */
public enum OrderStatus {
    OPEN("open"),           // 挂单中（含部分成交）
    CLOSED("closed"),       // 完全成交
    CANCELED("canceled"),   // 已取消
    REJECTED("rejected"),   // 被拒绝
    EXPIRED("expired");     // 已过期

    private final String code;

    OrderStatus(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    /**
     * 把交易所原始状态映射为统一状态
     * 缺省视为 OPEN
     */
    public static OrderStatus fromExchange(String raw) {
        if (raw == null || raw.isBlank()) {
            return OPEN;
        }
        return switch (raw.trim().toLowerCase()) {
            case "new", "open", "live", "partially_filled" -> OPEN;
            case "filled", "closed" -> CLOSED;
            case "canceled", "cancelled", "mmp_canceled" -> CANCELED;
            case "rejected" -> REJECTED;
            case "expired" -> EXPIRED;
            default -> OPEN;
        };
    }
}
