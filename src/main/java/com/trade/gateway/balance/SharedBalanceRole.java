package com.trade.gateway.balance;

/**
 * 进程在共享余额协议中的角色
 */
public enum SharedBalanceRole {
    LEADER("leader"),       // 每次直接拉取并发布
    FOLLOWER("follower"),   // 只读缓存，从不直接拉取
    AUTO("auto");           // 持锁者拉取，其余读缓存

    private final String code;

    SharedBalanceRole(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    /**
     * 未知或空值按 AUTO 处理
     */
    public static SharedBalanceRole fromCode(String code) {
        if (code == null) {
            return AUTO;
        }
        for (SharedBalanceRole role : values()) {
            if (role.code.equalsIgnoreCase(code.trim())) {
                return role;
            }
        }
        return AUTO;
    }
}
