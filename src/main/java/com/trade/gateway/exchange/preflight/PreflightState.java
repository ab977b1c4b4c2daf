package com.trade.gateway.exchange.preflight;

/**
 * 预检查进度
 * NOT_STARTED → NETWORK_CHECKED → AUTH_CHECKED → PASSED，任一步失败进入 FAILED
 */
public enum PreflightState {
    NOT_STARTED,
    NETWORK_CHECKED,
    AUTH_CHECKED,
    PASSED,
    FAILED
}
