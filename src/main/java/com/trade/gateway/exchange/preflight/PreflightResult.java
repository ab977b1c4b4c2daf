package com.trade.gateway.exchange.preflight;

import com.trade.gateway.exchange.NormalizedError;

/**
 * 预检查结果
 *
 * @param serverTime 交易所不提供时间接口时为本地时间；网络检查失败时为 null
 * @param serverIp   从 IP 白名单错误中提取的本机出口 IP，可能为 null
 * @param error      通过时为 null
 */
public record PreflightResult(PreflightState state,
                              boolean networkOk,
                              boolean apiKeyOk,
                              boolean ipAllowed,
                              Long serverTime,
                              String serverIp,
                              Diagnosis error) {

    public boolean passed() {
        return state == PreflightState.PASSED;
    }

    /**
     * 失败类型
     */
    public enum FailureType {
        AUTHENTICATION("检查 API 密钥是否正确、是否过期、是否开通合约交易权限"),
        IP_NOT_WHITELISTED("登录交易所 API 管理页面，将本机 IP 加入该密钥的白名单后重启"),
        NETWORK("检查网络连接、代理配置以及交易所是否可访问"),
        UNKNOWN("查看原始错误信息");

        private final String suggestion;

        FailureType(String suggestion) {
            this.suggestion = suggestion;
        }

        public String getSuggestion() {
            return suggestion;
        }
    }

    /**
     * @param code  交易所错误码；IP 白名单失败缺省为 50110
     * @param cause 归一化后的原始错误
     */
    public record Diagnosis(FailureType type, String message, String code, String suggestion, NormalizedError cause) {
    }
}
