package com.trade.gateway.exchange.preflight;

import com.trade.gateway.connector.ExchangeConnector;
import com.trade.gateway.connector.ExchangeException;
import com.trade.gateway.exchange.ErrorKind;
import com.trade.gateway.exchange.ErrorNormalizer;
import com.trade.gateway.exchange.NormalizedError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.LongSupplier;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 连接前的一次性检查：先用公共接口确认网络可达，再在配置了密钥时用余额接口确认密钥和 IP 白名单
 * 检查本身不重试，也不抛出异常；是否中断连接由调用方根据沙盒/生产环境决定
 */
public class PreflightVerifier {

    private static final Logger logger = LoggerFactory.getLogger(PreflightVerifier.class);

    static final String DEFAULT_PERMISSION_CODE = "50110";
    private static final Pattern IP_AFTER_LABEL = Pattern.compile("IP\\s+(\\d+\\.\\d+\\.\\d+\\.\\d+)",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern ANY_IPV4 = Pattern.compile("\\b(\\d{1,3}(?:\\.\\d{1,3}){3})\\b");

    private final String exchangeName;
    private final ExchangeConnector connector;
    private final boolean fetchTimeSupported;
    private final boolean credentialsConfigured;
    private final ErrorNormalizer normalizer;
    private final LongSupplier clock;

    private volatile PreflightState state = PreflightState.NOT_STARTED;

    public PreflightVerifier(String exchangeName, ExchangeConnector connector, boolean fetchTimeSupported,
                             boolean credentialsConfigured, LongSupplier clock) {
        this.exchangeName = exchangeName;
        this.connector = connector;
        this.fetchTimeSupported = fetchTimeSupported;
        this.credentialsConfigured = credentialsConfigured;
        this.normalizer = new ErrorNormalizer(exchangeName);
        this.clock = clock;
    }

    public PreflightState getState() {
        return state;
    }

    public PreflightResult verify() {
        logger.info("[{}] 执行 API 预检查...", exchangeName);
        long serverTime;
        try {
            serverTime = fetchTimeSupported ? connector.fetchTime() : clock.getAsLong();
        } catch (ExchangeException | RuntimeException e) {
            return fail(false, null, e);
        }
        state = PreflightState.NETWORK_CHECKED;
        logger.info("[{}] 网络连通性正常, 服务器时间: {}", exchangeName, serverTime);

        if (!credentialsConfigured) {
            logger.warn("[{}] 未配置 API 密钥，跳过认证检查，部分功能可能受限", exchangeName);
            state = PreflightState.PASSED;
            return new PreflightResult(state, true, false, false, serverTime, null, null);
        }

        try {
            connector.fetchBalance();
        } catch (ExchangeException | RuntimeException e) {
            return fail(true, serverTime, e);
        }
        state = PreflightState.AUTH_CHECKED;
        logger.info("[{}] API 密钥有效, IP 已在白名单中", exchangeName);

        state = PreflightState.PASSED;
        logger.info("[{}] API 预检查通过", exchangeName);
        return new PreflightResult(state, true, true, true, serverTime, null, null);
    }

    private PreflightResult fail(boolean reachedNetwork, Long serverTime, Exception e) {
        NormalizedError error = normalizer.normalize(e);
        ErrorKind kind = error.getKind();
        PreflightResult.FailureType type = failureType(kind);
        // 认证或权限错误说明请求已到达交易所
        boolean networkOk = reachedNetwork
                || type == PreflightResult.FailureType.AUTHENTICATION
                || type == PreflightResult.FailureType.IP_NOT_WHITELISTED;
        String code = error.getCode();
        String serverIp = null;
        if (type == PreflightResult.FailureType.IP_NOT_WHITELISTED) {
            code = code == null ? DEFAULT_PERMISSION_CODE : code;
            serverIp = extractIp(error.getMessage());
        }

        state = PreflightState.FAILED;
        logger.error("[{}] API 预检查失败 ({}): {}", exchangeName, type, error.getMessage());
        if (code != null) {
            logger.error("[{}]   错误码: {}", exchangeName, code);
        }
        if (serverIp != null) {
            logger.error("[{}]   当前服务器 IP: {}", exchangeName, serverIp);
        }
        logger.error("[{}]   解决方案: {}", exchangeName, type.getSuggestion());

        PreflightResult.Diagnosis diagnosis = new PreflightResult.Diagnosis(
                type, error.getMessage(), code, type.getSuggestion(), error);
        return new PreflightResult(state, networkOk, false, false, serverTime, serverIp, diagnosis);
    }

    static PreflightResult.FailureType failureType(ErrorKind kind) {
        return switch (kind) {
            case AUTHENTICATION_ERROR -> PreflightResult.FailureType.AUTHENTICATION;
            case PERMISSION_DENIED -> PreflightResult.FailureType.IP_NOT_WHITELISTED;
            case NETWORK_ERROR, REQUEST_TIMEOUT, EXCHANGE_NOT_AVAILABLE, DDOS_PROTECTION ->
                    PreflightResult.FailureType.NETWORK;
            default -> PreflightResult.FailureType.UNKNOWN;
        };
    }

    /**
     * 优先匹配 "IP x.x.x.x"，否则取第一个点分 IPv4
     */
    static String extractIp(String message) {
        if (message == null) {
            return null;
        }
        Matcher labelled = IP_AFTER_LABEL.matcher(message);
        if (labelled.find()) {
            return labelled.group(1);
        }
        Matcher any = ANY_IPV4.matcher(message);
        return any.find() ? any.group(1) : null;
    }
}
