package com.trade.gateway.connector;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.OkHttpClient;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.math.BigDecimal;
import java.net.SocketTimeoutException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * REST 连接器共用的工具方法
 */
public final class ConnectorSupport {

    private ConnectorSupport() {}

    /**
     * 数值一律解析为 BigDecimal，禁止 double
     */
    public static ObjectMapper newObjectMapper() {
        return new ObjectMapper()
                .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);
    }

    public static OkHttpClient newHttpClient(long timeoutMs) {
        long timeout = timeoutMs > 0 ? timeoutMs : 30_000L;
        return new OkHttpClient.Builder()
                .connectTimeout(timeout, TimeUnit.MILLISECONDS)
                .readTimeout(timeout, TimeUnit.MILLISECONDS)
                .writeTimeout(timeout, TimeUnit.MILLISECONDS)
                .build();
    }

    /**
     * 读取数值字段，缺失、空串或非数字返回 null
     */
    public static BigDecimal decimal(JsonNode node, String field) {
        JsonNode value = node.path(field);
        if (value.isMissingNode() || value.isNull()) {
            return null;
        }
        if (value.isNumber()) {
            return value.decimalValue();
        }
        String text = value.asText("").trim();
        if (text.isEmpty()) {
            return null;
        }
        try {
            return new BigDecimal(text);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    public static Long longValue(JsonNode node, String field) {
        BigDecimal value = decimal(node, field);
        return value == null ? null : value.longValue();
    }

    public static String text(JsonNode node, String field) {
        JsonNode value = node.path(field);
        if (value.isMissingNode() || value.isNull()) {
            return null;
        }
        String text = value.asText("");
        return text.isEmpty() ? null : text;
    }

    /**
     * 按插入顺序拼接查询串，值为 null 的参数跳过
     */
    public static String buildQueryString(Map<String, String> params) {
        if (params == null || params.isEmpty()) {
            return "";
        }
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<String, String> entry : params.entrySet()) {
            if (entry.getValue() == null) {
                continue;
            }
            if (sb.length() > 0) {
                sb.append("&");
            }
            sb.append(urlEncode(entry.getKey()))
                    .append("=")
                    .append(urlEncode(entry.getValue()));
        }
        return sb.toString();
    }

    public static String urlEncode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8)
                .replace("+", "%20");
    }

    public static String hmacSha256Hex(String data, String secret) {
        byte[] hash = hmacSha256(data, secret);
        StringBuilder hex = new StringBuilder(hash.length * 2);
        for (byte b : hash) {
            String h = Integer.toHexString(0xff & b);
            if (h.length() == 1) hex.append('0');
            hex.append(h);
        }
        return hex.toString();
    }

    public static String hmacSha256Base64(String data, String secret) {
        return Base64.getEncoder().encodeToString(hmacSha256(data, secret));
    }

    private static byte[] hmacSha256(String data, String secret) {
        try {
            Mac mac = Mac.getInstance("HmacSHA256");
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), "HmacSHA256"));
            return mac.doFinal(data.getBytes(StandardCharsets.UTF_8));
        } catch (Exception e) {
            throw new IllegalStateException("Sign failed", e);
        }
    }

    /**
     * 传输层异常包装：超时单独归类，其余视为网络错误
     */
    public static ExchangeException wrapTransport(String action, IOException e) {
        ExchangeException.ErrorCode code = e instanceof SocketTimeoutException
                || e instanceof InterruptedIOException && "timeout".equalsIgnoreCase(e.getMessage())
                ? ExchangeException.ErrorCode.TIMEOUT
                : ExchangeException.ErrorCode.NETWORK_ERROR;
        return new ExchangeException(code, action + " failed: " + e.getMessage(), e);
    }

    /**
     * 日志中展示的密钥：保留首尾各 4 位
     */
    public static String maskKey(String key) {
        if (key == null || key.length() <= 8) {
            return "****";
        }
        return key.substring(0, 4) + "****" + key.substring(key.length() - 4);
    }
}
