package com.trade.gateway.connector;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.util.Map;

import static com.trade.gateway.connector.ExchangeException.ErrorCode.*;

/**
 * Binance 错误响应 → {@link ExchangeException}
 * 响应体格式：{"code":-2015,"msg":"..."}
 */
final class BinanceErrorMapper {

    private static final Map<Integer, ExchangeException.ErrorCode> CODES = Map.ofEntries(
            Map.entry(-1001, SERVICE_UNAVAILABLE),   // internal error, unable to process
            Map.entry(-1003, RATE_LIMIT),            // too many requests
            Map.entry(-1007, TIMEOUT),               // backend timeout
            Map.entry(-1015, RATE_LIMIT),            // too many orders
            Map.entry(-1016, SERVICE_UNAVAILABLE),   // service shutting down
            Map.entry(-1002, AUTH_FAILED),
            Map.entry(-1022, AUTH_FAILED),           // invalid signature
            Map.entry(-2014, AUTH_FAILED),           // bad api key format
            Map.entry(-2015, AUTH_FAILED),           // invalid key, IP or permissions
            Map.entry(-1121, INVALID_SYMBOL),
            Map.entry(-1013, ORDER_REJECTED),
            Map.entry(-1102, ORDER_REJECTED),
            Map.entry(-1106, ORDER_REJECTED),
            Map.entry(-1111, ORDER_REJECTED),        // precision over maximum
            Map.entry(-2010, ORDER_REJECTED),
            Map.entry(-4003, ORDER_REJECTED),        // quantity less than zero
            Map.entry(-4164, ORDER_REJECTED),        // notional too small
            Map.entry(-2018, INSUFFICIENT_BALANCE),
            Map.entry(-2019, INSUFFICIENT_BALANCE),  // margin is insufficient
            Map.entry(-2011, ORDER_NOT_FOUND),       // cancel rejected, unknown order
            Map.entry(-2013, ORDER_NOT_FOUND)        // order does not exist
    );

    private BinanceErrorMapper() {}

    static ExchangeException toException(int httpStatus, String body, ObjectMapper objectMapper) {
        Integer code = null;
        String msg = body;
        try {
            JsonNode root = objectMapper.readTree(body == null ? "" : body);
            if (root != null && root.has("code")) {
                code = root.path("code").asInt();
                msg = root.path("msg").asText(body);
            }
        } catch (IOException e) {
            // 非 JSON 响应（网关 HTML 页面等）按 HTTP 状态归类
            code = null;
        }
        String exchangeCode = code == null ? null : String.valueOf(code);
        String message = "Binance HTTP " + httpStatus
                + (exchangeCode == null ? "" : " code=" + exchangeCode) + ": " + msg;
        return new ExchangeException(resolve(httpStatus, code), message, exchangeCode, httpStatus);
    }

    static ExchangeException.ErrorCode resolve(int httpStatus, Integer code) {
        if (httpStatus == 418) {
            return DDOS_PROTECTION;     // IP 已被自动封禁
        }
        if (httpStatus == 429) {
            return RATE_LIMIT;
        }
        if (code != null && CODES.containsKey(code)) {
            return CODES.get(code);
        }
        if (httpStatus == 401) {
            return AUTH_FAILED;
        }
        if (httpStatus == 403) {
            return PERMISSION_DENIED;   // WAF 拦截
        }
        if (httpStatus == 504) {
            return TIMEOUT;
        }
        if (httpStatus >= 500) {
            return SERVICE_UNAVAILABLE;
        }
        return API_ERROR;
    }
}
