package com.trade.gateway.connector;

import java.util.Map;

import static com.trade.gateway.connector.ExchangeException.ErrorCode.*;

/**
 * OKX 业务码 / HTTP 状态 → {@link ExchangeException}
 */
final class OkxErrorMapper {

    private static final Map<String, ExchangeException.ErrorCode> CODES = Map.ofEntries(
            Map.entry("50001", SERVICE_UNAVAILABLE),    // service temporarily unavailable
            Map.entry("50004", TIMEOUT),                // endpoint request timeout
            Map.entry("50011", RATE_LIMIT),             // too many requests
            Map.entry("50013", SERVICE_UNAVAILABLE),    // system busy
            Map.entry("50026", SERVICE_UNAVAILABLE),    // system error
            Map.entry("50061", RATE_LIMIT),             // sub-account rate limit
            Map.entry("50100", AUTH_FAILED),            // api frozen
            Map.entry("50101", AUTH_FAILED),            // key does not match environment
            Map.entry("50103", AUTH_FAILED),
            Map.entry("50104", AUTH_FAILED),
            Map.entry("50105", AUTH_FAILED),            // passphrase incorrect
            Map.entry("50111", AUTH_FAILED),            // invalid OK-ACCESS-KEY
            Map.entry("50113", AUTH_FAILED),            // invalid sign
            Map.entry("50114", AUTH_FAILED),
            Map.entry("50110", PERMISSION_DENIED),      // IP not in whitelist
            Map.entry("50120", PERMISSION_DENIED),      // api key lacks permission
            Map.entry("51001", INVALID_SYMBOL),         // instrument does not exist
            Map.entry("51000", ORDER_REJECTED),         // parameter error
            Map.entry("51004", ORDER_REJECTED),         // order amount exceeds limit
            Map.entry("51006", ORDER_REJECTED),         // price out of range
            Map.entry("51020", ORDER_REJECTED),         // order amount too small
            Map.entry("51121", ORDER_REJECTED),         // lot size mismatch
            Map.entry("51008", INSUFFICIENT_BALANCE),
            Map.entry("51119", INSUFFICIENT_BALANCE),
            Map.entry("51127", INSUFFICIENT_BALANCE),
            Map.entry("51131", INSUFFICIENT_BALANCE),
            Map.entry("51400", ORDER_NOT_FOUND),        // cancel failed, order does not exist
            Map.entry("51603", ORDER_NOT_FOUND)         // order does not exist
    );

    private OkxErrorMapper() {}

    static ExchangeException toException(Integer httpStatus, String code, String msg) {
        String message = "OKX " + (httpStatus == null ? "" : "HTTP " + httpStatus + " ")
                + "code=" + code + ", msg=" + msg;
        return new ExchangeException(resolve(httpStatus, code), message, code, httpStatus);
    }

    static ExchangeException.ErrorCode resolve(Integer httpStatus, String code) {
        if (code != null && CODES.containsKey(code)) {
            return CODES.get(code);
        }
        if (httpStatus != null) {
            if (httpStatus == 429) {
                return RATE_LIMIT;
            }
            if (httpStatus == 401) {
                return AUTH_FAILED;
            }
            if (httpStatus == 403) {
                return PERMISSION_DENIED;
            }
            if (httpStatus == 504) {
                return TIMEOUT;
            }
            if (httpStatus >= 500) {
                return SERVICE_UNAVAILABLE;
            }
        }
        return API_ERROR;
    }
}
