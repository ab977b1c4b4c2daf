package com.trade.gateway.connector;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.trade.gateway.core.Candle;
import com.trade.gateway.core.Decimal;
import com.trade.gateway.core.MarketType;
import com.trade.gateway.core.OrderType;
import com.trade.gateway.core.PrecisionInfo;
import com.trade.gateway.core.PrecisionValue;
import com.trade.gateway.core.Symbol;
import com.trade.gateway.core.Ticker;
import com.trade.gateway.core.Timeframe;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * OKX v5 连接器
 * defaultType=spot 时交易现货，否则交易 USDT/USD 永续合约（数量单位为张）
 */
public class OkxConnector implements ExchangeConnector {

    private static final Logger logger = LoggerFactory.getLogger(OkxConnector.class);

    private static final String BASE_URL = "https://www.okx.com";
    private static final MediaType JSON_MEDIA_TYPE = MediaType.parse("application/json");
    private static final String ALGO_ORDER_PREFIX = "okx-algo:";
    private static final int MAX_CANDLE_LIMIT = 300;

    private final ConnectorSettings settings;
    private final String baseUrl;
    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final Map<String, String> symbolById;   // BTC-USDT-SWAP → BTC/USDT:USDT

    public OkxConnector(ConnectorSettings settings) {
        this(settings, BASE_URL, ConnectorSupport.newHttpClient(settings.timeoutMs()));
    }

    OkxConnector(ConnectorSettings settings, String baseUrl, OkHttpClient httpClient) {
        this.settings = settings;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.httpClient = httpClient;
        this.objectMapper = ConnectorSupport.newObjectMapper();
        this.symbolById = new ConcurrentHashMap<>();
        if (settings.sandbox()) {
            logger.info("OKX connector using demo trading (x-simulated-trading)");
        }
    }

    @Override
    public String getId() {
        return "okx";
    }

    private boolean isSpot() {
        return settings.defaultType() == MarketType.SPOT;
    }

    private String instType() {
        return isSpot() ? "SPOT" : "SWAP";
    }

    @Override
    public long fetchTime() throws ExchangeException {
        JsonNode data = firstRow(publicRequest("/api/v5/public/time", Map.of(), "fetchTime"), "fetchTime");
        return data.path("ts").asLong();
    }

    @Override
    public Map<String, MarketInfo> loadMarkets() throws ExchangeException {
        JsonNode root = publicRequest("/api/v5/public/instruments", Map.of("instType", instType()), "loadMarkets");
        Map<String, MarketInfo> markets = new LinkedHashMap<>();
        for (JsonNode node : root.path("data")) {
            String instId = node.path("instId").asText();
            String base;
            String quote;
            String settle;
            MarketType type;
            if (isSpot()) {
                base = node.path("baseCcy").asText();
                quote = node.path("quoteCcy").asText();
                settle = null;
                type = MarketType.SPOT;
            } else {
                String[] family = node.path("instFamily").asText(node.path("uly").asText()).split("-");
                if (family.length < 2) {
                    continue;
                }
                base = family[0];
                quote = family[1];
                settle = node.path("settleCcy").asText(quote);
                type = MarketType.SWAP;
            }
            String unified = new Symbol(base, quote, settle).toString();
            BigDecimal tick = ConnectorSupport.decimal(node, "tickSz");
            BigDecimal lot = ConnectorSupport.decimal(node, "lotSz");
            BigDecimal maxSize = ConnectorSupport.decimal(node, "maxLmtSz");
            PrecisionInfo precision = new PrecisionInfo(
                    Decimal.isPositive(tick) ? PrecisionValue.tickSize(tick) : null,
                    Decimal.isPositive(lot) ? PrecisionValue.tickSize(lot) : null,
                    ConnectorSupport.decimal(node, "minSz"),
                    Decimal.isPositive(maxSize) ? maxSize : null,
                    null,
                    null,
                    null
            );
            BigDecimal contractSize = ConnectorSupport.decimal(node, "ctVal");
            markets.put(unified, new MarketInfo(
                    unified, instId, base, quote, settle, type,
                    "live".equals(node.path("state").asText()),
                    contractSize == null ? BigDecimal.ONE : contractSize,
                    precision
            ));
            symbolById.put(instId, unified);
        }
        logger.debug("OKX loaded {} {} markets", markets.size(), instType());
        return markets;
    }

    @Override
    public RawBalance fetchBalance() throws ExchangeException {
        JsonNode root = privateRequest("GET", "/api/v5/account/balance", Map.of(), null, "fetchBalance");
        JsonNode account = firstRow(root, "fetchBalance");
        Map<String, BigDecimal> total = new LinkedHashMap<>();
        Map<String, BigDecimal> free = new LinkedHashMap<>();
        Map<String, BigDecimal> used = new LinkedHashMap<>();
        for (JsonNode detail : account.path("details")) {
            String ccy = detail.path("ccy").asText();
            BigDecimal equity = Decimal.firstNonNull(
                    ConnectorSupport.decimal(detail, "eq"),
                    ConnectorSupport.decimal(detail, "cashBal"));
            BigDecimal available = Decimal.firstNonNull(
                    ConnectorSupport.decimal(detail, "availEq"),
                    ConnectorSupport.decimal(detail, "availBal"));
            if (Decimal.isNullOrZero(equity) && Decimal.isNullOrZero(available)) {
                continue;
            }
            BigDecimal totalValue = equity == null ? BigDecimal.ZERO : equity;
            BigDecimal freeValue = available == null ? BigDecimal.ZERO : available;
            BigDecimal frozen = ConnectorSupport.decimal(detail, "frozenBal");
            total.put(ccy, totalValue);
            free.put(ccy, freeValue);
            used.put(ccy, frozen != null ? frozen : totalValue.subtract(freeValue).max(BigDecimal.ZERO));
        }
        return new RawBalance(total, free, used, account);
    }

    @Override
    public List<RawPosition> fetchPositions(List<String> symbols) throws ExchangeException {
        Map<String, String> query = new LinkedHashMap<>();
        query.put("instType", "SWAP");
        if (symbols != null && !symbols.isEmpty() && symbols.size() <= 10) {
            List<String> ids = new ArrayList<>();
            for (String symbol : symbols) {
                ids.add(toMarketId(symbol));
            }
            query.put("instId", String.join(",", ids));
        }
        JsonNode root = privateRequest("GET", "/api/v5/account/positions", query, null, "fetchPositions");
        List<RawPosition> positions = new ArrayList<>();
        for (JsonNode row : root.path("data")) {
            String symbol = toUnifiedSymbol(row.path("instId").asText());
            if (symbols != null && !symbols.isEmpty() && !symbols.contains(symbol)) {
                continue;
            }
            String posSide = row.path("posSide").asText("net");
            String marginMode = ConnectorSupport.text(row, "mgnMode");
            BigDecimal notional = ConnectorSupport.decimal(row, "notionalUsd");
            positions.add(new RawPosition(
                    symbol,
                    "net".equalsIgnoreCase(posSide) ? null : posSide,
                    ConnectorSupport.decimal(row, "pos"),
                    notional == null ? null : notional.abs(),
                    ConnectorSupport.decimal(row, "avgPx"),
                    ConnectorSupport.decimal(row, "markPx"),
                    ConnectorSupport.decimal(row, "liqPx"),
                    ConnectorSupport.decimal(row, "lever"),
                    ConnectorSupport.decimal(row, "upl"),
                    ConnectorSupport.decimal(row, "realizedPnl"),
                    marginMode,
                    "isolated".equalsIgnoreCase(marginMode) ? ConnectorSupport.decimal(row, "margin") : null,
                    ConnectorSupport.decimal(row, "imr"),
                    ConnectorSupport.longValue(row, "uTime"),
                    row
            ));
        }
        return positions;
    }

    @Override
    public Ticker fetchTicker(String symbol) throws ExchangeException {
        JsonNode root = publicRequest("/api/v5/market/ticker", Map.of("instId", toMarketId(symbol)), "fetchTicker");
        JsonNode node = firstRow(root, "fetchTicker");
        Long ts = ConnectorSupport.longValue(node, "ts");
        return new Ticker(
                symbol,
                ConnectorSupport.decimal(node, "bidPx"),
                ConnectorSupport.decimal(node, "askPx"),
                ConnectorSupport.decimal(node, "last"),
                ConnectorSupport.decimal(node, "vol24h"),
                ConnectorSupport.decimal(node, "high24h"),
                ConnectorSupport.decimal(node, "low24h"),
                ts == null ? System.currentTimeMillis() : ts,
                node
        );
    }

    @Override
    public List<Candle> fetchOHLCV(String symbol, Timeframe timeframe, Long since, int limit)
            throws ExchangeException {
        Map<String, String> query = new LinkedHashMap<>();
        query.put("instId", toMarketId(symbol));
        query.put("bar", toOkxBar(timeframe));
        query.put("limit", String.valueOf(Math.min(Math.max(limit, 1), MAX_CANDLE_LIMIT)));
        if (since != null) {
            // before: 返回时间戳晚于该值的数据
            query.put("before", String.valueOf(since - 1));
        }
        JsonNode data = publicRequest("/api/v5/market/candles", query, "fetchOHLCV").path("data");
        List<Candle> candles = new ArrayList<>();
        // OKX 按时间倒序返回
        for (int i = data.size() - 1; i >= 0; i--) {
            JsonNode row = data.get(i);
            if (!row.isArray() || row.size() < 6) {
                continue;
            }
            candles.add(new Candle(
                    row.get(0).asLong(),
                    new BigDecimal(row.get(1).asText()),
                    new BigDecimal(row.get(2).asText()),
                    new BigDecimal(row.get(3).asText()),
                    new BigDecimal(row.get(4).asText()),
                    new BigDecimal(row.get(5).asText())
            ));
        }
        return candles;
    }

    @Override
    public RawFundingRate fetchFundingRate(String symbol) throws ExchangeException {
        JsonNode root = publicRequest("/api/v5/public/funding-rate", Map.of("instId", toMarketId(symbol)),
                "fetchFundingRate");
        JsonNode node = firstRow(root, "fetchFundingRate");
        Long fundingTime = ConnectorSupport.longValue(node, "fundingTime");
        return new RawFundingRate(
                symbol,
                ConnectorSupport.decimal(node, "fundingRate"),
                ConnectorSupport.decimal(node, "nextFundingRate"),
                fundingTime == null ? 0L : fundingTime,
                null,
                null,
                node
        );
    }

    @Override
    public RawOrder createOrder(OrderRequest request) throws ExchangeException {
        String instId = toMarketId(request.symbol());
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("instId", instId);
        body.put("tdMode", resolveTdMode(request));
        body.put("side", request.side().getCode());
        body.put("sz", request.amount().toPlainString());
        if (request.booleanParam("reduceOnly")) {
            body.put("reduceOnly", true);
        }
        String posSide = request.stringParam("positionSide");
        if (posSide != null) {
            body.put("posSide", posSide.toLowerCase(Locale.ROOT));
        }

        if (request.type().isConditional()) {
            BigDecimal stopPrice = request.decimalParam("stopPrice");
            if (stopPrice == null) {
                throw new ExchangeException(ExchangeException.ErrorCode.ORDER_REJECTED,
                        "OKX " + request.type().getCode() + " order requires params.stopPrice");
            }
            body.put("ordType", "trigger");
            body.put("triggerPx", stopPrice.toPlainString());
            body.put("orderPx", request.type() == OrderType.STOP_LIMIT ? request.price().toPlainString() : "-1");
            JsonNode row = checkRow(privateRequest("POST", "/api/v5/trade/order-algo", Map.of(), body, "createOrder"),
                    "createOrder");
            return acceptedOrder(ALGO_ORDER_PREFIX + row.path("algoId").asText(),
                    ConnectorSupport.text(row, "algoClOrdId"), request, row);
        }

        body.put("ordType", request.type() == OrderType.LIMIT ? "limit" : "market");
        if (request.type() == OrderType.LIMIT) {
            body.put("px", request.price().toPlainString());
        }
        String clientOrderId = trimClientOrderId(request.stringParam("clientOrderId"));
        if (clientOrderId != null) {
            body.put("clOrdId", clientOrderId);
        }
        JsonNode row = checkRow(privateRequest("POST", "/api/v5/trade/order", Map.of(), body, "createOrder"),
                "createOrder");
        return acceptedOrder(row.path("ordId").asText(), ConnectorSupport.text(row, "clOrdId"), request, row);
    }

    private RawOrder acceptedOrder(String id, String clientOrderId, OrderRequest request, JsonNode row) {
        return new RawOrder(id, clientOrderId, request.symbol(), request.side().getCode(),
                request.type().getCode(), request.amount(), request.price(), BigDecimal.ZERO, null, null,
                null, "open", System.currentTimeMillis(), null, null, null, row);
    }

    @Override
    public RawOrder cancelOrder(String id, String symbol) throws ExchangeException {
        String instId = toMarketId(symbol);
        JsonNode row;
        if (id.startsWith(ALGO_ORDER_PREFIX)) {
            Map<String, Object> item = new LinkedHashMap<>();
            item.put("algoId", id.substring(ALGO_ORDER_PREFIX.length()));
            item.put("instId", instId);
            row = checkRow(privateRequest("POST", "/api/v5/trade/cancel-algos", Map.of(), List.of(item),
                    "cancelOrder"), "cancelOrder");
        } else {
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("instId", instId);
            body.put("ordId", id);
            row = checkRow(privateRequest("POST", "/api/v5/trade/cancel-order", Map.of(), body, "cancelOrder"),
                    "cancelOrder");
        }
        return new RawOrder(id, ConnectorSupport.text(row, "clOrdId"), symbol, null, null, null, null,
                null, null, null, null, "canceled", System.currentTimeMillis(), null, null, null, row);
    }

    @Override
    public List<RawOrder> fetchOpenOrders(String symbol) throws ExchangeException {
        Map<String, String> query = new LinkedHashMap<>();
        query.put("instType", instType());
        if (symbol != null) {
            query.put("instId", toMarketId(symbol));
        }
        JsonNode root = privateRequest("GET", "/api/v5/trade/orders-pending", query, null, "fetchOpenOrders");
        List<RawOrder> orders = new ArrayList<>();
        for (JsonNode row : root.path("data")) {
            orders.add(parseOrder(row));
        }

        // 条件单不在普通挂单列表中，需单独查询
        Map<String, String> algoQuery = new LinkedHashMap<>(query);
        algoQuery.put("ordType", "trigger");
        JsonNode algoRoot = privateRequest("GET", "/api/v5/trade/orders-algo-pending", algoQuery, null,
                "fetchOpenOrders");
        for (JsonNode row : algoRoot.path("data")) {
            orders.add(parseAlgoOrder(row));
        }
        return orders;
    }

    @Override
    public RawOrder fetchOrder(String id, String symbol) throws ExchangeException {
        if (id.startsWith(ALGO_ORDER_PREFIX)) {
            return fetchAlgoOrder(id);
        }
        Map<String, String> query = new LinkedHashMap<>();
        query.put("instId", toMarketId(symbol));
        query.put("ordId", id);
        JsonNode root = privateRequest("GET", "/api/v5/trade/order", query, null, "fetchOrder");
        JsonNode data = root.path("data");
        if (!data.isArray() || data.isEmpty()) {
            throw new ExchangeException(ExchangeException.ErrorCode.ORDER_NOT_FOUND,
                    "OKX order " + id + " not found", "51603", null);
        }
        return parseOrder(data.get(0));
    }

    private RawOrder fetchAlgoOrder(String id) throws ExchangeException {
        Map<String, String> query = new LinkedHashMap<>();
        query.put("algoId", id.substring(ALGO_ORDER_PREFIX.length()));
        JsonNode root = privateRequest("GET", "/api/v5/trade/order-algo", query, null, "fetchOrder");
        JsonNode data = root.path("data");
        if (!data.isArray() || data.isEmpty()) {
            throw new ExchangeException(ExchangeException.ErrorCode.ORDER_NOT_FOUND,
                    "OKX algo order " + id + " not found", "51603", null);
        }
        return parseAlgoOrder(data.get(0));
    }

    @Override
    public JsonNode setLeverage(int leverage, String symbol) throws ExchangeException {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("instId", toMarketId(symbol));
        body.put("lever", String.valueOf(leverage));
        body.put("mgnMode", "cross");
        return firstRow(privateRequest("POST", "/api/v5/account/set-leverage", Map.of(), body, "setLeverage"),
                "setLeverage");
    }

    @Override
    public void close() {
        httpClient.dispatcher().executorService().shutdown();
        httpClient.connectionPool().evictAll();
    }

    // ==================== 私有方法 ====================

    RawOrder parseOrder(JsonNode node) {
        BigDecimal fee = ConnectorSupport.decimal(node, "fee");
        BigDecimal price = ConnectorSupport.decimal(node, "px");
        BigDecimal average = ConnectorSupport.decimal(node, "avgPx");
        return new RawOrder(
                node.path("ordId").asText(),
                ConnectorSupport.text(node, "clOrdId"),
                toUnifiedSymbol(node.path("instId").asText()),
                ConnectorSupport.text(node, "side"),
                fromOkxType(ConnectorSupport.text(node, "ordType")),
                ConnectorSupport.decimal(node, "sz"),
                Decimal.isNullOrZero(price) ? null : price,
                ConnectorSupport.decimal(node, "accFillSz"),
                null,
                null,
                Decimal.isNullOrZero(average) ? null : average,
                ConnectorSupport.text(node, "state"),
                ConnectorSupport.longValue(node, "cTime"),
                fee == null ? null : fee.negate(),
                ConnectorSupport.text(node, "feeCcy"),
                null,
                node
        );
    }

    /**
     * 条件单：id 带 okx-algo: 前缀，与 createOrder 返回的一致
     * orderPx 为 -1 表示触发后市价成交
     */
    RawOrder parseAlgoOrder(JsonNode node) {
        BigDecimal orderPrice = ConnectorSupport.decimal(node, "orderPx");
        boolean market = orderPrice == null || orderPrice.signum() <= 0;
        return new RawOrder(
                ALGO_ORDER_PREFIX + node.path("algoId").asText(),
                ConnectorSupport.text(node, "algoClOrdId"),
                toUnifiedSymbol(node.path("instId").asText()),
                ConnectorSupport.text(node, "side"),
                market ? OrderType.STOP_MARKET.getCode() : OrderType.STOP_LIMIT.getCode(),
                ConnectorSupport.decimal(node, "sz"),
                market ? null : orderPrice,
                ConnectorSupport.decimal(node, "actualSz"),
                null,
                null,
                null,
                algoState(ConnectorSupport.text(node, "state")),
                ConnectorSupport.longValue(node, "cTime"),
                null,
                null,
                null,
                node
        );
    }

    private static String algoState(String state) {
        if (state == null) {
            return null;
        }
        return switch (state) {
            case "partially_effective" -> "open";
            case "effective" -> "closed";       // 已触发
            case "order_failed" -> "rejected";
            default -> state;                   // live / canceled
        };
    }

    private static String fromOkxType(String ordType) {
        if (ordType == null) {
            return null;
        }
        return switch (ordType) {
            case "limit", "post_only", "fok", "ioc" -> "limit";
            case "market", "optimal_limit_ioc" -> "market";
            case "trigger", "conditional" -> "stop_market";
            default -> ordType;
        };
    }

    private String resolveTdMode(OrderRequest request) {
        if (isSpot()) {
            return "cash";
        }
        String explicit = request.stringParam("tdMode");
        if ("cross".equals(explicit) || "isolated".equals(explicit)) {
            return explicit;
        }
        return "cross";
    }

    private static String toOkxBar(Timeframe timeframe) {
        return switch (timeframe) {
            case ONE_HOUR -> "1H";
            case TWO_HOURS -> "2H";
            case FOUR_HOURS -> "4H";
            case ONE_DAY -> "1D";
            default -> timeframe.getCode();
        };
    }

    String toMarketId(String symbol) {
        Symbol parsed = Symbol.parse(symbol);
        if (parsed == null) {
            return symbol;
        }
        String pair = parsed.getBase() + "-" + parsed.getQuote();
        return parsed.isDerivative() ? pair + "-SWAP" : pair;
    }

    String toUnifiedSymbol(String instId) {
        String known = symbolById.get(instId);
        if (known != null) {
            return known;
        }
        String[] parts = instId.split("-");
        if (parts.length == 3 && "SWAP".equals(parts[2])) {
            String settle = "USD".equals(parts[1]) ? parts[0] : parts[1];
            return new Symbol(parts[0], parts[1], settle).toString();
        }
        if (parts.length == 2) {
            return new Symbol(parts[0], parts[1], null).toString();
        }
        return instId;
    }

    private String trimClientOrderId(String clientOrderId) {
        if (clientOrderId == null || clientOrderId.isBlank()) {
            return null;
        }
        // OKX requires clOrdId to be <= 32 chars and alphanumeric.
        String normalized = clientOrderId.replaceAll("[^A-Za-z0-9]", "");
        if (normalized.isBlank()) {
            return null;
        }
        return normalized.length() <= 32 ? normalized : normalized.substring(0, 32);
    }

    private JsonNode firstRow(JsonNode root, String action) throws ExchangeException {
        JsonNode data = root.path("data");
        if (!data.isArray() || data.isEmpty()) {
            throw new ExchangeException(ExchangeException.ErrorCode.API_ERROR,
                    "OKX " + action + " returned empty data");
        }
        return data.get(0);
    }

    /**
     * 交易类接口逐行返回 sCode，非 0 即失败
     */
    private JsonNode checkRow(JsonNode root, String action) throws ExchangeException {
        JsonNode row = firstRow(root, action);
        String sCode = row.path("sCode").asText("0");
        if (!"0".equals(sCode)) {
            throw OkxErrorMapper.toException(null, sCode, row.path("sMsg").asText("unknown"));
        }
        return row;
    }

    private JsonNode publicRequest(String path, Map<String, String> query, String action)
            throws ExchangeException {
        String queryString = ConnectorSupport.buildQueryString(query);
        Request.Builder builder = new Request.Builder()
                .url(baseUrl + path + (queryString.isEmpty() ? "" : "?" + queryString))
                .get();
        if (settings.sandbox()) {
            builder.addHeader("x-simulated-trading", "1");
        }
        return execute(builder.build(), action);
    }

    private JsonNode privateRequest(String method, String path, Map<String, String> query,
                                    Object body, String action) throws ExchangeException {
        if (!settings.hasCredentials()) {
            throw new ExchangeException(ExchangeException.ErrorCode.AUTH_FAILED,
                    "OKX " + action + " requires apiKey and secret");
        }
        if (settings.passphrase() == null || settings.passphrase().isBlank()) {
            throw new ExchangeException(ExchangeException.ErrorCode.AUTH_FAILED,
                    "OKX " + action + " requires passphrase");
        }
        String queryString = ConnectorSupport.buildQueryString(query);
        String requestPath = queryString.isEmpty() ? path : path + "?" + queryString;
        String bodyJson;
        try {
            bodyJson = body == null ? "" : objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new ExchangeException(ExchangeException.ErrorCode.API_ERROR, "OKX request body serialization failed", e);
        }

        String timestamp = Instant.now().truncatedTo(ChronoUnit.MILLIS).toString();
        String signature = ConnectorSupport.hmacSha256Base64(timestamp + method + requestPath + bodyJson,
                settings.secret());

        Request.Builder builder = new Request.Builder()
                .url(baseUrl + requestPath)
                .addHeader("OK-ACCESS-KEY", settings.apiKey())
                .addHeader("OK-ACCESS-SIGN", signature)
                .addHeader("OK-ACCESS-TIMESTAMP", timestamp)
                .addHeader("OK-ACCESS-PASSPHRASE", settings.passphrase())
                .addHeader("Content-Type", "application/json");
        if (settings.sandbox()) {
            builder.addHeader("x-simulated-trading", "1");
        }
        if ("POST".equals(method)) {
            builder.post(RequestBody.create(bodyJson, JSON_MEDIA_TYPE));
        } else {
            builder.get();
        }
        return execute(builder.build(), action);
    }

    private JsonNode execute(Request request, String action) throws ExchangeException {
        try (Response response = httpClient.newCall(request).execute()) {
            String body = response.body() == null ? "" : response.body().string();
            JsonNode root = parseBody(body, response.code(), action);
            String code = root.path("code").asText("");
            if (!response.isSuccessful()) {
                throw OkxErrorMapper.toException(response.code(), code, root.path("msg").asText(body));
            }
            if ("0".equals(code)) {
                return root;
            }
            // code=1 时真实原因在逐行 sCode 中
            JsonNode data = root.path("data");
            if ("1".equals(code) && data.isArray() && !data.isEmpty() && data.get(0).has("sCode")) {
                JsonNode row = data.get(0);
                throw OkxErrorMapper.toException(null, row.path("sCode").asText(), row.path("sMsg").asText());
            }
            throw OkxErrorMapper.toException(null, code, root.path("msg").asText("unknown"));
        } catch (IOException e) {
            throw ConnectorSupport.wrapTransport("OKX " + action, e);
        }
    }

    private JsonNode parseBody(String body, int httpStatus, String action) throws ExchangeException {
        try {
            return objectMapper.readTree(body.isEmpty() ? "{}" : body);
        } catch (JsonProcessingException e) {
            if (httpStatus >= 400) {
                throw OkxErrorMapper.toException(httpStatus, null, body);
            }
            throw new ExchangeException(ExchangeException.ErrorCode.API_ERROR,
                    "OKX " + action + " returned malformed body", e);
        }
    }
}
