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
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Binance USDT 本位合约连接器（fapi）
 */
public class BinanceFuturesConnector implements ExchangeConnector {

    private static final Logger logger = LoggerFactory.getLogger(BinanceFuturesConnector.class);

    private static final String PROD_BASE_URL = "https://fapi.binance.com";
    private static final String TESTNET_BASE_URL = "https://testnet.binancefuture.com";
    private static final String RECV_WINDOW = "10000";
    private static final int MAX_KLINE_LIMIT = 1500;

    private final ConnectorSettings settings;
    private final String baseUrl;
    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final Map<String, String> symbolById;   // BTCUSDT → BTC/USDT:USDT

    public BinanceFuturesConnector(ConnectorSettings settings) {
        this(settings, settings.sandbox() ? TESTNET_BASE_URL : PROD_BASE_URL,
                ConnectorSupport.newHttpClient(settings.timeoutMs()));
    }

    BinanceFuturesConnector(ConnectorSettings settings, String baseUrl, OkHttpClient httpClient) {
        this.settings = settings;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.httpClient = httpClient;
        this.objectMapper = ConnectorSupport.newObjectMapper();
        this.symbolById = new ConcurrentHashMap<>();
        if (settings.sandbox()) {
            logger.info("Binance connector using testnet: {}", this.baseUrl);
        }
    }

    @Override
    public String getId() {
        return "binance";
    }

    @Override
    public long fetchTime() throws ExchangeException {
        JsonNode root = publicRequest("/fapi/v1/time", Map.of(), "fetchTime");
        return root.path("serverTime").asLong();
    }

    @Override
    public Map<String, MarketInfo> loadMarkets() throws ExchangeException {
        JsonNode root = publicRequest("/fapi/v1/exchangeInfo", Map.of(), "loadMarkets");
        Map<String, MarketInfo> markets = new LinkedHashMap<>();
        for (JsonNode node : root.path("symbols")) {
            if (!"PERPETUAL".equals(node.path("contractType").asText())) {
                continue;
            }
            String id = node.path("symbol").asText();
            String base = node.path("baseAsset").asText();
            String quote = node.path("quoteAsset").asText();
            String settle = node.path("marginAsset").asText(quote);
            String unified = new Symbol(base, quote, settle).toString();

            markets.put(unified, new MarketInfo(
                    unified, id, base, quote, settle, MarketType.SWAP,
                    "TRADING".equals(node.path("status").asText()),
                    BigDecimal.ONE,
                    parsePrecision(node)
            ));
            symbolById.put(id, unified);
        }
        logger.debug("Binance loaded {} perpetual markets", markets.size());
        return markets;
    }

    private PrecisionInfo parsePrecision(JsonNode node) {
        PrecisionValue price = null;
        PrecisionValue amount = null;
        BigDecimal minAmount = null;
        BigDecimal maxAmount = null;
        BigDecimal minPrice = null;
        BigDecimal maxPrice = null;
        BigDecimal minCost = null;
        for (JsonNode filter : node.path("filters")) {
            switch (filter.path("filterType").asText()) {
                case "PRICE_FILTER" -> {
                    BigDecimal tick = ConnectorSupport.decimal(filter, "tickSize");
                    price = Decimal.isPositive(tick) ? PrecisionValue.tickSize(tick) : null;
                    minPrice = ConnectorSupport.decimal(filter, "minPrice");
                    maxPrice = positiveOrNull(ConnectorSupport.decimal(filter, "maxPrice"));
                }
                case "LOT_SIZE" -> {
                    BigDecimal step = ConnectorSupport.decimal(filter, "stepSize");
                    amount = Decimal.isPositive(step) ? PrecisionValue.tickSize(step) : null;
                    minAmount = ConnectorSupport.decimal(filter, "minQty");
                    maxAmount = positiveOrNull(ConnectorSupport.decimal(filter, "maxQty"));
                }
                case "MIN_NOTIONAL" -> minCost = ConnectorSupport.decimal(filter, "notional");
                default -> {
                }
            }
        }
        if (price == null && node.has("pricePrecision")) {
            price = PrecisionValue.decimalPlaces(node.path("pricePrecision").asInt());
        }
        if (amount == null && node.has("quantityPrecision")) {
            amount = PrecisionValue.decimalPlaces(node.path("quantityPrecision").asInt());
        }
        return new PrecisionInfo(price, amount, minAmount, maxAmount, minPrice, maxPrice, minCost);
    }

    private static BigDecimal positiveOrNull(BigDecimal value) {
        return Decimal.isPositive(value) ? value : null;
    }

    @Override
    public RawBalance fetchBalance() throws ExchangeException {
        JsonNode rows = signedRequest("GET", "/fapi/v2/balance", new LinkedHashMap<>(), "fetchBalance");
        Map<String, BigDecimal> total = new LinkedHashMap<>();
        Map<String, BigDecimal> free = new LinkedHashMap<>();
        Map<String, BigDecimal> used = new LinkedHashMap<>();
        for (JsonNode row : rows) {
            String asset = row.path("asset").asText();
            BigDecimal wallet = ConnectorSupport.decimal(row, "balance");
            BigDecimal available = ConnectorSupport.decimal(row, "availableBalance");
            if (Decimal.isNullOrZero(wallet) && Decimal.isNullOrZero(available)) {
                continue;
            }
            BigDecimal totalValue = wallet == null ? BigDecimal.ZERO : wallet;
            BigDecimal freeValue = available == null ? BigDecimal.ZERO : available;
            total.put(asset, totalValue);
            free.put(asset, freeValue);
            used.put(asset, totalValue.subtract(freeValue).max(BigDecimal.ZERO));
        }
        return new RawBalance(total, free, used, rows);
    }

    @Override
    public List<RawPosition> fetchPositions(List<String> symbols) throws ExchangeException {
        Map<String, String> params = new LinkedHashMap<>();
        if (symbols != null && symbols.size() == 1) {
            params.put("symbol", toMarketId(symbols.get(0)));
        }
        JsonNode rows = signedRequest("GET", "/fapi/v2/positionRisk", params, "fetchPositions");
        List<RawPosition> positions = new ArrayList<>();
        for (JsonNode row : rows) {
            String symbol = toUnifiedSymbol(row.path("symbol").asText());
            if (symbols != null && !symbols.isEmpty() && !symbols.contains(symbol)) {
                continue;
            }
            BigDecimal contracts = ConnectorSupport.decimal(row, "positionAmt");
            BigDecimal notional = ConnectorSupport.decimal(row, "notional");
            BigDecimal leverage = ConnectorSupport.decimal(row, "leverage");
            String positionSide = row.path("positionSide").asText("BOTH");
            String marginMode = row.path("marginType").asText(null);
            BigDecimal initialMargin = notional != null && Decimal.isPositive(leverage)
                    ? Decimal.divide(notional.abs(), leverage) : null;
            BigDecimal isolatedWallet = "isolated".equalsIgnoreCase(marginMode)
                    ? ConnectorSupport.decimal(row, "isolatedWallet") : null;

            positions.add(new RawPosition(
                    symbol,
                    "BOTH".equalsIgnoreCase(positionSide) ? null : positionSide.toLowerCase(),
                    contracts,
                    notional == null ? null : notional.abs(),
                    ConnectorSupport.decimal(row, "entryPrice"),
                    ConnectorSupport.decimal(row, "markPrice"),
                    positiveOrNull(ConnectorSupport.decimal(row, "liquidationPrice")),
                    leverage,
                    ConnectorSupport.decimal(row, "unRealizedProfit"),
                    null,
                    marginMode,
                    isolatedWallet,
                    initialMargin,
                    ConnectorSupport.longValue(row, "updateTime"),
                    row
            ));
        }
        return positions;
    }

    @Override
    public Ticker fetchTicker(String symbol) throws ExchangeException {
        String id = toMarketId(symbol);
        JsonNode book = publicRequest("/fapi/v1/ticker/bookTicker", Map.of("symbol", id), "fetchTicker");
        JsonNode stats = publicRequest("/fapi/v1/ticker/24hr", Map.of("symbol", id), "fetchTicker");
        Long closeTime = ConnectorSupport.longValue(stats, "closeTime");
        return new Ticker(
                symbol,
                ConnectorSupport.decimal(book, "bidPrice"),
                ConnectorSupport.decimal(book, "askPrice"),
                ConnectorSupport.decimal(stats, "lastPrice"),
                ConnectorSupport.decimal(stats, "volume"),
                ConnectorSupport.decimal(stats, "highPrice"),
                ConnectorSupport.decimal(stats, "lowPrice"),
                closeTime == null ? System.currentTimeMillis() : closeTime,
                stats
        );
    }

    @Override
    public List<Candle> fetchOHLCV(String symbol, Timeframe timeframe, Long since, int limit)
            throws ExchangeException {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("symbol", toMarketId(symbol));
        params.put("interval", timeframe.getCode());
        params.put("limit", String.valueOf(Math.min(Math.max(limit, 1), MAX_KLINE_LIMIT)));
        if (since != null) {
            params.put("startTime", String.valueOf(since));
        }
        JsonNode rows = publicRequest("/fapi/v1/klines", params, "fetchOHLCV");
        List<Candle> candles = new ArrayList<>();
        for (JsonNode row : rows) {
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
        JsonNode node = publicRequest("/fapi/v1/premiumIndex", Map.of("symbol", toMarketId(symbol)),
                "fetchFundingRate");
        Long nextFundingTime = ConnectorSupport.longValue(node, "nextFundingTime");
        return new RawFundingRate(
                symbol,
                ConnectorSupport.decimal(node, "lastFundingRate"),
                null,
                nextFundingTime == null ? 0L : nextFundingTime,
                ConnectorSupport.decimal(node, "markPrice"),
                ConnectorSupport.decimal(node, "indexPrice"),
                node
        );
    }

    @Override
    public RawOrder createOrder(OrderRequest request) throws ExchangeException {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("symbol", toMarketId(request.symbol()));
        params.put("side", request.side().getCode().toUpperCase());
        params.put("type", toBinanceType(request.type()));
        params.put("quantity", request.amount().toPlainString());
        if (request.type().requiresPrice()) {
            params.put("price", request.price().toPlainString());
            params.put("timeInForce", firstNonBlank(request.stringParam("timeInForce"), "GTC"));
        }
        if (request.type().isConditional()) {
            BigDecimal stopPrice = request.decimalParam("stopPrice");
            if (stopPrice == null) {
                throw new ExchangeException(ExchangeException.ErrorCode.ORDER_REJECTED,
                        "Binance " + request.type().getCode() + " order requires params.stopPrice");
            }
            params.put("stopPrice", stopPrice.toPlainString());
        }
        if (request.booleanParam("reduceOnly")) {
            params.put("reduceOnly", "true");
        }
        String positionSide = request.stringParam("positionSide");
        if (positionSide != null) {
            params.put("positionSide", positionSide.toUpperCase());
        }
        String clientOrderId = request.stringParam("clientOrderId");
        if (clientOrderId != null) {
            params.put("newClientOrderId", clientOrderId);
        }
        JsonNode node = signedRequest("POST", "/fapi/v1/order", params, "createOrder");
        return parseOrder(node);
    }

    @Override
    public RawOrder cancelOrder(String id, String symbol) throws ExchangeException {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("symbol", toMarketId(symbol));
        params.put("orderId", id);
        JsonNode node = signedRequest("DELETE", "/fapi/v1/order", params, "cancelOrder");
        return parseOrder(node);
    }

    @Override
    public List<RawOrder> cancelAllOrders(String symbol) throws ExchangeException {
        // 撤单接口只返回 {"code":200,"msg":"..."}，先查挂单作为撤单明细
        List<RawOrder> open = fetchOpenOrders(symbol);
        Map<String, String> params = new LinkedHashMap<>();
        params.put("symbol", toMarketId(symbol));
        signedRequest("DELETE", "/fapi/v1/allOpenOrders", params, "cancelAllOrders");

        List<RawOrder> canceled = new ArrayList<>(open.size());
        for (RawOrder order : open) {
            canceled.add(new RawOrder(order.id(), order.clientOrderId(), order.symbol(), order.side(), order.type(),
                    order.amount(), order.price(), order.filled(), order.remaining(), order.cost(), order.average(),
                    "CANCELED", order.timestamp(), order.fee(), order.feeCurrency(), order.trades(), order.raw()));
        }
        return canceled;
    }

    @Override
    public List<RawOrder> fetchOpenOrders(String symbol) throws ExchangeException {
        Map<String, String> params = new LinkedHashMap<>();
        if (symbol != null) {
            params.put("symbol", toMarketId(symbol));
        }
        JsonNode rows = signedRequest("GET", "/fapi/v1/openOrders", params, "fetchOpenOrders");
        List<RawOrder> orders = new ArrayList<>();
        for (JsonNode row : rows) {
            orders.add(parseOrder(row));
        }
        return orders;
    }

    @Override
    public RawOrder fetchOrder(String id, String symbol) throws ExchangeException {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("symbol", toMarketId(symbol));
        params.put("orderId", id);
        return parseOrder(signedRequest("GET", "/fapi/v1/order", params, "fetchOrder"));
    }

    @Override
    public JsonNode setLeverage(int leverage, String symbol) throws ExchangeException {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("symbol", toMarketId(symbol));
        params.put("leverage", String.valueOf(leverage));
        return signedRequest("POST", "/fapi/v1/leverage", params, "setLeverage");
    }

    @Override
    public void close() {
        httpClient.dispatcher().executorService().shutdown();
        httpClient.connectionPool().evictAll();
    }

    // ==================== 私有方法 ====================

    RawOrder parseOrder(JsonNode node) {
        BigDecimal average = ConnectorSupport.decimal(node, "avgPrice");
        BigDecimal price = ConnectorSupport.decimal(node, "price");
        Long timestamp = ConnectorSupport.longValue(node, "time");
        if (timestamp == null) {
            timestamp = ConnectorSupport.longValue(node, "updateTime");
        }
        return new RawOrder(
                node.path("orderId").asText(),
                ConnectorSupport.text(node, "clientOrderId"),
                toUnifiedSymbol(node.path("symbol").asText()),
                lower(ConnectorSupport.text(node, "side")),
                fromBinanceType(ConnectorSupport.text(node, "type")),
                ConnectorSupport.decimal(node, "origQty"),
                Decimal.isNullOrZero(price) ? null : price,
                ConnectorSupport.decimal(node, "executedQty"),
                null,
                ConnectorSupport.decimal(node, "cumQuote"),
                Decimal.isNullOrZero(average) ? null : average,
                ConnectorSupport.text(node, "status"),
                timestamp,
                null,
                null,
                null,
                node
        );
    }

    private static String toBinanceType(OrderType type) {
        return switch (type) {
            case MARKET -> "MARKET";
            case LIMIT -> "LIMIT";
            case STOP_LIMIT -> "STOP";
            case STOP, STOP_MARKET -> "STOP_MARKET";
        };
    }

    private static String fromBinanceType(String type) {
        if (type == null) {
            return null;
        }
        return switch (type) {
            case "STOP" -> "stop_limit";
            case "STOP_MARKET" -> "stop_market";
            default -> type.toLowerCase();
        };
    }

    String toMarketId(String symbol) {
        Symbol parsed = Symbol.parse(symbol);
        if (parsed == null) {
            return symbol.replace("/", "").replace("-", "").toUpperCase();
        }
        return parsed.toPairString();
    }

    String toUnifiedSymbol(String marketId) {
        String known = symbolById.get(marketId);
        if (known != null) {
            return known;
        }
        for (String quote : List.of("USDT", "USDC", "BUSD")) {
            if (marketId.endsWith(quote) && marketId.length() > quote.length()) {
                String base = marketId.substring(0, marketId.length() - quote.length());
                return new Symbol(base, quote, quote).toString();
            }
        }
        return marketId;
    }

    private JsonNode publicRequest(String path, Map<String, String> params, String action)
            throws ExchangeException {
        String query = ConnectorSupport.buildQueryString(params);
        Request request = new Request.Builder()
                .url(baseUrl + path + (query.isEmpty() ? "" : "?" + query))
                .get()
                .build();
        return execute(request, action);
    }

    private JsonNode signedRequest(String method, String path, Map<String, String> params, String action)
            throws ExchangeException {
        if (!settings.hasCredentials()) {
            throw new ExchangeException(ExchangeException.ErrorCode.AUTH_FAILED,
                    "Binance " + action + " requires apiKey and secret");
        }
        Map<String, String> signedParams = new LinkedHashMap<>(params);
        signedParams.put("recvWindow", RECV_WINDOW);
        signedParams.put("timestamp", String.valueOf(System.currentTimeMillis()));
        String query = ConnectorSupport.buildQueryString(signedParams);
        String signature = ConnectorSupport.hmacSha256Hex(query, settings.secret());
        String url = baseUrl + path + "?" + query + "&signature=" + signature;

        Request.Builder builder = new Request.Builder()
                .url(url)
                .addHeader("X-MBX-APIKEY", settings.apiKey());
        switch (method) {
            case "POST" -> builder.post(RequestBody.create("", null));
            case "DELETE" -> builder.delete();
            default -> builder.get();
        }
        return execute(builder.build(), action);
    }

    private JsonNode execute(Request request, String action) throws ExchangeException {
        try (Response response = httpClient.newCall(request).execute()) {
            String body = response.body() == null ? "" : response.body().string();
            if (!response.isSuccessful()) {
                throw BinanceErrorMapper.toException(response.code(), body, objectMapper);
            }
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new ExchangeException(ExchangeException.ErrorCode.API_ERROR,
                    "Binance " + action + " returned malformed body", e);
        } catch (IOException e) {
            throw ConnectorSupport.wrapTransport("Binance " + action, e);
        }
    }

    private static String lower(String value) {
        return value == null ? null : value.toLowerCase();
    }

    private static String firstNonBlank(String candidate, String fallback) {
        if (candidate == null || candidate.isBlank()) {
            return fallback;
        }
        return candidate.trim();
    }
}
