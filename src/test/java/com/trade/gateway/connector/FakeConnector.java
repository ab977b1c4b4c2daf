package com.trade.gateway.connector;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.trade.gateway.core.Candle;
import com.trade.gateway.core.MarketType;
import com.trade.gateway.core.PrecisionInfo;
import com.trade.gateway.core.Ticker;
import com.trade.gateway.core.Timeframe;

import java.math.BigDecimal;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 可编排的内存连接器：按操作排队失败、记录调用次数和请求
 */
public class FakeConnector implements ExchangeConnector {

    private final String id;
    private final Map<ConnectorOperation, Deque<Exception>> failures = new EnumMap<>(ConnectorOperation.class);
    private final Map<ConnectorOperation, Integer> calls = new EnumMap<>(ConnectorOperation.class);

    private final Map<String, MarketInfo> markets = new LinkedHashMap<>();
    private final List<RawPosition> positions = new ArrayList<>();
    private final List<RawOrder> openOrders = new ArrayList<>();
    private final Set<String> failingCancels = new HashSet<>();
    private final List<OrderRequest> orderRequests = new ArrayList<>();
    private final List<String> canceledIds = new ArrayList<>();

    private RawBalance balance = new RawBalance(Map.of("USDT", new BigDecimal("1000")),
            Map.of("USDT", new BigDecimal("800")), Map.of("USDT", new BigDecimal("200")), null);
    private long serverTime = 1_700_000_000_000L;
    private List<String> lastPositionSymbols;
    private boolean closed;

    public FakeConnector() {
        this("fake");
    }

    public FakeConnector(String id) {
        this.id = id;
    }

    // ==================== 编排 ====================

    public FakeConnector withMarket(String symbol, PrecisionInfo precision) {
        String[] parts = symbol.split("[/:]");
        markets.put(symbol, new MarketInfo(symbol, symbol.replace("/", "").replace(":", ""), parts[0], parts[1],
                parts.length > 2 ? parts[2] : null, parts.length > 2 ? MarketType.SWAP : MarketType.SPOT,
                true, BigDecimal.ONE, precision));
        return this;
    }

    public FakeConnector withBalance(RawBalance balance) {
        this.balance = balance;
        return this;
    }

    public FakeConnector withPosition(RawPosition position) {
        positions.add(position);
        return this;
    }

    public FakeConnector withOpenOrder(String id, String symbol) {
        openOrders.add(new RawOrder(id, null, symbol, "buy", "limit", new BigDecimal("1"),
                new BigDecimal("100"), BigDecimal.ZERO, null, null, null, "open", 1L, null, null, null, null));
        return this;
    }

    public FakeConnector withServerTime(long serverTime) {
        this.serverTime = serverTime;
        return this;
    }

    /**
     * 下一次调用该操作时抛出给定异常，可多次排队
     */
    public FakeConnector failNext(ConnectorOperation operation, Exception error) {
        failures.computeIfAbsent(operation, k -> new ArrayDeque<>()).add(error);
        return this;
    }

    public FakeConnector failCancel(String orderId) {
        failingCancels.add(orderId);
        return this;
    }

    public int calls(ConnectorOperation operation) {
        return calls.getOrDefault(operation, 0);
    }

    public List<OrderRequest> getOrderRequests() {
        return orderRequests;
    }

    public List<String> getCanceledIds() {
        return canceledIds;
    }

    public List<String> getLastPositionSymbols() {
        return lastPositionSymbols;
    }

    public boolean isClosed() {
        return closed;
    }

    public static ExchangeException error(ExchangeException.ErrorCode code, String message) {
        return new ExchangeException(code, message);
    }

    // ==================== ExchangeConnector ====================

    @Override
    public String getId() {
        return id;
    }

    @Override
    public long fetchTime() throws ExchangeException {
        before(ConnectorOperation.FETCH_TIME);
        return serverTime;
    }

    @Override
    public Map<String, MarketInfo> loadMarkets() throws ExchangeException {
        before(ConnectorOperation.LOAD_MARKETS);
        return new LinkedHashMap<>(markets);
    }

    @Override
    public RawBalance fetchBalance() throws ExchangeException {
        before(ConnectorOperation.FETCH_BALANCE);
        return balance;
    }

    @Override
    public List<RawPosition> fetchPositions(List<String> symbols) throws ExchangeException {
        before(ConnectorOperation.FETCH_POSITIONS);
        lastPositionSymbols = symbols;
        return new ArrayList<>(positions);
    }

    @Override
    public Ticker fetchTicker(String symbol) throws ExchangeException {
        before(ConnectorOperation.FETCH_TICKER);
        return new Ticker(symbol, new BigDecimal("99"), new BigDecimal("101"), new BigDecimal("100"),
                new BigDecimal("5000"), new BigDecimal("110"), new BigDecimal("90"), serverTime, null);
    }

    @Override
    public List<Candle> fetchOHLCV(String symbol, Timeframe timeframe, Long since, int limit)
            throws ExchangeException {
        before(ConnectorOperation.FETCH_OHLCV);
        return List.of(new Candle(serverTime, BigDecimal.ONE, BigDecimal.TEN, BigDecimal.ONE,
                BigDecimal.TEN, BigDecimal.ONE));
    }

    @Override
    public RawFundingRate fetchFundingRate(String symbol) throws ExchangeException {
        before(ConnectorOperation.FETCH_FUNDING_RATE);
        return new RawFundingRate(null, new BigDecimal("0.0001"), null, serverTime,
                new BigDecimal("100"), new BigDecimal("100"), null);
    }

    @Override
    public RawOrder createOrder(OrderRequest request) throws ExchangeException {
        before(ConnectorOperation.CREATE_ORDER);
        orderRequests.add(request);
        return new RawOrder("order-" + orderRequests.size(), null, null, request.side().getCode(),
                request.type().getCode(), request.amount(), request.price(), null, null, null, null,
                "NEW", null, null, null, null, null);
    }

    @Override
    public RawOrder cancelOrder(String orderId, String symbol) throws ExchangeException {
        before(ConnectorOperation.CANCEL_ORDER);
        if (failingCancels.contains(orderId)) {
            throw new ExchangeException(ExchangeException.ErrorCode.ORDER_NOT_FOUND, "order " + orderId + " not found");
        }
        canceledIds.add(orderId);
        return new RawOrder(orderId, null, symbol, "buy", "limit", new BigDecimal("1"), new BigDecimal("100"),
                BigDecimal.ZERO, null, null, null, "CANCELED", null, null, null, null, null);
    }

    @Override
    public List<RawOrder> cancelAllOrders(String symbol) throws ExchangeException {
        before(ConnectorOperation.CANCEL_ALL_ORDERS);
        List<RawOrder> canceled = new ArrayList<>(openOrders);
        openOrders.clear();
        return canceled;
    }

    @Override
    public List<RawOrder> fetchOpenOrders(String symbol) throws ExchangeException {
        before(ConnectorOperation.FETCH_OPEN_ORDERS);
        return new ArrayList<>(openOrders);
    }

    @Override
    public RawOrder fetchOrder(String orderId, String symbol) throws ExchangeException {
        before(ConnectorOperation.FETCH_ORDER);
        return new RawOrder(orderId, null, null, "sell", "market", new BigDecimal("2"), null,
                new BigDecimal("2"), null, null, new BigDecimal("50"), "filled", null, null, null, null, null);
    }

    @Override
    public JsonNode setLeverage(int leverage, String symbol) throws ExchangeException {
        before(ConnectorOperation.SET_LEVERAGE);
        return JsonNodeFactory.instance.objectNode().put("leverage", leverage).put("symbol", symbol);
    }

    @Override
    public void close() {
        closed = true;
    }

    private void before(ConnectorOperation operation) throws ExchangeException {
        calls.merge(operation, 1, Integer::sum);
        Deque<Exception> queue = failures.get(operation);
        Exception next = queue == null ? null : queue.poll();
        if (next instanceof ExchangeException exchangeException) {
            throw exchangeException;
        }
        if (next instanceof RuntimeException runtimeException) {
            throw runtimeException;
        }
    }
}
