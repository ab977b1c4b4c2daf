package com.trade.gateway.exchange;

import com.fasterxml.jackson.databind.JsonNode;
import com.trade.gateway.balance.SharedBalanceCache;
import com.trade.gateway.balance.SharedBalanceConfig;
import com.trade.gateway.balance.SharedBalanceCoordinator;
import com.trade.gateway.balance.SharedBalanceUnavailableException;
import com.trade.gateway.balance.SharedStore;
import com.trade.gateway.balance.SharedStoreException;
import com.trade.gateway.balance.SharedStoreProvider;
import com.trade.gateway.connector.ConnectorOperation;
import com.trade.gateway.connector.ConnectorSupport;
import com.trade.gateway.connector.ExchangeConnector;
import com.trade.gateway.connector.ExchangeException;
import com.trade.gateway.connector.MarketInfo;
import com.trade.gateway.connector.OrderRequest;
import com.trade.gateway.connector.RawBalance;
import com.trade.gateway.connector.RawFundingRate;
import com.trade.gateway.connector.RawOrder;
import com.trade.gateway.connector.RawPosition;
import com.trade.gateway.core.CancelAllResult;
import com.trade.gateway.core.Candle;
import com.trade.gateway.core.Decimal;
import com.trade.gateway.core.FundingRate;
import com.trade.gateway.core.OrderSide;
import com.trade.gateway.core.OrderType;
import com.trade.gateway.core.PrecisionInfo;
import com.trade.gateway.core.Sleeper;
import com.trade.gateway.core.Ticker;
import com.trade.gateway.core.Timeframe;
import com.trade.gateway.core.UnifiedBalance;
import com.trade.gateway.core.UnifiedOrder;
import com.trade.gateway.core.UnifiedPosition;
import com.trade.gateway.exchange.preflight.PreflightResult;
import com.trade.gateway.exchange.preflight.PreflightVerifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.LongSupplier;

/**
 * 单个交易所连接器之上的统一接口
 * <p>
 * 交易操作先解析交易对，校验并按精度截断订单参数，
 * 再按重试策略调用连接器，最后归一化结果。
 * 启用共享余额时 {@link #fetchBalance()} 走共享余额协议。
 */
public class ExchangeGateway implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(ExchangeGateway.class);

    private final ExchangeCapability capability;
    private final GatewayConfig config;
    private final String name;
    private final ErrorNormalizer normalizer;
    private final GatewayListeners listeners = new GatewayListeners();
    private final RetryExecutor retry;
    private final Sleeper sleeper;
    private final LongSupplier clock;
    private final SharedStore.Opener storeOpener;

    private volatile ExchangeConnector connector;
    private volatile boolean connected;
    private volatile SymbolResolver resolver;
    private volatile PrecisionAdjuster precisions = PrecisionAdjuster.empty();
    private volatile PreflightResult lastPreflight;

    private SharedBalanceCoordinator balanceCoordinator;
    private boolean sharedBalanceDisabled;

    public ExchangeGateway(ExchangeCapability capability, GatewayConfig config) {
        this(capability, config, Sleeper.SYSTEM, System::currentTimeMillis,
                () -> SharedStoreProvider.getStore(config.getSharedBalance().getRedis()));
    }

    ExchangeGateway(ExchangeCapability capability, GatewayConfig config, Sleeper sleeper,
                    LongSupplier clock, SharedStore.Opener storeOpener) {
        this.capability = capability;
        this.config = config;
        this.name = capability.name();
        this.normalizer = new ErrorNormalizer(name);
        this.sleeper = sleeper;
        this.clock = clock;
        this.storeOpener = storeOpener;
        this.retry = new RetryExecutor(config.getRetryPolicy(), normalizer, listeners, sleeper,
                () -> ThreadLocalRandom.current().nextDouble());
        this.resolver = SymbolResolver.lightweight(config.getDefaultType());
    }

    public void addListener(GatewayListener listener) {
        listeners.add(listener);
    }

    public void removeListener(GatewayListener listener) {
        listeners.remove(listener);
    }

    public String getName() {
        return name;
    }

    public ExchangeCapability getCapability() {
        return capability;
    }

    public GatewayConfig getConfig() {
        return config;
    }

    public boolean isConnected() {
        return connected;
    }

    /**
     * 未加载市场信息的轻量连接
     */
    public boolean isLightweight() {
        return resolver.isLightweight();
    }

    public PreflightResult getLastPreflight() {
        return lastPreflight;
    }

    // ==================== 连接 ====================

    public void connect() throws GatewayException {
        connect(ConnectOptions.defaults());
    }

    public synchronized void connect(ConnectOptions options) throws GatewayException {
        if (connected) {
            logger.debug("[{}] 已连接，忽略重复 connect", name);
            return;
        }
        logger.info("[{}] 正在连接交易所: apiKey={}, passphrase={}, sandbox={}, defaultType={}, loadMarkets={}",
                name, config.getApiKey() == null ? "-" : ConnectorSupport.maskKey(config.getApiKey()),
                config.getPassphrase() != null, config.isSandbox(), config.getDefaultType().getCode(),
                options.loadMarkets());
        boolean reported = false;
        try {
            connector = capability.createConnector(config);

            if (!options.skipPreflight()) {
                runPreflight();
            }

            if (options.loadMarkets()) {
                ExchangeConnector current = connector;
                Map<String, MarketInfo> markets;
                try {
                    markets = retry.execute(current::loadMarkets, "loadMarkets");
                } catch (NormalizedError e) {
                    // 重试引擎已发出 error 事件
                    reported = true;
                    throw e;
                }
                precisions = PrecisionAdjuster.fromMarkets(markets);
                resolver = new SymbolResolver(markets.keySet(), config.getDefaultType());
                logger.info("[{}] 加载了 {} 个交易对", name, markets.size());
            } else {
                precisions = PrecisionAdjuster.empty();
                resolver = SymbolResolver.lightweight(config.getDefaultType());
                logger.info("[{}] 轻量模式：跳过加载市场信息", name);
            }

            connected = true;
        } catch (GatewayException | RuntimeException e) {
            connected = false;
            NormalizedError error = e instanceof NormalizedError normalized ? normalized : normalizer.normalize(e);
            logger.error("[{}] 连接失败: {}", name, error.getMessage(), e);
            if (!reported) {
                listeners.notify(l -> l.onError(new GatewayListener.ErrorEvent("connect", "connect", error)));
            }
            closeConnector();
            throw error;
        }

        logger.info("[{}] 连接成功", name);
        boolean lightweight = !options.loadMarkets();
        listeners.notify(l -> l.onConnected(new GatewayListener.ConnectedEvent(name, lightweight)));
    }

    private void runPreflight() throws NormalizedError {
        PreflightVerifier verifier = new PreflightVerifier(name, connector,
                capability.supports(ConnectorOperation.FETCH_TIME), config.hasCredentials(), clock);
        lastPreflight = verifier.verify();
        if (lastPreflight.passed()) {
            return;
        }
        if (config.isSandbox()) {
            logger.warn("[{}] 沙盒模式: API 预检查失败，但将继续连接", name);
            return;
        }
        throw lastPreflight.error().cause();
    }

    @Override
    public synchronized void close() {
        logger.info("[{}] 关闭连接", name);
        connected = false;
        closeConnector();
        listeners.notify(l -> l.onDisconnected(name));
    }

    private void closeConnector() {
        ExchangeConnector current = connector;
        connector = null;
        if (current == null) {
            return;
        }
        try {
            current.close();
        } catch (RuntimeException e) {
            logger.warn("[{}] 关闭连接器失败: {}", name, e.getMessage());
        }
    }

    // ==================== 账户 ====================

    public UnifiedBalance fetchBalance() throws GatewayException {
        ExchangeConnector current = ensureConnected();
        SharedBalanceCoordinator coordinator = balanceCoordinator();
        if (coordinator == null) {
            return fetchBalanceDirect(current);
        }
        try {
            return coordinator.fetchBalance(() -> fetchBalanceDirect(current));
        } catch (SharedBalanceUnavailableException e) {
            logger.error("[{}] {}", name, e.getMessage());
            throw new GatewayException(GatewayException.Reason.CACHE_UNAVAILABLE, name, e.getMessage(), e);
        }
    }

    private UnifiedBalance fetchBalanceDirect(ExchangeConnector current) throws NormalizedError {
        RawBalance raw = retry.execute(current::fetchBalance, "fetchBalance");
        return new UnifiedBalance(raw.total(), raw.free(), raw.used(), name, clock.getAsLong(), raw.raw());
    }

    /**
     * 首次使用时打开共享存储，连接不上则本网关不再使用共享余额
     */
    private synchronized SharedBalanceCoordinator balanceCoordinator() {
        SharedBalanceConfig shared = config.getSharedBalance();
        if (!shared.isEnabled() || sharedBalanceDisabled) {
            return null;
        }
        if (balanceCoordinator == null) {
            try {
                SharedStore store = storeOpener.open();
                balanceCoordinator = new SharedBalanceCoordinator(
                        new SharedBalanceCache(shared, store, clock, sleeper), name);
                logger.info("[{}] 共享余额已启用: {}", name, shared);
            } catch (SharedStoreException e) {
                sharedBalanceDisabled = true;
                logger.warn("[{}] 共享余额已禁用: {}", name, e.getMessage());
                return null;
            }
        }
        return balanceCoordinator;
    }

    /**
     * @param symbols 为空时返回全部，否则只返回这些（解析后的）交易对
     */
    public List<UnifiedPosition> fetchPositions(List<String> symbols) throws GatewayException {
        ExchangeConnector current = ensureConnected();
        if (!capability.supports(ConnectorOperation.FETCH_POSITIONS)) {
            logger.warn("[{}] 该交易所不支持获取持仓", name);
            return List.of();
        }
        List<String> wanted = new ArrayList<>();
        if (symbols != null) {
            for (String symbol : symbols) {
                wanted.add(resolver.resolve(symbol));
            }
        }
        List<RawPosition> raw = retry.execute(() -> current.fetchPositions(wanted), "fetchPositions");
        Set<String> filter = new HashSet<>(wanted);
        long now = clock.getAsLong();
        List<UnifiedPosition> positions = new ArrayList<>();
        for (RawPosition position : raw) {
            if (PositionNormalizer.isEmpty(position)) {
                continue;
            }
            if (!filter.isEmpty() && !filter.contains(position.symbol())) {
                continue;
            }
            positions.add(PositionNormalizer.normalize(position, now));
        }
        return positions;
    }

    public List<UnifiedPosition> fetchPositions() throws GatewayException {
        return fetchPositions(null);
    }

    public JsonNode setLeverage(int leverage, String symbol) throws GatewayException {
        ExchangeConnector current = ensureConnected();
        String resolved = validSymbol(symbol);
        if (!capability.supports(ConnectorOperation.SET_LEVERAGE)) {
            throw unsupported("setLeverage");
        }
        if (leverage < 1) {
            throw new GatewayException(GatewayException.Reason.INVALID_LEVERAGE, name,
                    "[" + name + "] 无效的杠杆倍数: " + leverage);
        }
        JsonNode result = retry.execute(() -> current.setLeverage(leverage, resolved),
                "setLeverage " + resolved + " " + leverage + "x");
        logger.info("[{}] 杠杆已设置: {} {}x", name, resolved, leverage);
        return result;
    }

    // ==================== 行情 ====================

    public Ticker fetchTicker(String symbol) throws GatewayException {
        ExchangeConnector current = ensureConnected();
        String resolved = validSymbol(symbol);
        return retry.execute(() -> current.fetchTicker(resolved), "fetchTicker " + resolved);
    }

    public List<Candle> fetchOHLCV(String symbol, Timeframe timeframe, Long since, int limit)
            throws GatewayException {
        ExchangeConnector current = ensureConnected();
        String resolved = validSymbol(symbol);
        Timeframe frame = timeframe == null ? Timeframe.ONE_HOUR : timeframe;
        return retry.execute(() -> current.fetchOHLCV(resolved, frame, since, limit),
                "fetchOHLCV " + resolved + " " + frame.getCode());
    }

    public FundingRate fetchFundingRate(String symbol) throws GatewayException {
        ExchangeConnector current = ensureConnected();
        String resolved = validSymbol(symbol);
        if (!capability.supports(ConnectorOperation.FETCH_FUNDING_RATE)) {
            throw unsupported("fetchFundingRate");
        }
        RawFundingRate raw = retry.execute(() -> current.fetchFundingRate(resolved), "fetchFundingRate " + resolved);
        return new FundingRate(raw.symbol() == null ? resolved : raw.symbol(), raw.fundingRate(),
                raw.fundingRatePredicted(), raw.fundingTimestamp(), raw.markPrice(), raw.indexPrice(),
                name, clock.getAsLong(), raw.raw());
    }

    public Optional<PrecisionInfo> getPrecision(String symbol) {
        return precisions.get(symbol);
    }

    // ==================== 订单 ====================

    public UnifiedOrder createOrder(String symbol, OrderSide side, OrderType type, BigDecimal amount,
                                    BigDecimal price, Map<String, Object> params) throws GatewayException {
        return createOrder(symbol, side == null ? null : side.getCode(), type == null ? null : type.getCode(),
                amount, price, params);
    }

    /**
     * 参数在任何网络请求之前校验。数量和价格按交易对精度向下截断，
     * 截断后为 0 的数量会被拒绝。
     *
     * @param price  limit 和 stop_limit 订单必填
     * @param params 透传给连接器（{@code clientOrderId}、{@code stopPrice}、
     *               {@code reduceOnly} 等）；{@code stopPrice} 与价格一样截断
     */
    public UnifiedOrder createOrder(String symbol, String side, String type, BigDecimal amount,
                                    BigDecimal price, Map<String, Object> params) throws GatewayException {
        ExchangeConnector current = ensureConnected();
        String resolved = validSymbol(symbol);

        OrderSide orderSide = OrderSide.fromCode(side);
        if (orderSide == null) {
            throw invalid(GatewayException.Reason.INVALID_SIDE, "无效的订单方向，应为 buy/sell: " + side);
        }
        OrderType orderType = OrderType.fromCode(type);
        if (orderType == null) {
            throw invalid(GatewayException.Reason.INVALID_TYPE, "无效的订单类型: " + type);
        }
        if (!Decimal.isPositive(amount)) {
            throw invalid(GatewayException.Reason.INVALID_AMOUNT, "无效的订单数量，必须为正数: " + amount);
        }
        if (orderType.requiresPrice() && !Decimal.isPositive(price)) {
            throw invalid(GatewayException.Reason.INVALID_PRICE, orderType.getCode() + " 订单必须指定有效价格: " + price);
        }

        BigDecimal adjustedAmount = precisions.adjustAmount(resolved, amount);
        if (!Decimal.isPositive(adjustedAmount)) {
            throw invalid(GatewayException.Reason.INVALID_AMOUNT,
                    "订单数量 " + amount.toPlainString() + " 按精度截断后为 0");
        }
        BigDecimal adjustedPrice = precisions.adjustPrice(resolved, price);
        if (orderType.requiresPrice() && !Decimal.isPositive(adjustedPrice)) {
            throw invalid(GatewayException.Reason.INVALID_PRICE,
                    "订单价格 " + price.toPlainString() + " 按精度截断后为 0");
        }
        Map<String, Object> extra = new LinkedHashMap<>(params == null ? Map.of() : params);
        Object stopPrice = extra.get("stopPrice");
        if (stopPrice != null) {
            BigDecimal parsedStop = Decimal.parse(stopPrice.toString());
            if (!Decimal.isPositive(parsedStop)) {
                throw invalid(GatewayException.Reason.INVALID_PRICE, "无效的触发价格，必须为正数: " + stopPrice);
            }
            BigDecimal adjustedStop = precisions.adjustPrice(resolved, parsedStop);
            if (!Decimal.isPositive(adjustedStop)) {
                throw invalid(GatewayException.Reason.INVALID_PRICE,
                        "触发价格 " + parsedStop.toPlainString() + " 按精度截断后为 0");
            }
            extra.put("stopPrice", adjustedStop);
        }

        OrderRequest request = new OrderRequest(resolved, orderSide, orderType, adjustedAmount, adjustedPrice, extra);
        logger.info("[{}] 创建订单: {} {} {} amount={} price={}", name, resolved, orderSide.getCode(),
                orderType.getCode(), adjustedAmount.toPlainString(),
                adjustedPrice == null ? "-" : adjustedPrice.toPlainString());

        RawOrder raw = retry.execute(() -> current.createOrder(request),
                "createOrder " + resolved + " " + orderSide.getCode() + " " + orderType.getCode());
        UnifiedOrder order = OrderNormalizer.normalize(raw, resolved, clock.getAsLong());
        logger.info("[{}] 订单创建成功: {}", name, order.getId());
        listeners.notify(l -> l.onOrderCreated(order));
        return order;
    }

    public UnifiedOrder cancelOrder(String id, String symbol) throws GatewayException {
        ExchangeConnector current = ensureConnected();
        String resolved = resolver.resolve(symbol);
        logger.info("[{}] 取消订单: {}", name, id);
        RawOrder raw = retry.execute(() -> current.cancelOrder(id, resolved), "cancelOrder " + id);
        UnifiedOrder order = OrderNormalizer.normalize(raw, resolved, clock.getAsLong());
        logger.info("[{}] 订单已取消: {}", name, id);
        listeners.notify(l -> l.onOrderCanceled(order));
        return order;
    }

    /**
     * 交易所支持批量撤单时直接调用，否则逐个撤销挂单
     * 逐个撤单时单笔失败只计数，不抛出
     */
    public CancelAllResult cancelAllOrders(String symbol) throws GatewayException {
        ExchangeConnector current = ensureConnected();
        String resolved = validSymbol(symbol);
        logger.info("[{}] 取消所有订单: {}", name, resolved);

        CancelAllResult result;
        if (capability.supports(ConnectorOperation.CANCEL_ALL_ORDERS)) {
            List<RawOrder> raw = retry.execute(() -> current.cancelAllOrders(resolved), "cancelAllOrders " + resolved);
            List<UnifiedOrder> orders = normalizeAll(raw, resolved);
            result = new CancelAllResult(resolved, name, orders.size(), 0, orders, clock.getAsLong());
        } else {
            List<RawOrder> open = retry.execute(() -> current.fetchOpenOrders(resolved), "fetchOpenOrders " + resolved);
            List<UnifiedOrder> canceled = new ArrayList<>();
            int failed = 0;
            for (RawOrder order : open) {
                try {
                    RawOrder raw = current.cancelOrder(order.id(), resolved);
                    canceled.add(OrderNormalizer.normalize(raw, resolved, clock.getAsLong()));
                } catch (ExchangeException | RuntimeException e) {
                    failed++;
                    logger.warn("[{}] 取消订单 {} 失败: {}", name, order.id(), e.getMessage());
                }
            }
            result = new CancelAllResult(resolved, name, canceled.size(), failed, canceled, clock.getAsLong());
        }

        logger.info("[{}] 已取消 {} 个订单", name, result.canceledCount());
        if (result.failedCount() > 0) {
            logger.warn("[{}] {} 个订单取消失败", name, result.failedCount());
        }
        CancelAllResult event = result;
        listeners.notify(l -> l.onAllOrdersCanceled(event));
        return result;
    }

    public UnifiedOrder fetchOrder(String id, String symbol) throws GatewayException {
        ExchangeConnector current = ensureConnected();
        String resolved = resolver.resolve(symbol);
        RawOrder raw = retry.execute(() -> current.fetchOrder(id, resolved), "fetchOrder " + id);
        return OrderNormalizer.normalize(raw, resolved, clock.getAsLong());
    }

    /**
     * @param symbol 为 null 时查询全部交易对
     */
    public List<UnifiedOrder> fetchOpenOrders(String symbol) throws GatewayException {
        ExchangeConnector current = ensureConnected();
        String resolved = symbol == null ? null : resolver.resolve(symbol);
        List<RawOrder> raw = retry.execute(() -> current.fetchOpenOrders(resolved),
                "fetchOpenOrders " + (resolved == null ? "all" : resolved));
        return normalizeAll(raw, resolved);
    }

    // ==================== 内部 ====================

    private List<UnifiedOrder> normalizeAll(List<RawOrder> raw, String fallbackSymbol) {
        long now = clock.getAsLong();
        List<UnifiedOrder> orders = new ArrayList<>(raw.size());
        for (RawOrder order : raw) {
            orders.add(OrderNormalizer.normalize(order, fallbackSymbol, now));
        }
        return orders;
    }

    private ExchangeConnector ensureConnected() throws GatewayException {
        ExchangeConnector current = connector;
        if (!connected || current == null) {
            throw new GatewayException(GatewayException.Reason.NOT_CONNECTED, name,
                    "[" + name + "] 交易所未连接，请先调用 connect()");
        }
        return current;
    }

    /**
     * 解析交易对；已加载市场时拒绝未知交易对
     */
    private String validSymbol(String symbol) throws GatewayException {
        if (symbol == null || symbol.isBlank()) {
            throw invalid(GatewayException.Reason.INVALID_SYMBOL, "交易对不能为空");
        }
        String resolved = resolver.resolve(symbol);
        if (!resolver.isKnown(resolved)) {
            throw invalid(GatewayException.Reason.INVALID_SYMBOL, "无效的交易对: " + symbol);
        }
        return resolved;
    }

    private GatewayException invalid(GatewayException.Reason reason, String message) {
        return new GatewayException(reason, name, "[" + name + "] " + message);
    }

    private GatewayException unsupported(String operation) {
        return new GatewayException(GatewayException.Reason.UNSUPPORTED, name,
                "[" + name + "] 该交易所不支持 " + operation);
    }
}
