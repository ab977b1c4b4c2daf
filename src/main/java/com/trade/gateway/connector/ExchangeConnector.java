package com.trade.gateway.connector;

import com.fasterxml.jackson.databind.JsonNode;
import com.trade.gateway.core.Candle;
import com.trade.gateway.core.Ticker;
import com.trade.gateway.core.Timeframe;

import java.util.List;
import java.util.Map;

/**
 * 交易所连接器
 * 只负责与交易所通信，不做重试、精度处理和归一化，这些由网关完成
 *
 * 交易对参数一律使用统一格式（BTC/USDT:USDT），由连接器自行转换为原生ID。
 * 可选操作的默认实现抛出 NOT_SUPPORTED，是否支持以交易所能力声明为准。
 */
public interface ExchangeConnector {

    /**
     * 交易所标识，如 binance、okx
     */
    String getId();

    /**
     * 服务器时间（毫秒），公共接口
     */
    default long fetchTime() throws ExchangeException {
        throw notSupported("fetchTime");
    }

    /**
     * 加载交易对元数据，键为统一交易对
     */
    Map<String, MarketInfo> loadMarkets() throws ExchangeException;

    RawBalance fetchBalance() throws ExchangeException;

    /**
     * @param symbols 为空表示全部
     */
    default List<RawPosition> fetchPositions(List<String> symbols) throws ExchangeException {
        throw notSupported("fetchPositions");
    }

    Ticker fetchTicker(String symbol) throws ExchangeException;

    /**
     * @param since 起始时间（毫秒），null 表示最新
     */
    List<Candle> fetchOHLCV(String symbol, Timeframe timeframe, Long since, int limit) throws ExchangeException;

    default RawFundingRate fetchFundingRate(String symbol) throws ExchangeException {
        throw notSupported("fetchFundingRate");
    }

    RawOrder createOrder(OrderRequest request) throws ExchangeException;

    RawOrder cancelOrder(String id, String symbol) throws ExchangeException;

    /**
     * 原生批量撤单，返回交易所给出的订单明细（可能为空）
     */
    default List<RawOrder> cancelAllOrders(String symbol) throws ExchangeException {
        throw notSupported("cancelAllOrders");
    }

    /**
     * @param symbol 为 null 表示全部交易对
     */
    List<RawOrder> fetchOpenOrders(String symbol) throws ExchangeException;

    RawOrder fetchOrder(String id, String symbol) throws ExchangeException;

    default JsonNode setLeverage(int leverage, String symbol) throws ExchangeException {
        throw notSupported("setLeverage");
    }

    /**
     * 释放连接资源
     */
    void close();

    private ExchangeException notSupported(String operation) {
        return new ExchangeException(ExchangeException.ErrorCode.NOT_SUPPORTED,
                getId() + " does not support " + operation);
    }
}
