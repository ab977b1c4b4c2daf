package com.trade.gateway.connector;

/**
 * 连接器操作，用作交易所能力标记
 */
public enum ConnectorOperation {
    FETCH_TIME,
    LOAD_MARKETS,
    FETCH_BALANCE,
    FETCH_POSITIONS,
    FETCH_TICKER,
    FETCH_OHLCV,
    FETCH_FUNDING_RATE,
    CREATE_ORDER,
    CANCEL_ORDER,
    CANCEL_ALL_ORDERS,
    FETCH_OPEN_ORDERS,
    FETCH_ORDER,
    SET_LEVERAGE
}
