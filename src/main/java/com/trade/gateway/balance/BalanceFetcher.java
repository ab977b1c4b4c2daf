package com.trade.gateway.balance;

import com.trade.gateway.core.UnifiedBalance;

/**
 * 直接从交易所拉取余额，由网关提供
 *
 * @param <E> 拉取失败时的异常类型
 */
@FunctionalInterface
public interface BalanceFetcher<E extends Exception> {

    UnifiedBalance fetch() throws E;
}
