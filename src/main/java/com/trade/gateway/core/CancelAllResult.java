package com.trade.gateway.core;

import java.util.List;

/**
 * 批量撤单结果
 *
 * @param orders 已撤销的订单；交易所原生批量撤单不返回明细时为空列表
 */
public record CancelAllResult(String symbol,
                              String exchange,
                              int canceledCount,
                              int failedCount,
                              List<UnifiedOrder> orders,
                              long timestamp) {

    public CancelAllResult {
        orders = orders == null ? List.of() : List.copyOf(orders);
    }
}
