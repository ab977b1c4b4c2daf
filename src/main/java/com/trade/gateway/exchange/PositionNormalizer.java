package com.trade.gateway.exchange;

import com.trade.gateway.connector.RawPosition;
import com.trade.gateway.core.Decimal;
import com.trade.gateway.core.MarginMode;
import com.trade.gateway.core.PositionSide;
import com.trade.gateway.core.UnifiedPosition;

import java.math.BigDecimal;

/**
 * 把连接器持仓转换为 {@link UnifiedPosition}
 */
final class PositionNormalizer {

    private PositionNormalizer() {
    }

    /**
     * 部分交易所会为每个交易对返回空仓位
     */
    static boolean isEmpty(RawPosition raw) {
        return Decimal.isNullOrZero(raw.contracts()) && Decimal.isNullOrZero(raw.notional());
    }

    static UnifiedPosition normalize(RawPosition raw, long now) {
        BigDecimal contracts = raw.contracts() == null ? BigDecimal.ZERO : raw.contracts();
        PositionSide side = PositionSide.fromCode(raw.side());
        if (side == null) {
            side = Decimal.isNegative(contracts) ? PositionSide.SHORT : PositionSide.LONG;
        }
        BigDecimal leverage = Decimal.isPositive(raw.leverage()) ? raw.leverage() : BigDecimal.ONE;

        return UnifiedPosition.builder()
                .symbol(raw.symbol())
                .side(side)
                .contracts(contracts.abs())
                .notional(raw.notional() == null ? null : raw.notional().abs())
                .entryPrice(raw.entryPrice())
                .markPrice(raw.markPrice())
                .liquidationPrice(raw.liquidationPrice())
                .leverage(leverage)
                .unrealizedPnl(raw.unrealizedPnl())
                .realizedPnl(raw.realizedPnl())
                .marginMode(MarginMode.fromCode(raw.marginMode()))
                .collateral(Decimal.firstNonNull(raw.collateral(), raw.initialMargin()))
                .timestamp(raw.timestamp() == null ? now : raw.timestamp())
                .raw(raw.raw())
                .build();
    }
}
