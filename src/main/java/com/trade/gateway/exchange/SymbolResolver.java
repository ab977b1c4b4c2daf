package com.trade.gateway.exchange;

import com.trade.gateway.core.MarketType;
import com.trade.gateway.core.Symbol;

import java.util.List;
import java.util.Set;

/**
 * 统一现货（{@code BASE/QUOTE}）与合约（{@code BASE/QUOTE:SETTLE}）两种交易对写法
 * <p>
 * 未加载市场时为轻量模式：只按默认市场类型转换，
 * 不做校验。解析结果幂等。
 */
public final class SymbolResolver {

    static final List<String> SETTLE_SUFFIXES = List.of(":USDT", ":USD", ":BUSD");
    private static final String LIGHTWEIGHT_SUFFIX = ":USDT";

    private final Set<String> markets;
    private final MarketType defaultType;

    public SymbolResolver(Set<String> markets, MarketType defaultType) {
        this.markets = markets == null ? Set.of() : Set.copyOf(markets);
        this.defaultType = defaultType == null ? MarketType.SWAP : defaultType;
    }

    public static SymbolResolver lightweight(MarketType defaultType) {
        return new SymbolResolver(Set.of(), defaultType);
    }

    public boolean isLightweight() {
        return markets.isEmpty();
    }

    /**
     * 无法解析的输入原样返回，由校验环节拒绝
     */
    public String resolve(String symbol) {
        if (symbol == null || symbol.isBlank()) {
            return symbol;
        }
        if (isLightweight()) {
            return byConvention(symbol);
        }
        if (markets.contains(symbol)) {
            return symbol;
        }
        String converted = oppositeForm(symbol);
        return converted != null ? converted : symbol;
    }

    /**
     * 交易对或其另一种写法已在市场表中
     * 轻量模式下总是 true
     */
    public boolean isKnown(String symbol) {
        if (isLightweight()) {
            return true;
        }
        if (symbol == null) {
            return false;
        }
        return markets.contains(symbol) || oppositeForm(symbol) != null;
    }

    private String byConvention(String symbol) {
        boolean derivativeForm = Symbol.isDerivativeForm(symbol);
        if (defaultType.isDerivative() && !derivativeForm) {
            return symbol + LIGHTWEIGHT_SUFFIX;
        }
        if (defaultType == MarketType.SPOT && derivativeForm) {
            return Symbol.toSpotForm(symbol);
        }
        return symbol;
    }

    private String oppositeForm(String symbol) {
        if (Symbol.isDerivativeForm(symbol)) {
            String spot = Symbol.toSpotForm(symbol);
            return markets.contains(spot) ? spot : null;
        }
        for (String suffix : SETTLE_SUFFIXES) {
            String candidate = symbol + suffix;
            if (markets.contains(candidate)) {
                return candidate;
            }
        }
        return null;
    }
}
