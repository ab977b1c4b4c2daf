package com.trade.gateway.core;

import java.util.Objects;

/**
 * 统一交易对
 * 现货: BASE/QUOTE，衍生品: BASE/QUOTE:SETTLE
 */
public final class Symbol {
    private final String base;      // 基础货币，如 BTC
    private final String quote;     // 报价货币，如 USDT
    private final String settle;    // 结算货币，现货为 null

    public Symbol(String base, String quote, String settle) {
        this.base = Objects.requireNonNull(base, "base").toUpperCase();
        this.quote = Objects.requireNonNull(quote, "quote").toUpperCase();
        this.settle = settle == null || settle.isBlank() ? null : settle.toUpperCase();
    }

    /**
     * 解析统一格式交易对，格式不符返回 null
     */
    public static Symbol parse(String symbol) {
        if (symbol == null) {
            return null;
        }
        String pair = symbol;
        String settle = null;
        int colon = symbol.indexOf(':');
        if (colon >= 0) {
            pair = symbol.substring(0, colon);
            settle = symbol.substring(colon + 1);
        }
        String[] parts = pair.split("/");
        if (parts.length != 2 || parts[0].isBlank() || parts[1].isBlank()) {
            return null;
        }
        return new Symbol(parts[0], parts[1], settle);
    }

    /**
     * 是否为衍生品写法（含 :SETTLE）
     */
    public static boolean isDerivativeForm(String symbol) {
        return symbol != null && symbol.contains(":");
    }

    /**
     * 去掉 :SETTLE 后缀
     */
    public static String toSpotForm(String symbol) {
        if (symbol == null) {
            return null;
        }
        int colon = symbol.indexOf(':');
        return colon >= 0 ? symbol.substring(0, colon) : symbol;
    }

    public String getBase() {
        return base;
    }

    public String getQuote() {
        return quote;
    }

    public String getSettle() {
        return settle;
    }

    public boolean isDerivative() {
        return settle != null;
    }

    public Symbol withSettle(String newSettle) {
        return new Symbol(base, quote, newSettle);
    }

    public Symbol toSpot() {
        return new Symbol(base, quote, null);
    }

    /**
     * 交易所原生格式（无分隔符），如 BTCUSDT
     */
    public String toPairString() {
        return base + quote;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Symbol symbol = (Symbol) o;
        return Objects.equals(base, symbol.base)
                && Objects.equals(quote, symbol.quote)
                && Objects.equals(settle, symbol.settle);
    }

    @Override
    public int hashCode() {
        return Objects.hash(base, quote, settle);
    }

    @Override
    public String toString() {
        return settle == null ? base + "/" + quote : base + "/" + quote + ":" + settle;
    }
}
