package com.trade.gateway.core;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * 精度值：小数位数或最小步长，二者由 {@link Mode} 显式区分
 * 步长为整数（如 1、10）时也不会被误判为小数位
 */
public final class PrecisionValue {

    public enum Mode {
        DECIMAL_PLACES, // 小数位数，如 3 → 0.001
        TICK_SIZE       // 最小步长，如 0.5
    }

    private final Mode mode;
    private final BigDecimal value;

    private PrecisionValue(Mode mode, BigDecimal value) {
        this.mode = mode;
        this.value = value;
    }

    public static PrecisionValue decimalPlaces(int places) {
        if (places < 0) {
            throw new IllegalArgumentException("小数位不能为负: " + places);
        }
        return new PrecisionValue(Mode.DECIMAL_PLACES, BigDecimal.valueOf(places));
    }

    public static PrecisionValue tickSize(BigDecimal tick) {
        if (!Decimal.isPositive(tick)) {
            throw new IllegalArgumentException("步长必须为正: " + tick);
        }
        return new PrecisionValue(Mode.TICK_SIZE, tick.stripTrailingZeros());
    }

    /**
     * 无类型来源的兼容推断：整数视为小数位，非整数视为步长
     */
    public static PrecisionValue infer(BigDecimal raw) {
        Objects.requireNonNull(raw, "raw");
        BigDecimal stripped = raw.stripTrailingZeros();
        if (stripped.scale() <= 0) {
            return decimalPlaces(stripped.intValueExact());
        }
        return tickSize(stripped);
    }

    public Mode getMode() {
        return mode;
    }

    public BigDecimal getValue() {
        return value;
    }

    /**
     * 按精度向下截断
     */
    public BigDecimal floor(BigDecimal raw) {
        if (mode == Mode.DECIMAL_PLACES) {
            return Decimal.floorToScale(raw, value.intValueExact());
        }
        return Decimal.floorToStep(raw, value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        PrecisionValue that = (PrecisionValue) o;
        return mode == that.mode && value.compareTo(that.value) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(mode, value.stripTrailingZeros());
    }

    @Override
    public String toString() {
        return mode == Mode.DECIMAL_PLACES ? value + "dp" : "tick " + value.toPlainString();
    }
}
