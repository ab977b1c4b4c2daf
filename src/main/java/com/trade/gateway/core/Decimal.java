package com.trade.gateway.core;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * BigDecimal 工具类
 * 所有金额、价格、数量计算必须使用此类，禁止 double
 */
public final class Decimal {

    private Decimal() {}

    /**
     * 默认精度：价格保留8位小数
     */
    public static final int DEFAULT_SCALE = 8;

    public static BigDecimal of(String value) {
        return new BigDecimal(value);
    }

    public static BigDecimal of(double value) {
        return BigDecimal.valueOf(value);
    }

    public static BigDecimal zero() {
        return BigDecimal.ZERO;
    }

    /**
     * 宽松解析：null、空串、非数字返回 null
     */
    public static BigDecimal parse(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        if (trimmed.isEmpty()) {
            return null;
        }
        try {
            return new BigDecimal(trimmed);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /**
     * 按小数位截断（向下取整）
     * floor(value × 10^n) / 10^n
     */
    public static BigDecimal floorToScale(BigDecimal value, int decimalPlaces) {
        if (decimalPlaces < 0) {
            throw new IllegalArgumentException("小数位不能为负: " + decimalPlaces);
        }
        return value.setScale(decimalPlaces, RoundingMode.FLOOR);
    }

    /**
     * 按步长截断（向下取整）
     * floor(value / step) × step
     */
    public static BigDecimal floorToStep(BigDecimal value, BigDecimal step) {
        if (!isPositive(step)) {
            throw new IllegalArgumentException("步长必须为正: " + step);
        }
        BigDecimal steps = value.divide(step, 0, RoundingMode.FLOOR);
        return steps.multiply(step).setScale(Math.max(step.stripTrailingZeros().scale(), 0), RoundingMode.UNNECESSARY);
    }

    /**
     * 安全除法，避免除零
     */
    public static BigDecimal divide(BigDecimal dividend, BigDecimal divisor) {
        if (divisor.compareTo(BigDecimal.ZERO) == 0) {
            return BigDecimal.ZERO;
        }
        return dividend.divide(divisor, DEFAULT_SCALE, RoundingMode.HALF_UP);
    }

    /**
     * 两数相减，任一为 null 返回 null
     */
    public static BigDecimal subtract(BigDecimal a, BigDecimal b) {
        if (a == null || b == null) {
            return null;
        }
        return a.subtract(b);
    }

    /**
     * 返回第一个非 null 值
     */
    public static BigDecimal firstNonNull(BigDecimal... values) {
        for (BigDecimal value : values) {
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    /**
     * 判断是否为正值
     */
    public static boolean isPositive(BigDecimal value) {
        return value != null && value.compareTo(BigDecimal.ZERO) > 0;
    }

    /**
     * 判断是否为负值
     */
    public static boolean isNegative(BigDecimal value) {
        return value != null && value.compareTo(BigDecimal.ZERO) < 0;
    }

    /**
     * 判断是否为零
     */
    public static boolean isZero(BigDecimal value) {
        return value != null && value.compareTo(BigDecimal.ZERO) == 0;
    }

    /**
     * null 或 0 都视为空
     */
    public static boolean isNullOrZero(BigDecimal value) {
        return value == null || value.signum() == 0;
    }
}
