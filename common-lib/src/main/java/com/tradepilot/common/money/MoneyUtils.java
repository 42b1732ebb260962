package com.tradepilot.common.money;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;

/**
 * Fixed-scale arithmetic for notional amounts, balances and PnL.
 * Percentages are carried at {@link MathContext#DECIMAL64} precision and only
 * rounded when they become money.
 */
public final class MoneyUtils {

    public static final int SCALE = 4;
    public static final BigDecimal ZERO = BigDecimal.ZERO.setScale(SCALE, RoundingMode.HALF_UP);
    public static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private MoneyUtils() {}

    public static BigDecimal bd(double value) {
        return scale(BigDecimal.valueOf(value));
    }

    public static BigDecimal bd(String value) {
        if (value == null || value.isBlank()) {
            return ZERO;
        }
        return scale(new BigDecimal(value.trim()));
    }

    public static BigDecimal scale(BigDecimal value) {
        if (value == null) {
            return ZERO;
        }
        return value.setScale(SCALE, RoundingMode.HALF_UP);
    }

    public static BigDecimal add(BigDecimal left, BigDecimal right) {
        return scale(scale(left).add(scale(right)));
    }

    public static BigDecimal subtract(BigDecimal left, BigDecimal right) {
        return scale(scale(left).subtract(scale(right)));
    }

    /** {@code (value - base) / base × 100}, unrounded. */
    public static BigDecimal percentChange(BigDecimal base, BigDecimal value) {
        return value.subtract(base)
            .multiply(HUNDRED)
            .divide(base, MathContext.DECIMAL64);
    }

    /** {@code amount × pct / 100}, rounded to money scale. */
    public static BigDecimal percentOf(BigDecimal amount, BigDecimal pct) {
        return scale(amount.multiply(pct).divide(HUNDRED, MathContext.DECIMAL64));
    }

    public static boolean isPositive(BigDecimal value) {
        return value != null && value.signum() > 0;
    }
}
