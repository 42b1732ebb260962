package com.tradepilot.common.risk;

import com.tradepilot.common.money.MoneyUtils;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;

/**
 * Risk-bounded notional for autonomous entries.
 *
 * <pre>
 *   notional = max(0, min(balance × riskFraction, cap, balance))
 * </pre>
 *
 * <p>Sizing is notional-based; {@code price} only matters to callers converting the
 * result into units via {@link #units}. Manually entered trades do not go through here.
 */
public final class PositionSizer {

    private PositionSizer() {}

    /**
     * @param balance      available balance of the account
     * @param price        current price (unused by the sizing rule)
     * @param riskFraction share of balance to commit, e.g. 0.02
     * @param cap          hard notional ceiling
     * @return notional in [0, min(balance × riskFraction, cap)], never null
     */
    public static BigDecimal safeSize(BigDecimal balance, BigDecimal price, double riskFraction, BigDecimal cap) {
        if (!MoneyUtils.isPositive(balance) || !Double.isFinite(riskFraction) || riskFraction <= 0
                || cap == null || cap.signum() <= 0) {
            return MoneyUtils.ZERO;
        }
        BigDecimal risked = balance.multiply(BigDecimal.valueOf(riskFraction));
        BigDecimal bounded = risked.min(cap).min(balance);
        // round down so the result never exceeds either bound
        return bounded.max(BigDecimal.ZERO).setScale(MoneyUtils.SCALE, RoundingMode.DOWN);
    }

    /** Converts a notional into asset units at {@code price}; zero when price is not positive. */
    public static BigDecimal units(BigDecimal notional, BigDecimal price) {
        if (!MoneyUtils.isPositive(price) || notional == null) {
            return BigDecimal.ZERO;
        }
        return notional.divide(price, MathContext.DECIMAL64);
    }
}
