package com.tradepilot.common.analysis;

import java.util.List;

/**
 * Pure calculation helpers over price series.
 * Input prices are chronological (index 0 = oldest, last index = most recent).
 */
public final class PriceIndicators {

    private PriceIndicators() {}

    /**
     * Mean of the most recent {@code period} prices.
     * @return SMA value, or NaN if insufficient data
     */
    public static double sma(List<Double> prices, int period) {
        if (prices == null || period <= 0 || prices.size() < period) return Double.NaN;
        double sum = 0;
        for (int i = prices.size() - period; i < prices.size(); i++) sum += prices.get(i);
        return sum / period;
    }

    /**
     * Least-squares slope over the most recent {@code period} prices, in price units per step.
     * @return slope, or NaN if insufficient data
     */
    public static double slope(List<Double> prices, int period) {
        if (prices == null || period < 2 || prices.size() < period) return Double.NaN;
        int offset = prices.size() - period;
        double meanX = (period - 1) / 2.0;
        double meanY = sma(prices, period);
        double num = 0;
        double den = 0;
        for (int i = 0; i < period; i++) {
            double dx = i - meanX;
            num += dx * (prices.get(offset + i) - meanY);
            den += dx * dx;
        }
        return num / den;
    }

    /** True when every element is a finite number. */
    public static boolean allFinite(List<Double> prices) {
        for (Double p : prices) {
            if (p == null || !Double.isFinite(p)) return false;
        }
        return true;
    }
}
