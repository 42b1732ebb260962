package com.tradepilot.common.analysis;

import com.tradepilot.common.model.SignalAction;
import com.tradepilot.common.model.TrendSignal;

import java.util.List;

/**
 * Momentum classifier used by autonomous entries and by the advisory fallback.
 *
 * <h3>Rule</h3>
 * <pre>
 *   shortMean = SMA(last 10)
 *   baseline  = SMA(last min(n, 50))
 *   momentum  = (shortMean − baseline) / baseline × 100      (percent)
 *
 *   momentum ≥ +0.15  → BUY
 *   momentum ≤ −0.15  → SELL
 *   otherwise         → HOLD
 *
 *   confidence = round(min(95, 50 + |momentum| × 100))
 * </pre>
 *
 * <p>Pure and stateless: the same sequence always yields the same signal. Callers
 * enforce the minimum history length (50 for autopilot, 20 for the advisory
 * fallback); shorter or non-finite input degrades to HOLD instead of throwing.
 */
public final class TrendAnalyzer {

    public static final int SHORT_WINDOW = 10;
    public static final int BASELINE_WINDOW = 50;
    public static final double MOMENTUM_THRESHOLD_PCT = 0.15;

    private static final double BASE_CONFIDENCE = 50.0;
    private static final double MAX_CONFIDENCE = 95.0;
    private static final double CONFIDENCE_PER_PCT = 100.0;

    private TrendAnalyzer() {}

    /**
     * @param history chronological prices, oldest first
     * @return trend signal, never null
     */
    public static TrendSignal analyzeTrend(List<Double> history) {
        if (history == null || history.size() < SHORT_WINDOW || !PriceIndicators.allFinite(history)) {
            return new TrendSignal(SignalAction.HOLD, 0, "Insufficient price history for trend analysis.");
        }

        int baselineWindow = Math.min(history.size(), BASELINE_WINDOW);
        double shortMean = PriceIndicators.sma(history, SHORT_WINDOW);
        double baseline  = PriceIndicators.sma(history, baselineWindow);
        if (baseline <= 0) {
            return new TrendSignal(SignalAction.HOLD, 0, "Non-positive price baseline.");
        }

        double momentum = (shortMean - baseline) / baseline * 100.0;
        double slopePct = PriceIndicators.slope(history, SHORT_WINDOW) / baseline * 100.0;

        SignalAction action;
        if (momentum >= MOMENTUM_THRESHOLD_PCT)       action = SignalAction.BUY;
        else if (momentum <= -MOMENTUM_THRESHOLD_PCT) action = SignalAction.SELL;
        else                                          action = SignalAction.HOLD;

        int confidence = confidence(momentum);

        String reason = String.format(
            "SMA%d vs SMA%d momentum %+.3f%% (slope %+.4f%%/tick) → %s",
            SHORT_WINDOW, baselineWindow, momentum, slopePct, describe(action));

        return new TrendSignal(action, confidence, reason);
    }

    static int confidence(double momentumPct) {
        double raw = BASE_CONFIDENCE + Math.abs(momentumPct) * CONFIDENCE_PER_PCT;
        return (int) Math.round(Math.max(0.0, Math.min(MAX_CONFIDENCE, raw)));
    }

    private static String describe(SignalAction action) {
        return switch (action) {
            case BUY  -> "bullish momentum above threshold";
            case SELL -> "bearish momentum below threshold";
            case HOLD -> "momentum inside neutral band";
        };
    }
}
