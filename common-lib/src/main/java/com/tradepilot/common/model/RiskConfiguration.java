package com.tradepilot.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.tradepilot.common.exception.TradeRejectedException;

import java.math.BigDecimal;

/**
 * Operator risk settings. Percent fields are whole percentages (2 = 2 %).
 *
 * <p>Stop-loss and take-profit are copied onto each {@link Trade} when it opens;
 * changing the configuration later never affects positions already open.
 *
 * @param stopLossPct         close when PnL% falls to −stopLossPct
 * @param takeProfitPct       close when PnL% reaches takeProfitPct
 * @param maxDrawdownPct      kill switch when cumulative PnL ≤ −maxDrawdownPct of balance
 * @param advisoryRiskPct     share of balance committed per autonomous entry
 * @param advisoryMaxPosition notional cap per autonomous entry
 * @param useProxy            route market-data requests through {@code proxyUrl}
 * @param proxyUrl            URL prefix used when {@code useProxy} is set
 */
public record RiskConfiguration(
    @JsonProperty("stopLossPct")         double stopLossPct,
    @JsonProperty("takeProfitPct")       double takeProfitPct,
    @JsonProperty("maxDrawdownPct")      double maxDrawdownPct,
    @JsonProperty("advisoryRiskPct")     double advisoryRiskPct,
    @JsonProperty("advisoryMaxPosition") BigDecimal advisoryMaxPosition,
    @JsonProperty("useProxy")            boolean useProxy,
    @JsonProperty("proxyUrl")            String proxyUrl
) {

    public static final double DEFAULT_STOP_LOSS_PCT   = 2.0;
    public static final double DEFAULT_TAKE_PROFIT_PCT = 5.0;
    public static final double DEFAULT_MAX_DRAWDOWN    = 15.0;
    public static final double DEFAULT_ADVISORY_RISK   = 2.0;
    public static final BigDecimal DEFAULT_MAX_POSITION = BigDecimal.valueOf(50);

    public static RiskConfiguration defaults() {
        return new RiskConfiguration(DEFAULT_STOP_LOSS_PCT, DEFAULT_TAKE_PROFIT_PCT, DEFAULT_MAX_DRAWDOWN,
            DEFAULT_ADVISORY_RISK, DEFAULT_MAX_POSITION, false, "");
    }

    /** Advisory risk as a fraction of balance (2 % → 0.02). */
    public double advisoryRiskFraction() {
        return advisoryRiskPct / 100.0;
    }

    /** True when the three headline limits equal the factory values. */
    @JsonIgnore
    public boolean isFactoryDefault() {
        return stopLossPct == DEFAULT_STOP_LOSS_PCT
            && takeProfitPct == DEFAULT_TAKE_PROFIT_PCT
            && maxDrawdownPct == DEFAULT_MAX_DRAWDOWN;
    }

    /**
     * Proxy prefix for outbound market-data URLs, or empty when proxying is off.
     */
    public String proxyPrefix() {
        return useProxy && proxyUrl != null && !proxyUrl.isBlank() ? proxyUrl : "";
    }

    /**
     * @return this configuration
     * @throws TradeRejectedException when any limit is out of range
     */
    public RiskConfiguration validate() {
        requirePositive(stopLossPct, "stopLossPct");
        requirePositive(takeProfitPct, "takeProfitPct");
        requirePositive(maxDrawdownPct, "maxDrawdownPct");
        requirePositive(advisoryRiskPct, "advisoryRiskPct");
        if (advisoryRiskPct > 100.0) {
            throw new TradeRejectedException("RiskConfiguration", "advisoryRiskPct must not exceed 100");
        }
        if (advisoryMaxPosition == null || advisoryMaxPosition.signum() < 0) {
            throw new TradeRejectedException("RiskConfiguration", "advisoryMaxPosition must be zero or positive");
        }
        return this;
    }

    private static void requirePositive(double value, String field) {
        if (!Double.isFinite(value) || value <= 0) {
            throw new TradeRejectedException("RiskConfiguration", field + " must be a positive number, got " + value);
        }
    }
}
