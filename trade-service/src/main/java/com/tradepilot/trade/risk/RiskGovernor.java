package com.tradepilot.trade.risk;

import com.tradepilot.common.model.SafetyState;
import com.tradepilot.common.money.MoneyUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.MathContext;

/**
 * Kill switch for autonomous trading.
 *
 * <p>Tracks the run of consecutive losing settlements and the cumulative realised PnL
 * of the session. {@link #evaluate} is the gate consulted before every autopilot
 * cycle: once either limit is breached autopilot is switched off and an alert is
 * raised. Nothing re-enables autopilot except an explicit operator action.
 *
 * <p>Not thread-safe; owned by the single engine thread.
 */
public class RiskGovernor {

    private static final Logger log = LoggerFactory.getLogger(RiskGovernor.class);

    private final int maxConsecutiveLosses;

    private int consecutiveLosses;
    private BigDecimal cumulativePnl = MoneyUtils.ZERO;
    private boolean autopilotEnabled;
    private String alert;

    public RiskGovernor(int maxConsecutiveLosses) {
        if (maxConsecutiveLosses < 1) {
            throw new IllegalArgumentException("maxConsecutiveLosses must be at least 1");
        }
        this.maxConsecutiveLosses = maxConsecutiveLosses;
    }

    /**
     * Folds one realised PnL into the counters. A loss extends the streak, anything
     * else (including break-even) resets it.
     */
    public void recordSettlement(BigDecimal pnlValue) {
        BigDecimal pnl = MoneyUtils.scale(pnlValue);
        cumulativePnl = MoneyUtils.add(cumulativePnl, pnl);
        if (pnl.signum() < 0) {
            consecutiveLosses++;
        } else {
            consecutiveLosses = 0;
        }
        log.debug("[RiskGovernor] Settlement recorded. pnl={} consecutiveLosses={} cumulativePnl={}",
                  pnl, consecutiveLosses, cumulativePnl);
    }

    /**
     * Gate consulted before an autopilot cycle opens anything.
     *
     * @param balance        balance of the account the cycle trades against
     * @param maxDrawdownPct drawdown limit in whole percent
     */
    public GovernorDecision evaluate(BigDecimal balance, double maxDrawdownPct) {
        GovernorDecision decision = check(balance, maxDrawdownPct);
        if (decision.isHalt()) {
            autopilotEnabled = false;
            alert = alertMessage(decision, balance, maxDrawdownPct);
            log.warn("[RiskGovernor] Autopilot halted. decision={} consecutiveLosses={} cumulativePnl={} balance={}",
                     decision, consecutiveLosses, cumulativePnl, balance);
        }
        return decision;
    }

    /**
     * Drawdown of the session as a percentage of {@code balance}; negative when losing.
     * Returns zero for a non-positive balance.
     */
    public BigDecimal drawdownPct(BigDecimal balance) {
        if (!MoneyUtils.isPositive(balance)) {
            return BigDecimal.ZERO;
        }
        return cumulativePnl.multiply(MoneyUtils.HUNDRED).divide(balance, MathContext.DECIMAL64);
    }

    public void setAutopilotEnabled(boolean enabled) {
        this.autopilotEnabled = enabled;
    }

    public boolean isAutopilotEnabled() {
        return autopilotEnabled;
    }

    /** Clears the alert and the loss streak. Cumulative PnL is kept. */
    public void dismissAlert() {
        alert = null;
        consecutiveLosses = 0;
    }

    public SafetyState snapshot() {
        return new SafetyState(consecutiveLosses, cumulativePnl, autopilotEnabled, alert);
    }

    private GovernorDecision check(BigDecimal balance, double maxDrawdownPct) {
        if (consecutiveLosses >= maxConsecutiveLosses) {
            return GovernorDecision.HALT_CONSECUTIVE_LOSSES;
        }
        if (!MoneyUtils.isPositive(balance)) {
            // nothing to measure against: any realised loss is a breach
            return cumulativePnl.signum() < 0 ? GovernorDecision.HALT_DRAWDOWN : GovernorDecision.ALLOW;
        }
        BigDecimal limit = BigDecimal.valueOf(-maxDrawdownPct);
        return drawdownPct(balance).compareTo(limit) <= 0 ? GovernorDecision.HALT_DRAWDOWN : GovernorDecision.ALLOW;
    }

    private String alertMessage(GovernorDecision decision, BigDecimal balance, double maxDrawdownPct) {
        return switch (decision) {
            case HALT_CONSECUTIVE_LOSSES -> "SAFETY TRIGGERED: max consecutive losses reached (" + consecutiveLosses + ")";
            case HALT_DRAWDOWN -> String.format("SAFETY TRIGGERED: drawdown limit reached (%.2f%% against a -%.2f%% limit)",
                drawdownPct(balance).doubleValue(), maxDrawdownPct);
            case ALLOW -> null;
        };
    }
}
