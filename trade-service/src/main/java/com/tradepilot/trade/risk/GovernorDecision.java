package com.tradepilot.trade.risk;

/**
 * Outcome of the pre-entry safety gate.
 */
public enum GovernorDecision {
    ALLOW,
    HALT_CONSECUTIVE_LOSSES,
    HALT_DRAWDOWN;

    public boolean isHalt() {
        return this != ALLOW;
    }
}
