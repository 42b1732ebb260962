package com.tradepilot.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;

/**
 * Read-only view of the risk governor's counters.
 *
 * @param consecutiveLosses losing settlements since the last win or operator dismissal
 * @param cumulativePnl     sum of every realised PnL reported this session
 * @param autopilotEnabled  whether autonomous entries are allowed
 * @param alert             active kill-switch message, or {@code null}
 */
public record SafetyState(
    @JsonProperty("consecutiveLosses") int consecutiveLosses,
    @JsonProperty("cumulativePnl")     BigDecimal cumulativePnl,
    @JsonProperty("autopilotEnabled")  boolean autopilotEnabled,
    @JsonProperty("alert")             String alert
) {
    public boolean hasAlert() {
        return alert != null;
    }
}
