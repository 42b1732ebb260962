package com.tradepilot.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Output of {@link com.tradepilot.common.analysis.TrendAnalyzer}.
 *
 * @param action     BUY / SELL / HOLD
 * @param confidence 0–100, monotone in momentum magnitude
 * @param reason     short human-readable explanation
 */
public record TrendSignal(
    @JsonProperty("action")     SignalAction action,
    @JsonProperty("confidence") int confidence,
    @JsonProperty("reason")     String reason
) {}
