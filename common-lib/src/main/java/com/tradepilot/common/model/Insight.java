package com.tradepilot.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Strategic recommendation for one pair.
 *
 * <p>Always usable: when the advisory service cannot answer in time the insight is
 * synthesised locally and tagged {@link Provenance#FALLBACK}.
 *
 * @param pair       pair symbol, e.g. {@code BTC/USDT}
 * @param confidence 0–100
 * @param action     BUY / SELL / HOLD
 * @param reasoning  free-form explanation
 * @param keyLevels  support / resistance levels
 * @param timestamp  creation time
 * @param provenance EXTERNAL or FALLBACK
 */
public record Insight(
    @JsonProperty("pair")       String pair,
    @JsonProperty("confidence") int confidence,
    @JsonProperty("action")     SignalAction action,
    @JsonProperty("reasoning")  String reasoning,
    @JsonProperty("keyLevels")  KeyLevels keyLevels,
    @JsonProperty("timestamp")  Instant timestamp,
    @JsonProperty("provenance") Provenance provenance
) {}
