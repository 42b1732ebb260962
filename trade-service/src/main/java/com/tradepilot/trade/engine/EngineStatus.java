package com.tradepilot.trade.engine;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.tradepilot.common.model.AccountMode;

/**
 * Summary shown in the status bar.
 *
 * @param mode           account the operator is trading
 * @param running        periodic tasks are live
 * @param autopilot      autonomous entries enabled
 * @param feedLatencyMs  latency of the last market poll
 * @param syntheticFeed  the last poll came from the local random walk
 * @param openTrades     OPEN trades across both accounts
 */
public record EngineStatus(
    @JsonProperty("mode")          AccountMode mode,
    @JsonProperty("running")       boolean running,
    @JsonProperty("autopilot")     boolean autopilot,
    @JsonProperty("feedLatencyMs") long feedLatencyMs,
    @JsonProperty("syntheticFeed") boolean syntheticFeed,
    @JsonProperty("openTrades")    int openTrades
) {}
