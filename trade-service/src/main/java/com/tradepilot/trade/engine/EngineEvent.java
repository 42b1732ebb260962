package com.tradepilot.trade.engine;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Operator-facing event, shown in the activity log.
 */
public record EngineEvent(
    @JsonProperty("id")        long id,
    @JsonProperty("timestamp") Instant timestamp,
    @JsonProperty("type")      EventType type,
    @JsonProperty("message")   String message
) {}
