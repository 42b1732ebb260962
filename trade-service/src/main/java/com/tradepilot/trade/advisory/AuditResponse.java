package com.tradepilot.trade.advisory;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Performance audit as returned by the advisory service, before validation.
 */
public record AuditResponse(
    @JsonProperty("rating")                String rating,
    @JsonProperty("efficiencyScore")       Double efficiencyScore,
    @JsonProperty("critique")              String critique,
    @JsonProperty("recommendedAdjustment") String recommendedAdjustment
) {}
