package com.tradepilot.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Summary grade over a set of closed trades.
 *
 * @param rating                letter grade (S, A, B, C or F)
 * @param efficiencyScore       0–100
 * @param critique              one-paragraph assessment
 * @param recommendedAdjustment suggested change to the operating parameters
 * @param provenance            EXTERNAL when summarised by the advisory service
 */
public record PerformanceAudit(
    @JsonProperty("rating")                String rating,
    @JsonProperty("efficiencyScore")       int efficiencyScore,
    @JsonProperty("critique")              String critique,
    @JsonProperty("recommendedAdjustment") String recommendedAdjustment,
    @JsonProperty("provenance")            Provenance provenance
) {}
