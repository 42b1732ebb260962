package com.tradepilot.trade.advisory;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Insight as returned by the advisory service, before validation. Every field may be
 * missing or out of range.
 */
public record AdvisoryResponse(
    @JsonProperty("pair")       String pair,
    @JsonProperty("confidence") Double confidence,
    @JsonProperty("action")     String action,
    @JsonProperty("reasoning")  String reasoning,
    @JsonProperty("keyLevels")  Levels keyLevels
) {

    public record Levels(
        @JsonProperty("support")    Double support,
        @JsonProperty("resistance") Double resistance
    ) {}
}
