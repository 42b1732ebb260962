package com.tradepilot.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Latest quote for a pair as observed by the market feed (live or synthetic).
 */
public record PriceQuote(
    @JsonProperty("pair")         String pair,
    @JsonProperty("price")        BigDecimal price,
    @JsonProperty("pctChange24h") double pctChange24h,
    @JsonProperty("timestamp")    Instant timestamp
) {
    public PriceQuote withTimestamp(Instant timestamp) {
        return new PriceQuote(pair, price, pctChange24h, timestamp);
    }
}
