package com.tradepilot.trade.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Body of every 4xx answer.
 */
public record ErrorResponse(
    @JsonProperty("error")   String error,
    @JsonProperty("message") String message
) {}
