package com.tradepilot.trade.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.tradepilot.common.model.TradeSide;

import java.math.BigDecimal;

/**
 * Request body for POST /api/v1/engine/trades. {@code price} is optional; the latest
 * quote is used when it is absent.
 */
public record OpenTradeRequest(
    @JsonProperty("pair")   String pair,
    @JsonProperty("side")   TradeSide side,
    @JsonProperty("amount") BigDecimal amount,
    @JsonProperty("price")  BigDecimal price
) {}
