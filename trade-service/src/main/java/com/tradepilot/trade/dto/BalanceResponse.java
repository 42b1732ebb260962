package com.tradepilot.trade.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.tradepilot.common.model.AccountMode;

import java.math.BigDecimal;

public record BalanceResponse(
    @JsonProperty("mode")    AccountMode mode,
    @JsonProperty("balance") BigDecimal balance
) {}
