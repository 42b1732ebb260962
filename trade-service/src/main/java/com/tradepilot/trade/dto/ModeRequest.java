package com.tradepilot.trade.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.tradepilot.common.model.AccountMode;

public record ModeRequest(
    @JsonProperty("mode") AccountMode mode
) {}
