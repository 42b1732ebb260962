package com.tradepilot.trade.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record AutopilotRequest(
    @JsonProperty("enabled") boolean enabled
) {}
