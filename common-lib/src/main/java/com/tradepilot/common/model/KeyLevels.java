package com.tradepilot.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record KeyLevels(
    @JsonProperty("support")    double support,
    @JsonProperty("resistance") double resistance
) {}
