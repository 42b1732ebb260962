package com.tradepilot.trade.persistence;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Signed-in operator, persisted as given and never interpreted by the engine.
 */
public record OperatorSession(
    @JsonProperty("id")    String id,
    @JsonProperty("name")  String name,
    @JsonProperty("email") String email,
    @JsonProperty("role")  String role
) {}
