package com.incidentcommander.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

public record DispatchFailure(
    @JsonProperty("role")     AgentRole role,
    @JsonProperty("round")    int round,
    @JsonProperty("kind")     FailureKind kind,
    @JsonProperty("detail")   String detail,
    @JsonProperty("failedAt") Instant failedAt
) {}
