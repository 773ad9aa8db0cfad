package com.incidentcommander.common.breaker;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.incidentcommander.common.model.AgentRole;

import java.time.Instant;

/** Point-in-time view of one agent's breaker, for health reporting. */
public record CircuitBreakerSnapshot(
    @JsonProperty("role")                AgentRole role,
    @JsonProperty("state")               CircuitState state,
    @JsonProperty("consecutiveFailures") int consecutiveFailures,
    @JsonProperty("lastTransitionAt")    Instant lastTransitionAt,
    @JsonProperty("totalCalls")          long totalCalls,
    @JsonProperty("successes")           long successes,
    @JsonProperty("failures")            long failures,
    @JsonProperty("rejected")            long rejected
) {
    public boolean healthy() {
        return state != CircuitState.OPEN;
    }

    public double failureRate() {
        return totalCalls == 0 ? 0.0 : (double) failures / totalCalls;
    }
}
