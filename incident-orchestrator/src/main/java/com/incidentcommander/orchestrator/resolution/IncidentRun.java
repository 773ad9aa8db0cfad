package com.incidentcommander.orchestrator.resolution;

import com.incidentcommander.common.model.Incident;
import com.incidentcommander.orchestrator.policy.CategoryPolicy;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * One incident's fixed inputs while it is being resolved.
 *
 * @param deadline when the overall incident budget runs out
 */
public record IncidentRun(
    Incident incident,
    CategoryPolicy policy,
    Instant deadline
) {
    public String id() {
        return incident.id();
    }

    public Duration remaining(Clock clock) {
        Duration left = Duration.between(clock.instant(), deadline);
        return left.isNegative() ? Duration.ZERO : left;
    }
}
