package com.incidentcommander.analysis.service;

import com.incidentcommander.common.model.AgentRole;
import com.incidentcommander.common.model.DispatchFailure;
import com.incidentcommander.common.model.DispatchOutcome;
import com.incidentcommander.common.model.Finding;

import java.util.List;
import java.util.Objects;

/**
 * Everything one round produced.
 *
 * @param skippedRoles roles not dispatched because their breaker was OPEN
 */
public record RoundResult(
    int round,
    List<DispatchOutcome> outcomes,
    List<AgentRole> skippedRoles
) {
    public RoundResult {
        outcomes = List.copyOf(outcomes);
        skippedRoles = List.copyOf(skippedRoles);
    }

    public List<Finding> findings() {
        return outcomes.stream().map(DispatchOutcome::finding).filter(Objects::nonNull).toList();
    }

    public List<DispatchFailure> failures() {
        return outcomes.stream().map(DispatchOutcome::failure).filter(Objects::nonNull).toList();
    }
}
