package com.incidentcommander.orchestrator.policy;

import com.incidentcommander.common.consensus.ConsensusPolicy;
import com.incidentcommander.common.model.AgentDescriptor;
import com.incidentcommander.common.model.AgentRole;
import com.incidentcommander.common.model.IncidentCategory;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Resolved, immutable policy for one incident category.
 *
 * @param roster every role with its static weight for this category, including unused (0.0) roles
 */
public record CategoryPolicy(
    IncidentCategory category,
    List<AgentDescriptor> roster,
    ConsensusPolicy consensus,
    Set<String> autoExecutableActions
) {
    public CategoryPolicy {
        roster = List.copyOf(roster);
        autoExecutableActions = Set.copyOf(autoExecutableActions);
    }

    public Map<AgentRole, Double> staticWeights() {
        Map<AgentRole, Double> weights = new EnumMap<>(AgentRole.class);
        roster.forEach(d -> weights.put(d.role(), d.weight()));
        return weights;
    }

    public boolean isAutoExecutable(String action) {
        return autoExecutableActions.contains(action);
    }
}
