package com.incidentcommander.common.consensus;

import com.incidentcommander.common.model.AgentRole;
import com.incidentcommander.common.model.Finding;

import java.util.List;
import java.util.Map;

/**
 * Strategy contract for aggregating one round of findings into a single decision.
 *
 * <p>Implementations must be:
 * <ul>
 *   <li><b>Stateless</b>: no mutable state; safe to call concurrently</li>
 *   <li><b>Pure</b>: no logging, no reactive types, no clock</li>
 *   <li><b>Non-null</b>: always return a {@link ConsensusOutcome}</li>
 * </ul>
 *
 * <p>Current implementation: {@link WeightedConsensusStrategy}.
 */
public interface ConsensusEngine {

    /**
     * @param findings      validated findings of one round, from agents that were dispatched
     * @param staticWeights configured weight table of the incident's category (all roles)
     * @param policy        threshold and quorum rules for the category
     * @return a decision, or an insufficient-quorum outcome
     */
    ConsensusOutcome compute(List<Finding> findings, Map<AgentRole, Double> staticWeights,
                             ConsensusPolicy policy);
}
