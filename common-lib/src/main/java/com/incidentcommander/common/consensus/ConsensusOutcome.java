package com.incidentcommander.common.consensus;

import com.incidentcommander.common.model.AgentRole;

import java.util.List;

/**
 * Either a {@link ConsensusDecision} or an insufficient-quorum verdict. Never both.
 *
 * @param respondingStaticWeight combined static weight of the responders, before renormalization
 */
public record ConsensusOutcome(
    ConsensusDecision decision,
    String quorumFailure,
    List<AgentRole> responders,
    double respondingStaticWeight
) {
    public static ConsensusOutcome reached(ConsensusDecision decision, double respondingStaticWeight) {
        return new ConsensusOutcome(decision, null, decision.contributingRoles(), respondingStaticWeight);
    }

    public static ConsensusOutcome insufficientQuorum(String reason, List<AgentRole> responders,
                                                      double respondingStaticWeight) {
        return new ConsensusOutcome(null, reason, List.copyOf(responders), respondingStaticWeight);
    }

    public boolean isReached() {
        return decision != null;
    }
}
