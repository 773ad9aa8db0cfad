package com.incidentcommander.orchestrator.resolution;

import com.incidentcommander.common.model.EscalationReason;

/**
 * What the resolution state machine does after a round's decision.
 */
public record ResolutionVerdict(
    Kind kind,
    String action,
    EscalationReason reason,
    String summary
) {
    public enum Kind { EXECUTE, ESCALATE, RETRY_ROUND }

    public static ResolutionVerdict execute(String action) {
        return new ResolutionVerdict(Kind.EXECUTE, action, null, "auto-executing " + action);
    }

    public static ResolutionVerdict escalate(EscalationReason reason, String summary) {
        return new ResolutionVerdict(Kind.ESCALATE, null, reason, summary);
    }

    public static ResolutionVerdict retryRound(String summary) {
        return new ResolutionVerdict(Kind.RETRY_ROUND, null, null, summary);
    }
}
