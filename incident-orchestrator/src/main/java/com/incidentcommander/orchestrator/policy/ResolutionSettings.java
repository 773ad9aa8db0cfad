package com.incidentcommander.orchestrator.policy;

import java.time.Duration;
import java.util.Set;

/**
 * Category-independent knobs of the resolution state machine.
 *
 * @param maxRounds analysis rounds per incident, 1 or 2
 */
public record ResolutionSettings(
    int maxRounds,
    double retryMargin,
    Duration incidentTimeout,
    Duration executionTimeout,
    Set<String> requiresApprovalActions
) {
    public static final int MAX_ROUNDS = 2;

    public ResolutionSettings {
        if (maxRounds < 1 || maxRounds > MAX_ROUNDS) {
            throw new IllegalArgumentException("maxRounds must be in [1," + MAX_ROUNDS + "]: " + maxRounds);
        }
        if (retryMargin < 0.0) {
            throw new IllegalArgumentException("retryMargin must be >= 0: " + retryMargin);
        }
        requiresApprovalActions = Set.copyOf(requiresApprovalActions);
    }

    public boolean requiresApproval(String action) {
        return requiresApprovalActions.contains(action);
    }
}
