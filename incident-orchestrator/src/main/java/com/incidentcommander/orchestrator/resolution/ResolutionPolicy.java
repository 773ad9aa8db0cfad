package com.incidentcommander.orchestrator.resolution;

import com.incidentcommander.common.consensus.ConsensusDecision;
import com.incidentcommander.common.model.EscalationReason;
import com.incidentcommander.orchestrator.policy.CategoryPolicy;
import com.incidentcommander.orchestrator.policy.ResolutionSettings;

/**
 * The {@code DECIDING} step as a pure function.
 *
 * <pre>
 *   eligible and auto-executable and not approval-gated → EXECUTE
 *   eligible otherwise                                   → ESCALATE (ACTION_REQUIRES_APPROVAL)
 *   below threshold, within retry margin, rounds left    → RETRY_ROUND
 *   below threshold otherwise                            → ESCALATE (BELOW_THRESHOLD)
 * </pre>
 */
public final class ResolutionPolicy {

    private static final double EPSILON = 1e-9;

    private ResolutionPolicy() {}

    public static ResolutionVerdict decide(ConsensusDecision decision, CategoryPolicy policy,
                                           ResolutionSettings settings, int round, boolean budgetLeft) {
        String action = decision.winningAction();
        if (decision.autonomousEligible()) {
            if (settings.requiresApproval(action)) {
                return ResolutionVerdict.escalate(EscalationReason.ACTION_REQUIRES_APPROVAL,
                    "action " + action + " requires human approval");
            }
            if (!policy.isAutoExecutable(action)) {
                return ResolutionVerdict.escalate(EscalationReason.ACTION_REQUIRES_APPROVAL,
                    "action " + action + " is not auto-executable for " + policy.category());
            }
            return ResolutionVerdict.execute(action);
        }

        double gap = decision.threshold() - decision.weightedConfidence();
        String confidence = String.format("weighted confidence %.3f below threshold %.2f",
                                          decision.weightedConfidence(), decision.threshold());
        if (gap <= settings.retryMargin() + EPSILON && round < settings.maxRounds() && budgetLeft) {
            return ResolutionVerdict.retryRound(confidence + " within margin " + settings.retryMargin()
                                                + ", running round " + (round + 1));
        }
        return ResolutionVerdict.escalate(EscalationReason.BELOW_THRESHOLD, confidence);
    }
}
