package com.incidentcommander.analysis.agent;

import java.util.Map;

/**
 * Raw agent output before validation. {@code confidence} is boxed because a provider may
 * omit it; the harness rejects such a report instead of guessing a value.
 */
public record AgentReport(
    Double confidence,
    String recommendedAction,
    String summary,
    Map<String, Object> evidence
) {
    public static AgentReport of(double confidence, String recommendedAction, String summary,
                                 Map<String, Object> evidence) {
        return new AgentReport(confidence, recommendedAction, summary, evidence);
    }
}
