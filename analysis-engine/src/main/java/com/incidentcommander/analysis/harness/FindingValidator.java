package com.incidentcommander.analysis.harness;

import com.incidentcommander.analysis.agent.AgentReport;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Strict schema check at the harness boundary. A report that fails here becomes an
 * {@code INVALID_OUTPUT} failure; it is never coerced into a low-confidence finding.
 */
public final class FindingValidator {

    static final Pattern ACTION_TOKEN = Pattern.compile("[a-z][a-z0-9_]*");

    private FindingValidator() {}

    /** First schema violation, or empty when the report is well-formed. */
    public static Optional<String> violation(AgentReport report) {
        if (report == null) {
            return Optional.of("agent returned no report");
        }
        Double confidence = report.confidence();
        if (confidence == null) {
            return Optional.of("confidence missing");
        }
        if (confidence.isNaN() || confidence < 0.0 || confidence > 1.0) {
            return Optional.of("confidence out of range: " + confidence);
        }
        String action = report.recommendedAction();
        if (action == null || action.isBlank()) {
            return Optional.of("recommended action missing");
        }
        if (!ACTION_TOKEN.matcher(action).matches()) {
            return Optional.of("malformed action token: '" + action + "'");
        }
        return Optional.empty();
    }
}
