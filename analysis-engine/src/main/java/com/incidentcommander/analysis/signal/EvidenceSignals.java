package com.incidentcommander.analysis.signal;

import com.incidentcommander.common.model.IncidentCategory;

import java.util.Map;

/**
 * Pure accessors over the alert evidence map. Missing or non-numeric values read as
 * {@link Double#NaN}, and every comparison against NaN is false.
 */
public final class EvidenceSignals {

    public static final String ERROR_RATE          = "errorRate";
    public static final String LATENCY_P99_MS      = "latencyP99Ms";
    public static final String CPU_UTILIZATION     = "cpuUtilization";
    public static final String MEMORY_UTILIZATION  = "memoryUtilization";
    public static final String FAILED_LOGINS       = "failedLogins";
    public static final String DEPENDENCY_FAILURES = "dependencyFailures";
    public static final String ERROR_RATE_TREND    = "errorRateTrend";
    public static final String RESTART_COUNT       = "restartCount";
    public static final String AFFECTED_USERS      = "affectedUsers";

    // ── anomaly thresholds ─────────────────────────────────────────────────
    public static final double HIGH_ERROR_RATE      = 0.05;
    public static final double HIGH_LATENCY_MS      = 1000;
    public static final double HIGH_CPU             = 0.85;
    public static final double HIGH_MEMORY          = 0.85;
    public static final double SUSPICIOUS_LOGINS    = 100;
    public static final double CASCADE_DEPENDENCIES = 3;

    private EvidenceSignals() {}

    public static double number(Map<String, Object> evidence, String key) {
        if (evidence == null) return Double.NaN;
        Object value = evidence.get(key);
        if (value instanceof Number n) return n.doubleValue();
        if (value instanceof String s) {
            try {
                return Double.parseDouble(s.trim());
            } catch (NumberFormatException e) {
                return Double.NaN;
            }
        }
        return Double.NaN;
    }

    public static boolean above(Map<String, Object> evidence, String key, double threshold) {
        return number(evidence, key) > threshold;
    }

    /** Number of well-known signals currently past their anomaly threshold. */
    public static int anomalyCount(Map<String, Object> evidence) {
        int count = 0;
        if (above(evidence, ERROR_RATE, HIGH_ERROR_RATE))                    count++;
        if (above(evidence, LATENCY_P99_MS, HIGH_LATENCY_MS))                count++;
        if (above(evidence, CPU_UTILIZATION, HIGH_CPU))                      count++;
        if (above(evidence, MEMORY_UTILIZATION, HIGH_MEMORY))                count++;
        if (above(evidence, FAILED_LOGINS, SUSPICIOUS_LOGINS))               count++;
        if (number(evidence, DEPENDENCY_FAILURES) >= CASCADE_DEPENDENCIES)   count++;
        return count;
    }

    /** True when none of the well-known keys is present. */
    public static boolean isBlind(Map<String, Object> evidence) {
        for (String key : new String[]{ERROR_RATE, LATENCY_P99_MS, CPU_UTILIZATION, MEMORY_UTILIZATION,
                                       FAILED_LOGINS, DEPENDENCY_FAILURES, ERROR_RATE_TREND,
                                       RESTART_COUNT, AFFECTED_USERS}) {
            if (!Double.isNaN(number(evidence, key))) return false;
        }
        return true;
    }

    /** First-line remediation for a category when nothing more specific applies. */
    public static String playbookAction(IncidentCategory category) {
        return switch (category) {
            case INFRASTRUCTURE_CASCADE -> "enable_circuit_breaker";
            case RESOURCE_EXHAUSTION    -> "scale_service";
            case SECURITY               -> "isolate_host";
            case LATENCY_DEGRADATION    -> "drain_traffic";
        };
    }

    public static double clamp(double v, double lo, double hi) {
        return Math.max(lo, Math.min(hi, v));
    }
}
