package com.incidentcommander.common.model;

/**
 * Ordered incident severity. Declaration order is significant: {@code LOW < MEDIUM < HIGH < CRITICAL}.
 */
public enum Severity {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    /** Triage priority used on escalation records. */
    public IncidentPriority priority() {
        return switch (this) {
            case CRITICAL -> IncidentPriority.P1;
            case HIGH     -> IncidentPriority.P2;
            case MEDIUM   -> IncidentPriority.P3;
            case LOW      -> IncidentPriority.P4;
        };
    }

    public boolean isAtLeast(Severity other) {
        return compareTo(other) >= 0;
    }
}
