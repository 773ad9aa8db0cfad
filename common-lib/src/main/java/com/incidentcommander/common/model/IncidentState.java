package com.incidentcommander.common.model;

/**
 * Lifecycle of one incident as driven by the resolution state machine.
 *
 * <pre>
 *   PENDING → ANALYZING → DECIDING → EXECUTING  → RESOLVED
 *                            │  ↑        │
 *                            │  └ (extra round)
 *                            └────→ ESCALATING → ESCALATED_OPEN
 *   any non-terminal state → ABANDONED (overall incident timeout)
 * </pre>
 */
public enum IncidentState {
    PENDING,
    ANALYZING,
    DECIDING,
    EXECUTING,
    ESCALATING,
    RESOLVED,
    ESCALATED_OPEN,
    ABANDONED;

    public boolean isTerminal() {
        return this == RESOLVED || this == ESCALATED_OPEN || this == ABANDONED;
    }
}
