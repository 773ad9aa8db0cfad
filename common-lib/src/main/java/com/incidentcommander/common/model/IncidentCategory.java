package com.incidentcommander.common.model;

/**
 * Incident categories recognised by the consensus core. Each category carries its own
 * agent weight table, autonomous threshold and auto-executable action allow-list.
 */
public enum IncidentCategory {
    INFRASTRUCTURE_CASCADE,
    RESOURCE_EXHAUSTION,
    SECURITY,
    LATENCY_DEGRADATION
}
