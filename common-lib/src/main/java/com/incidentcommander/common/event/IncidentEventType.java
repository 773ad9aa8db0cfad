package com.incidentcommander.common.event;

/**
 * Every kind of entry the incident ledger records; the same events feed the telemetry stream.
 */
public enum IncidentEventType {
    INCIDENT_OPENED,
    STATE_CHANGED,
    ROUND_STARTED,
    FINDING_RECORDED,
    DISPATCH_FAILED,
    CONSENSUS_REACHED,
    QUORUM_FAILED,
    ACTION_EXECUTED,
    ACTION_FAILED,
    ACTION_ROLLED_BACK,
    ROLLBACK_FAILED,
    ESCALATED,
    RESOLVED,
    ABANDONED
}
