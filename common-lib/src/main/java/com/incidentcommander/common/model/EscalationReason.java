package com.incidentcommander.common.model;

public enum EscalationReason {
    /** Weighted confidence stayed below the category threshold. */
    BELOW_THRESHOLD,
    /** Confident enough, but the winning action is not auto-executable by policy. */
    ACTION_REQUIRES_APPROVAL,
    /** Too few agents, or too little static weight, responded. */
    INSUFFICIENT_QUORUM,
    /** The autonomous remediation failed or timed out. */
    ACTION_FAILED,
    /** The overall incident budget elapsed before a terminal outcome. */
    INCIDENT_TIMEOUT
}
