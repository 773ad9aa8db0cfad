package com.incidentcommander.common.model;

/** Human triage priority; P1 is paged first. */
public enum IncidentPriority {
    P1,
    P2,
    P3,
    P4
}
