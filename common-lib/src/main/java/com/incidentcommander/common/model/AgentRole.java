package com.incidentcommander.common.model;

/**
 * Fixed analysis roles. Each role is backed by exactly one agent and carries a static
 * trust weight per {@link IncidentCategory}.
 */
public enum AgentRole {
    DETECTION,
    DIAGNOSIS,
    PREDICTION,
    RESOLUTION,
    COMMUNICATION
}
