package com.incidentcommander.common.exception;

import com.incidentcommander.common.model.AgentRole;

/**
 * Raised by an analysis agent when it cannot produce a report (provider error).
 * The harness converts it into a {@code PROVIDER_ERROR} dispatch failure and may retry.
 */
public class AgentException extends RuntimeException {

    private final AgentRole role;

    public AgentException(AgentRole role, String message) {
        super("[" + role + "] " + message);
        this.role = role;
    }

    public AgentException(AgentRole role, String message, Throwable cause) {
        super("[" + role + "] " + message, cause);
        this.role = role;
    }

    public AgentRole getRole() {
        return role;
    }
}
