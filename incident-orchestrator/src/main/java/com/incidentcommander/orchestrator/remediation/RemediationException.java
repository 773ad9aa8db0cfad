package com.incidentcommander.orchestrator.remediation;

public class RemediationException extends RuntimeException {

    private final String action;

    public RemediationException(String action, String message, Throwable cause) {
        super("[" + action + "] " + message, cause);
        this.action = action;
    }

    public String getAction() {
        return action;
    }
}
