package com.incidentcommander.orchestrator.remediation;

import com.fasterxml.jackson.annotation.JsonProperty;

public record RemediationResult(
    @JsonProperty("action")  String action,
    @JsonProperty("success") boolean success,
    @JsonProperty("detail")  String detail
) {
    public static RemediationResult succeeded(String action, String detail) {
        return new RemediationResult(action, true, detail);
    }

    public static RemediationResult failed(String action, String detail) {
        return new RemediationResult(action, false, detail);
    }
}
