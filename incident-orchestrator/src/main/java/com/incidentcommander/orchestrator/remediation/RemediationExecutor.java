package com.incidentcommander.orchestrator.remediation;

import com.incidentcommander.common.model.Incident;
import reactor.core.publisher.Mono;

/**
 * Applies an automated remediation. Called behind the execution timeout; a failure or an
 * error signal is escalated and never retried.
 */
public interface RemediationExecutor {

    Mono<RemediationResult> execute(Incident incident, String action);

    /**
     * Reverts a remediation that reported failure, before the incident is escalated. Called
     * behind the same timeout; the outcome is recorded but never changes the escalation.
     */
    default Mono<RemediationResult> rollback(Incident incident, String action) {
        return Mono.just(RemediationResult.failed(action, "rollback not supported by this executor"));
    }
}
