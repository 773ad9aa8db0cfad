package com.incidentcommander.orchestrator.remediation;

import com.incidentcommander.common.model.Incident;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.util.Set;

/**
 * Logs the remediation instead of applying it. Actions listed as failing report failure,
 * which exercises the rollback and escalation path without a healing endpoint. Rollbacks
 * always succeed.
 */
public class DryRunRemediationExecutor implements RemediationExecutor {

    private static final Logger log = LoggerFactory.getLogger(DryRunRemediationExecutor.class);

    private final Set<String> failingActions;

    public DryRunRemediationExecutor(Set<String> failingActions) {
        this.failingActions = Set.copyOf(failingActions);
    }

    @Override
    public Mono<RemediationResult> execute(Incident incident, String action) {
        return Mono.fromSupplier(() -> {
            if (failingActions.contains(action)) {
                log.warn("[Remediation] dry-run FAILED action={} incident={} category={}",
                         action, incident.id(), incident.category());
                return RemediationResult.failed(action, "dry-run: configured to fail");
            }
            log.info("[Remediation] dry-run applied action={} incident={} category={}",
                     action, incident.id(), incident.category());
            return RemediationResult.succeeded(action, "dry-run: no change applied");
        });
    }

    @Override
    public Mono<RemediationResult> rollback(Incident incident, String action) {
        return Mono.fromSupplier(() -> {
            log.info("[Remediation] dry-run rollback action={} incident={}", action, incident.id());
            return RemediationResult.succeeded(action, "dry-run: nothing to revert");
        });
    }
}
