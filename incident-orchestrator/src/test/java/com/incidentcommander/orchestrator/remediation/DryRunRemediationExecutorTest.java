package com.incidentcommander.orchestrator.remediation;

import com.incidentcommander.common.model.AlertPayload;
import com.incidentcommander.common.model.Incident;
import com.incidentcommander.common.model.IncidentCategory;
import com.incidentcommander.common.model.Severity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Instant;
import java.util.Map;
import java.util.Set;

class DryRunRemediationExecutorTest {

    private final Incident incident = Incident.open(
        new AlertPayload(IncidentCategory.LATENCY_DEGRADATION, Severity.MEDIUM, "slow", Map.of()), Instant.now());

    @Test
    @DisplayName("unlisted action succeeds without side effects")
    void succeeds() {
        StepVerifier.create(new DryRunRemediationExecutor(Set.of()).execute(incident, "drain_traffic"))
            .expectNextMatches(r -> r.success() && r.action().equals("drain_traffic"))
            .verifyComplete();
    }

    @Test
    @DisplayName("action listed as failing reports failure")
    void configuredFailure() {
        StepVerifier.create(new DryRunRemediationExecutor(Set.of("drain_traffic")).execute(incident, "drain_traffic"))
            .expectNextMatches(r -> !r.success())
            .verifyComplete();
    }
}
