package com.incidentcommander.orchestrator.remediation;

import com.incidentcommander.common.model.Incident;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Hands the remediation to an external healing endpoint:
 * {@code POST /api/v1/remediations {incidentId, category, action}}, and its rollback to
 * {@code POST /api/v1/remediations/rollback} with the same body.
 * A 2xx response is success; any error status or transport failure surfaces as
 * {@link RemediationException}.
 */
public class RestRemediationExecutor implements RemediationExecutor {

    private static final Logger log = LoggerFactory.getLogger(RestRemediationExecutor.class);

    private final WebClient remediationClient;

    public RestRemediationExecutor(WebClient remediationClient) {
        this.remediationClient = remediationClient;
    }

    @Override
    public Mono<RemediationResult> execute(Incident incident, String action) {
        return post("/api/v1/remediations", incident, action)
            .map(r -> RemediationResult.succeeded(action, "healing endpoint answered " + r.getStatusCode()))
            .doOnNext(r -> log.info("[Remediation] applied action={} incident={} detail={}",
                                    action, incident.id(), r.detail()));
    }

    @Override
    public Mono<RemediationResult> rollback(Incident incident, String action) {
        return post("/api/v1/remediations/rollback", incident, action)
            .map(r -> RemediationResult.succeeded(action, "rollback answered " + r.getStatusCode()))
            .doOnNext(r -> log.info("[Remediation] rolled back action={} incident={} detail={}",
                                    action, incident.id(), r.detail()));
    }

    private Mono<ResponseEntity<Void>> post(String path, Incident incident, String action) {
        return remediationClient.post()
            .uri(path)
            .header("X-Trace-Id", incident.id())
            .bodyValue(Map.of(
                "incidentId", incident.id(),
                "category",   incident.category().name(),
                "action",     action))
            .retrieve()
            .toBodilessEntity()
            .onErrorMap(e -> !(e instanceof RemediationException),
                        e -> new RemediationException(action, "healing endpoint call to " + path
                                                              + " failed: " + e.getMessage(), e));
    }
}
