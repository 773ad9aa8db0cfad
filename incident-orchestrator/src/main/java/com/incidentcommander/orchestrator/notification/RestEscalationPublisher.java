package com.incidentcommander.orchestrator.notification;

import com.incidentcommander.common.event.IncidentEvent;
import com.incidentcommander.common.event.IncidentEventPublisher;
import com.incidentcommander.common.event.IncidentEventType;
import com.incidentcommander.common.model.EscalationRecord;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.Disposable;

/**
 * Forwards every escalation record to notification-service via HTTP POST (fire-and-forget).
 * A failed delivery is logged and dropped; the ledger stays the source of truth.
 */
@Component
@ConditionalOnProperty(name = "notification.escalations.enabled", havingValue = "true", matchIfMissing = true)
public class RestEscalationPublisher {

    private static final Logger log = LoggerFactory.getLogger(RestEscalationPublisher.class);

    private final IncidentEventPublisher eventPublisher;
    private final WebClient notificationClient;
    private Disposable subscription;

    public RestEscalationPublisher(IncidentEventPublisher eventPublisher, WebClient notificationClient) {
        this.eventPublisher = eventPublisher;
        this.notificationClient = notificationClient;
    }

    @PostConstruct
    public void start() {
        subscription = eventPublisher.stream()
            .filter(e -> e.type() == IncidentEventType.ESCALATED || e.type() == IncidentEventType.ABANDONED)
            .filter(e -> e.escalation() != null)
            .subscribe(this::publish,
                       err -> log.error("[Escalation] event stream terminated", err));
        log.info("[Escalation] forwarding escalations to notification-service");
    }

    void publish(IncidentEvent event) {
        EscalationRecord record = event.escalation();
        notificationClient.post()
            .uri("/api/v1/notify/escalation")
            .header("X-Trace-Id", event.incidentId())
            .bodyValue(record)
            .retrieve()
            .toBodilessEntity()
            .subscribe(
                r   -> log.info("[Escalation] published incident={} reason={} status={}",
                                event.incidentId(), record.reason(), r.getStatusCode()),
                err -> log.warn("[Escalation] publish failed (non-critical). incident={}",
                                event.incidentId(), err)
            );
    }

    @PreDestroy
    public void stop() {
        if (subscription != null) {
            subscription.dispose();
        }
    }
}
