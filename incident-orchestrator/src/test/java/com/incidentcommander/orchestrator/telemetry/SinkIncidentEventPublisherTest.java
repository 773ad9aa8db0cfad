package com.incidentcommander.orchestrator.telemetry;

import com.incidentcommander.common.event.IncidentEvent;
import com.incidentcommander.common.event.IncidentEventType;
import com.incidentcommander.common.model.IncidentState;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.time.Instant;

class SinkIncidentEventPublisherTest {

    private static IncidentEvent event(long version) {
        return IncidentEvent.of(IncidentEventType.STATE_CHANGED, "INC-1", 1, IncidentState.ANALYZING,
                                Instant.parse("2024-01-01T00:00:00Z")).withVersion(version);
    }

    @Test
    @DisplayName("publishing without subscribers neither blocks nor fails")
    void noSubscribers() {
        SinkIncidentEventPublisher publisher = new SinkIncidentEventPublisher();
        publisher.publish(event(1));
        publisher.publish(event(2));
    }

    @Test
    @DisplayName("subscribers receive events published after they join")
    void liveDelivery() {
        SinkIncidentEventPublisher publisher = new SinkIncidentEventPublisher();
        publisher.publish(event(1));

        StepVerifier.create(publisher.stream().take(2))
            .then(() -> {
                publisher.publish(event(2));
                publisher.publish(event(3));
            })
            .expectNextMatches(e -> e.version() == 2)
            .expectNextMatches(e -> e.version() == 3)
            .expectComplete()
            .verify(Duration.ofSeconds(5));
    }

    @Test
    @DisplayName("a subscriber without demand misses events instead of stalling the publisher")
    void slowSubscriberDrops() {
        SinkIncidentEventPublisher publisher = new SinkIncidentEventPublisher();

        StepVerifier.create(publisher.stream(), 0)
            .then(() -> publisher.publish(event(1)))
            .thenRequest(1)
            .then(() -> publisher.publish(event(2)))
            .expectNextMatches(e -> e.version() == 2)
            .thenCancel()
            .verify(Duration.ofSeconds(5));
    }
}
