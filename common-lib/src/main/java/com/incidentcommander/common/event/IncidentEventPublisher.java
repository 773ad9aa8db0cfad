package com.incidentcommander.common.event;

import reactor.core.publisher.Flux;

/**
 * Publish-only telemetry seam between the core and any dashboard or notifier.
 *
 * <p>Current implementation: {@code SinkIncidentEventPublisher}, a hot multicast stream.
 */
public interface IncidentEventPublisher {

    /**
     * Publish one ledger event. Implementations MUST NOT block and MUST NOT throw because a
     * subscriber is slow or absent; dropping an event for a slow subscriber is acceptable.
     *
     * @param event an event that has already been appended to the ledger
     */
    void publish(IncidentEvent event);

    /** Hot stream of events published after subscription. */
    Flux<IncidentEvent> stream();
}
