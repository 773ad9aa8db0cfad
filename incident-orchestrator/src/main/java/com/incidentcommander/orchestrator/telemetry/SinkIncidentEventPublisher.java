package com.incidentcommander.orchestrator.telemetry;

import com.incidentcommander.common.event.IncidentEvent;
import com.incidentcommander.common.event.IncidentEventPublisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

/**
 * Hot, best-effort telemetry stream. A subscriber without demand misses events rather than
 * slowing the core down; with no subscriber at all, events are simply not delivered.
 */
@Component
public class SinkIncidentEventPublisher implements IncidentEventPublisher {

    private static final Logger log = LoggerFactory.getLogger(SinkIncidentEventPublisher.class);

    private final Sinks.Many<IncidentEvent> sink = Sinks.many().multicast().directBestEffort();

    @Override
    public void publish(IncidentEvent event) {
        Sinks.EmitResult result;
        // the sink requires serialized emission; appends for different incidents race here
        synchronized (sink) {
            result = sink.tryEmitNext(event);
        }
        if (result.isFailure() && result != Sinks.EmitResult.FAIL_ZERO_SUBSCRIBER) {
            log.debug("[Telemetry] event dropped incident={} v{} result={}",
                      event.incidentId(), event.version(), result);
        }
    }

    @Override
    public Flux<IncidentEvent> stream() {
        return sink.asFlux();
    }
}
