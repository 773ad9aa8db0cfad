package com.incidentcommander.orchestrator.controller;

import com.incidentcommander.common.event.IncidentEvent;
import com.incidentcommander.common.event.IncidentEventPublisher;
import com.incidentcommander.common.ledger.IncidentSnapshot;
import com.incidentcommander.common.model.AlertPayload;
import com.incidentcommander.orchestrator.service.IncidentOrchestratorService;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/incidents")
public class IncidentController {

    private final IncidentOrchestratorService orchestratorService;
    private final IncidentEventPublisher eventPublisher;

    public IncidentController(IncidentOrchestratorService orchestratorService,
                              IncidentEventPublisher eventPublisher) {
        this.orchestratorService = orchestratorService;
        this.eventPublisher = eventPublisher;
    }

    @PostMapping
    public Mono<ResponseEntity<Map<String, String>>> submit(@RequestBody AlertPayload alert) {
        return Mono.fromCallable(() -> orchestratorService.submit(alert))
            .map(id -> ResponseEntity.status(HttpStatus.ACCEPTED).body(Map.of("incidentId", id)))
            .onErrorMap(IllegalArgumentException.class,
                        e -> new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage(), e));
    }

    @GetMapping
    public List<IncidentSnapshot> list() {
        return orchestratorService.snapshots();
    }

    @GetMapping("/{incidentId}")
    public IncidentSnapshot get(@PathVariable String incidentId) {
        return orchestratorService.snapshot(incidentId)
            .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "unknown incident " + incidentId));
    }

    @GetMapping("/{incidentId}/events")
    public List<IncidentEvent> events(@PathVariable String incidentId) {
        List<IncidentEvent> history = orchestratorService.events(incidentId);
        if (history.isEmpty()) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "unknown incident " + incidentId);
        }
        return history;
    }

    /** Live ledger events of all incidents; subscribers only see events appended after they join. */
    @GetMapping(value = "/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<IncidentEvent> stream() {
        return eventPublisher.stream();
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }
}
