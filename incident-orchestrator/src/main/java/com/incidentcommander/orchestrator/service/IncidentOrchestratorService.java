package com.incidentcommander.orchestrator.service;

import com.incidentcommander.common.event.IncidentEvent;
import com.incidentcommander.common.ledger.IncidentSnapshot;
import com.incidentcommander.common.model.AlertPayload;
import com.incidentcommander.common.model.Incident;
import com.incidentcommander.common.model.IncidentState;
import com.incidentcommander.common.trace.TraceContextUtil;
import com.incidentcommander.orchestrator.ledger.LedgerWriter;
import com.incidentcommander.orchestrator.logger.IncidentFlowLogger;
import com.incidentcommander.orchestrator.policy.CategoryPolicyRegistry;
import com.incidentcommander.orchestrator.policy.ResolutionSettings;
import com.incidentcommander.orchestrator.resolution.IncidentRun;
import com.incidentcommander.orchestrator.resolution.ResolutionDriver;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.Disposable;
import reactor.core.Disposables;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Entry point for alerts. {@link #submit} opens the incident synchronously and returns its id;
 * resolution then runs in the background under the incident timeout.
 *
 * <p>Each incident runs in its own pipeline with the incident id as trace id. Incidents never
 * share mutable state apart from the ledger and the per-role circuit breakers.
 */
@Service
public class IncidentOrchestratorService {

    private static final Logger log = LoggerFactory.getLogger(IncidentOrchestratorService.class);

    private final ResolutionDriver driver;
    private final LedgerWriter ledger;
    private final CategoryPolicyRegistry policies;
    private final ResolutionSettings settings;
    private final IncidentFlowLogger flowLogger;
    private final Clock clock;

    private final ConcurrentMap<String, Disposable> active = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, Sinks.One<IncidentState>> completions = new ConcurrentHashMap<>();

    public IncidentOrchestratorService(ResolutionDriver driver,
                                       LedgerWriter ledger,
                                       CategoryPolicyRegistry policies,
                                       ResolutionSettings settings,
                                       IncidentFlowLogger flowLogger,
                                       Clock clock) {
        this.driver     = driver;
        this.ledger     = ledger;
        this.policies   = policies;
        this.settings   = settings;
        this.flowLogger = flowLogger;
        this.clock      = clock;
    }

    /**
     * Opens an incident for {@code alert} and starts resolving it.
     *
     * @return the new incident id
     * @throws IllegalArgumentException if the alert lacks a category or severity
     */
    public String submit(AlertPayload alert) {
        validate(alert);
        Incident incident = Incident.open(alert, clock.instant());
        String incidentId = incident.id();
        ledger.append(IncidentEvent.opened(incident));
        flowLogger.logWithTraceId(IncidentFlowLogger.ALERT_RECEIVED, incidentId,
            "category=" + incident.category() + " severity=" + incident.severity()
            + " priority=" + incident.priority());

        IncidentRun run = new IncidentRun(incident, policies.forCategory(incident.category()),
                                          incident.openedAt().plus(settings.incidentTimeout()));
        Sinks.One<IncidentState> done = Sinks.one();
        completions.put(incidentId, done);

        // the timer counts down to the incident deadline, not from subscription
        Mono<IncidentState> pipeline = Mono.defer(() -> driver.resolve(run)
                .timeout(run.remaining(clock), Mono.defer(() -> driver.abandon(run,
                    "no terminal state within " + settings.incidentTimeout().toMillis() + "ms"))))
            .onErrorResume(e -> {
                log.error("[Resolution] pipeline failed incident={}", incidentId, e);
                return driver.abandon(run, "resolution failed: " + e.getMessage());
            });

        Disposable.Swap handle = Disposables.swap();
        active.put(incidentId, handle);
        handle.update(TraceContextUtil.withTraceId(pipeline, incidentId)
            .subscribeOn(Schedulers.boundedElastic())
            .subscribe(
                state -> {
                    release(incidentId);
                    log.info("[Resolution] incident={} finished state={}", incidentId, state);
                    done.tryEmitValue(state);
                },
                err -> {
                    release(incidentId);
                    log.error("[Resolution] incident={} could not be closed", incidentId, err);
                    done.tryEmitError(err);
                }));
        return incidentId;
    }

    /**
     * Emits the snapshot once the incident is terminal. Emits straight away for an incident
     * that has already closed; errors for an unknown id.
     */
    public Mono<IncidentSnapshot> completion(String incidentId) {
        Sinks.One<IncidentState> done = completions.get(incidentId);
        Mono<IncidentState> terminal = done != null ? done.asMono() : Mono.empty();
        return terminal.then(Mono.fromCallable(() -> snapshot(incidentId)
            .orElseThrow(() -> new IllegalArgumentException("unknown incident " + incidentId))));
    }

    public Optional<IncidentSnapshot> snapshot(String incidentId) {
        return ledger.snapshot(incidentId);
    }

    public List<IncidentEvent> events(String incidentId) {
        return ledger.history(incidentId);
    }

    /** Snapshots of every known incident, oldest first. */
    public List<IncidentSnapshot> snapshots() {
        return ledger.incidentIds().stream()
            .map(ledger::snapshot)
            .flatMap(Optional::stream)
            .toList();
    }

    public int activeCount() {
        return active.size();
    }

    @PreDestroy
    public void shutdown() {
        if (!active.isEmpty()) {
            log.info("[Resolution] cancelling {} in-flight incident(s)", active.size());
        }
        active.values().forEach(Disposable::dispose);
    }

    // runs before waiters are signalled
    private void release(String incidentId) {
        active.remove(incidentId);
        completions.remove(incidentId);
    }

    private static void validate(AlertPayload alert) {
        if (alert == null) {
            throw new IllegalArgumentException("alert body is required");
        }
        if (alert.category() == null) {
            throw new IllegalArgumentException("alert category is required");
        }
        if (alert.severity() == null) {
            throw new IllegalArgumentException("alert severity is required");
        }
    }
}
