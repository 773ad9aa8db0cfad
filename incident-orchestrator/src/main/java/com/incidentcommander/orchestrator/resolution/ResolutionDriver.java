package com.incidentcommander.orchestrator.resolution;

import com.incidentcommander.analysis.service.AgentDispatchService;
import com.incidentcommander.analysis.service.RoundResult;
import com.incidentcommander.common.consensus.ConsensusDecision;
import com.incidentcommander.common.consensus.ConsensusEngine;
import com.incidentcommander.common.consensus.ConsensusOutcome;
import com.incidentcommander.common.event.IncidentEvent;
import com.incidentcommander.common.event.IncidentEventType;
import com.incidentcommander.common.ledger.IncidentSnapshot;
import com.incidentcommander.common.model.AgentDescriptor;
import com.incidentcommander.common.model.DispatchOutcome;
import com.incidentcommander.common.model.EscalationReason;
import com.incidentcommander.common.model.EscalationRecord;
import com.incidentcommander.common.model.IncidentState;
import com.incidentcommander.orchestrator.ledger.LedgerWriter;
import com.incidentcommander.orchestrator.logger.IncidentFlowLogger;
import com.incidentcommander.orchestrator.policy.ResolutionSettings;
import com.incidentcommander.orchestrator.remediation.RemediationExecutor;
import com.incidentcommander.orchestrator.remediation.RemediationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.concurrent.TimeoutException;

import static com.incidentcommander.common.model.IncidentState.*;

/**
 * Drives one incident through the resolution state machine, recording every step in the
 * ledger before acting on it.
 *
 * <pre>
 *   PENDING → ANALYZING ─round─→ DECIDING ─┬→ EXECUTING ─┬→ RESOLVED
 *                 ↑                         │             └→ (rollback) ESCALATING → ESCALATED_OPEN
 *                 └──── extra round ────────┤
 *                                           └→ ESCALATING → ESCALATED_OPEN
 * </pre>
 * Rounds of one incident run strictly one after another inside a single reactive chain.
 * {@link #abandon} is the timeout path, usable from any non-terminal state. A round that
 * joins, or a decision that is ready to execute, after the incident deadline is abandoned too.
 */
@Component
public class ResolutionDriver {

    private static final Logger log = LoggerFactory.getLogger(ResolutionDriver.class);

    private final AgentDispatchService dispatchService;
    private final ConsensusEngine consensusEngine;
    private final RemediationExecutor remediationExecutor;
    private final LedgerWriter ledger;
    private final IncidentFlowLogger flowLogger;
    private final ResolutionSettings settings;
    private final Clock clock;

    public ResolutionDriver(AgentDispatchService dispatchService,
                            ConsensusEngine consensusEngine,
                            RemediationExecutor remediationExecutor,
                            LedgerWriter ledger,
                            IncidentFlowLogger flowLogger,
                            ResolutionSettings settings,
                            Clock clock) {
        this.dispatchService     = dispatchService;
        this.consensusEngine     = consensusEngine;
        this.remediationExecutor = remediationExecutor;
        this.ledger              = ledger;
        this.flowLogger          = flowLogger;
        this.settings            = settings;
        this.clock               = clock;
    }

    /** Runs the incident to RESOLVED or ESCALATED_OPEN and emits that state. */
    public Mono<IncidentState> resolve(IncidentRun run) {
        return append(event(run, IncidentEventType.STATE_CHANGED, 1, ANALYZING).withDetail("fan-out"))
            .then(Mono.defer(() -> runRound(run, 1)));
    }

    /**
     * Records ABANDONED with whatever findings the ledger already holds. A no-op returning the
     * current state when the incident has already reached a terminal state.
     */
    public Mono<IncidentState> abandon(IncidentRun run, String why) {
        return Mono.fromCallable(() -> {
                IncidentSnapshot snapshot = currentSnapshot(run);
                if (snapshot.terminal()) {
                    return snapshot.state();
                }
                EscalationRecord record = EscalationRecord.of(run.incident(), EscalationReason.INCIDENT_TIMEOUT,
                    why, snapshot.latestDecision(), snapshot.findings(), snapshot.failures());
                ledger.append(event(run, IncidentEventType.ABANDONED, snapshot.round(), ABANDONED)
                                  .withEscalation(record).withDetail(why));
                log.warn("[Resolution] incident={} ABANDONED after round={} findings={}: {}",
                         run.id(), snapshot.round(), snapshot.findings().size(), why);
                flowLogger.logWithTraceId(IncidentFlowLogger.INCIDENT_CLOSED, run.id(), "state=ABANDONED");
                return ABANDONED;
            })
            // lost a race with the main pipeline reaching a terminal state
            .onErrorResume(IllegalStateException.class, e -> Mono.justOrEmpty(ledger.snapshot(run.id()))
                .filter(IncidentSnapshot::terminal)
                .map(IncidentSnapshot::state)
                .switchIfEmpty(Mono.error(e)));
    }

    // ── rounds ────────────────────────────────────────────────────────────

    private Mono<IncidentState> runRound(IncidentRun run, int round) {
        String roster = run.policy().roster().stream()
            .filter(AgentDescriptor::isActive).map(d -> d.role().name()).toList().toString();
        return append(event(run, IncidentEventType.ROUND_STARTED, round, ANALYZING).withDetail("roster=" + roster))
            .doOnEach(flowLogger.stage(IncidentFlowLogger.ROUND_DISPATCHED))
            .then(Mono.defer(() -> dispatchService.dispatchRound(run.incident(), round, run.policy().roster(),
                                                                  run.remaining(clock), o -> recordOutcome(run, o))))
            .doOnEach(flowLogger.stage(IncidentFlowLogger.FINDINGS_COLLECTED))
            .flatMap(result -> decide(run, round, result));
    }

    private Mono<IncidentState> decide(IncidentRun run, int round, RoundResult result) {
        if (run.remaining(clock).isZero()) {
            return abandon(run, "incident timeout elapsed during round " + round);
        }
        ConsensusOutcome outcome = consensusEngine.compute(result.findings(), run.policy().staticWeights(),
                                                           run.policy().consensus());
        if (!outcome.isReached()) {
            String reason = outcome.quorumFailure();
            flowLogger.logWithTraceId(IncidentFlowLogger.DECISION_MADE, run.id(), "quorum failed: " + reason);
            return append(event(run, IncidentEventType.QUORUM_FAILED, round, DECIDING).withDetail(reason))
                .then(Mono.defer(() -> escalate(run, round, EscalationReason.INSUFFICIENT_QUORUM,
                                                "insufficient quorum: " + reason, null)));
        }

        ConsensusDecision decision = outcome.decision();
        flowLogger.logDecision(decision, run.id());
        if (decision.faultBudgetExceeded()) {
            log.warn("[Consensus] incident={} round={} excluded={} exceeds Byzantine tolerance {}",
                     run.id(), round, decision.excludedRoles(), decision.byzantineTolerance());
        }

        boolean budgetLeft = !run.remaining(clock).isZero();
        ResolutionVerdict verdict = ResolutionPolicy.decide(decision, run.policy(), settings, round, budgetLeft);
        return append(event(run, IncidentEventType.CONSENSUS_REACHED, round, DECIDING)
                          .withDecision(decision).withDetail(verdict.summary()))
            .then(Mono.defer(() -> switch (verdict.kind()) {
                case EXECUTE     -> execute(run, round, decision);
                case RETRY_ROUND -> append(event(run, IncidentEventType.STATE_CHANGED, round + 1, ANALYZING)
                                               .withDetail(verdict.summary()))
                                        .then(Mono.defer(() -> runRound(run, round + 1)));
                case ESCALATE    -> escalate(run, round, verdict.reason(), verdict.summary(), decision);
            }));
    }

    // ── outcomes ──────────────────────────────────────────────────────────

    private Mono<IncidentState> execute(IncidentRun run, int round, ConsensusDecision decision) {
        String action = decision.winningAction();
        if (run.remaining(clock).isZero()) {
            return abandon(run, "incident timeout elapsed before executing " + action);
        }
        return append(event(run, IncidentEventType.STATE_CHANGED, round, EXECUTING).withDetail(action))
            .doOnNext(e -> flowLogger.logWithTraceId(IncidentFlowLogger.ACTION_DISPATCHED, run.id(), "action=" + action))
            .then(guarded(run, action, "remediation", Mono.defer(() -> remediationExecutor.execute(run.incident(), action))))
            .flatMap(result -> result.success()
                ? append(event(run, IncidentEventType.ACTION_EXECUTED, round, EXECUTING).withDetail(action))
                    .then(append(event(run, IncidentEventType.RESOLVED, round, RESOLVED).withDetail(result.detail())))
                    .map(IncidentEvent::state)
                    .doOnNext(s -> flowLogger.logWithTraceId(IncidentFlowLogger.INCIDENT_CLOSED, run.id(),
                                                             "state=RESOLVED action=" + action))
                : append(event(run, IncidentEventType.ACTION_FAILED, round, EXECUTING).withDetail(result.detail()))
                    .then(Mono.defer(() -> rollback(run, round, action)))
                    .flatMap(rollback -> escalate(run, round, EscalationReason.ACTION_FAILED,
                        "remediation " + action + " failed: " + result.detail(), decision, rollback)));
    }

    /** Reverts a failed remediation and records the outcome; emits a line for the escalation record. */
    private Mono<String> rollback(IncidentRun run, int round, String action) {
        return guarded(run, action, "rollback", Mono.defer(() -> remediationExecutor.rollback(run.incident(), action)))
            .flatMap(result -> {
                IncidentEventType type = result.success() ? IncidentEventType.ACTION_ROLLED_BACK
                                                          : IncidentEventType.ROLLBACK_FAILED;
                String outcome = "rollback of " + action + (result.success() ? " succeeded: " : " failed: ")
                                 + result.detail();
                return append(event(run, type, round, EXECUTING).withDetail(result.detail()))
                    .doOnNext(e -> log.info("[Resolution] incident={} {}", run.id(), outcome))
                    .thenReturn(outcome);
            });
    }

    /** Bounds an executor call by the execution timeout; errors and empty results become failures. */
    private Mono<RemediationResult> guarded(IncidentRun run, String action, String what, Mono<RemediationResult> call) {
        return call
            .timeout(settings.executionTimeout())
            .onErrorResume(e -> {
                log.warn("[Resolution] {} error incident={} action={}", what, run.id(), action, e);
                return Mono.just(RemediationResult.failed(action, describe(e)));
            })
            .defaultIfEmpty(RemediationResult.failed(action, "executor returned no " + what + " result"));
    }

    private Mono<IncidentState> escalate(IncidentRun run, int round, EscalationReason reason, String summary,
                                         ConsensusDecision decision) {
        return escalate(run, round, reason, summary, decision, null);
    }

    private Mono<IncidentState> escalate(IncidentRun run, int round, EscalationReason reason, String summary,
                                         ConsensusDecision decision, String rollback) {
        return append(event(run, IncidentEventType.STATE_CHANGED, round, ESCALATING).withDetail(reason.name()))
            .then(Mono.fromCallable(() -> {
                IncidentSnapshot snapshot = currentSnapshot(run);
                EscalationRecord record = EscalationRecord.of(run.incident(), reason, summary, decision,
                                                              snapshot.findings(), snapshot.failures())
                                                          .withRollback(rollback);
                return ledger.append(event(run, IncidentEventType.ESCALATED, round, ESCALATED_OPEN)
                                         .withEscalation(record).withDecision(decision));
            }))
            .map(IncidentEvent::state)
            .doOnNext(s -> flowLogger.logWithTraceId(IncidentFlowLogger.INCIDENT_CLOSED, run.id(),
                                                     "state=ESCALATED_OPEN reason=" + reason));
    }

    private void recordOutcome(IncidentRun run, DispatchOutcome outcome) {
        IncidentEvent event = outcome.isSuccess()
            ? event(run, IncidentEventType.FINDING_RECORDED, outcome.finding().round(), ANALYZING)
                  .withFinding(outcome.finding())
            : event(run, IncidentEventType.DISPATCH_FAILED, outcome.failure().round(), ANALYZING)
                  .withFailure(outcome.failure());
        try {
            ledger.append(event);
        } catch (IllegalStateException e) {
            boolean closed = ledger.snapshot(run.id()).map(IncidentSnapshot::terminal).orElse(false);
            if (!closed) {
                throw e;
            }
            log.warn("[Resolution] late outcome not recorded, incident={} already closed role={}",
                     run.id(), outcome.role());
        }
    }

    // ── helpers ───────────────────────────────────────────────────────────

    private IncidentEvent event(IncidentRun run, IncidentEventType type, int round, IncidentState state) {
        return IncidentEvent.of(type, run.id(), round, state, clock.instant());
    }

    private Mono<IncidentEvent> append(IncidentEvent event) {
        return Mono.fromCallable(() -> ledger.append(event));
    }

    private IncidentSnapshot currentSnapshot(IncidentRun run) {
        return ledger.snapshot(run.id())
            .orElseThrow(() -> new IllegalStateException("no ledger history for " + run.id()));
    }

    private String describe(Throwable e) {
        if (e instanceof TimeoutException) {
            return "no result within " + settings.executionTimeout().toMillis() + "ms";
        }
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
