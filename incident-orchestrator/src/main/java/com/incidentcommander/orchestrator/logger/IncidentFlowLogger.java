package com.incidentcommander.orchestrator.logger;

import com.incidentcommander.common.consensus.ConsensusDecision;
import com.incidentcommander.common.trace.TraceContextUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Signal;

import java.util.function.Consumer;

/**
 * Lifecycle logging for one incident's reactive pipeline. Pure side effects: nothing here
 * changes what the pipeline emits.
 *
 * <p>Stages, in order:
 * <ol>
 *   <li>{@link #ALERT_RECEIVED}: incident opened and recorded</li>
 *   <li>{@link #ROUND_DISPATCHED}: agents fanned out for a round</li>
 *   <li>{@link #FINDINGS_COLLECTED}: round joined</li>
 *   <li>{@link #DECISION_MADE}: consensus computed or quorum failed</li>
 *   <li>{@link #ACTION_DISPATCHED}: remediation handed to the executor</li>
 *   <li>{@link #INCIDENT_CLOSED}: terminal state recorded</li>
 * </ol>
 *
 * <pre>
 *     .doOnEach(flowLogger.stage(IncidentFlowLogger.FINDINGS_COLLECTED))
 * </pre>
 */
@Component
public class IncidentFlowLogger {

    private static final Logger log = LoggerFactory.getLogger(IncidentFlowLogger.class);

    public static final String ALERT_RECEIVED     = "ALERT_RECEIVED";
    public static final String ROUND_DISPATCHED   = "ROUND_DISPATCHED";
    public static final String FINDINGS_COLLECTED = "FINDINGS_COLLECTED";
    public static final String DECISION_MADE      = "DECISION_MADE";
    public static final String ACTION_DISPATCHED  = "ACTION_DISPATCHED";
    public static final String INCIDENT_CLOSED    = "INCIDENT_CLOSED";

    /**
     * {@code doOnEach} consumer logging {@code stageName} on each onNext. The incident id is read
     * from the Reactor Context and bridged into MDC only for the log call.
     */
    public <T> Consumer<Signal<T>> stage(String stageName) {
        return signal -> {
            if (!signal.isOnNext()) return;
            String incidentId = TraceContextUtil.getTraceId(signal.getContextView());
            TraceContextUtil.withMdc(incidentId, () ->
                log.info("[IncidentFlow] stage={} incident={}", stageName, incidentId));
        };
    }

    /** For call sites that already hold the incident id. */
    public void logWithTraceId(String stageName, String incidentId, String detail) {
        TraceContextUtil.withMdc(incidentId, () ->
            log.info("[IncidentFlow] stage={} incident={} {}", stageName, incidentId, detail));
    }

    public void logDecision(ConsensusDecision decision, String incidentId) {
        TraceContextUtil.withMdc(incidentId, () ->
            log.info("[IncidentFlow] stage={} incident={} round={} action={} weightedConfidence={} "
                     + "threshold={} eligible={} contributors={} excluded={} suspected={}",
                     DECISION_MADE, incidentId, decision.round(), decision.winningAction(),
                     String.format("%.3f", decision.weightedConfidence()), decision.threshold(),
                     decision.autonomousEligible(), decision.contributingRoles(),
                     decision.excludedRoles(), decision.suspectedFaultyRoles()));
    }
}
