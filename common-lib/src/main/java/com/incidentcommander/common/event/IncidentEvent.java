package com.incidentcommander.common.event;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.incidentcommander.common.consensus.ConsensusDecision;
import com.incidentcommander.common.model.DispatchFailure;
import com.incidentcommander.common.model.EscalationRecord;
import com.incidentcommander.common.model.Finding;
import com.incidentcommander.common.model.Incident;
import com.incidentcommander.common.model.IncidentState;

import java.time.Instant;
import java.util.Objects;

/**
 * One immutable ledger entry. {@code state} is the lifecycle state <em>after</em> the event,
 * which is what makes a history replayable without re-running any logic.
 *
 * <p>Events are built unversioned ({@code version = 0}); the ledger stamps the version on append.
 * Payload fields are optional and typed:
 * <pre>
 *   INCIDENT_OPENED   → incident
 *   FINDING_RECORDED  → finding
 *   DISPATCH_FAILED   → failure
 *   CONSENSUS_REACHED → decision
 *   ESCALATED         → escalation (+ decision when one exists)
 *   ABANDONED         → escalation (partial findings)
 *   others            → detail
 * </pre>
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record IncidentEvent(
    @JsonProperty("incidentId") String incidentId,
    @JsonProperty("version")    long version,
    @JsonProperty("type")       IncidentEventType type,
    @JsonProperty("occurredAt") Instant occurredAt,
    @JsonProperty("round")      int round,
    @JsonProperty("state")      IncidentState state,
    @JsonProperty("incident")   Incident incident,
    @JsonProperty("finding")    Finding finding,
    @JsonProperty("failure")    DispatchFailure failure,
    @JsonProperty("decision")   ConsensusDecision decision,
    @JsonProperty("escalation") EscalationRecord escalation,
    @JsonProperty("detail")     String detail
) {
    public IncidentEvent {
        Objects.requireNonNull(incidentId, "incidentId");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(occurredAt, "occurredAt");
        Objects.requireNonNull(state, "state");
    }

    public static IncidentEvent of(IncidentEventType type, String incidentId, int round,
                                   IncidentState state, Instant occurredAt) {
        return new IncidentEvent(incidentId, 0L, type, occurredAt, round, state,
                                 null, null, null, null, null, null);
    }

    public static IncidentEvent opened(Incident incident) {
        return of(IncidentEventType.INCIDENT_OPENED, incident.id(), 0, IncidentState.PENDING, incident.openedAt())
            .withIncident(incident);
    }

    public IncidentEvent withVersion(long v) {
        return new IncidentEvent(incidentId, v, type, occurredAt, round, state,
                                 incident, finding, failure, decision, escalation, detail);
    }

    public IncidentEvent withIncident(Incident i) {
        return new IncidentEvent(incidentId, version, type, occurredAt, round, state,
                                 i, finding, failure, decision, escalation, detail);
    }

    public IncidentEvent withFinding(Finding f) {
        return new IncidentEvent(incidentId, version, type, occurredAt, round, state,
                                 incident, f, failure, decision, escalation, detail);
    }

    public IncidentEvent withFailure(DispatchFailure f) {
        return new IncidentEvent(incidentId, version, type, occurredAt, round, state,
                                 incident, finding, f, decision, escalation, detail);
    }

    public IncidentEvent withDecision(ConsensusDecision d) {
        return new IncidentEvent(incidentId, version, type, occurredAt, round, state,
                                 incident, finding, failure, d, escalation, detail);
    }

    public IncidentEvent withEscalation(EscalationRecord e) {
        return new IncidentEvent(incidentId, version, type, occurredAt, round, state,
                                 incident, finding, failure, decision, e, detail);
    }

    public IncidentEvent withDetail(String d) {
        return new IncidentEvent(incidentId, version, type, occurredAt, round, state,
                                 incident, finding, failure, decision, escalation, d);
    }
}
