package com.incidentcommander.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.incidentcommander.common.consensus.ConsensusDecision;

import java.util.List;

/**
 * Human-actionable escalation. Always carries every finding and its evidence so that a
 * responder is never asked to act on an opaque decision.
 *
 * @param decision the last consensus decision, or {@code null} when no round reached one
 * @param rollback outcome of reverting a failed remediation, or {@code null} when none ran
 */
public record EscalationRecord(
    @JsonProperty("incident")  Incident incident,
    @JsonProperty("priority")  IncidentPriority priority,
    @JsonProperty("reason")    EscalationReason reason,
    @JsonProperty("summary")   String summary,
    @JsonProperty("decision")  ConsensusDecision decision,
    @JsonProperty("findings")  List<Finding> findings,
    @JsonProperty("failures")  List<DispatchFailure> failures,
    @JsonProperty("rollback")  String rollback
) {
    public EscalationRecord {
        findings = findings == null ? List.of() : List.copyOf(findings);
        failures = failures == null ? List.of() : List.copyOf(failures);
    }

    public static EscalationRecord of(Incident incident, EscalationReason reason, String summary,
                                      ConsensusDecision decision, List<Finding> findings,
                                      List<DispatchFailure> failures) {
        return new EscalationRecord(incident, incident.priority(), reason, summary,
                                    decision, findings, failures, null);
    }

    public EscalationRecord withRollback(String outcome) {
        return new EscalationRecord(incident, priority, reason, summary, decision, findings, failures, outcome);
    }
}
