package com.incidentcommander.common.ledger;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.incidentcommander.common.consensus.ConsensusDecision;
import com.incidentcommander.common.model.DispatchFailure;
import com.incidentcommander.common.model.EscalationRecord;
import com.incidentcommander.common.model.Finding;
import com.incidentcommander.common.model.Incident;
import com.incidentcommander.common.model.IncidentState;

import java.util.List;

/**
 * Incident state reconstructed from its ledger history by {@link IncidentReplayer}.
 *
 * @param executedAction the remediation that ran successfully, or {@code null}
 * @param escalation     the escalation or abandonment record, or {@code null}
 */
public record IncidentSnapshot(
    @JsonProperty("incident")       Incident incident,
    @JsonProperty("state")          IncidentState state,
    @JsonProperty("round")          int round,
    @JsonProperty("findings")       List<Finding> findings,
    @JsonProperty("failures")       List<DispatchFailure> failures,
    @JsonProperty("decisions")      List<ConsensusDecision> decisions,
    @JsonProperty("escalation")     EscalationRecord escalation,
    @JsonProperty("executedAction") String executedAction,
    @JsonProperty("version")        long version
) {
    public IncidentSnapshot {
        findings  = List.copyOf(findings);
        failures  = List.copyOf(failures);
        decisions = List.copyOf(decisions);
    }

    @JsonProperty("terminal")
    public boolean terminal() {
        return state.isTerminal();
    }

    @JsonIgnore
    public ConsensusDecision latestDecision() {
        return decisions.isEmpty() ? null : decisions.get(decisions.size() - 1);
    }
}
