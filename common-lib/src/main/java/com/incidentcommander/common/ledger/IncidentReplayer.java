package com.incidentcommander.common.ledger;

import com.incidentcommander.common.consensus.ConsensusDecision;
import com.incidentcommander.common.event.IncidentEvent;
import com.incidentcommander.common.event.IncidentEventType;
import com.incidentcommander.common.model.DispatchFailure;
import com.incidentcommander.common.model.EscalationRecord;
import com.incidentcommander.common.model.Finding;
import com.incidentcommander.common.model.Incident;
import com.incidentcommander.common.model.IncidentState;

import java.util.ArrayList;
import java.util.List;

/**
 * Folds a ledger history into an {@link IncidentSnapshot}. Pure and deterministic: the same
 * history always yields the same snapshot.
 *
 * <p>The history is verified while folding. Any of these raises {@link IllegalStateException}:
 * <ul>
 *   <li>empty history, or a first event other than {@code INCIDENT_OPENED} at version 1</li>
 *   <li>a gap or repeat in the version sequence</li>
 *   <li>a state change the {@link IncidentStateMachine} rejects</li>
 *   <li>a finding whose digest does not match its content</li>
 * </ul>
 */
public final class IncidentReplayer {

    private IncidentReplayer() {}

    public static IncidentSnapshot replay(List<IncidentEvent> history) {
        if (history.isEmpty()) {
            throw new IllegalStateException("cannot replay an empty history");
        }
        IncidentEvent first = history.get(0);
        if (first.type() != IncidentEventType.INCIDENT_OPENED || first.version() != 1L
                || first.state() != IncidentState.PENDING || first.incident() == null) {
            throw new IllegalStateException("history of " + first.incidentId()
                                            + " does not start with INCIDENT_OPENED v1");
        }

        Incident incident = first.incident();
        IncidentState state = IncidentState.PENDING;
        int round = 0;
        long version = 1L;
        List<Finding> findings = new ArrayList<>();
        List<DispatchFailure> failures = new ArrayList<>();
        List<ConsensusDecision> decisions = new ArrayList<>();
        EscalationRecord escalation = null;
        String executedAction = null;

        for (IncidentEvent event : history.subList(1, history.size())) {
            if (event.version() != version + 1) {
                throw new IllegalStateException("version gap in " + incident.id()
                                                + ": v" + version + " followed by v" + event.version());
            }
            IncidentStateMachine.requireTransition(state, event.state());

            switch (event.type()) {
                case INCIDENT_OPENED -> throw new IllegalStateException(
                    "duplicate INCIDENT_OPENED in " + incident.id() + " at v" + event.version());
                case ROUND_STARTED -> round = event.round();
                case FINDING_RECORDED -> {
                    Finding finding = event.finding();
                    if (finding == null || !finding.digestMatches()) {
                        throw new IllegalStateException("finding digest mismatch in " + incident.id()
                                                        + " at v" + event.version());
                    }
                    findings.add(finding);
                }
                case DISPATCH_FAILED -> {
                    if (event.failure() != null) failures.add(event.failure());
                }
                case CONSENSUS_REACHED -> {
                    if (event.decision() != null) decisions.add(event.decision());
                }
                case ACTION_EXECUTED -> executedAction = event.detail();
                case ESCALATED, ABANDONED -> escalation = event.escalation();
                default -> { }  // state change only
            }
            state = event.state();
            version = event.version();
        }
        return new IncidentSnapshot(incident, state, round, findings, failures, decisions,
                                    escalation, executedAction, version);
    }
}
