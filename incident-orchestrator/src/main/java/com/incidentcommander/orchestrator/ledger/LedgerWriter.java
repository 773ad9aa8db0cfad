package com.incidentcommander.orchestrator.ledger;

import com.incidentcommander.common.event.IncidentEvent;
import com.incidentcommander.common.event.IncidentEventPublisher;
import com.incidentcommander.common.exception.LedgerVersionConflictException;
import com.incidentcommander.common.ledger.IncidentLedger;
import com.incidentcommander.common.ledger.IncidentReplayer;
import com.incidentcommander.common.ledger.IncidentSnapshot;
import com.incidentcommander.common.ledger.IncidentStateMachine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * The only write path into the ledger. Each append re-reads the latest version, checks the
 * state change against {@link IncidentStateMachine}, and retries on a version conflict.
 * Every stored event is then handed to the telemetry publisher.
 */
@Component
public class LedgerWriter {

    private static final Logger log = LoggerFactory.getLogger(LedgerWriter.class);

    static final int MAX_ATTEMPTS = 16;

    private final IncidentLedger ledger;
    private final IncidentEventPublisher publisher;

    public LedgerWriter(IncidentLedger ledger, IncidentEventPublisher publisher) {
        this.ledger = ledger;
        this.publisher = publisher;
    }

    /**
     * @throws IllegalStateException if the state change is illegal, or the retry budget is spent
     */
    public IncidentEvent append(IncidentEvent event) {
        String incidentId = event.incidentId();
        for (int attempt = 1; attempt <= MAX_ATTEMPTS; attempt++) {
            List<IncidentEvent> history = ledger.history(incidentId);
            if (!history.isEmpty()) {
                IncidentStateMachine.requireTransition(history.get(history.size() - 1).state(), event.state());
            }
            try {
                IncidentEvent stored = ledger.append(incidentId, history.size(), event);
                log.debug("[Ledger] appended incident={} v{} type={} state={}",
                          incidentId, stored.version(), stored.type(), stored.state());
                publisher.publish(stored);
                return stored;
            } catch (LedgerVersionConflictException e) {
                log.debug("[Ledger] version conflict incident={} attempt={}/{}: {}",
                          incidentId, attempt, MAX_ATTEMPTS, e.getMessage());
            }
        }
        throw new IllegalStateException("ledger append for " + incidentId + " still conflicting after "
                                        + MAX_ATTEMPTS + " attempts");
    }

    public List<IncidentEvent> history(String incidentId) {
        return ledger.history(incidentId);
    }

    public Optional<IncidentSnapshot> snapshot(String incidentId) {
        List<IncidentEvent> history = ledger.history(incidentId);
        return history.isEmpty() ? Optional.empty() : Optional.of(IncidentReplayer.replay(history));
    }

    public List<String> incidentIds() {
        return ledger.incidentIds();
    }
}
