package com.incidentcommander.orchestrator.ledger;

import com.incidentcommander.common.event.IncidentEvent;
import com.incidentcommander.common.exception.LedgerVersionConflictException;
import com.incidentcommander.common.ledger.IncidentLedger;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Thread-safe in-memory ledger. The version check and the append happen inside one
 * {@link ConcurrentMap#compute} call, so they are atomic per incident.
 */
@Component
public class InMemoryIncidentLedger implements IncidentLedger {

    private final ConcurrentMap<String, List<IncidentEvent>> streams = new ConcurrentHashMap<>();
    private final List<String> openingOrder = new CopyOnWriteArrayList<>();

    @Override
    public IncidentEvent append(String incidentId, long expectedVersion, IncidentEvent event) {
        if (!incidentId.equals(event.incidentId())) {
            throw new IllegalArgumentException("event for " + event.incidentId() + " appended to " + incidentId);
        }
        IncidentEvent stamped = event.withVersion(expectedVersion + 1);
        streams.compute(incidentId, (id, existing) -> {
            long actual = existing == null ? 0L : existing.size();
            if (actual != expectedVersion) {
                throw new LedgerVersionConflictException(id, expectedVersion, actual);
            }
            List<IncidentEvent> next = existing == null ? new ArrayList<>() : existing;
            next.add(stamped);
            return next;
        });
        if (expectedVersion == 0L) {
            openingOrder.add(incidentId);
        }
        return stamped;
    }

    @Override
    public List<IncidentEvent> history(String incidentId) {
        List<IncidentEvent> copy = new ArrayList<>();
        // compute-style read keeps the copy consistent with concurrent appends
        streams.computeIfPresent(incidentId, (id, events) -> {
            copy.addAll(events);
            return events;
        });
        return List.copyOf(copy);
    }

    @Override
    public long currentVersion(String incidentId) {
        return history(incidentId).size();
    }

    @Override
    public List<String> incidentIds() {
        return List.copyOf(openingOrder);
    }
}
