package com.incidentcommander.common.ledger;

import com.incidentcommander.common.event.IncidentEvent;
import com.incidentcommander.common.exception.LedgerVersionConflictException;

import java.util.List;

/**
 * Append-only, optimistically locked event log of every incident.
 *
 * <p>Versions are 1-based and contiguous per incident. Events are never mutated or removed.
 */
public interface IncidentLedger {

    /**
     * Appends {@code event} as version {@code expectedVersion + 1}.
     *
     * @param expectedVersion the version the caller last observed; {@code 0} for a new incident
     * @return the stored event, stamped with its version
     * @throws LedgerVersionConflictException if another append happened since {@code expectedVersion}
     */
    IncidentEvent append(String incidentId, long expectedVersion, IncidentEvent event);

    /** Full history in version order; empty for an unknown incident. */
    List<IncidentEvent> history(String incidentId);

    /** Latest version, or {@code 0} when nothing has been recorded. */
    long currentVersion(String incidentId);

    List<String> incidentIds();
}
