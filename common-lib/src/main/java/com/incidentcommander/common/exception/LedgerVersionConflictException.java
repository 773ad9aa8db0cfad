package com.incidentcommander.common.exception;

/**
 * Optimistic-lock failure on a ledger append: another writer appended first.
 * Callers re-read the current version and retry.
 */
public class LedgerVersionConflictException extends RuntimeException {

    private final String incidentId;
    private final long expectedVersion;
    private final long actualVersion;

    public LedgerVersionConflictException(String incidentId, long expectedVersion, long actualVersion) {
        super("ledger version conflict for " + incidentId
              + ": expected=" + expectedVersion + " actual=" + actualVersion);
        this.incidentId      = incidentId;
        this.expectedVersion = expectedVersion;
        this.actualVersion   = actualVersion;
    }

    public String getIncidentId() {
        return incidentId;
    }

    public long getExpectedVersion() {
        return expectedVersion;
    }

    public long getActualVersion() {
        return actualVersion;
    }
}
