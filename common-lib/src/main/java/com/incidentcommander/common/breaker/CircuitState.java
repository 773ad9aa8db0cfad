package com.incidentcommander.common.breaker;

/**
 * <pre>
 * CLOSED ──(failureThreshold consecutive failures)──▶ OPEN
 * OPEN   ──(cooldown elapsed, checked on next dispatch)──▶ HALF_OPEN
 * HALF_OPEN ──success──▶ CLOSED
 * HALF_OPEN ──failure──▶ OPEN
 * </pre>
 */
public enum CircuitState {
    CLOSED,
    OPEN,
    HALF_OPEN
}
