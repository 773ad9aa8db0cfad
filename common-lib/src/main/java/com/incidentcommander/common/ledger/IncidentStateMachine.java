package com.incidentcommander.common.ledger;

import com.incidentcommander.common.model.IncidentState;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * The legal lifecycle transitions. Staying in the same state is always allowed (findings
 * and failures are recorded while ANALYZING); anything not listed is rejected.
 */
public final class IncidentStateMachine {

    private static final Map<IncidentState, Set<IncidentState>> ALLOWED = new EnumMap<>(IncidentState.class);

    static {
        ALLOWED.put(IncidentState.PENDING,    EnumSet.of(IncidentState.ANALYZING));
        ALLOWED.put(IncidentState.ANALYZING,  EnumSet.of(IncidentState.DECIDING));
        ALLOWED.put(IncidentState.DECIDING,   EnumSet.of(IncidentState.EXECUTING,
                                                         IncidentState.ESCALATING,
                                                         IncidentState.ANALYZING));
        ALLOWED.put(IncidentState.EXECUTING,  EnumSet.of(IncidentState.RESOLVED, IncidentState.ESCALATING));
        ALLOWED.put(IncidentState.ESCALATING, EnumSet.of(IncidentState.ESCALATED_OPEN));
        for (IncidentState state : IncidentState.values()) {
            if (state.isTerminal()) {
                ALLOWED.put(state, EnumSet.noneOf(IncidentState.class));
            } else {
                ALLOWED.get(state).add(IncidentState.ABANDONED);
            }
        }
    }

    private IncidentStateMachine() {}

    public static boolean canTransition(IncidentState from, IncidentState to) {
        if (from == to) {
            return !from.isTerminal();
        }
        return ALLOWED.get(from).contains(to);
    }

    /**
     * @throws IllegalStateException when {@code from → to} is not a legal transition
     */
    public static void requireTransition(IncidentState from, IncidentState to) {
        if (!canTransition(from, to)) {
            throw new IllegalStateException("illegal incident transition " + from + " → " + to);
        }
    }

    public static Set<IncidentState> successors(IncidentState from) {
        return Collections.unmodifiableSet(ALLOWED.get(from));
    }
}
