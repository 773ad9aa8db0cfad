package com.incidentcommander.common.ledger;

import com.incidentcommander.common.model.IncidentState;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static com.incidentcommander.common.model.IncidentState.*;
import static org.junit.jupiter.api.Assertions.*;

class IncidentStateMachineTest {

    @Test
    @DisplayName("happy path transitions are legal")
    void happyPath() {
        assertTrue(IncidentStateMachine.canTransition(PENDING, ANALYZING));
        assertTrue(IncidentStateMachine.canTransition(ANALYZING, DECIDING));
        assertTrue(IncidentStateMachine.canTransition(DECIDING, EXECUTING));
        assertTrue(IncidentStateMachine.canTransition(EXECUTING, RESOLVED));
        assertTrue(IncidentStateMachine.canTransition(DECIDING, ESCALATING));
        assertTrue(IncidentStateMachine.canTransition(EXECUTING, ESCALATING));
        assertTrue(IncidentStateMachine.canTransition(ESCALATING, ESCALATED_OPEN));
    }

    @Test
    @DisplayName("DECIDING → ANALYZING is allowed for the extra round")
    void extraRound() {
        assertTrue(IncidentStateMachine.canTransition(DECIDING, ANALYZING));
    }

    @Test
    @DisplayName("skipping states is rejected with IllegalStateException")
    void skippingRejected() {
        assertFalse(IncidentStateMachine.canTransition(PENDING, EXECUTING));
        assertFalse(IncidentStateMachine.canTransition(ANALYZING, RESOLVED));
        assertThrows(IllegalStateException.class,
            () -> IncidentStateMachine.requireTransition(DECIDING, RESOLVED));
    }

    @ParameterizedTest
    @EnumSource(value = IncidentState.class, names = {"PENDING", "ANALYZING", "DECIDING", "EXECUTING", "ESCALATING"})
    @DisplayName("every non-terminal state can be abandoned")
    void abandonFromNonTerminal(IncidentState state) {
        assertTrue(IncidentStateMachine.canTransition(state, ABANDONED));
        assertTrue(IncidentStateMachine.canTransition(state, state));
    }

    @ParameterizedTest
    @EnumSource(value = IncidentState.class, names = {"RESOLVED", "ESCALATED_OPEN", "ABANDONED"})
    @DisplayName("terminal states accept nothing further")
    void terminalIsFinal(IncidentState state) {
        assertTrue(IncidentStateMachine.successors(state).isEmpty());
        assertFalse(IncidentStateMachine.canTransition(state, state));
        assertFalse(IncidentStateMachine.canTransition(state, ABANDONED));
    }
}
