package com.incidentcommander.orchestrator.ledger;

import com.incidentcommander.common.event.IncidentEvent;
import com.incidentcommander.common.event.IncidentEventPublisher;
import com.incidentcommander.common.event.IncidentEventType;
import com.incidentcommander.common.exception.LedgerVersionConflictException;
import com.incidentcommander.common.ledger.IncidentLedger;
import com.incidentcommander.common.ledger.IncidentSnapshot;
import com.incidentcommander.common.model.AgentRole;
import com.incidentcommander.common.model.AlertPayload;
import com.incidentcommander.common.model.Finding;
import com.incidentcommander.common.model.Incident;
import com.incidentcommander.common.model.IncidentCategory;
import com.incidentcommander.common.model.IncidentState;
import com.incidentcommander.common.model.Severity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class LedgerWriterTest {

    private static final Instant NOW = Instant.parse("2024-01-01T00:00:00Z");

    private IncidentEventPublisher publisher;
    private Incident incident;

    @BeforeEach
    void setUp() {
        publisher = mock(IncidentEventPublisher.class);
        incident = Incident.open(new AlertPayload(IncidentCategory.INFRASTRUCTURE_CASCADE, Severity.HIGH, "x", Map.of()), NOW);
    }

    private IncidentEvent event(IncidentEventType type, IncidentState state) {
        return IncidentEvent.of(type, incident.id(), 1, state, NOW);
    }

    @Nested
    @DisplayName("state machine")
    class TransitionTests {

        @Test
        @DisplayName("legal append is stored and published")
        void legalAppendPublished() {
            LedgerWriter writer = new LedgerWriter(new InMemoryIncidentLedger(), publisher);

            writer.append(IncidentEvent.opened(incident));
            IncidentEvent stored = writer.append(event(IncidentEventType.STATE_CHANGED, IncidentState.ANALYZING));

            assertEquals(2, stored.version());
            verify(publisher).publish(stored);
            verify(publisher, times(2)).publish(any());
        }

        @Test
        @DisplayName("illegal transition → IllegalStateException, nothing stored or published")
        void illegalTransitionRejected() {
            LedgerWriter writer = new LedgerWriter(new InMemoryIncidentLedger(), publisher);
            writer.append(IncidentEvent.opened(incident));

            assertThrows(IllegalStateException.class,
                () -> writer.append(event(IncidentEventType.RESOLVED, IncidentState.RESOLVED)));

            assertEquals(1, writer.history(incident.id()).size());
            verify(publisher, times(1)).publish(any());
        }

        @Test
        @DisplayName("nothing may follow a terminal state")
        void terminalIsFinal() {
            LedgerWriter writer = new LedgerWriter(new InMemoryIncidentLedger(), publisher);
            writer.append(IncidentEvent.opened(incident));
            writer.append(event(IncidentEventType.ABANDONED, IncidentState.ABANDONED));

            assertThrows(IllegalStateException.class,
                () -> writer.append(event(IncidentEventType.FINDING_RECORDED, IncidentState.ANALYZING)));
        }
    }

    @Nested
    @DisplayName("optimistic concurrency")
    class ConcurrencyTests {

        @Test
        @DisplayName("a version conflict is retried against the fresh history")
        void conflictRetried() {
            IncidentLedger ledger = mock(IncidentLedger.class);
            IncidentEvent opened = IncidentEvent.opened(incident).withVersion(1);
            IncidentEvent analyzing = event(IncidentEventType.STATE_CHANGED, IncidentState.ANALYZING);
            when(ledger.history(incident.id())).thenReturn(List.of(opened));
            when(ledger.append(eq(incident.id()), anyLong(), any()))
                .thenThrow(new LedgerVersionConflictException(incident.id(), 1, 2))
                .thenReturn(analyzing.withVersion(2));

            IncidentEvent stored = new LedgerWriter(ledger, publisher).append(analyzing);

            assertEquals(2, stored.version());
            verify(ledger, times(2)).append(eq(incident.id()), eq(1L), any());
        }

        @Test
        @DisplayName("conflicts beyond the retry budget → IllegalStateException")
        void retryBudgetExhausted() {
            IncidentLedger ledger = mock(IncidentLedger.class);
            when(ledger.history(incident.id())).thenReturn(List.of(IncidentEvent.opened(incident).withVersion(1)));
            when(ledger.append(eq(incident.id()), anyLong(), any()))
                .thenThrow(new LedgerVersionConflictException(incident.id(), 1, 2));

            LedgerWriter writer = new LedgerWriter(ledger, publisher);

            assertThrows(IllegalStateException.class,
                () -> writer.append(event(IncidentEventType.STATE_CHANGED, IncidentState.ANALYZING)));
            verify(ledger, times(LedgerWriter.MAX_ATTEMPTS)).append(eq(incident.id()), anyLong(), any());
            verifyNoInteractions(publisher);
        }

        @Test
        @DisplayName("concurrent finding appends all land with contiguous versions")
        void concurrentAppends() throws Exception {
            LedgerWriter writer = new LedgerWriter(new InMemoryIncidentLedger(), publisher);
            writer.append(IncidentEvent.opened(incident));
            writer.append(event(IncidentEventType.STATE_CHANGED, IncidentState.ANALYZING));

            int writers = 8;
            ExecutorService pool = Executors.newFixedThreadPool(writers);
            CountDownLatch start = new CountDownLatch(1);
            List<Future<IncidentEvent>> futures = new ArrayList<>();
            for (int i = 0; i < writers; i++) {
                AgentRole role = AgentRole.values()[i % AgentRole.values().length];
                Finding finding = Finding.of(role, 1, 0.5 + i * 0.01, "restart_service", "f" + i, Map.of(), NOW);
                futures.add(pool.submit(() -> {
                    start.await();
                    return writer.append(event(IncidentEventType.FINDING_RECORDED, IncidentState.ANALYZING)
                                             .withFinding(finding));
                }));
            }
            start.countDown();
            for (Future<IncidentEvent> f : futures) {
                f.get(5, TimeUnit.SECONDS);
            }
            pool.shutdown();

            List<IncidentEvent> history = writer.history(incident.id());
            assertEquals(2 + writers, history.size());
            for (int i = 0; i < history.size(); i++) {
                assertEquals(i + 1, history.get(i).version());
            }
            IncidentSnapshot snapshot = writer.snapshot(incident.id()).orElseThrow();
            assertEquals(writers, snapshot.findings().size());
        }
    }

    @Test
    @DisplayName("snapshot of an unknown incident is empty")
    void unknownSnapshot() {
        LedgerWriter writer = new LedgerWriter(new InMemoryIncidentLedger(), publisher);
        assertTrue(writer.snapshot("INC-missing").isEmpty());
    }
}
