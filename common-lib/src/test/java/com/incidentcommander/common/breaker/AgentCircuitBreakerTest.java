package com.incidentcommander.common.breaker;

import com.incidentcommander.common.model.AgentRole;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class AgentCircuitBreakerTest {

    private MutableClock clock;
    private AgentCircuitBreaker breaker;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
        breaker = new AgentCircuitBreaker(AgentRole.DIAGNOSIS,
                                          new CircuitBreakerConfig(5, Duration.ofSeconds(30)), clock);
    }

    private void fail(int times) {
        for (int i = 0; i < times; i++) {
            breaker.recordFailure();
        }
    }

    // ── CLOSED ────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("CLOSED")
    class ClosedTests {

        @Test
        @DisplayName("four consecutive failures keep the breaker closed")
        void belowThresholdStaysClosed() {
            fail(4);
            assertEquals(CircuitState.CLOSED, breaker.state());
            assertTrue(breaker.tryAcquirePermission());
        }

        @Test
        @DisplayName("fifth consecutive failure trips to OPEN")
        void thresholdTrips() {
            fail(5);
            assertEquals(CircuitState.OPEN, breaker.state());
            assertFalse(breaker.tryAcquirePermission());
            assertEquals(1, breaker.snapshot().rejected());
        }

        @Test
        @DisplayName("a success clears the failure streak")
        void successResetsStreak() {
            fail(4);
            breaker.recordSuccess();
            fail(4);
            assertEquals(CircuitState.CLOSED, breaker.state());
            assertEquals(4, breaker.snapshot().consecutiveFailures());
        }
    }

    // ── OPEN / HALF_OPEN ──────────────────────────────────────────────────

    @Nested
    @DisplayName("OPEN and HALF_OPEN")
    class OpenTests {

        @BeforeEach
        void trip() {
            fail(5);
        }

        @Test
        @DisplayName("still rejected one second before the cooldown ends")
        void rejectedDuringCooldown() {
            clock.advance(Duration.ofSeconds(29));
            assertFalse(breaker.tryAcquirePermission());
            assertEquals(CircuitState.OPEN, breaker.state());
        }

        @Test
        @DisplayName("cooldown elapsed → next permission check moves to HALF_OPEN")
        void cooldownMovesToHalfOpen() {
            clock.advance(Duration.ofSeconds(30));
            assertEquals(CircuitState.OPEN, breaker.state());
            assertTrue(breaker.tryAcquirePermission());
            assertEquals(CircuitState.HALF_OPEN, breaker.state());
        }

        @Test
        @DisplayName("HALF_OPEN admits a single trial call until its outcome is recorded")
        void halfOpenSingleTrialCall() {
            clock.advance(Duration.ofSeconds(30));
            assertTrue(breaker.tryAcquirePermission());
            assertFalse(breaker.tryAcquirePermission());
            assertEquals(CircuitState.HALF_OPEN, breaker.state());
        }

        @Test
        @DisplayName("HALF_OPEN + success → CLOSED")
        void halfOpenSuccessCloses() {
            clock.advance(Duration.ofSeconds(30));
            breaker.tryAcquirePermission();
            breaker.recordSuccess();
            assertEquals(CircuitState.CLOSED, breaker.state());
            assertEquals(0, breaker.snapshot().consecutiveFailures());
        }

        @Test
        @DisplayName("HALF_OPEN + failure → OPEN with a fresh cooldown")
        void halfOpenFailureReopens() {
            clock.advance(Duration.ofSeconds(30));
            breaker.tryAcquirePermission();
            breaker.recordFailure();
            assertEquals(CircuitState.OPEN, breaker.state());

            clock.advance(Duration.ofSeconds(29));
            assertFalse(breaker.tryAcquirePermission());
        }

        @Test
        @DisplayName("operator reset → CLOSED immediately, lifetime counters kept")
        void resetCloses() {
            breaker.reset();
            assertEquals(CircuitState.CLOSED, breaker.state());
            assertTrue(breaker.tryAcquirePermission());
            assertEquals(5, breaker.snapshot().failures());
        }
    }

    // ── registry ──────────────────────────────────────────────────────────

    @Nested
    @DisplayName("CircuitBreakerRegistry")
    class RegistryTests {

        @Test
        @DisplayName("one breaker per role, independent of each other")
        void breakersAreIndependent() {
            CircuitBreakerRegistry registry = new CircuitBreakerRegistry(new CircuitBreakerConfig(2, Duration.ofSeconds(30)), clock);

            registry.forRole(AgentRole.DETECTION).recordFailure();
            registry.forRole(AgentRole.DETECTION).recordFailure();

            assertSame(registry.forRole(AgentRole.DETECTION), registry.forRole(AgentRole.DETECTION));
            assertEquals(CircuitState.OPEN, registry.forRole(AgentRole.DETECTION).state());
            assertEquals(CircuitState.CLOSED, registry.forRole(AgentRole.PREDICTION).state());
        }

        @Test
        @DisplayName("a breaker sliding past an old success trips on the threshold-th consecutive failure")
        void trailingSuccessFallsOutOfWindow() {
            CircuitBreakerRegistry registry = new CircuitBreakerRegistry(new CircuitBreakerConfig(3, Duration.ofSeconds(30)), clock);
            AgentCircuitBreaker b = registry.forRole(AgentRole.DIAGNOSIS);

            b.recordSuccess();
            b.recordFailure();
            b.recordFailure();
            assertEquals(CircuitState.CLOSED, b.state());

            b.recordFailure();
            assertEquals(CircuitState.OPEN, b.state());
            assertEquals(clock.instant(), b.snapshot().lastTransitionAt());
        }

        @Test
        @DisplayName("snapshots are sorted by role and reset reopens dispatch")
        void snapshotsAndReset() {
            CircuitBreakerRegistry registry = new CircuitBreakerRegistry(new CircuitBreakerConfig(1, Duration.ofSeconds(30)), clock);
            registry.forRole(AgentRole.RESOLUTION).recordFailure();
            registry.forRole(AgentRole.DETECTION).recordSuccess();

            assertEquals(AgentRole.DETECTION, registry.snapshots().get(0).role());
            assertFalse(registry.snapshots().get(1).healthy());

            registry.reset(AgentRole.RESOLUTION);
            assertTrue(registry.forRole(AgentRole.RESOLUTION).tryAcquirePermission());
        }
    }

    @Test
    @DisplayName("concurrent bookkeeping loses no updates")
    void concurrentRecording() throws InterruptedException {
        AgentCircuitBreaker shared = new AgentCircuitBreaker(AgentRole.PREDICTION,
                                                             new CircuitBreakerConfig(5, Duration.ofSeconds(30)), clock);
        ExecutorService pool = Executors.newFixedThreadPool(8);
        for (int i = 0; i < 1000; i++) {
            boolean ok = i % 2 == 0;
            pool.submit(() -> {
                if (ok) shared.recordSuccess();
                else shared.recordFailure();
            });
        }
        pool.shutdown();
        assertTrue(pool.awaitTermination(10, TimeUnit.SECONDS));

        CircuitBreakerSnapshot snapshot = shared.snapshot();
        assertEquals(1000, snapshot.totalCalls());
        assertEquals(500, snapshot.successes());
        assertEquals(500, snapshot.failures());
    }
}
