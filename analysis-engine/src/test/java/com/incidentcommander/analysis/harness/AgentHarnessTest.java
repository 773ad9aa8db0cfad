package com.incidentcommander.analysis.harness;

import com.incidentcommander.analysis.StubAgent;
import com.incidentcommander.analysis.agent.AgentReport;
import com.incidentcommander.analysis.agent.AnalysisContext;
import com.incidentcommander.common.breaker.CircuitBreakerConfig;
import com.incidentcommander.common.breaker.CircuitBreakerRegistry;
import com.incidentcommander.common.exception.AgentException;
import com.incidentcommander.common.model.AgentDescriptor;
import com.incidentcommander.common.model.AgentRole;
import com.incidentcommander.common.model.AlertPayload;
import com.incidentcommander.common.model.DispatchOutcome;
import com.incidentcommander.common.model.FailureKind;
import com.incidentcommander.common.model.Incident;
import com.incidentcommander.common.model.IncidentCategory;
import com.incidentcommander.common.model.Severity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class AgentHarnessTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-01-01T00:00:00Z"), ZoneOffset.UTC);

    private CircuitBreakerRegistry breakers;
    private AgentHarness harness;
    private AnalysisContext context;

    @BeforeEach
    void setUp() {
        breakers = new CircuitBreakerRegistry(CircuitBreakerConfig.defaults(), CLOCK);
        harness = new AgentHarness(breakers, CLOCK);
        Incident incident = Incident.open(new AlertPayload(IncidentCategory.LATENCY_DEGRADATION, Severity.HIGH,
                                                           "p99 spike", Map.of("latencyP99Ms", 2500)), CLOCK.instant());
        context = new AnalysisContext(incident, 1);
    }

    private static AgentDescriptor descriptor(AgentRole role, int maxRetries) {
        return new AgentDescriptor(role, 0.4, Duration.ofSeconds(2), maxRetries);
    }

    @Nested
    @DisplayName("success")
    class SuccessTests {

        @Test
        @DisplayName("valid report → Finding with digest, breaker success recorded")
        void validReport() {
            StubAgent agent = StubAgent.answering(AgentRole.DIAGNOSIS, 0.82, "clear_cache");

            StepVerifier.create(harness.invoke(agent, descriptor(AgentRole.DIAGNOSIS, 1), context, Duration.ofSeconds(1)))
                .assertNext(outcome -> {
                    assertTrue(outcome.isSuccess());
                    assertEquals(0.82, outcome.finding().confidence());
                    assertEquals(1, outcome.finding().round());
                    assertEquals(CLOCK.instant(), outcome.finding().producedAt());
                    assertTrue(outcome.finding().digestMatches());
                })
                .verifyComplete();

            assertEquals(1, breakers.forRole(AgentRole.DIAGNOSIS).snapshot().successes());
        }

        @Test
        @DisplayName("provider error then success within retry budget → Finding")
        void retryRecovers() {
            StubAgent agent = new StubAgent(AgentRole.PREDICTION, n -> {
                if (n == 1) throw new AgentException(AgentRole.PREDICTION, "provider hiccup");
                return AgentReport.of(0.7, "scale_service", "second try", Map.of());
            });

            StepVerifier.create(harness.invoke(agent, descriptor(AgentRole.PREDICTION, 1), context, Duration.ofSeconds(1)))
                .assertNext(outcome -> assertTrue(outcome.isSuccess()))
                .verifyComplete();

            assertEquals(2, agent.calls());
            // one dispatch, one verdict
            assertEquals(1, breakers.forRole(AgentRole.PREDICTION).snapshot().totalCalls());
            assertEquals(0, breakers.forRole(AgentRole.PREDICTION).snapshot().failures());
        }
    }

    @Nested
    @DisplayName("failures")
    class FailureTests {

        @Test
        @DisplayName("errors beyond maxRetries → PROVIDER_ERROR with the agent's message")
        void retriesExhausted() {
            StubAgent agent = new StubAgent(AgentRole.DETECTION, n -> {
                throw new AgentException(AgentRole.DETECTION, "provider down");
            });

            DispatchOutcome outcome = harness.invoke(agent, descriptor(AgentRole.DETECTION, 2), context,
                                                     Duration.ofSeconds(1)).block();

            assertNotNull(outcome);
            assertEquals(FailureKind.PROVIDER_ERROR, outcome.failure().kind());
            assertTrue(outcome.failure().detail().contains("provider down"));
            assertEquals(3, agent.calls());
            assertEquals(1, breakers.forRole(AgentRole.DETECTION).snapshot().failures());
        }

        @Test
        @DisplayName("slow agent → TIMEOUT, not retried")
        void timeout() {
            StubAgent agent = StubAgent.sleeping(AgentRole.DIAGNOSIS, 1_000, 0.9, "scale_service");

            DispatchOutcome outcome = harness.invoke(agent, descriptor(AgentRole.DIAGNOSIS, 3), context,
                                                     Duration.ofMillis(100)).block();

            assertNotNull(outcome);
            assertEquals(FailureKind.TIMEOUT, outcome.failure().kind());
            assertEquals(1, agent.calls());
        }

        @Test
        @DisplayName("NaN confidence → INVALID_OUTPUT, not retried, breaker failure recorded")
        void invalidConfidence() {
            StubAgent agent = StubAgent.answering(AgentRole.RESOLUTION, Double.NaN, "restart_service");

            DispatchOutcome outcome = harness.invoke(agent, descriptor(AgentRole.RESOLUTION, 3), context,
                                                     Duration.ofSeconds(1)).block();

            assertNotNull(outcome);
            assertEquals(FailureKind.INVALID_OUTPUT, outcome.failure().kind());
            assertEquals(1, agent.calls());
            assertEquals(1, breakers.forRole(AgentRole.RESOLUTION).snapshot().consecutiveFailures());
        }

        @Test
        @DisplayName("null report → INVALID_OUTPUT")
        void nullReport() {
            StubAgent agent = new StubAgent(AgentRole.RESOLUTION, n -> null);

            DispatchOutcome outcome = harness.invoke(agent, descriptor(AgentRole.RESOLUTION, 0), context,
                                                     Duration.ofSeconds(1)).block();

            assertNotNull(outcome);
            assertEquals(FailureKind.INVALID_OUTPUT, outcome.failure().kind());
        }

        @Test
        @DisplayName("free-text action → INVALID_OUTPUT")
        void malformedAction() {
            StubAgent agent = StubAgent.answering(AgentRole.DIAGNOSIS, 0.9, "Please restart the service");

            DispatchOutcome outcome = harness.invoke(agent, descriptor(AgentRole.DIAGNOSIS, 0), context,
                                                     Duration.ofSeconds(1)).block();

            assertNotNull(outcome);
            assertEquals(FailureKind.INVALID_OUTPUT, outcome.failure().kind());
        }
    }
}
