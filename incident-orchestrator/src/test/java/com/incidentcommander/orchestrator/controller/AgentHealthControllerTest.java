package com.incidentcommander.orchestrator.controller;

import com.incidentcommander.common.breaker.CircuitBreakerConfig;
import com.incidentcommander.common.breaker.CircuitBreakerRegistry;
import com.incidentcommander.common.model.AgentRole;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.time.Clock;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;

class AgentHealthControllerTest {

    private CircuitBreakerRegistry breakers;
    private WebTestClient client;

    @BeforeEach
    void setUp() {
        breakers = new CircuitBreakerRegistry(new CircuitBreakerConfig(1, Duration.ofMinutes(5)), Clock.systemUTC());
        client = WebTestClient.bindToController(new AgentHealthController(breakers)).build();
    }

    @Test
    @DisplayName("GET lists a breaker for every role, including never-used ones")
    void listsAllRoles() {
        breakers.forRole(AgentRole.PREDICTION).recordFailure();

        client.get().uri("/api/v1/agents/circuit-breakers")
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.length()").isEqualTo(AgentRole.values().length)
            .jsonPath("$[2].role").isEqualTo("PREDICTION")
            .jsonPath("$[2].state").isEqualTo("OPEN")
            .jsonPath("$[0].state").isEqualTo("CLOSED");
    }

    @Test
    @DisplayName("POST reset closes an open breaker")
    void reset() {
        breakers.forRole(AgentRole.DIAGNOSIS).recordFailure();

        client.post().uri("/api/v1/agents/circuit-breakers/DIAGNOSIS/reset")
            .exchange()
            .expectStatus().isOk()
            .expectBody().jsonPath("$.state").isEqualTo("CLOSED");

        assertEquals("CLOSED", breakers.forRole(AgentRole.DIAGNOSIS).state().name());
    }
}
