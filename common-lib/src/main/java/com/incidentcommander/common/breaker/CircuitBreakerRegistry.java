package com.incidentcommander.common.breaker;

import com.incidentcommander.common.model.AgentRole;

import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Explicit home of all per-agent breakers. Injected wherever dispatch decisions are made,
 * never reached through static state. The underlying Resilience4j breakers are created by,
 * and named after their role in, one Resilience4j registry.
 */
public class CircuitBreakerRegistry {

    private final CircuitBreakerConfig config;
    private final Clock clock;
    private final io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry delegate;
    private final ConcurrentMap<AgentRole, AgentCircuitBreaker> breakers = new ConcurrentHashMap<>();

    public CircuitBreakerRegistry(CircuitBreakerConfig config, Clock clock) {
        this.config = config;
        this.clock = clock;
        this.delegate = io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry.of(config.toResilience4j());
    }

    public AgentCircuitBreaker forRole(AgentRole role) {
        return breakers.computeIfAbsent(role,
            r -> new AgentCircuitBreaker(r, config, delegate.circuitBreaker(r.name()), clock));
    }

    public List<CircuitBreakerSnapshot> snapshots() {
        return breakers.values().stream()
            .map(AgentCircuitBreaker::snapshot)
            .sorted(Comparator.comparing(CircuitBreakerSnapshot::role))
            .toList();
    }

    public void reset(AgentRole role) {
        forRole(role).reset();
    }

    public CircuitBreakerConfig config() {
        return config;
    }
}
