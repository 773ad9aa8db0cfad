package com.incidentcommander.common.breaker;

import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig.SlidingWindowType;

import java.time.Duration;
import java.util.Objects;

public record CircuitBreakerConfig(
    int failureThreshold,
    Duration cooldown
) {
    public static final int      DEFAULT_FAILURE_THRESHOLD = 5;
    public static final Duration DEFAULT_COOLDOWN          = Duration.ofSeconds(30);

    private static final Duration MIN_WAIT = Duration.ofMillis(1);

    public CircuitBreakerConfig {
        Objects.requireNonNull(cooldown, "cooldown");
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("failureThreshold must be >= 1: " + failureThreshold);
        }
        if (cooldown.isNegative()) {
            throw new IllegalArgumentException("cooldown must not be negative");
        }
    }

    public static CircuitBreakerConfig defaults() {
        return new CircuitBreakerConfig(DEFAULT_FAILURE_THRESHOLD, DEFAULT_COOLDOWN);
    }

    /**
     * A count window as wide as the threshold with a 100% failure rate trips on exactly
     * {@code failureThreshold} consecutive failures. HALF_OPEN admits a single trial call.
     */
    public io.github.resilience4j.circuitbreaker.CircuitBreakerConfig toResilience4j() {
        return io.github.resilience4j.circuitbreaker.CircuitBreakerConfig.custom()
            .slidingWindowType(SlidingWindowType.COUNT_BASED)
            .slidingWindowSize(failureThreshold)
            .minimumNumberOfCalls(failureThreshold)
            .failureRateThreshold(100.0f)
            .waitDurationInOpenState(cooldown.compareTo(MIN_WAIT) < 0 ? MIN_WAIT : cooldown)
            .permittedNumberOfCallsInHalfOpenState(1)
            .automaticTransitionFromOpenToHalfOpenEnabled(false)
            .writableStackTraceEnabled(false)
            .build();
    }
}
