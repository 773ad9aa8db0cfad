package com.incidentcommander.common.breaker;

import com.incidentcommander.common.exception.AgentException;
import com.incidentcommander.common.model.AgentRole;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.event.CircuitBreakerOnStateTransitionEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Failure isolation for one agent role, shared by every incident that dispatches to it.
 *
 * <p>Backed by a Resilience4j {@link CircuitBreaker} configured by
 * {@link CircuitBreakerConfig#toResilience4j()}. The cooldown is measured on the injected
 * {@link Clock}: an elapsed cooldown moves the breaker to HALF_OPEN in
 * {@link #tryAcquirePermission()}, there is no timer thread.
 */
public final class AgentCircuitBreaker {

    private static final Logger log = LoggerFactory.getLogger(AgentCircuitBreaker.class);

    private final AgentRole role;
    private final CircuitBreakerConfig config;
    private final CircuitBreaker delegate;
    private final Clock clock;
    // serialises the lazy OPEN → HALF_OPEN check with operator resets
    private final ReentrantLock transitionLock = new ReentrantLock();

    private final AtomicInteger consecutiveFailures = new AtomicInteger();
    private final AtomicLong totalCalls = new AtomicLong();
    private final AtomicLong successes = new AtomicLong();
    private final AtomicLong failures = new AtomicLong();
    private final AtomicLong rejected = new AtomicLong();
    private volatile Instant lastTransitionAt;

    public AgentCircuitBreaker(AgentRole role, CircuitBreakerConfig config, Clock clock) {
        this(role, config, CircuitBreaker.of(role.name(), config.toResilience4j()), clock);
    }

    AgentCircuitBreaker(AgentRole role, CircuitBreakerConfig config, CircuitBreaker delegate, Clock clock) {
        this.role = role;
        this.config = config;
        this.delegate = delegate;
        this.clock = clock;
        this.lastTransitionAt = clock.instant();
        delegate.getEventPublisher().onStateTransition(this::onTransition);
    }

    public AgentRole role() {
        return role;
    }

    /**
     * Returns {@code false} while OPEN and the cooldown has not elapsed; the rejection is counted.
     * An elapsed cooldown moves the breaker to HALF_OPEN and admits a single trial call.
     */
    public boolean tryAcquirePermission() {
        transitionLock.lock();
        try {
            if (delegate.getState() == CircuitBreaker.State.OPEN && cooldownElapsed()) {
                delegate.transitionToHalfOpenState();
            }
            boolean permitted = delegate.tryAcquirePermission();
            if (!permitted) {
                rejected.incrementAndGet();
            }
            return permitted;
        } finally {
            transitionLock.unlock();
        }
    }

    public void recordSuccess() {
        totalCalls.incrementAndGet();
        successes.incrementAndGet();
        consecutiveFailures.set(0);
        delegate.onSuccess(0, TimeUnit.NANOSECONDS);
    }

    public void recordFailure() {
        totalCalls.incrementAndGet();
        failures.incrementAndGet();
        int streak = consecutiveFailures.incrementAndGet();
        delegate.onError(0, TimeUnit.NANOSECONDS, new AgentException(role, "dispatch failed"));
        if (delegate.getState() == CircuitBreaker.State.CLOSED) {
            log.debug("[CircuitBreaker] failure recorded role={} consecutive={}/{}",
                      role, streak, config.failureThreshold());
        }
    }

    /** Operator reset: back to CLOSED with the failure streak cleared; lifetime counters kept. */
    public void reset() {
        transitionLock.lock();
        try {
            consecutiveFailures.set(0);
            delegate.reset();
            lastTransitionAt = clock.instant();
            log.info("[CircuitBreaker] reset → CLOSED role={}", role);
        } finally {
            transitionLock.unlock();
        }
    }

    public CircuitState state() {
        return switch (delegate.getState()) {
            case OPEN, FORCED_OPEN -> CircuitState.OPEN;
            case HALF_OPEN         -> CircuitState.HALF_OPEN;
            default                -> CircuitState.CLOSED;
        };
    }

    public CircuitBreakerSnapshot snapshot() {
        return new CircuitBreakerSnapshot(role, state(), consecutiveFailures.get(), lastTransitionAt,
                                          totalCalls.get(), successes.get(), failures.get(), rejected.get());
    }

    private boolean cooldownElapsed() {
        return Duration.between(lastTransitionAt, clock.instant()).compareTo(config.cooldown()) >= 0;
    }

    private void onTransition(CircuitBreakerOnStateTransitionEvent event) {
        lastTransitionAt = clock.instant();
        CircuitBreaker.State from = event.getStateTransition().getFromState();
        CircuitBreaker.State to = event.getStateTransition().getToState();
        if (to == CircuitBreaker.State.OPEN) {
            log.warn("[CircuitBreaker] {} → OPEN role={} consecutiveFailures={} cooldown={}",
                     from, role, consecutiveFailures.get(), config.cooldown());
        } else {
            log.info("[CircuitBreaker] {} → {} role={}", from, to, role);
        }
    }
}
