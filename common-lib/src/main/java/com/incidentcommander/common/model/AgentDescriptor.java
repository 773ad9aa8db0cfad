package com.incidentcommander.common.model;

import java.time.Duration;
import java.util.Objects;

/**
 * Static configuration of one agent for one incident category.
 *
 * <p>Weights are domain-expertise proxies fixed at configuration time. A weight of
 * {@code 0.0} marks the role as unused for the category: it is never dispatched.
 */
public record AgentDescriptor(
    AgentRole role,
    double weight,
    Duration timeout,
    int maxRetries
) {
    public AgentDescriptor {
        Objects.requireNonNull(role, "role");
        Objects.requireNonNull(timeout, "timeout");
        if (Double.isNaN(weight) || weight < 0.0 || weight > 1.0) {
            throw new IllegalArgumentException("weight must be in [0,1] for " + role + ": " + weight);
        }
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive for " + role);
        }
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0 for " + role);
        }
    }

    public boolean isActive() {
        return weight > 0.0;
    }
}
