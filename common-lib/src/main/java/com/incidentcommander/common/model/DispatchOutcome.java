package com.incidentcommander.common.model;

import java.util.Objects;

/**
 * Result of one agent harness call: exactly one of {@code finding} or {@code failure} is set.
 */
public record DispatchOutcome(
    AgentRole role,
    Finding finding,
    DispatchFailure failure
) {
    public DispatchOutcome {
        Objects.requireNonNull(role, "role");
        if ((finding == null) == (failure == null)) {
            throw new IllegalArgumentException("exactly one of finding/failure must be present for " + role);
        }
    }

    public static DispatchOutcome success(Finding finding) {
        return new DispatchOutcome(finding.role(), finding, null);
    }

    public static DispatchOutcome failure(DispatchFailure failure) {
        return new DispatchOutcome(failure.role(), null, failure);
    }

    public boolean isSuccess() {
        return finding != null;
    }
}
