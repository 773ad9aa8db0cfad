package com.incidentcommander.common.model;

/** Why a single agent dispatch produced no finding. */
public enum FailureKind {
    /** The agent did not answer inside its deadline. */
    TIMEOUT,
    /** The agent threw, on every permitted attempt. */
    PROVIDER_ERROR,
    /** The agent answered, but the answer failed the strict finding schema. */
    INVALID_OUTPUT
}
