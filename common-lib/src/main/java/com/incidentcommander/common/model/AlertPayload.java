package com.incidentcommander.common.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Inbound alert as emitted by an upstream detector. {@code evidence} is opaque to the
 * core; agents read the keys they understand and ignore the rest. Detectors that send it as
 * {@code evidence_blob} are accepted too.
 */
public record AlertPayload(
    @JsonProperty("category")    IncidentCategory category,
    @JsonProperty("severity")    Severity severity,
    @JsonProperty("description") String description,
    @JsonProperty("evidence") @JsonAlias("evidence_blob") Map<String, Object> evidence
) {}
