package com.incidentcommander.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Immutable identity and attributes of an incident. The current lifecycle state is not
 * held here; it is reconstructed from the ledger (see {@code IncidentSnapshot}).
 */
public record Incident(
    @JsonProperty("id")          String id,
    @JsonProperty("category")    IncidentCategory category,
    @JsonProperty("severity")    Severity severity,
    @JsonProperty("description") String description,
    @JsonProperty("evidence")    Map<String, Object> evidence,
    @JsonProperty("openedAt")    Instant openedAt
) {
    public Incident {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(category, "category");
        Objects.requireNonNull(severity, "severity");
        Objects.requireNonNull(openedAt, "openedAt");
        evidence = evidence == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(evidence));
        description = description == null ? "" : description;
    }

    public static Incident open(AlertPayload alert, Instant openedAt) {
        return new Incident("INC-" + UUID.randomUUID(), alert.category(), alert.severity(),
                            alert.description(), alert.evidence(), openedAt);
    }

    @JsonIgnore
    public IncidentPriority priority() {
        return severity.priority();
    }
}
