package com.incidentcommander.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One agent's validated analysis output for one round. Produced only by the agent harness
 * after strict validation; never mutated afterwards.
 *
 * <p>{@code digest} is a SHA-256 over the content fields (see {@link FindingDigests}) and is
 * re-verified whenever a ledger history is replayed.
 */
public record Finding(
    @JsonProperty("role")              AgentRole role,
    @JsonProperty("round")             int round,
    @JsonProperty("confidence")        double confidence,
    @JsonProperty("recommendedAction") String recommendedAction,
    @JsonProperty("summary")           String summary,
    @JsonProperty("evidence")          Map<String, Object> evidence,
    @JsonProperty("producedAt")        Instant producedAt,
    @JsonProperty("digest")            String digest
) {
    public Finding {
        evidence = evidence == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(evidence));
        summary = summary == null ? "" : summary;
    }

    public static Finding of(AgentRole role, int round, double confidence, String recommendedAction,
                             String summary, Map<String, Object> evidence, Instant producedAt) {
        String digest = FindingDigests.compute(role, round, confidence, recommendedAction, evidence);
        return new Finding(role, round, confidence, recommendedAction, summary, evidence, producedAt, digest);
    }

    public boolean digestMatches() {
        return FindingDigests.compute(role, round, confidence, recommendedAction, evidence).equals(digest);
    }
}
