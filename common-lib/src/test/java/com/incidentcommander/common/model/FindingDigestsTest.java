package com.incidentcommander.common.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class FindingDigestsTest {

    @Test
    @DisplayName("digest is 64 hex characters")
    void sha256Hex() {
        String digest = FindingDigests.compute(AgentRole.DETECTION, 1, 0.5, "investigate", Map.of());
        assertEquals(64, digest.length());
        assertTrue(digest.matches("[0-9a-f]+"));
    }

    @Test
    @DisplayName("evidence insertion order does not change the digest")
    void evidenceOrderIndependent() {
        Map<String, Object> a = new LinkedHashMap<>();
        a.put("errorRate", 0.4);
        a.put("latencyP99Ms", 1200);
        Map<String, Object> b = new LinkedHashMap<>();
        b.put("latencyP99Ms", 1200);
        b.put("errorRate", 0.4);

        assertEquals(FindingDigests.compute(AgentRole.DIAGNOSIS, 1, 0.8, "restart_service", a),
                     FindingDigests.compute(AgentRole.DIAGNOSIS, 1, 0.8, "restart_service", b));
    }

    @Test
    @DisplayName("any content change changes the digest")
    void contentSensitive() {
        String base = FindingDigests.compute(AgentRole.DIAGNOSIS, 1, 0.8, "restart_service", Map.of());
        assertNotEquals(base, FindingDigests.compute(AgentRole.DIAGNOSIS, 1, 0.81, "restart_service", Map.of()));
        assertNotEquals(base, FindingDigests.compute(AgentRole.DIAGNOSIS, 2, 0.8, "restart_service", Map.of()));
        assertNotEquals(base, FindingDigests.compute(AgentRole.DIAGNOSIS, 1, 0.8, "scale_service", Map.of()));
    }

    @Test
    @DisplayName("Finding.of stamps a digest that verifies")
    void findingVerifies() {
        Finding f = Finding.of(AgentRole.PREDICTION, 1, 0.7, "scale_service", "trend up",
                               Map.of("errorRateTrend", 0.2), Instant.EPOCH);
        assertTrue(f.digestMatches());
    }

    @Test
    @DisplayName("severity maps to priority and orders LOW < CRITICAL")
    void severityPriority() {
        assertEquals(IncidentPriority.P1, Severity.CRITICAL.priority());
        assertEquals(IncidentPriority.P4, Severity.LOW.priority());
        assertTrue(Severity.HIGH.isAtLeast(Severity.MEDIUM));
        assertFalse(Severity.LOW.isAtLeast(Severity.HIGH));
    }
}
