package com.incidentcommander.common.consensus;

import com.incidentcommander.common.model.AgentRole;
import com.incidentcommander.common.model.Finding;

import java.util.List;

/**
 * Flags findings whose confidence sits far from the round's median. Audit signal only:
 * flagged roles keep their weight and their vote.
 */
public final class FaultSuspicionDetector {

    static final double MAX_MEDIAN_DEVIATION = 0.3;
    static final int    MIN_SAMPLE           = 3;

    private FaultSuspicionDetector() {}

    public static List<AgentRole> suspects(List<Finding> findings) {
        if (findings.size() < MIN_SAMPLE) {
            return List.of();
        }
        double[] sorted = findings.stream().mapToDouble(Finding::confidence).sorted().toArray();
        int mid = sorted.length / 2;
        double median = sorted.length % 2 == 1 ? sorted[mid] : (sorted[mid - 1] + sorted[mid]) / 2.0;
        return findings.stream()
            .filter(f -> Math.abs(f.confidence() - median) > MAX_MEDIAN_DEVIATION)
            .map(Finding::role)
            .toList();
    }
}
