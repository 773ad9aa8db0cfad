package com.incidentcommander.analysis.agent;

import com.incidentcommander.common.model.Incident;

import java.util.Map;

/** Read-only view an agent gets of the incident for one round. */
public record AnalysisContext(
    Incident incident,
    int round
) {
    public Map<String, Object> evidence() {
        return incident.evidence();
    }
}
