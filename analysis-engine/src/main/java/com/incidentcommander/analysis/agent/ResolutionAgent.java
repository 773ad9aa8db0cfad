package com.incidentcommander.analysis.agent;

import com.incidentcommander.common.model.AgentRole;
import com.incidentcommander.common.model.Incident;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;

import static com.incidentcommander.analysis.signal.EvidenceSignals.*;

/**
 * Proposes the lowest-risk remediation that is known to work for the category. Confidence
 * drops when the service keeps restarting, since the usual fix is evidently not holding.
 */
@Component
public class ResolutionAgent implements AnalysisAgent {

    private static final Logger log = LoggerFactory.getLogger(ResolutionAgent.class);

    private static final double BASE_CONFIDENCE   = 0.75;
    private static final double PER_RESTART       = 0.05;
    private static final double MIN_CONFIDENCE    = 0.3;

    @Override
    public AgentRole role() { return AgentRole.RESOLUTION; }

    @Override
    public AgentReport analyze(AnalysisContext context) {
        Incident incident = context.incident();
        log.info("[ResolutionAgent] Planning remediation for incident={} round={}", incident.id(), context.round());

        Map<String, Object> evidence = context.evidence();
        String action = playbookAction(incident.category());
        double restarts = number(evidence, RESTART_COUNT);
        double penalty = Double.isNaN(restarts) ? 0.0 : restarts * PER_RESTART;
        double confidence = clamp(BASE_CONFIDENCE - penalty, MIN_CONFIDENCE, 0.95);

        String summary = String.format("Playbook for %s → %s (restarts=%s)",
            incident.category(), action, Double.isNaN(restarts) ? "N/A" : String.valueOf((long) restarts));
        return AgentReport.of(confidence, action, summary, Map.of(
            "playbook", incident.category().name(),
            "restartPenalty", penalty
        ));
    }
}
