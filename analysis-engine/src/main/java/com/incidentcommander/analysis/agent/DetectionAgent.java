package com.incidentcommander.analysis.agent;

import com.incidentcommander.common.exception.AgentException;
import com.incidentcommander.common.model.AgentRole;
import com.incidentcommander.common.model.Incident;
import com.incidentcommander.common.model.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;

import static com.incidentcommander.analysis.signal.EvidenceSignals.*;

/**
 * Confirms the alert is a real incident: the more well-known signals are past their anomaly
 * threshold, the more confident it is that the category's first-line remediation is needed.
 */
@Component
public class DetectionAgent implements AnalysisAgent {

    private static final Logger log = LoggerFactory.getLogger(DetectionAgent.class);

    private static final double BASE_CONFIDENCE     = 0.5;
    private static final double PER_ANOMALY         = 0.1;
    private static final double SEVERITY_BONUS      = 0.05;  // HIGH and above
    private static final double UNCONFIRMED_CONFIDENCE = 0.4;

    @Override
    public AgentRole role() { return AgentRole.DETECTION; }

    @Override
    public AgentReport analyze(AnalysisContext context) {
        Incident incident = context.incident();
        log.info("[DetectionAgent] Analyzing incident={} round={}", incident.id(), context.round());

        Map<String, Object> evidence = context.evidence();
        if (isBlind(evidence)) {
            throw new AgentException(role(), "No usable evidence for incident=" + incident.id());
        }

        int anomalies = anomalyCount(evidence);
        if (anomalies == 0) {
            return AgentReport.of(UNCONFIRMED_CONFIDENCE, "investigate",
                "No signal past its anomaly threshold; alert unconfirmed",
                Map.of("anomalies", 0));
        }

        double confidence = BASE_CONFIDENCE + PER_ANOMALY * anomalies
            + (incident.severity().isAtLeast(Severity.HIGH) ? SEVERITY_BONUS : 0.0);
        confidence = clamp(confidence, 0.0, 0.95);
        String action = playbookAction(incident.category());

        String summary = String.format("Confirmed %s: %d anomalous signal(s), severity=%s → %s",
            incident.category(), anomalies, incident.severity(), action);
        return AgentReport.of(confidence, action, summary, Map.of(
            "anomalies", anomalies,
            "severity",  incident.severity().name()
        ));
    }
}
