package com.incidentcommander.analysis.agent;

import com.incidentcommander.common.model.AgentRole;
import com.incidentcommander.common.model.Incident;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;

import static com.incidentcommander.analysis.signal.EvidenceSignals.*;

/**
 * Judges stakeholder impact. Carries no weight in the shipped categories; when a category
 * gives it one, it votes for notifying stakeholders in proportion to the users affected.
 */
@Component
public class CommunicationAgent implements AnalysisAgent {

    private static final Logger log = LoggerFactory.getLogger(CommunicationAgent.class);

    private static final double WIDE_IMPACT_USERS = 1000;

    @Override
    public AgentRole role() { return AgentRole.COMMUNICATION; }

    @Override
    public AgentReport analyze(AnalysisContext context) {
        Incident incident = context.incident();
        log.info("[CommunicationAgent] Assessing impact for incident={} round={}", incident.id(), context.round());

        double users = number(context.evidence(), AFFECTED_USERS);
        double confidence = Double.isNaN(users) ? 0.5
            : clamp(0.5 + 0.4 * Math.min(1.0, users / WIDE_IMPACT_USERS), 0.0, 0.9);

        String summary = String.format("Impact: %s users, priority %s",
            Double.isNaN(users) ? "unknown" : String.valueOf((long) users), incident.priority());
        return AgentReport.of(confidence, "notify_stakeholders", summary, Map.of(
            "priority", incident.priority().name()
        ));
    }
}
