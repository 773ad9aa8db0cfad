package com.incidentcommander.analysis.agent;

import com.incidentcommander.common.exception.AgentException;
import com.incidentcommander.common.model.AgentRole;
import com.incidentcommander.common.model.Incident;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;

import static com.incidentcommander.analysis.signal.EvidenceSignals.*;

/**
 * Projects where the incident is heading from the error-rate trend. A fast-worsening error
 * rate on an already failing service points at the last deployment.
 */
@Component
public class PredictionAgent implements AnalysisAgent {

    private static final Logger log = LoggerFactory.getLogger(PredictionAgent.class);

    private static final double REGRESSION_TREND      = 0.05;
    private static final double REGRESSION_ERROR_RATE = 0.1;
    private static final double BASE_CONFIDENCE       = 0.6;
    private static final double TREND_GAIN            = 3.0;
    private static final double MAX_TREND_BONUS       = 0.3;

    @Override
    public AgentRole role() { return AgentRole.PREDICTION; }

    @Override
    public AgentReport analyze(AnalysisContext context) {
        Incident incident = context.incident();
        log.info("[PredictionAgent] Analyzing incident={} round={}", incident.id(), context.round());

        Map<String, Object> evidence = context.evidence();
        double trend = number(evidence, ERROR_RATE_TREND);
        if (Double.isNaN(trend)) {
            throw new AgentException(role(), "No errorRateTrend for incident=" + incident.id());
        }

        String outlook;
        String action;
        double confidence;
        if (trend > REGRESSION_TREND && above(evidence, ERROR_RATE, REGRESSION_ERROR_RATE)) {
            outlook    = "regression, worsening";
            action     = "rollback_deployment";
            confidence = BASE_CONFIDENCE + Math.min(MAX_TREND_BONUS, trend * TREND_GAIN);
        } else if (trend > 0) {
            outlook    = "worsening";
            action     = playbookAction(incident.category());
            confidence = BASE_CONFIDENCE + Math.min(MAX_TREND_BONUS, trend * TREND_GAIN) / 2;
        } else {
            outlook    = "stable or recovering";
            action     = playbookAction(incident.category());
            confidence = BASE_CONFIDENCE - 0.1;
        }
        confidence = clamp(confidence, 0.0, 0.95);

        String summary = String.format("Outlook: %s (trend=%+.3f/min) → %s", outlook, trend, action);
        return AgentReport.of(confidence, action, summary, Map.of(
            "errorRateTrend", trend,
            "outlook",        outlook
        ));
    }
}
