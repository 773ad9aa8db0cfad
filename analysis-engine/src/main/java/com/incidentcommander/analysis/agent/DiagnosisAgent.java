package com.incidentcommander.analysis.agent;

import com.incidentcommander.common.exception.AgentException;
import com.incidentcommander.common.model.AgentRole;
import com.incidentcommander.common.model.Incident;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

import static com.incidentcommander.analysis.signal.EvidenceSignals.*;

/**
 * Root-cause analysis. Maps the strongest evidence pattern of the category to the
 * remediation that addresses the cause rather than the symptom.
 */
@Component
public class DiagnosisAgent implements AnalysisAgent {

    private static final Logger log = LoggerFactory.getLogger(DiagnosisAgent.class);

    private static final double CREDENTIAL_STUFFING_LOGINS = 500;
    private static final double CRITICAL_MEMORY            = 0.9;
    private static final double LEAK_RESTARTS              = 3;
    private static final double CACHE_LATENCY_MS           = 2000;
    private static final double LOW_ERROR_RATE             = 0.01;

    @Override
    public AgentRole role() { return AgentRole.DIAGNOSIS; }

    @Override
    public AgentReport analyze(AnalysisContext context) {
        Incident incident = context.incident();
        log.info("[DiagnosisAgent] Analyzing incident={} category={} round={}",
                 incident.id(), incident.category(), context.round());

        Map<String, Object> evidence = context.evidence();
        if (isBlind(evidence)) {
            throw new AgentException(role(), "No usable evidence for incident=" + incident.id());
        }

        Diagnosis d = switch (incident.category()) {
            case SECURITY               -> diagnoseSecurity(evidence);
            case RESOURCE_EXHAUSTION    -> diagnoseResources(evidence);
            case INFRASTRUCTURE_CASCADE -> diagnoseCascade(evidence);
            case LATENCY_DEGRADATION    -> diagnoseLatency(evidence);
        };

        Map<String, Object> out = new LinkedHashMap<>();
        out.put("rootCause", d.rootCause());
        out.put("anomalies", anomalyCount(evidence));
        return AgentReport.of(d.confidence(), d.action(),
            String.format("Root cause: %s → %s", d.rootCause(), d.action()), out);
    }

    private Diagnosis diagnoseSecurity(Map<String, Object> e) {
        double logins = number(e, FAILED_LOGINS);
        if (logins > CREDENTIAL_STUFFING_LOGINS) {
            return new Diagnosis("credential stuffing", "rotate_credentials", 0.9);
        }
        if (logins > SUSPICIOUS_LOGINS) {
            return new Diagnosis("brute-force on exposed host", "isolate_host", 0.8);
        }
        return new Diagnosis("unclassified security signal", "investigate", 0.5);
    }

    private Diagnosis diagnoseResources(Map<String, Object> e) {
        double memory = number(e, MEMORY_UTILIZATION);
        if (memory > CRITICAL_MEMORY && number(e, RESTART_COUNT) >= LEAK_RESTARTS) {
            return new Diagnosis("memory leak", "restart_service", 0.85);
        }
        if (memory > CRITICAL_MEMORY) {
            return new Diagnosis("memory limit too low", "increase_resources", 0.85);
        }
        if (above(e, CPU_UTILIZATION, HIGH_CPU)) {
            return new Diagnosis("cpu saturation", "scale_service", 0.8);
        }
        return new Diagnosis("resource pressure below saturation", "investigate", 0.45);
    }

    private Diagnosis diagnoseCascade(Map<String, Object> e) {
        double deps = number(e, DEPENDENCY_FAILURES);
        if (deps >= CASCADE_DEPENDENCIES) {
            return new Diagnosis("failing downstream dependency", "enable_circuit_breaker", 0.85);
        }
        if (above(e, ERROR_RATE, HIGH_ERROR_RATE)) {
            return new Diagnosis("unhealthy service instance", "restart_service", 0.7);
        }
        return new Diagnosis("cascade not reproduced", "investigate", 0.45);
    }

    private Diagnosis diagnoseLatency(Map<String, Object> e) {
        if (above(e, CPU_UTILIZATION, HIGH_CPU)) {
            return new Diagnosis("compute-bound request path", "scale_service", 0.8);
        }
        double errorRate = number(e, ERROR_RATE);
        if (above(e, LATENCY_P99_MS, CACHE_LATENCY_MS) && !(errorRate > LOW_ERROR_RATE)) {
            return new Diagnosis("cold or poisoned cache", "clear_cache", 0.75);
        }
        if (above(e, LATENCY_P99_MS, HIGH_LATENCY_MS)) {
            return new Diagnosis("overloaded zone", "drain_traffic", 0.7);
        }
        return new Diagnosis("latency within tolerance", "investigate", 0.4);
    }

    private record Diagnosis(String rootCause, String action, double confidence) {}
}
