package com.incidentcommander.orchestrator.config;

import com.incidentcommander.common.model.AgentRole;
import com.incidentcommander.common.model.IncidentCategory;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Typed binding of everything under {@code incident-commander.*}.
 * Validated once at startup when {@code CategoryPolicyRegistry} is built.
 */
@Data
@ConfigurationProperties(prefix = "incident-commander")
public class IncidentCommanderProperties {

    private Map<AgentRole, AgentProperties> agents = new LinkedHashMap<>();
    private ConsensusProperties consensus = new ConsensusProperties();
    private CircuitBreakerProperties circuitBreaker = new CircuitBreakerProperties();
    private ResolutionProperties resolution = new ResolutionProperties();
    private RemediationProperties remediation = new RemediationProperties();

    @Data
    public static class AgentProperties {
        private Duration timeout = Duration.ofSeconds(2);
        private int maxRetries = 1;
    }

    @Data
    public static class ConsensusProperties {
        private double defaultThreshold = 0.70;
        private double quorumFraction = 0.5;
        private int minResponders = 2;
        // COMMUNICATION is opt-in: it is dispatched only where a category gives it weight
        private Map<AgentRole, Double> defaultWeights = new LinkedHashMap<>(Map.of(
            AgentRole.DETECTION,     0.2,
            AgentRole.DIAGNOSIS,     0.4,
            AgentRole.PREDICTION,    0.3,
            AgentRole.RESOLUTION,    0.1,
            AgentRole.COMMUNICATION, 0.0));
        private Map<IncidentCategory, CategoryProperties> categories = new LinkedHashMap<>();
    }

    /** Per-category overrides; any field left null falls back to the global default. */
    @Data
    public static class CategoryProperties {
        private Double threshold;
        private Map<AgentRole, Double> weights;
        private List<String> autoExecutableActions;
    }

    @Data
    public static class CircuitBreakerProperties {
        private int failureThreshold = 5;
        private Duration cooldown = Duration.ofSeconds(30);
    }

    @Data
    public static class ResolutionProperties {
        private int maxRounds = 2;
        private double retryMargin = 0.05;
        private Duration incidentTimeout = Duration.ofSeconds(60);
        private Duration executionTimeout = Duration.ofSeconds(10);
        private List<String> autoExecutableActions = new ArrayList<>(List.of(
            "restart_service", "scale_service", "increase_resources",
            "clear_cache", "enable_circuit_breaker", "drain_traffic"));
        private List<String> requiresApprovalActions = new ArrayList<>(List.of(
            "rollback_deployment", "rotate_credentials"));
    }

    @Data
    public static class RemediationProperties {
        /** {@code dry-run} or {@code rest}. */
        private String mode = "dry-run";
        /** Actions the dry-run executor reports as failed. */
        private List<String> failingActions = new ArrayList<>();
    }
}
