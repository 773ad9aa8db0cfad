package com.incidentcommander.orchestrator.policy;

import com.incidentcommander.common.consensus.ConsensusPolicy;
import com.incidentcommander.common.model.AgentDescriptor;
import com.incidentcommander.common.model.AgentRole;
import com.incidentcommander.common.model.IncidentCategory;
import com.incidentcommander.orchestrator.config.IncidentCommanderProperties;
import com.incidentcommander.orchestrator.config.IncidentCommanderProperties.AgentProperties;
import com.incidentcommander.orchestrator.config.IncidentCommanderProperties.CategoryProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Builds one {@link CategoryPolicy} per incident category from configuration and fails fast
 * on an invalid table: any weight outside [0,1], or a category whose weights do not sum to 1.0.
 */
public class CategoryPolicyRegistry {

    private static final Logger log = LoggerFactory.getLogger(CategoryPolicyRegistry.class);

    static final double WEIGHT_SUM_TOLERANCE = 1e-6;

    private final Map<IncidentCategory, CategoryPolicy> policies = new EnumMap<>(IncidentCategory.class);

    public CategoryPolicyRegistry(IncidentCommanderProperties properties) {
        IncidentCommanderProperties.ConsensusProperties consensus = properties.getConsensus();
        for (IncidentCategory category : IncidentCategory.values()) {
            CategoryProperties overrides = consensus.getCategories().get(category);

            Map<AgentRole, Double> weights = overrides != null && overrides.getWeights() != null
                ? overrides.getWeights() : consensus.getDefaultWeights();
            double threshold = overrides != null && overrides.getThreshold() != null
                ? overrides.getThreshold() : consensus.getDefaultThreshold();
            List<String> autoExecutable = overrides != null && overrides.getAutoExecutableActions() != null
                ? overrides.getAutoExecutableActions() : properties.getResolution().getAutoExecutableActions();

            List<AgentDescriptor> roster = roster(category, weights, properties.getAgents());
            ConsensusPolicy policy = new ConsensusPolicy(threshold, consensus.getQuorumFraction(),
                                                         consensus.getMinResponders());
            policies.put(category, new CategoryPolicy(category, roster, policy, Set.copyOf(autoExecutable)));
            log.info("[Policy] category={} threshold={} weights={} autoExecutable={}",
                     category, threshold, weights, autoExecutable);
        }
    }

    public CategoryPolicy forCategory(IncidentCategory category) {
        return policies.get(category);
    }

    private static List<AgentDescriptor> roster(IncidentCategory category, Map<AgentRole, Double> weights,
                                                Map<AgentRole, AgentProperties> agents) {
        List<AgentDescriptor> roster = new ArrayList<>();
        double sum = 0.0;
        for (AgentRole role : AgentRole.values()) {
            double weight = weights.getOrDefault(role, 0.0);
            AgentProperties agent = agents.getOrDefault(role, new AgentProperties());
            // AgentDescriptor rejects weights outside [0,1]
            roster.add(new AgentDescriptor(role, weight, agent.getTimeout(), agent.getMaxRetries()));
            sum += weight;
        }
        if (Math.abs(sum - 1.0) > WEIGHT_SUM_TOLERANCE) {
            throw new IllegalArgumentException(
                "weights for category " + category + " must sum to 1.0 but sum to " + sum);
        }
        return roster;
    }
}
