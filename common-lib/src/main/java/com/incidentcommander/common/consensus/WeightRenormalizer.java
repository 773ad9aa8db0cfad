package com.incidentcommander.common.consensus;

import com.incidentcommander.common.model.AgentRole;

import java.util.Collection;
import java.util.EnumMap;
import java.util.Map;

/**
 * Redistributes the trust mass of excluded agents proportionally over the responders:
 * <pre>
 *   w_i' = w_i / Σ(w_j for j in responders)
 * </pre>
 * The result always sums to 1.0, so thresholds keep their meaning when agents drop out.
 */
public final class WeightRenormalizer {

    private WeightRenormalizer() {}

    public static double staticMass(Map<AgentRole, Double> staticWeights, Collection<AgentRole> responders) {
        double sum = 0.0;
        for (AgentRole role : responders) {
            sum += staticWeights.getOrDefault(role, 0.0);
        }
        return sum;
    }

    /**
     * @throws IllegalArgumentException if the responders carry no static weight
     */
    public static Map<AgentRole, Double> renormalize(Map<AgentRole, Double> staticWeights,
                                                     Collection<AgentRole> responders) {
        double mass = staticMass(staticWeights, responders);
        if (mass <= 0.0) {
            throw new IllegalArgumentException("responders carry no weight: " + responders);
        }
        Map<AgentRole, Double> renormalized = new EnumMap<>(AgentRole.class);
        for (AgentRole role : responders) {
            renormalized.put(role, staticWeights.getOrDefault(role, 0.0) / mass);
        }
        return renormalized;
    }
}
