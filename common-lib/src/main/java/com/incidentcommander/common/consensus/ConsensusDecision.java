package com.incidentcommander.common.consensus;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.incidentcommander.common.model.AgentRole;
import com.incidentcommander.common.model.Finding;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable output of one consensus round. Collections are copied on construction, so a
 * decision stored in the ledger never changes with the engine's working state.
 *
 * <p>Fields:
 * <ul>
 *   <li>{@code weightedConfidence}: Σ(renormalized weight × confidence) over contributors</li>
 *   <li>{@code winningAction}: highest weighted vote after tie-breaks</li>
 *   <li>{@code autonomousEligible}: {@code weightedConfidence ≥ threshold}</li>
 *   <li>{@code findings}: every contributing finding, in role order</li>
 *   <li>{@code staticWeights}: configured weight of each contributor</li>
 *   <li>{@code renormalizedWeights}: weight actually applied; sums to 1.0</li>
 *   <li>{@code actionVotes}: renormalized weight summed per action</li>
 *   <li>{@code excludedRoles}: configured roles that did not contribute</li>
 *   <li>{@code byzantineTolerance}: ⌊(N−1)/3⌋ for the N configured roles</li>
 *   <li>{@code faultBudgetExceeded}: more roles excluded than the tolerance allows</li>
 *   <li>{@code suspectedFaultyRoles}: confidence outliers, reported for audit only</li>
 * </ul>
 */
public record ConsensusDecision(
    @JsonProperty("round")                int round,
    @JsonProperty("weightedConfidence")   double weightedConfidence,
    @JsonProperty("winningAction")        String winningAction,
    @JsonProperty("autonomousEligible")   boolean autonomousEligible,
    @JsonProperty("threshold")            double threshold,
    @JsonProperty("findings")             List<Finding> findings,
    @JsonProperty("staticWeights")        Map<AgentRole, Double> staticWeights,
    @JsonProperty("renormalizedWeights")  Map<AgentRole, Double> renormalizedWeights,
    @JsonProperty("actionVotes")          Map<String, Double> actionVotes,
    @JsonProperty("excludedRoles")        List<AgentRole> excludedRoles,
    @JsonProperty("byzantineTolerance")   int byzantineTolerance,
    @JsonProperty("faultBudgetExceeded")  boolean faultBudgetExceeded,
    @JsonProperty("suspectedFaultyRoles") List<AgentRole> suspectedFaultyRoles
) {
    public ConsensusDecision {
        findings             = findings == null ? List.of() : List.copyOf(findings);
        staticWeights        = roleMap(staticWeights);
        renormalizedWeights  = roleMap(renormalizedWeights);
        actionVotes          = actionVotes == null ? Map.of()
                                                   : Collections.unmodifiableMap(new LinkedHashMap<>(actionVotes));
        excludedRoles        = excludedRoles == null ? List.of() : List.copyOf(excludedRoles);
        suspectedFaultyRoles = suspectedFaultyRoles == null ? List.of() : List.copyOf(suspectedFaultyRoles);
    }

    public List<AgentRole> contributingRoles() {
        return findings.stream().map(Finding::role).toList();
    }

    private static Map<AgentRole, Double> roleMap(Map<AgentRole, Double> weights) {
        Map<AgentRole, Double> copy = new EnumMap<>(AgentRole.class);
        if (weights != null) {
            copy.putAll(weights);
        }
        return Collections.unmodifiableMap(copy);
    }
}
