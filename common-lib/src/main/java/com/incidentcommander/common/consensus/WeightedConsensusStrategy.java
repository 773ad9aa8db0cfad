package com.incidentcommander.common.consensus;

import com.incidentcommander.common.model.AgentRole;
import com.incidentcommander.common.model.Finding;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Default {@link ConsensusEngine}: weighted voting over renormalized static weights.
 *
 * <h3>Quorum</h3>
 * A round fails with insufficient quorum when fewer than {@code minResponders} agents
 * contributed, or when their combined <em>static</em> weight is below {@code quorumFraction}.
 * Findings from roles with no weight in the category table do not count as responders.
 *
 * <h3>Algorithm</h3>
 * <ol>
 *   <li>Renormalize the responders' static weights so they sum to 1.0.</li>
 *   <li>{@code weightedConfidence = Σ(w_i' × confidence_i)}.</li>
 *   <li>Sum {@code w_i'} per distinct recommended action; the highest total wins.</li>
 *   <li>Ties go to the action with the highest single confidence, then to the action backed
 *       by the heavier static weight, then to the lexicographically smaller token.</li>
 *   <li>{@code autonomousEligible = weightedConfidence ≥ threshold} (inclusive).</li>
 * </ol>
 *
 * <p>This class is stateless and thread-safe.
 */
public class WeightedConsensusStrategy implements ConsensusEngine {

    /** Absolute tolerance for vote ties and for the inclusive threshold comparison. */
    static final double EPSILON = 1e-9;

    @Override
    public ConsensusOutcome compute(List<Finding> findings, Map<AgentRole, Double> staticWeights,
                                    ConsensusPolicy policy) {
        List<Finding> contributing = contributors(findings, staticWeights);
        List<AgentRole> responders = contributing.stream().map(Finding::role).toList();
        double staticMass = WeightRenormalizer.staticMass(staticWeights, responders);

        if (responders.size() < policy.minResponders()) {
            return ConsensusOutcome.insufficientQuorum(
                "only " + responders.size() + " agent(s) responded, " + policy.minResponders() + " required",
                responders, staticMass);
        }
        if (staticMass + EPSILON < policy.quorumFraction()) {
            return ConsensusOutcome.insufficientQuorum(
                String.format("responding static weight %.3f below quorum %.3f", staticMass, policy.quorumFraction()),
                responders, staticMass);
        }

        Map<AgentRole, Double> renormalized = WeightRenormalizer.renormalize(staticWeights, responders);

        double weightedConfidence = 0.0;
        Map<String, Double> votes          = new TreeMap<>();
        Map<String, Double> peakConfidence = new TreeMap<>();
        Map<String, Double> peakWeight     = new TreeMap<>();
        for (Finding f : contributing) {
            double w = renormalized.get(f.role());
            weightedConfidence += w * f.confidence();
            votes.merge(f.recommendedAction(), w, Double::sum);
            peakConfidence.merge(f.recommendedAction(), f.confidence(), Math::max);
            peakWeight.merge(f.recommendedAction(), staticWeights.get(f.role()), Math::max);
        }
        weightedConfidence = Math.max(0.0, Math.min(1.0, weightedConfidence));

        String winner = null;
        for (String action : votes.keySet()) {  // TreeMap: ascending token order
            if (winner == null || beats(action, winner, votes, peakConfidence, peakWeight)) {
                winner = action;
            }
        }

        Map<AgentRole, Double> contributorStatic = new EnumMap<>(AgentRole.class);
        responders.forEach(r -> contributorStatic.put(r, staticWeights.get(r)));

        List<AgentRole> configured = staticWeights.entrySet().stream()
            .filter(e -> e.getValue() != null && e.getValue() > 0.0)
            .map(Map.Entry::getKey)
            .sorted()
            .toList();
        List<AgentRole> excluded = configured.stream().filter(r -> !responders.contains(r)).toList();
        int tolerance = Math.max(0, (configured.size() - 1) / 3);

        ConsensusDecision decision = new ConsensusDecision(
            contributing.get(0).round(),
            weightedConfidence,
            winner,
            weightedConfidence + EPSILON >= policy.threshold(),
            policy.threshold(),
            contributing,
            contributorStatic,
            renormalized,
            votes,
            excluded,
            tolerance,
            excluded.size() > tolerance,
            FaultSuspicionDetector.suspects(contributing)
        );
        return ConsensusOutcome.reached(decision, staticMass);
    }

    /** Findings from weighted roles, one per role, in role order. */
    private List<Finding> contributors(List<Finding> findings, Map<AgentRole, Double> staticWeights) {
        Set<AgentRole> seen = new HashSet<>();
        List<Finding> contributing = new ArrayList<>();
        for (Finding f : findings) {
            if (!seen.add(f.role())) {
                throw new IllegalArgumentException("duplicate finding for role " + f.role() + " in one round");
            }
            Double w = staticWeights.get(f.role());
            if (w != null && w > 0.0) {
                contributing.add(f);
            }
        }
        contributing.sort(Comparator.comparing(Finding::role));
        return contributing;
    }

    private boolean beats(String candidate, String incumbent, Map<String, Double> votes,
                          Map<String, Double> peakConfidence, Map<String, Double> peakWeight) {
        double dv = votes.get(candidate) - votes.get(incumbent);
        if (Math.abs(dv) > EPSILON) return dv > 0;
        double dc = peakConfidence.get(candidate) - peakConfidence.get(incumbent);
        if (Math.abs(dc) > EPSILON) return dc > 0;
        double dw = peakWeight.get(candidate) - peakWeight.get(incumbent);
        if (Math.abs(dw) > EPSILON) return dw > 0;
        return false;
    }
}
