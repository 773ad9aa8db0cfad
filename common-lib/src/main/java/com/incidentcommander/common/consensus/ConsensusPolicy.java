package com.incidentcommander.common.consensus;

/**
 * Thresholds applied to one round.
 *
 * @param threshold      minimum weighted confidence for {@code autonomousEligible}
 * @param quorumFraction minimum combined <em>static</em> weight of responders
 * @param minResponders  minimum number of responding agents; never below 2, a single agent
 *                       cannot reach consensus
 */
public record ConsensusPolicy(
    double threshold,
    double quorumFraction,
    int minResponders
) {
    public static final double DEFAULT_QUORUM_FRACTION = 0.5;
    public static final int    DEFAULT_MIN_RESPONDERS  = 2;

    public ConsensusPolicy {
        if (threshold < 0.0 || threshold > 1.0) {
            throw new IllegalArgumentException("threshold must be in [0,1]: " + threshold);
        }
        if (quorumFraction < 0.0 || quorumFraction > 1.0) {
            throw new IllegalArgumentException("quorumFraction must be in [0,1]: " + quorumFraction);
        }
        if (minResponders < DEFAULT_MIN_RESPONDERS) {
            throw new IllegalArgumentException("minResponders must be >= " + DEFAULT_MIN_RESPONDERS + ": " + minResponders);
        }
    }

    public static ConsensusPolicy withThreshold(double threshold) {
        return new ConsensusPolicy(threshold, DEFAULT_QUORUM_FRACTION, DEFAULT_MIN_RESPONDERS);
    }
}
