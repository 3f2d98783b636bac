package com.tsmonitor.anomaly.engine.ensemble;

import com.tsmonitor.anomaly.exception.InvalidConfigurationException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Voting mode plus one weight per member, normalized to sum to 1.
 */
public final class EnsembleConfig {

    private final VotingMode votingMode;
    private final List<Double> weights;

    private EnsembleConfig(VotingMode votingMode, List<Double> weights) {
        this.votingMode = votingMode;
        this.weights = weights;
    }

    /**
     * @param rawWeights one non-negative weight per member, or null/empty for equal weights
     */
    public static EnsembleConfig of(VotingMode votingMode, List<Double> rawWeights, int memberCount) {
        if (votingMode == null) {
            throw new InvalidConfigurationException("votingMode is required");
        }
        if (memberCount < 2) {
            throw new InvalidConfigurationException("An ensemble needs at least 2 members, got " + memberCount);
        }
        List<Double> source = (rawWeights == null || rawWeights.isEmpty())
                ? Collections.nCopies(memberCount, 1.0)
                : rawWeights;
        if (source.size() != memberCount) {
            throw new InvalidConfigurationException(String.format(
                    "Expected %d weights (one per member) but got %d", memberCount, source.size()));
        }

        double sum = 0.0;
        for (Double w : source) {
            if (w == null || w < 0 || Double.isNaN(w) || Double.isInfinite(w)) {
                throw new InvalidConfigurationException("Weights must be finite and non-negative: " + source);
            }
            sum += w;
        }
        if (sum <= 0) {
            throw new InvalidConfigurationException("Weights must not all be zero");
        }

        List<Double> normalized = new ArrayList<>(source.size());
        for (Double w : source) {
            normalized.add(w / sum);
        }
        return new EnsembleConfig(votingMode, Collections.unmodifiableList(normalized));
    }

    public static EnsembleConfig majority(int memberCount) {
        return of(VotingMode.MAJORITY, null, memberCount);
    }

    public VotingMode getVotingMode() {
        return votingMode;
    }

    public List<Double> getWeights() {
        return weights;
    }

    public double weightAt(int member) {
        return weights.get(member);
    }
}
