package uk.gegc.interviewledger.features.scoring.domain.model;

import uk.gegc.interviewledger.features.scoring.domain.exception.InvalidWeightsException;

import java.util.List;

/**
 * Ordered, monotonic mapping from a score to a label. Tiers are listed worst first; the first
 * tier starts at 0 and every following floor is strictly higher than the previous one.
 */
public final class DecisionScale {

    private final List<DecisionTier> tiers;

    private DecisionScale(List<DecisionTier> tiers) {
        this.tiers = tiers;
    }

    public static DecisionScale of(List<DecisionTier> tiers) {
        if (tiers == null || tiers.isEmpty()) {
            throw new InvalidWeightsException("Decision scale needs at least one tier");
        }
        if (tiers.get(0).floor() != 0.0) {
            throw new InvalidWeightsException("Lowest decision tier must start at 0");
        }
        for (int i = 1; i < tiers.size(); i++) {
            double previous = tiers.get(i - 1).floor();
            double current = tiers.get(i).floor();
            if (!(current > previous) || current > 100.0) {
                throw new InvalidWeightsException("Decision thresholds must be strictly increasing within [0, 100]: "
                        + tiers.get(i).label() + "=" + current);
            }
        }
        return new DecisionScale(List.copyOf(tiers));
    }

    public DecisionTier classify(double score) {
        DecisionTier result = tiers.get(0);
        for (DecisionTier tier : tiers) {
            if (score >= tier.floor()) {
                result = tier;
            }
        }
        return result;
    }

    /**
     * Position of a label on the scale, 0 being the worst; -1 when unknown.
     */
    public int rank(String label) {
        for (int i = 0; i < tiers.size(); i++) {
            if (tiers.get(i).label().equals(label)) {
                return i;
            }
        }
        return -1;
    }

    public List<DecisionTier> tiers() {
        return tiers;
    }
}
