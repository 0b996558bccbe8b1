package uk.gegc.interviewledger.features.scoring.domain.model;

import uk.gegc.interviewledger.features.scoring.domain.exception.InvalidWeightsException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Immutable, validated map of metric name to weight. Weights are non-negative and sum to 1.0
 * within {@link #EPSILON}; validation happens once, when the set is built.
 */
public final class WeightSet {

    public static final double EPSILON = 1e-6;

    private final Map<String, Double> weights;

    private WeightSet(Map<String, Double> weights) {
        this.weights = weights;
    }

    public static WeightSet of(Map<String, Double> weights) {
        if (weights == null || weights.isEmpty()) {
            throw new InvalidWeightsException("Weight set must name at least one metric");
        }
        double sum = 0.0;
        Map<String, Double> copy = new LinkedHashMap<>();
        for (Map.Entry<String, Double> entry : weights.entrySet()) {
            Double weight = entry.getValue();
            if (entry.getKey() == null || entry.getKey().isBlank()) {
                throw new InvalidWeightsException("Metric names must not be blank");
            }
            if (weight == null || weight.isNaN() || weight < 0.0) {
                throw new InvalidWeightsException("Weight for '" + entry.getKey() + "' must be >= 0 but was " + weight);
            }
            sum += weight;
            copy.put(entry.getKey(), weight);
        }
        if (Math.abs(sum - 1.0) > EPSILON) {
            throw new InvalidWeightsException("Weights " + copy.keySet() + " must sum to 1.0 but sum to " + sum);
        }
        return new WeightSet(Collections.unmodifiableMap(copy));
    }

    public Map<String, Double> weights() {
        return weights;
    }

    public Set<String> metrics() {
        return weights.keySet();
    }

    public double weightOf(String metric) {
        return weights.getOrDefault(metric, 0.0);
    }

    /**
     * Weighted sum of the given sub-scores. Every metric named by this set must be present and
     * within [0, 100]; extra entries in {@code scores} are ignored.
     */
    public double apply(Map<String, Double> scores) {
        double total = 0.0;
        for (Map.Entry<String, Double> entry : weights.entrySet()) {
            Double value = scores == null ? null : scores.get(entry.getKey());
            ScoreRange.require(entry.getKey(), value);
            total += entry.getValue() * value;
        }
        return total;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof WeightSet other)) return false;
        return weights.equals(other.weights);
    }

    @Override
    public int hashCode() {
        return weights.hashCode();
    }

    @Override
    public String toString() {
        return "WeightSet" + weights;
    }
}
