package uk.gegc.interviewledger.features.scoring.domain.model;

import uk.gegc.interviewledger.features.scoring.domain.exception.InvalidWeightsException;

/**
 * Blends the weakest dimension into the classification score so that one very low dimension
 * is not averaged away.
 */
public record DimensionFloor(boolean enabled, double sessionWeight, double dimensionWeight) {

    public static final DimensionFloor DISABLED = new DimensionFloor(false, 1.0, 0.0);

    public DimensionFloor {
        if (sessionWeight < 0 || dimensionWeight < 0
                || Math.abs(sessionWeight + dimensionWeight - 1.0) > WeightSet.EPSILON) {
            throw new InvalidWeightsException("Dimension floor weights must be >= 0 and sum to 1.0 but were "
                    + sessionWeight + " and " + dimensionWeight);
        }
    }

    public static DimensionFloor of(double sessionWeight, double dimensionWeight) {
        return new DimensionFloor(true, sessionWeight, dimensionWeight);
    }

    public double blend(double sessionScore, double minDimension) {
        if (!enabled) {
            return sessionScore;
        }
        return sessionWeight * sessionScore + dimensionWeight * minDimension;
    }
}
