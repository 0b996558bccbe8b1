package uk.gegc.interviewledger.features.scoring.domain.model;

import uk.gegc.interviewledger.features.scoring.domain.exception.ScoreOutOfRangeException;

/**
 * Range guard shared by every scoring input.
 */
public final class ScoreRange {

    public static final double MIN = 0.0;
    public static final double MAX = 100.0;

    private ScoreRange() {
    }

    public static void require(String metric, Double value) {
        if (value == null || value.isNaN() || value < MIN || value > MAX) {
            throw new ScoreOutOfRangeException(metric, value);
        }
    }

    public static double clamp(double value) {
        return Math.max(MIN, Math.min(MAX, value));
    }
}
