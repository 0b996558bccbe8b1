package uk.gegc.interviewledger.features.scoring.domain.model;

import java.util.List;

/**
 * Result of rolling answers up into one session score.
 *
 * @param perAnswerMean mean of the per-answer totals before adjustments
 * @param adjustments   rules that fired, in profile order
 * @param score         adjusted mean clamped to [0, 100]
 */
public record SessionScore(double perAnswerMean, List<AppliedAdjustment> adjustments, double score) {
}
