package uk.gegc.interviewledger.features.scoring.domain.model;

/**
 * One label of a decision scale. Scores at or above {@code floor} (and below the next tier's floor)
 * receive this label.
 */
public record DecisionTier(String label, double floor, String summary) {
}
