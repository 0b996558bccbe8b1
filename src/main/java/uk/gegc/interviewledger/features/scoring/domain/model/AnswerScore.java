package uk.gegc.interviewledger.features.scoring.domain.model;

/**
 * Category composites and the weighted total for one answer.
 */
public record AnswerScore(double content, double speech, double body, double total) {
}
