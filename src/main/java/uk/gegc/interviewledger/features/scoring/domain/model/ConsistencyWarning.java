package uk.gegc.interviewledger.features.scoring.domain.model;

public record ConsistencyWarning(
        ConsistencyWarningType type,
        double perAnswerMean,
        double holisticScore,
        double discrepancy,
        String message
) {
}
