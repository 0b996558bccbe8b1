package uk.gegc.interviewledger.features.scoring.domain.model;

public record AppliedAdjustment(String rule, double amount) {
}
