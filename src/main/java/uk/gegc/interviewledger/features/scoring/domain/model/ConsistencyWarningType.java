package uk.gegc.interviewledger.features.scoring.domain.model;

public enum ConsistencyWarningType {
    DRIFT_WARNING,
    HIGH_PERFORMER_DRIFT
}
