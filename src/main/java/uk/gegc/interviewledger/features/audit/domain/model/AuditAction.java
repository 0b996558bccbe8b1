package uk.gegc.interviewledger.features.audit.domain.model;

public enum AuditAction {
    QUOTA_CONSUMED,
    INTERVIEW_STARTED,
    SCORE_COMPUTED,
    INTERVIEW_FAILED,
    INTERVIEW_RECONCILED_COMPLETED,
    INTERVIEW_RECONCILED_FAILED,
    CREDIT_RESTORED
}
