package uk.gegc.interviewledger.features.ledger.application;

import java.util.UUID;

/**
 * Counters for ledger, lifecycle and scoring events.
 */
public interface LedgerMetricsService {

    /**
     * Reservation counters.
     */
    void incrementReservationCreated(UUID orgId, String creditSource);
    void incrementReservationRejected(String errorCode);

    /**
     * Credit movement counters.
     */
    void incrementCreditsAdjusted(UUID orgId, int amount);
    void incrementCreditRestored(UUID orgId);

    /**
     * Optimistic transaction counters.
     */
    void incrementTransactionRetry(String operation);
    void incrementConflictExhausted(String operation);

    /**
     * Interview reconciliation counters.
     */
    void recordInterviewReconciliation(int fixedCompleted, int fixedFailed, int skipped, int failed);

    /**
     * Credit ledger reconciliation counters.
     */
    void recordCreditReconciliationDrift(UUID studentId, long driftAmount);
    void recordCreditReconciliationSuccess(UUID studentId);
    void recordCreditReconciliationFailure(UUID studentId, String reason);

    void incrementConsistencyWarning(String warningType);
}
