package uk.gegc.interviewledger.features.interview.application;

import uk.gegc.interviewledger.features.interview.api.dto.InterviewReconciliationResult;

import java.time.Duration;

/**
 * Repairs interviews left in progress: completes those with an attached report and fails those
 * older than the staleness window as abandoned. Idempotent.
 */
public interface InterviewReconciliationService {

    String ABANDONED_REASON = "abandoned";

    InterviewReconciliationResult reconcile(Duration stalenessWindow);

    /**
     * Sweep using the configured staleness window.
     */
    InterviewReconciliationResult reconcile();
}
