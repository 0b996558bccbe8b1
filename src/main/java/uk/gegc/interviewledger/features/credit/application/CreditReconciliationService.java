package uk.gegc.interviewledger.features.credit.application;

import java.util.List;
import java.util.UUID;

/**
 * Verifies that stored student credit counters agree with the credit history.
 * Drift is reported, never corrected automatically.
 */
public interface CreditReconciliationService {

    /**
     * Reconcile one student.
     *
     * @param studentId the student to reconcile
     * @return result with any drift found
     */
    StudentReconciliationResult reconcileStudent(UUID studentId);

    /**
     * Reconcile every student.
     */
    ReconciliationSummary reconcileAllStudents();

    /**
     * Result of reconciling a single student.
     *
     * @param calculatedRemaining remaining credits implied by the history
     * @param actualRemaining     remaining credits derived from the stored counters
     * @param latestBalanceAfter  balance recorded by the most recent history entry, if any
     * @param driftAmount         {@code calculatedRemaining - actualRemaining}
     * @param chainBreaks         entries whose balanceBefore differs from the previous balanceAfter
     */
    record StudentReconciliationResult(
            UUID studentId,
            boolean isBalanced,
            int calculatedRemaining,
            int actualRemaining,
            Integer latestBalanceAfter,
            int driftAmount,
            int chainBreaks,
            String details
    ) {
        public boolean hasDrift() {
            return !isBalanced;
        }
    }

    record ReconciliationSummary(
            int totalStudents,
            int balancedStudents,
            int studentsWithDrift,
            long totalDriftAmount,
            List<StudentReconciliationResult> driftResults
    ) {
        public boolean isSuccessful() {
            return studentsWithDrift == 0;
        }
    }
}
