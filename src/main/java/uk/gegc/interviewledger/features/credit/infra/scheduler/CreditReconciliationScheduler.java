package uk.gegc.interviewledger.features.credit.infra.scheduler;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import uk.gegc.interviewledger.features.credit.application.CreditReconciliationService;
import uk.gegc.interviewledger.features.credit.application.CreditReconciliationService.ReconciliationSummary;

/**
 * Weekly credit ledger reconciliation (Sunday 02:00 by default).
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CreditReconciliationScheduler {

    private final CreditReconciliationService reconciliationService;

    @Scheduled(cron = "${ledger.reconciliation.cron:0 0 2 * * SUN}")
    public void performWeeklyReconciliation() {
        log.info("Starting weekly credit reconciliation job");
        try {
            ReconciliationSummary summary = reconciliationService.reconcileAllStudents();
            if (summary.isSuccessful()) {
                log.info("Weekly credit reconciliation completed successfully: {} students balanced",
                        summary.balancedStudents());
            } else {
                log.warn("Weekly credit reconciliation found issues: {} students with drift, total drift: {} credits",
                        summary.studentsWithDrift(), summary.totalDriftAmount());
            }
        } catch (Exception e) {
            log.error("Error during weekly credit reconciliation: {}", e.getMessage(), e);
        }
    }
}
