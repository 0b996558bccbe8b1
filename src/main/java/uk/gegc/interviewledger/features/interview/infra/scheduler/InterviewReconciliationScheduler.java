package uk.gegc.interviewledger.features.interview.infra.scheduler;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import uk.gegc.interviewledger.features.interview.api.dto.InterviewReconciliationResult;
import uk.gegc.interviewledger.features.interview.application.InterviewReconciliationService;

/**
 * Hourly sweep over interviews stuck in progress.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class InterviewReconciliationScheduler {

    private final InterviewReconciliationService reconciliationService;

    @Scheduled(cron = "${interview.reconciliation.cron:0 0 * * * *}")
    public void reconcileStuckInterviews() {
        try {
            InterviewReconciliationResult result = reconciliationService.reconcile();
            if (result.failed() > 0) {
                log.warn("Scheduled interview reconciliation finished with {} errors out of {}",
                        result.failed(), result.total());
            }
        } catch (Exception e) {
            log.error("Error during scheduled interview reconciliation: {}", e.getMessage(), e);
        }
    }
}
