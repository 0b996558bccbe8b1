package uk.gegc.interviewledger.features.interview.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.interviewledger.features.audit.application.AuditEntryFactory;
import uk.gegc.interviewledger.features.audit.domain.model.AuditAction;
import uk.gegc.interviewledger.features.interview.api.dto.InterviewReconciliationResult;
import uk.gegc.interviewledger.features.interview.application.InterviewProperties;
import uk.gegc.interviewledger.features.interview.application.InterviewReconciliationService;
import uk.gegc.interviewledger.features.interview.domain.model.Interview;
import uk.gegc.interviewledger.features.interview.domain.model.InterviewStatus;
import uk.gegc.interviewledger.features.ledger.application.LedgerMetricsService;
import uk.gegc.interviewledger.features.ledger.domain.LedgerConflictException;
import uk.gegc.interviewledger.features.ledger.domain.LedgerStore;
import uk.gegc.interviewledger.features.scoring.domain.model.ScoreReport;
import uk.gegc.interviewledger.shared.exception.InvalidRequestException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static uk.gegc.interviewledger.features.ledger.application.LedgerStructuredLogger.logTransition;

/**
 * Each interview is repaired in its own transaction that re-reads the record and only acts while
 * it is still in progress, so concurrent sweeps and late evaluator writes cannot double-apply.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class InterviewReconciliationServiceImpl implements InterviewReconciliationService {

    private final LedgerStore ledgerStore;
    private final AuditEntryFactory auditEntryFactory;
    private final LedgerMetricsService metricsService;
    private final InterviewProperties interviewProperties;
    private final Clock clock;

    private enum Outcome { COMPLETED, ABANDONED, SKIPPED }

    @Override
    public InterviewReconciliationResult reconcile() {
        return reconcile(interviewProperties.getStalenessWindow());
    }

    @Override
    public InterviewReconciliationResult reconcile(Duration stalenessWindow) {
        if (stalenessWindow == null || stalenessWindow.isNegative() || stalenessWindow.isZero()) {
            throw new InvalidRequestException("Staleness window must be positive");
        }

        List<UUID> candidates = ledgerStore.read(tx -> tx.findInterviewsByStatus(InterviewStatus.IN_PROGRESS)
                .stream()
                .map(Interview::getId)
                .toList());
        log.info("Reconciling {} in-progress interviews (staleness window {})", candidates.size(), stalenessWindow);

        int completed = 0;
        int abandoned = 0;
        int skipped = 0;
        int failed = 0;
        for (UUID interviewId : candidates) {
            try {
                Outcome outcome = repair(interviewId, stalenessWindow);
                switch (outcome) {
                    case COMPLETED -> completed++;
                    case ABANDONED -> abandoned++;
                    case SKIPPED -> skipped++;
                }
            } catch (LedgerConflictException ex) {
                log.info("Interview {} changed during reconciliation; leaving it for the next sweep", interviewId);
                skipped++;
            } catch (RuntimeException ex) {
                log.error("Failed to reconcile interview {}: {}", interviewId, ex.getMessage(), ex);
                failed++;
            }
        }

        metricsService.recordInterviewReconciliation(completed, abandoned, skipped, failed);
        InterviewReconciliationResult result = new InterviewReconciliationResult(
                completed + abandoned, skipped, failed, candidates.size());
        log.info("Interview reconciliation finished: {} fixed ({} completed, {} abandoned), {} skipped, {} failed, {} total",
                result.fixed(), completed, abandoned, result.skipped(), result.failed(), result.total());
        return result;
    }

    private Outcome repair(UUID interviewId, Duration stalenessWindow) {
        return ledgerStore.runTransaction(tx -> {
            Interview interview = tx.findInterview(interviewId).orElse(null);
            if (interview == null || interview.getStatus() != InterviewStatus.IN_PROGRESS) {
                return Outcome.SKIPPED;
            }

            Instant now = Instant.now(clock);
            ScoreReport report = interview.getFinalReport();
            if (report != null) {
                Integer previousScore = interview.getScore();
                Integer previousFinalScore = interview.getFinalScore();
                if (interview.getScore() == null) {
                    interview.setScore(report.overall());
                }
                if (interview.getFinalScore() == null) {
                    interview.setFinalScore(interview.getScore());
                }
                if ((interview.getScoreDetails() == null || interview.getScoreDetails().isEmpty())
                        && report.dimensions() != null) {
                    interview.setScoreDetails(new LinkedHashMap<>(report.dimensions()));
                }
                interview.setStatus(InterviewStatus.COMPLETED);
                if (interview.getEndTime() == null) {
                    interview.setEndTime(now);
                }
                interview.setUpdatedAt(now);
                tx.saveInterview(interview);

                Map<String, Object> details = new LinkedHashMap<>();
                details.put("overall", report.overall());
                details.put("scoreBackfilled", previousScore == null);
                details.put("finalScoreBackfilled", previousFinalScore == null);
                tx.appendAudit(auditEntryFactory.create(interview.getOrgId(), null,
                        AuditAction.INTERVIEW_RECONCILED_COMPLETED, AuditEntryFactory.TARGET_INTERVIEW,
                        interviewId, details));
                logTransition(log, "info", "Reconciled interview {} to completed from its attached report",
                        interview.getOrgId(), interviewId, InterviewStatus.COMPLETED.wireName(), interviewId);
                return Outcome.COMPLETED;
            }

            Instant reference = interview.getCreatedAt() != null ? interview.getCreatedAt() : interview.getStartTime();
            // an interview of unknown age is treated as stale
            boolean stale = reference == null || Duration.between(reference, now).compareTo(stalenessWindow) > 0;
            if (!stale) {
                return Outcome.SKIPPED;
            }

            interview.setStatus(InterviewStatus.FAILED);
            interview.setFailureReason(ABANDONED_REASON);
            interview.setEndTime(now);
            interview.setUpdatedAt(now);
            tx.saveInterview(interview);

            Map<String, Object> details = new LinkedHashMap<>();
            details.put("reason", ABANDONED_REASON);
            details.put("stalenessWindowSeconds", stalenessWindow.getSeconds());
            if (reference != null) {
                details.put("ageSeconds", Duration.between(reference, now).getSeconds());
            }
            tx.appendAudit(auditEntryFactory.create(interview.getOrgId(), null,
                    AuditAction.INTERVIEW_RECONCILED_FAILED, AuditEntryFactory.TARGET_INTERVIEW,
                    interviewId, details));
            logTransition(log, "warn", "Reconciled abandoned interview {} to failed",
                    interview.getOrgId(), interviewId, InterviewStatus.FAILED.wireName(), interviewId);
            return Outcome.ABANDONED;
        });
    }
}
