package uk.gegc.interviewledger.features.credit.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.interviewledger.features.credit.application.CreditReconciliationService;
import uk.gegc.interviewledger.features.credit.domain.model.CreditHistoryEntry;
import uk.gegc.interviewledger.features.credit.domain.model.Student;
import uk.gegc.interviewledger.features.ledger.application.LedgerMetricsService;
import uk.gegc.interviewledger.features.ledger.domain.LedgerStore;
import uk.gegc.interviewledger.shared.exception.ResourceNotFoundException;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Recomputes each student's remaining credits from the history
 * ({@code allocated - deallocated - used + restored}, starting from the first entry's
 * balanceBefore) and compares it with the stored counters and the latest balanceAfter.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CreditReconciliationServiceImpl implements CreditReconciliationService {

    private final LedgerStore ledgerStore;
    private final LedgerMetricsService metricsService;

    @Override
    public StudentReconciliationResult reconcileStudent(UUID studentId) {
        try {
            StudentReconciliationResult result = ledgerStore.read(tx -> {
                Student student = tx.findStudent(studentId)
                        .orElseThrow(() -> ResourceNotFoundException.of("Student", studentId));
                return compare(student, tx.findAllHistoryByStudent(studentId));
            });

            if (result.isBalanced()) {
                metricsService.recordCreditReconciliationSuccess(studentId);
            } else {
                metricsService.recordCreditReconciliationDrift(studentId, result.driftAmount());
                log.warn("Credit reconciliation drift detected for student {}: {}", studentId, result.details());
            }
            return result;
        } catch (ResourceNotFoundException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("Error during credit reconciliation for student {}: {}", studentId, e.getMessage(), e);
            metricsService.recordCreditReconciliationFailure(studentId, e.getMessage());
            return new StudentReconciliationResult(studentId, false, 0, 0, null, 0, 0,
                    "Error during reconciliation: " + e.getMessage());
        }
    }

    @Override
    public ReconciliationSummary reconcileAllStudents() {
        log.info("Starting credit reconciliation for all students");

        List<UUID> studentIds = ledgerStore.read(tx -> tx.findAllStudentIds());
        List<StudentReconciliationResult> driftResults = new ArrayList<>();
        for (UUID studentId : studentIds) {
            StudentReconciliationResult result;
            try {
                result = reconcileStudent(studentId);
            } catch (ResourceNotFoundException e) {
                log.debug("Student {} disappeared during reconciliation", studentId);
                continue;
            }
            if (result.hasDrift()) {
                driftResults.add(result);
            }
        }

        int totalStudents = studentIds.size();
        int studentsWithDrift = driftResults.size();
        long totalDrift = driftResults.stream()
                .mapToLong(r -> Math.abs(r.driftAmount()))
                .sum();
        ReconciliationSummary summary = new ReconciliationSummary(
                totalStudents, totalStudents - studentsWithDrift, studentsWithDrift, totalDrift, driftResults);

        log.info("Credit reconciliation completed: {} students, {} balanced, {} with drift, total drift: {}",
                totalStudents, summary.balancedStudents(), studentsWithDrift, totalDrift);
        return summary;
    }

    private StudentReconciliationResult compare(Student student, List<CreditHistoryEntry> history) {
        int actual = student.getCreditsRemaining();
        boolean overspent = student.getCreditsUsed() > student.getCreditsAllocated();
        if (history.isEmpty()) {
            boolean balanced = student.getCreditsUsed() == 0;
            return new StudentReconciliationResult(student.getId(), balanced, actual, actual, null,
                    balanced ? 0 : -student.getCreditsUsed(), 0,
                    balanced ? "No credit history" : "Credits used without any history entry: " + student.getCreditsUsed());
        }

        int calculated = history.get(0).getBalanceBefore();
        int chainBreaks = 0;
        Integer previousAfter = null;
        for (CreditHistoryEntry entry : history) {
            calculated += entry.getType().isDebit() ? -entry.getAmount() : entry.getAmount();
            if (previousAfter != null && entry.getBalanceBefore() != previousAfter) {
                chainBreaks++;
            }
            previousAfter = entry.getBalanceAfter();
        }
        int latestAfter = history.get(history.size() - 1).getBalanceAfter();
        int drift = calculated - actual;
        boolean balanced = drift == 0 && latestAfter == actual && chainBreaks == 0 && !overspent;

        String details = String.format(
                "Calculated: %d, Actual: %d (allocated: %d, used: %d), Latest balanceAfter: %d, Chain breaks: %d, Drift: %d",
                calculated, actual, student.getCreditsAllocated(), student.getCreditsUsed(),
                latestAfter, chainBreaks, drift);
        return new StudentReconciliationResult(student.getId(), balanced, calculated, actual, latestAfter,
                drift, chainBreaks, details);
    }
}
