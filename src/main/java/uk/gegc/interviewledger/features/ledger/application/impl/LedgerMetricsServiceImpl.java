package uk.gegc.interviewledger.features.ledger.application.impl;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.interviewledger.features.ledger.application.LedgerMetricsService;

import java.util.UUID;

/**
 * Micrometer-backed ledger metrics.
 */
@Slf4j
@Service
public class LedgerMetricsServiceImpl implements LedgerMetricsService {

    private final MeterRegistry meterRegistry;

    private final Counter creditsAllocatedCounter;
    private final Counter creditsDeallocatedCounter;
    private final Counter creditRestoredCounter;
    private final Counter reconciliationCompletedCounter;
    private final Counter reconciliationAbandonedCounter;
    private final Counter reconciliationSkippedCounter;
    private final Counter reconciliationFailedCounter;
    private final Counter creditReconciliationSuccessCounter;
    private final Counter creditReconciliationDriftCounter;
    private final Counter creditReconciliationFailureCounter;

    public LedgerMetricsServiceImpl(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.creditsAllocatedCounter = Counter.builder("ledger.credits.allocated")
                .description("Credits allocated to students")
                .register(meterRegistry);
        this.creditsDeallocatedCounter = Counter.builder("ledger.credits.deallocated")
                .description("Credits taken back from students")
                .register(meterRegistry);
        this.creditRestoredCounter = Counter.builder("ledger.credits.restored")
                .description("Credits restored after failed interviews")
                .register(meterRegistry);
        this.reconciliationCompletedCounter = Counter.builder("interview.reconciliation.repaired")
                .tag("outcome", "completed")
                .description("Stuck interviews completed from an attached report")
                .register(meterRegistry);
        this.reconciliationAbandonedCounter = Counter.builder("interview.reconciliation.repaired")
                .tag("outcome", "failed")
                .description("Stuck interviews failed as abandoned")
                .register(meterRegistry);
        this.reconciliationSkippedCounter = Counter.builder("interview.reconciliation.skipped")
                .description("In-progress interviews left untouched")
                .register(meterRegistry);
        this.reconciliationFailedCounter = Counter.builder("interview.reconciliation.errors")
                .description("Interviews whose repair raised an error")
                .register(meterRegistry);
        this.creditReconciliationSuccessCounter = Counter.builder("ledger.reconciliation.success")
                .description("Students whose credit ledger reconciled cleanly")
                .register(meterRegistry);
        this.creditReconciliationDriftCounter = Counter.builder("ledger.reconciliation.drift")
                .description("Students whose credit ledger drifted")
                .register(meterRegistry);
        this.creditReconciliationFailureCounter = Counter.builder("ledger.reconciliation.failure")
                .description("Credit ledger reconciliations that errored")
                .register(meterRegistry);
    }

    @Override
    public void incrementReservationCreated(UUID orgId, String creditSource) {
        log.info("METRIC: ledger.reservations.created orgId={} source={}", orgId, creditSource);
        meterRegistry.counter("ledger.reservations.created", "source", creditSource).increment();
    }

    @Override
    public void incrementReservationRejected(String errorCode) {
        log.info("METRIC: ledger.reservations.rejected code={}", errorCode);
        meterRegistry.counter("ledger.reservations.rejected", "code", errorCode).increment();
    }

    @Override
    public void incrementCreditsAdjusted(UUID orgId, int amount) {
        log.info("METRIC: ledger.credits.adjusted orgId={} amount={}", orgId, amount);
        if (amount > 0) {
            creditsAllocatedCounter.increment(amount);
        } else {
            creditsDeallocatedCounter.increment(Math.abs(amount));
        }
    }

    @Override
    public void incrementCreditRestored(UUID orgId) {
        log.info("METRIC: ledger.credits.restored orgId={}", orgId);
        creditRestoredCounter.increment();
    }

    @Override
    public void incrementTransactionRetry(String operation) {
        meterRegistry.counter("ledger.transactions.retried", "operation", operation).increment();
    }

    @Override
    public void incrementConflictExhausted(String operation) {
        log.info("METRIC: ledger.transactions.conflicts operation={}", operation);
        meterRegistry.counter("ledger.transactions.conflicts", "operation", operation).increment();
    }

    @Override
    public void recordInterviewReconciliation(int fixedCompleted, int fixedFailed, int skipped, int failed) {
        log.info("METRIC: interview.reconciliation completed={} abandoned={} skipped={} errors={}",
                fixedCompleted, fixedFailed, skipped, failed);
        reconciliationCompletedCounter.increment(fixedCompleted);
        reconciliationAbandonedCounter.increment(fixedFailed);
        reconciliationSkippedCounter.increment(skipped);
        reconciliationFailedCounter.increment(failed);
    }

    @Override
    public void recordCreditReconciliationDrift(UUID studentId, long driftAmount) {
        log.warn("METRIC: ledger.reconciliation.drift studentId={} drift={}", studentId, driftAmount);
        creditReconciliationDriftCounter.increment();
    }

    @Override
    public void recordCreditReconciliationSuccess(UUID studentId) {
        creditReconciliationSuccessCounter.increment();
    }

    @Override
    public void recordCreditReconciliationFailure(UUID studentId, String reason) {
        log.error("METRIC: ledger.reconciliation.failure studentId={} reason={}", studentId, reason);
        creditReconciliationFailureCounter.increment();
    }

    @Override
    public void incrementConsistencyWarning(String warningType) {
        meterRegistry.counter("scoring.consistency.warnings", "type", warningType).increment();
    }
}
