package uk.gegc.interviewledger.features.ledger.application;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.interviewledger.features.ledger.domain.LedgerConflictException;
import uk.gegc.interviewledger.features.ledger.domain.LedgerStore;
import uk.gegc.interviewledger.features.ledger.domain.LedgerWork;
import uk.gegc.interviewledger.shared.exception.ResourceConflictException;

/**
 * Runs a unit of work in a ledger transaction, re-running the whole read-modify-write when a
 * concurrent commit wins. Attempts are bounded by {@code ledger.max-attempts}; there is no backoff.
 * Store failures other than conflicts propagate on the first attempt.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RetryingLedgerExecutor {

    private final LedgerStore ledgerStore;
    private final LedgerProperties ledgerProperties;
    private final LedgerMetricsService metricsService;

    public <T> T execute(String operation, LedgerWork<T> work) {
        int maxAttempts = ledgerProperties.getMaxAttempts();
        int attempts = 0;
        while (true) {
            attempts++;
            try {
                return ledgerStore.runTransaction(work);
            } catch (LedgerConflictException ex) {
                if (attempts >= maxAttempts) {
                    log.warn("{}() transaction conflict persisted after {} attempts", operation, attempts);
                    metricsService.incrementConflictExhausted(operation);
                    throw new ResourceConflictException(
                            "Concurrent update prevented " + operation + "; please retry", attempts, ex);
                }
                metricsService.incrementTransactionRetry(operation);
                log.debug("{}() transaction conflict on attempt {}, retrying", operation, attempts);
            }
        }
    }
}
