package uk.gegc.interviewledger.features.ledger.domain;

/**
 * Unit of work executed against a {@link LedgerTransaction}. It may run more than once when a
 * conflicting commit forces a retry, so it must not have side effects outside the transaction.
 */
@FunctionalInterface
public interface LedgerWork<T> {

    T execute(LedgerTransaction tx);
}
