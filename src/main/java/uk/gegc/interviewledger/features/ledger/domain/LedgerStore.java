package uk.gegc.interviewledger.features.ledger.domain;

/**
 * Atomic store behind the allocator and the lifecycle.
 * <p>
 * {@link #runTransaction} commits everything the work wrote or nothing. A commit that loses an
 * optimistic race fails with {@link LedgerConflictException}; any other storage failure surfaces
 * as {@link LedgerStoreException}. Implementations never retry on their own.
 */
public interface LedgerStore {

    <T> T runTransaction(LedgerWork<T> work);

    /**
     * Read-only variant. Writes attempted inside are not guaranteed to persist.
     */
    <T> T read(LedgerWork<T> work);
}
