package uk.gegc.interviewledger.features.ledger.domain;

/**
 * A concurrent writer committed first. Transient: the whole unit of work may be retried.
 */
public class LedgerConflictException extends RuntimeException {

    public LedgerConflictException(String message, Throwable cause) {
        super(message, cause);
    }

    public LedgerConflictException(String message) {
        super(message);
    }
}
