package uk.gegc.interviewledger.features.ledger.domain;

import uk.gegc.interviewledger.shared.exception.ErrorCode;
import uk.gegc.interviewledger.shared.exception.LedgerException;

/**
 * Opaque storage failure. Never retried by the ledger; the caller decides.
 */
public class LedgerStoreException extends LedgerException {

    public LedgerStoreException(String message, Throwable cause) {
        super(ErrorCode.INTERNAL_STORE_ERROR, message, cause);
    }
}
