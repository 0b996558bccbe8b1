package uk.gegc.interviewledger.shared.exception;

/**
 * Thrown when the caller lacks a capability (self-start disabled, dashboard disabled)
 * or acts across tenant boundaries.
 */
public class ForbiddenException extends LedgerException {

    public ForbiddenException(String message) {
        super(ErrorCode.FORBIDDEN, message);
    }
}
