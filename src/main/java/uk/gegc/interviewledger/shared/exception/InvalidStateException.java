package uk.gegc.interviewledger.shared.exception;

public class InvalidStateException extends LedgerException {

    public InvalidStateException(String message) {
        super(ErrorCode.INVALID_STATE, message);
    }
}
