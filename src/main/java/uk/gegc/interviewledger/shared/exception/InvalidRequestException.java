package uk.gegc.interviewledger.shared.exception;

public class InvalidRequestException extends LedgerException {

    public InvalidRequestException(String message) {
        super(ErrorCode.INVALID_REQUEST, message);
    }
}
