package uk.gegc.interviewledger.shared.exception;

import lombok.Getter;

import java.util.Map;

/**
 * Base class for expected, caller-facing failures. Subclasses may expose extra structured
 * properties that are copied into the problem response.
 */
@Getter
public abstract class LedgerException extends RuntimeException {

    private final ErrorCode errorCode;

    protected LedgerException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    protected LedgerException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public Map<String, Object> getProperties() {
        return Map.of();
    }
}
