package uk.gegc.interviewledger.shared.exception;

import lombok.Getter;

import java.util.Map;

/**
 * Transient failure surfaced after the bounded optimistic retries were exhausted.
 * The caller may retry the whole request.
 */
@Getter
public class ResourceConflictException extends LedgerException {

    private final int attempts;

    public ResourceConflictException(String message, int attempts, Throwable cause) {
        super(ErrorCode.RESOURCE_CONFLICT, message, cause);
        this.attempts = attempts;
    }

    @Override
    public Map<String, Object> getProperties() {
        return Map.of("attempts", attempts, "retryable", true);
    }
}
