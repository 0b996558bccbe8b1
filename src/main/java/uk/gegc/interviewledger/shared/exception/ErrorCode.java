package uk.gegc.interviewledger.shared.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;
import uk.gegc.interviewledger.shared.api.problem.ErrorTypes;

import java.net.URI;

/**
 * Error taxonomy shared by the allocator, the lifecycle and the scoring engine.
 * {@link #code} is the stable name returned to callers in the {@code code} problem property.
 */
@Getter
public enum ErrorCode {

    NOT_FOUND("NotFound", HttpStatus.NOT_FOUND, ErrorTypes.RESOURCE_NOT_FOUND, "Resource Not Found"),
    FORBIDDEN("Forbidden", HttpStatus.FORBIDDEN, ErrorTypes.ACCESS_DENIED, "Forbidden"),
    QUOTA_EXCEEDED("QuotaExceeded", HttpStatus.FORBIDDEN, ErrorTypes.QUOTA_EXCEEDED, "Quota Exceeded"),
    NO_CREDITS_REMAINING("NoCreditsRemaining", HttpStatus.BAD_REQUEST, ErrorTypes.NO_CREDITS_REMAINING, "No Credits Remaining"),
    RESOURCE_CONFLICT("ResourceConflict", HttpStatus.CONFLICT, ErrorTypes.RESOURCE_CONFLICT, "Resource Conflict"),
    INVALID_WEIGHTS("InvalidWeights", HttpStatus.BAD_REQUEST, ErrorTypes.INVALID_WEIGHTS, "Invalid Weights"),
    OUT_OF_RANGE("OutOfRange", HttpStatus.BAD_REQUEST, ErrorTypes.SCORE_OUT_OF_RANGE, "Score Out Of Range"),
    INVALID_STATE("InvalidState", HttpStatus.CONFLICT, ErrorTypes.ILLEGAL_STATE, "Invalid State"),
    INVALID_REQUEST("InvalidRequest", HttpStatus.BAD_REQUEST, ErrorTypes.VALIDATION_FAILED, "Invalid Request"),
    INTERNAL_STORE_ERROR("InternalStoreError", HttpStatus.INTERNAL_SERVER_ERROR, ErrorTypes.INTERNAL_SERVER_ERROR, "Internal Server Error");

    private final String code;
    private final HttpStatus status;
    private final URI type;
    private final String title;

    ErrorCode(String code, HttpStatus status, URI type, String title) {
        this.code = code;
        this.status = status;
        this.type = type;
        this.title = title;
    }
}
