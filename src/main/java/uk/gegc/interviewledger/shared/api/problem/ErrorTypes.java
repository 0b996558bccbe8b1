package uk.gegc.interviewledger.shared.api.problem;

import java.net.URI;

/**
 * Centralised catalog of RFC 7807 Problem Detail type URIs.
 * Each constant should point to documentation describing the error.
 *
 * @see ProblemDetailBuilder
 * @see <a href="https://www.rfc-editor.org/rfc/rfc7807">RFC 7807</a>
 */
public final class ErrorTypes {

    private static final String BASE_URL = "https://interview-ledger.gegc.uk/docs/errors";

    // ==================== Resource Errors ====================
    public static final URI RESOURCE_NOT_FOUND = URI.create(BASE_URL + "/resource-not-found");

    // ==================== Validation Errors ====================
    public static final URI VALIDATION_FAILED = URI.create(BASE_URL + "/validation-failed");
    public static final URI MALFORMED_JSON = URI.create(BASE_URL + "/malformed-json");
    public static final URI TYPE_MISMATCH = URI.create(BASE_URL + "/type-mismatch");

    // ==================== Security Errors ====================
    public static final URI ACCESS_DENIED = URI.create(BASE_URL + "/access-denied");

    // ==================== Credit Errors ====================
    public static final URI QUOTA_EXCEEDED = URI.create(BASE_URL + "/quota-exceeded");
    public static final URI NO_CREDITS_REMAINING = URI.create(BASE_URL + "/no-credits-remaining");
    public static final URI RESOURCE_CONFLICT = URI.create(BASE_URL + "/resource-conflict");

    // ==================== Scoring Errors ====================
    public static final URI INVALID_WEIGHTS = URI.create(BASE_URL + "/invalid-weights");
    public static final URI SCORE_OUT_OF_RANGE = URI.create(BASE_URL + "/score-out-of-range");

    // ==================== State Errors ====================
    public static final URI ILLEGAL_STATE = URI.create(BASE_URL + "/illegal-state");

    // ==================== Generic Errors ====================
    public static final URI INTERNAL_SERVER_ERROR = URI.create(BASE_URL + "/internal-server-error");

    private ErrorTypes() {
        throw new AssertionError("Utility class - do not instantiate");
    }
}
