package uk.gegc.interviewledger.features.credit.domain.exception;

import lombok.Getter;
import uk.gegc.interviewledger.shared.exception.ErrorCode;
import uk.gegc.interviewledger.shared.exception.LedgerException;

import java.util.Map;
import java.util.UUID;

@Getter
public class NoCreditsRemainingException extends LedgerException {

    private final UUID studentId;
    private final int creditsRemaining;
    private final int requested;

    public NoCreditsRemainingException(UUID studentId, int creditsRemaining, int requested) {
        super(ErrorCode.NO_CREDITS_REMAINING, "Student " + studentId + " has " + creditsRemaining
                + " credits remaining, " + requested + " required");
        this.studentId = studentId;
        this.creditsRemaining = creditsRemaining;
        this.requested = requested;
    }

    @Override
    public Map<String, Object> getProperties() {
        return Map.of("creditsRemaining", creditsRemaining, "requested", requested);
    }
}
