package uk.gegc.interviewledger.features.credit.domain.exception;

import lombok.Getter;
import uk.gegc.interviewledger.shared.exception.ErrorCode;
import uk.gegc.interviewledger.shared.exception.LedgerException;

import java.util.Map;
import java.util.UUID;

@Getter
public class QuotaExceededException extends LedgerException {

    private final UUID orgId;
    private final int quotaLimit;
    private final int quotaUsed;

    public QuotaExceededException(UUID orgId, int quotaLimit, int quotaUsed, String message) {
        super(ErrorCode.QUOTA_EXCEEDED, message);
        this.orgId = orgId;
        this.quotaLimit = quotaLimit;
        this.quotaUsed = quotaUsed;
    }

    @Override
    public Map<String, Object> getProperties() {
        return Map.of("quotaLimit", quotaLimit, "quotaUsed", quotaUsed);
    }
}
