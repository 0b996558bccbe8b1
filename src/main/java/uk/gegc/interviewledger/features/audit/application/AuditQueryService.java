package uk.gegc.interviewledger.features.audit.application;

import uk.gegc.interviewledger.features.audit.api.dto.AuditEntryDto;
import uk.gegc.interviewledger.shared.security.CallerContext;

import java.util.List;
import java.util.UUID;

public interface AuditQueryService {

    /**
     * Audit trail of one interview, oldest first.
     */
    List<AuditEntryDto> getInterviewAuditTrail(CallerContext caller, UUID interviewId);
}
