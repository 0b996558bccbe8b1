package uk.gegc.interviewledger.features.audit.application.impl;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import uk.gegc.interviewledger.features.audit.api.dto.AuditEntryDto;
import uk.gegc.interviewledger.features.audit.application.AuditQueryService;
import uk.gegc.interviewledger.features.audit.infra.mapping.AuditEntryMapper;
import uk.gegc.interviewledger.features.interview.domain.model.Interview;
import uk.gegc.interviewledger.features.ledger.domain.LedgerStore;
import uk.gegc.interviewledger.shared.exception.ResourceNotFoundException;
import uk.gegc.interviewledger.shared.security.AccessPolicy;
import uk.gegc.interviewledger.shared.security.CallerContext;

import java.util.List;
import java.util.UUID;

@Service
@RequiredArgsConstructor
public class AuditQueryServiceImpl implements AuditQueryService {

    private final LedgerStore ledgerStore;
    private final AccessPolicy accessPolicy;
    private final AuditEntryMapper auditEntryMapper;

    @Override
    public List<AuditEntryDto> getInterviewAuditTrail(CallerContext caller, UUID interviewId) {
        return ledgerStore.read(tx -> {
            Interview interview = tx.findInterview(interviewId)
                    .orElseThrow(() -> ResourceNotFoundException.of("Interview", interviewId));
            accessPolicy.requireOrgAdmin(caller, interview.getOrgId());
            return auditEntryMapper.toDtos(tx.findAuditByTarget(interviewId));
        });
    }
}
