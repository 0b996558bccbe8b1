package uk.gegc.interviewledger.features.credit.application;

import uk.gegc.interviewledger.features.credit.api.dto.CreditSummaryDto;
import uk.gegc.interviewledger.shared.security.CallerContext;

import java.util.UUID;

/**
 * Owns the organization quota and student credit counters. Every mutation runs in one ledger
 * transaction together with the history entry that documents it.
 */
public interface CreditAllocationService {

    /**
     * Reserve a student-paid interview. Pre-checks run outside the transaction and are repeated
     * authoritatively inside it; conflicting commits are retried up to {@code ledger.max-attempts}.
     *
     * @return id of the scheduled interview
     * @throws uk.gegc.interviewledger.shared.exception.ResourceNotFoundException student or organization missing
     * @throws uk.gegc.interviewledger.shared.exception.ForbiddenException cross-tenant call or capability disabled
     * @throws uk.gegc.interviewledger.features.credit.domain.exception.NoCreditsRemainingException no credit left
     * @throws uk.gegc.interviewledger.features.credit.domain.exception.QuotaExceededException organization quota exhausted
     * @throws uk.gegc.interviewledger.shared.exception.ResourceConflictException retries exhausted
     */
    UUID reserve(CallerContext caller, UUID studentId, String route);

    /**
     * Reserve an interview paid from the organization quota. No student credit moves.
     */
    UUID reserveForOrganization(CallerContext caller, UUID studentId, String route);

    /**
     * Allocate (positive amount) or deallocate (negative amount) student credits.
     */
    CreditSummaryDto adjustCredits(CallerContext caller, UUID studentId, int amount, String reason);

    /**
     * Give back the credit spent on a failed, student-paid interview. Repeated calls are no-ops.
     */
    CreditSummaryDto restoreCredit(CallerContext caller, UUID interviewId, String reason);

    CreditSummaryDto getCreditSummary(CallerContext caller, UUID studentId);
}
