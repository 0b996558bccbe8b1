package uk.gegc.interviewledger.features.credit.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import uk.gegc.interviewledger.features.audit.application.AuditEntryFactory;
import uk.gegc.interviewledger.features.audit.domain.model.AuditAction;
import uk.gegc.interviewledger.features.credit.api.dto.AdjustCreditsRequest;
import uk.gegc.interviewledger.features.credit.api.dto.CreditSummaryDto;
import uk.gegc.interviewledger.features.credit.application.CreditAllocationService;
import uk.gegc.interviewledger.features.credit.domain.exception.NoCreditsRemainingException;
import uk.gegc.interviewledger.features.credit.domain.exception.QuotaExceededException;
import uk.gegc.interviewledger.features.credit.domain.model.CreditHistoryEntry;
import uk.gegc.interviewledger.features.credit.domain.model.CreditHistoryType;
import uk.gegc.interviewledger.features.credit.domain.model.Organization;
import uk.gegc.interviewledger.features.credit.domain.model.Student;
import uk.gegc.interviewledger.features.credit.infra.mapping.CreditHistoryMapper;
import uk.gegc.interviewledger.features.interview.application.InterviewProperties;
import uk.gegc.interviewledger.features.interview.domain.model.CreditSource;
import uk.gegc.interviewledger.features.interview.domain.model.Interview;
import uk.gegc.interviewledger.features.interview.domain.model.InterviewStatus;
import uk.gegc.interviewledger.features.ledger.application.LedgerMetricsService;
import uk.gegc.interviewledger.features.ledger.application.LedgerProperties;
import uk.gegc.interviewledger.features.ledger.application.RetryingLedgerExecutor;
import uk.gegc.interviewledger.features.ledger.domain.LedgerStore;
import uk.gegc.interviewledger.features.ledger.domain.LedgerTransaction;
import uk.gegc.interviewledger.shared.exception.ForbiddenException;
import uk.gegc.interviewledger.shared.exception.InvalidRequestException;
import uk.gegc.interviewledger.shared.exception.InvalidStateException;
import uk.gegc.interviewledger.shared.exception.LedgerException;
import uk.gegc.interviewledger.shared.exception.ResourceNotFoundException;
import uk.gegc.interviewledger.shared.security.AccessPolicy;
import uk.gegc.interviewledger.shared.security.CallerContext;
import uk.gegc.interviewledger.shared.security.CallerRole;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

import static uk.gegc.interviewledger.features.ledger.application.LedgerStructuredLogger.logCreditMutation;

@Slf4j
@Service
@RequiredArgsConstructor
public class CreditAllocationServiceImpl implements CreditAllocationService {

    private final LedgerStore ledgerStore;
    private final RetryingLedgerExecutor ledgerExecutor;
    private final AccessPolicy accessPolicy;
    private final AuditEntryFactory auditEntryFactory;
    private final CreditHistoryMapper creditHistoryMapper;
    private final LedgerMetricsService metricsService;
    private final LedgerProperties ledgerProperties;
    private final InterviewProperties interviewProperties;
    private final Clock clock;

    @Override
    public UUID reserve(CallerContext caller, UUID studentId, String route) {
        try {
            Student snapshot = ledgerStore.read(tx -> {
                Student student = requireStudent(tx, studentId);
                accessPolicy.requireSelfOrAdmin(caller, studentId, student.getOrgId());
                requireReservationCapabilities(caller, student);
                if (student.getCreditsRemaining() <= 0) {
                    throw new NoCreditsRemainingException(studentId, student.getCreditsRemaining(), 1);
                }
                Organization organization = requireOrganization(tx, student.getOrgId());
                if (organization.isQuotaExhausted()) {
                    throw quotaExhausted(organization);
                }
                return student;
            });
            String resolvedRoute = resolveRoute(route, snapshot);

            Reservation reservation = ledgerExecutor.execute("reserve", tx -> {
                Student student = requireStudent(tx, studentId);
                Organization organization = requireOrganization(tx, student.getOrgId());

                requireReservationCapabilities(caller, student);
                int balanceBefore = student.getCreditsRemaining();
                if (balanceBefore <= 0) {
                    throw new NoCreditsRemainingException(studentId, balanceBefore, 1);
                }
                if (organization.isQuotaExhausted()) {
                    throw quotaExhausted(organization);
                }

                Instant now = Instant.now(clock);
                Interview interview = newInterview(student, resolvedRoute, CreditSource.STUDENT, now);
                tx.createInterview(interview);

                student.setCreditsUsed(student.getCreditsUsed() + 1);
                student.setUpdatedAt(now);
                tx.saveStudent(student);

                // quotaUsed is reserved for org-initiated interviews and stays untouched here
                organization.setStudentCreditsUsed(organization.getStudentCreditsUsed() + 1);
                organization.setUpdatedAt(now);
                tx.saveOrganization(organization);

                tx.appendHistory(historyEntry(student, CreditHistoryType.USED, 1,
                        "Self-initiated " + resolvedRoute + " interview", caller.callerId(),
                        interview.getId(), balanceBefore, student.getCreditsRemaining(), now));

                return new Reservation(interview.getId(), student.getOrgId(), student.getCreditsRemaining());
            });

            logCreditMutation(log, "info", "Reserved interview {} for student {} (route {})",
                    reservation.orgId(), studentId, CreditHistoryType.USED.wireName(), 1,
                    reservation.balanceAfter(), reservation.interviewId(),
                    reservation.interviewId(), studentId, resolvedRoute);
            metricsService.incrementReservationCreated(reservation.orgId(), CreditSource.STUDENT.wireName());
            return reservation.interviewId();
        } catch (LedgerException ex) {
            metricsService.incrementReservationRejected(ex.getErrorCode().getCode());
            throw ex;
        }
    }

    @Override
    public UUID reserveForOrganization(CallerContext caller, UUID studentId, String route) {
        try {
            Student snapshot = ledgerStore.read(tx -> {
                Student student = requireStudent(tx, studentId);
                accessPolicy.requireOrgAdmin(caller, student.getOrgId());
                Organization organization = requireOrganization(tx, student.getOrgId());
                if (organization.isQuotaExhausted()) {
                    throw quotaExhausted(organization);
                }
                return student;
            });
            String resolvedRoute = resolveRoute(route, snapshot);

            Reservation reservation = ledgerExecutor.execute("reserveForOrganization", tx -> {
                Student student = requireStudent(tx, studentId);
                Organization organization = requireOrganization(tx, student.getOrgId());
                if (organization.isQuotaExhausted()) {
                    throw quotaExhausted(organization);
                }

                Instant now = Instant.now(clock);
                Interview interview = newInterview(student, resolvedRoute, CreditSource.ORG, now);
                tx.createInterview(interview);

                organization.setQuotaUsed(organization.getQuotaUsed() + 1);
                organization.setUpdatedAt(now);
                tx.saveOrganization(organization);

                Map<String, Object> details = new LinkedHashMap<>();
                details.put("studentId", studentId);
                details.put("interviewId", interview.getId());
                details.put("route", resolvedRoute);
                details.put("quotaUsed", organization.getQuotaUsed());
                details.put("quotaLimit", organization.getQuotaLimit());
                tx.appendAudit(auditEntryFactory.create(organization.getId(), caller.callerId(),
                        AuditAction.QUOTA_CONSUMED, AuditEntryFactory.TARGET_ORGANIZATION,
                        organization.getId(), details));

                return new Reservation(interview.getId(), organization.getId(), student.getCreditsRemaining());
            });

            log.info("Reserved org-paid interview {} for student {} in org {} (route {})",
                    reservation.interviewId(), studentId, reservation.orgId(), resolvedRoute);
            metricsService.incrementReservationCreated(reservation.orgId(), CreditSource.ORG.wireName());
            return reservation.interviewId();
        } catch (LedgerException ex) {
            metricsService.incrementReservationRejected(ex.getErrorCode().getCode());
            throw ex;
        }
    }

    @Override
    public CreditSummaryDto adjustCredits(CallerContext caller, UUID studentId, int amount, String reason) {
        if (amount == 0) {
            throw new InvalidRequestException("Credit adjustment amount must not be zero");
        }
        if (amount < -AdjustCreditsRequest.MAX_ADJUSTMENT || amount > AdjustCreditsRequest.MAX_ADJUSTMENT) {
            throw new InvalidRequestException("Credit adjustment amount must be within "
                    + AdjustCreditsRequest.MAX_ADJUSTMENT + " of zero");
        }

        Adjustment adjustment = ledgerExecutor.execute("adjustCredits", tx -> {
            Student student = requireStudent(tx, studentId);
            accessPolicy.requireOrgAdmin(caller, student.getOrgId());
            Organization organization = requireOrganization(tx, student.getOrgId());

            int balanceBefore = student.getCreditsRemaining();
            Instant now = Instant.now(clock);
            CreditHistoryType type;
            if (amount > 0) {
                if (organization.hasQuotaLimit() && amount > organization.getAllocatableCredits()) {
                    throw new QuotaExceededException(organization.getId(), organization.getQuotaLimit(),
                            organization.getQuotaUsed(), "Cannot allocate " + amount + " credits; only "
                            + organization.getAllocatableCredits() + " remain in the organization quota");
                }
                int studentAllocated;
                int orgAllocated;
                try {
                    studentAllocated = Math.addExact(student.getCreditsAllocated(), amount);
                    orgAllocated = Math.addExact(organization.getStudentCreditsAllocated(), amount);
                } catch (ArithmeticException ex) {
                    throw new InvalidRequestException("Cannot allocate " + amount
                            + " credits; the allocated total would overflow");
                }
                type = CreditHistoryType.ALLOCATED;
                student.setCreditsAllocated(studentAllocated);
                organization.setStudentCreditsAllocated(orgAllocated);
            } else {
                int release = -amount;
                if (release > balanceBefore) {
                    throw new NoCreditsRemainingException(studentId, balanceBefore, release);
                }
                type = CreditHistoryType.DEALLOCATED;
                student.setCreditsAllocated(student.getCreditsAllocated() - release);
                organization.setStudentCreditsAllocated(Math.max(0, organization.getStudentCreditsAllocated() - release));
            }
            student.setUpdatedAt(now);
            organization.setUpdatedAt(now);
            tx.saveStudent(student);
            tx.saveOrganization(organization);

            String resolvedReason = StringUtils.hasText(reason) ? reason.trim()
                    : (amount > 0 ? "Credits allocated by organization" : "Credits deallocated by organization");
            tx.appendHistory(historyEntry(student, type, Math.abs(amount), resolvedReason, caller.callerId(),
                    null, balanceBefore, student.getCreditsRemaining(), now));
            return new Adjustment(student.getOrgId(), type, student.getCreditsRemaining());
        });

        logCreditMutation(log, "info", "Adjusted credits of student {} by {}",
                adjustment.orgId(), studentId, adjustment.type().wireName(), Math.abs(amount),
                adjustment.balanceAfter(), null, studentId, amount);
        metricsService.incrementCreditsAdjusted(adjustment.orgId(), amount);
        return getCreditSummary(caller, studentId);
    }

    @Override
    public CreditSummaryDto restoreCredit(CallerContext caller, UUID interviewId, String reason) {
        Restoration restoration = ledgerExecutor.execute("restoreCredit", tx -> {
            Interview interview = tx.findInterview(interviewId)
                    .orElseThrow(() -> ResourceNotFoundException.of("Interview", interviewId));
            accessPolicy.requireOrgAdmin(caller, interview.getOrgId());

            if (interview.getStatus() != InterviewStatus.FAILED) {
                throw new InvalidStateException("Only failed interviews can have their credit restored; interview "
                        + interviewId + " is " + interview.getStatus().wireName());
            }
            if (interview.getCreditSource() != CreditSource.STUDENT) {
                throw new InvalidRequestException("Interview " + interviewId + " was paid from the organization quota");
            }
            if (interview.isCreditRestored()) {
                return new Restoration(interview.getUserId(), interview.getOrgId(), false, -1);
            }

            Student student = requireStudent(tx, interview.getUserId());
            if (student.getCreditsUsed() <= 0) {
                throw new InvalidStateException("Student " + student.getId() + " has no used credits to restore");
            }
            Instant now = Instant.now(clock);
            int balanceBefore = student.getCreditsRemaining();
            student.setCreditsUsed(student.getCreditsUsed() - 1);
            student.setUpdatedAt(now);
            tx.saveStudent(student);

            interview.setCreditRestored(true);
            interview.setUpdatedAt(now);
            tx.saveInterview(interview);

            String resolvedReason = StringUtils.hasText(reason) ? reason.trim()
                    : "Credit restored for failed interview";
            tx.appendHistory(historyEntry(student, CreditHistoryType.RESTORED, 1, resolvedReason,
                    caller.callerId(), interviewId, balanceBefore, student.getCreditsRemaining(), now));
            tx.appendAudit(auditEntryFactory.create(interview.getOrgId(), caller.callerId(),
                    AuditAction.CREDIT_RESTORED, AuditEntryFactory.TARGET_INTERVIEW, interviewId,
                    Map.of("studentId", student.getId(), "reason", resolvedReason)));
            return new Restoration(student.getId(), interview.getOrgId(), true, student.getCreditsRemaining());
        });

        if (restoration.restored()) {
            logCreditMutation(log, "info", "Restored credit for failed interview {}",
                    restoration.orgId(), restoration.studentId(), CreditHistoryType.RESTORED.wireName(), 1,
                    restoration.balanceAfter(), interviewId, interviewId);
            metricsService.incrementCreditRestored(restoration.orgId());
        } else {
            log.info("Credit for interview {} was already restored; nothing to do", interviewId);
        }
        return getCreditSummary(caller, restoration.studentId());
    }

    @Override
    public CreditSummaryDto getCreditSummary(CallerContext caller, UUID studentId) {
        return ledgerStore.read(tx -> {
            Student student = requireStudent(tx, studentId);
            accessPolicy.requireSelfOrAdmin(caller, studentId, student.getOrgId());
            return creditHistoryMapper.toSummary(student,
                    tx.findHistoryByStudent(studentId, ledgerProperties.getHistoryPageSize()));
        });
    }

    private void requireReservationCapabilities(CallerContext caller, Student student) {
        if (!student.isDashboardEnabled()) {
            throw new ForbiddenException("Dashboard access is disabled for student " + student.getId());
        }
        if (caller.role() == CallerRole.STUDENT && caller.isSelf(student.getId())
                && !student.isCanSelfStartInterviews()) {
            throw new ForbiddenException("Self-started interviews are disabled for student " + student.getId());
        }
    }

    private String resolveRoute(String requested, Student student) {
        if (StringUtils.hasText(requested)) {
            return requested.trim();
        }
        if (StringUtils.hasText(student.getDefaultRoute())) {
            return student.getDefaultRoute();
        }
        return interviewProperties.getDefaultRoute();
    }

    private Interview newInterview(Student student, String route, CreditSource source, Instant now) {
        Interview interview = new Interview();
        interview.setId(UUID.randomUUID());
        interview.setOrgId(student.getOrgId());
        interview.setUserId(student.getId());
        interview.setRoute(route);
        interview.setStatus(InterviewStatus.SCHEDULED);
        interview.setCreditSource(source);
        interview.setStartTime(now);
        interview.setCreatedAt(now);
        interview.setUpdatedAt(now);
        return interview;
    }

    private CreditHistoryEntry historyEntry(Student student, CreditHistoryType type, int amount, String reason,
                                            UUID performedBy, UUID interviewId,
                                            int balanceBefore, int balanceAfter, Instant now) {
        CreditHistoryEntry entry = new CreditHistoryEntry();
        entry.setOrgId(student.getOrgId());
        entry.setStudentId(student.getId());
        entry.setType(type);
        entry.setAmount(amount);
        entry.setReason(reason);
        entry.setPerformedBy(performedBy);
        entry.setInterviewId(interviewId);
        entry.setBalanceBefore(balanceBefore);
        entry.setBalanceAfter(balanceAfter);
        entry.setTimestamp(now);
        entry.setSequenceNo(student.getVersion());
        return entry;
    }

    private static Student requireStudent(LedgerTransaction tx, UUID studentId) {
        return tx.findStudent(studentId)
                .orElseThrow(() -> ResourceNotFoundException.of("Student", studentId));
    }

    private static Organization requireOrganization(LedgerTransaction tx, UUID orgId) {
        return tx.findOrganization(orgId)
                .orElseThrow(() -> ResourceNotFoundException.of("Organization", orgId));
    }

    private static QuotaExceededException quotaExhausted(Organization organization) {
        return new QuotaExceededException(organization.getId(), organization.getQuotaLimit(),
                organization.getQuotaUsed(), "Organization quota of " + organization.getQuotaLimit()
                + " interviews is exhausted");
    }

    private record Reservation(UUID interviewId, UUID orgId, int balanceAfter) {
    }

    private record Adjustment(UUID orgId, CreditHistoryType type, int balanceAfter) {
    }

    private record Restoration(UUID studentId, UUID orgId, boolean restored, int balanceAfter) {
    }
}
