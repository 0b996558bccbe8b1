package uk.gegc.interviewledger.features.interview.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.interviewledger.features.audit.application.AuditEntryFactory;
import uk.gegc.interviewledger.features.audit.domain.model.AuditAction;
import uk.gegc.interviewledger.features.interview.api.dto.InterviewDto;
import uk.gegc.interviewledger.features.interview.application.InterviewLifecycleService;
import uk.gegc.interviewledger.features.interview.domain.model.Interview;
import uk.gegc.interviewledger.features.interview.domain.model.InterviewStatus;
import uk.gegc.interviewledger.features.interview.infra.mapping.InterviewMapper;
import uk.gegc.interviewledger.features.ledger.application.RetryingLedgerExecutor;
import uk.gegc.interviewledger.features.ledger.domain.LedgerStore;
import uk.gegc.interviewledger.features.ledger.domain.LedgerTransaction;
import uk.gegc.interviewledger.features.scoring.application.ScoringService;
import uk.gegc.interviewledger.features.scoring.domain.model.AnswerInput;
import uk.gegc.interviewledger.features.scoring.domain.model.ScoreReport;
import uk.gegc.interviewledger.shared.exception.InvalidRequestException;
import uk.gegc.interviewledger.shared.exception.InvalidStateException;
import uk.gegc.interviewledger.shared.exception.ResourceNotFoundException;
import uk.gegc.interviewledger.shared.security.AccessPolicy;
import uk.gegc.interviewledger.shared.security.CallerContext;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static uk.gegc.interviewledger.features.ledger.application.LedgerStructuredLogger.logTransition;

@Slf4j
@Service
@RequiredArgsConstructor
public class InterviewLifecycleServiceImpl implements InterviewLifecycleService {

    private final LedgerStore ledgerStore;
    private final RetryingLedgerExecutor ledgerExecutor;
    private final ScoringService scoringService;
    private final AccessPolicy accessPolicy;
    private final AuditEntryFactory auditEntryFactory;
    private final InterviewMapper interviewMapper;
    private final Clock clock;

    @Override
    public InterviewDto start(CallerContext caller, UUID interviewId) {
        Interview started = ledgerExecutor.execute("startInterview", tx -> {
            Interview interview = requireAccessible(tx, caller, interviewId);
            requireTransition(interview, InterviewStatus.IN_PROGRESS);

            Instant now = Instant.now(clock);
            interview.setStatus(InterviewStatus.IN_PROGRESS);
            interview.setStartTime(now);
            interview.setUpdatedAt(now);
            tx.saveInterview(interview);
            tx.appendAudit(auditEntryFactory.create(interview.getOrgId(), caller.callerId(),
                    AuditAction.INTERVIEW_STARTED, AuditEntryFactory.TARGET_INTERVIEW, interviewId,
                    Map.of("route", interview.getRoute())));
            return interview;
        });

        logTransition(log, "info", "Interview {} started", started.getOrgId(), interviewId,
                started.getStatus().wireName(), interviewId);
        return interviewMapper.toDto(started);
    }

    @Override
    public ScoreReport finalizeInterview(CallerContext caller, UUID interviewId, List<AnswerInput> answers,
                                         Double holisticScore, boolean bodyEnabled) {
        if (answers == null || answers.isEmpty()) {
            throw new InvalidRequestException("At least one answer score is required");
        }
        Interview snapshot = ledgerStore.read(tx -> {
            Interview interview = requireAccessible(tx, caller, interviewId);
            requireTransition(interview, InterviewStatus.COMPLETED);
            return interview;
        });

        // scoring is pure and runs outside the ledger transaction
        ScoreReport report = scoringService.score(snapshot.getRoute(), answers, holisticScore, bodyEnabled);

        Interview completed = ledgerExecutor.execute("finalizeInterview", tx -> {
            Interview interview = requireInterview(tx, interviewId);
            requireTransition(interview, InterviewStatus.COMPLETED);

            Instant now = Instant.now(clock);
            interview.setStatus(InterviewStatus.COMPLETED);
            interview.setScore(report.overall());
            interview.setFinalScore(report.overall());
            interview.setScoreDetails(new LinkedHashMap<>(report.dimensions()));
            interview.setFinalReport(report);
            interview.setEndTime(now);
            interview.setUpdatedAt(now);
            tx.saveInterview(interview);

            Map<String, Object> details = new LinkedHashMap<>();
            details.put("overall", report.overall());
            details.put("decision", report.decision());
            details.put("profile", report.profile());
            details.put("bodyEnabled", report.bodyEnabled());
            details.put("consistencyWarnings", report.consistencyWarnings().size());
            tx.appendAudit(auditEntryFactory.create(interview.getOrgId(), caller.callerId(),
                    AuditAction.SCORE_COMPUTED, AuditEntryFactory.TARGET_INTERVIEW, interviewId, details));
            return interview;
        });

        logTransition(log, "info", "Interview {} completed with overall {} ({})", completed.getOrgId(),
                interviewId, completed.getStatus().wireName(), interviewId, report.overall(), report.decision());
        return report;
    }

    @Override
    public InterviewDto fail(CallerContext caller, UUID interviewId, String reason) {
        if (reason == null || reason.isBlank()) {
            throw new InvalidRequestException("A failure reason is required");
        }
        Interview failed = ledgerExecutor.execute("failInterview", tx -> {
            Interview interview = requireAccessible(tx, caller, interviewId);
            requireTransition(interview, InterviewStatus.FAILED);

            Instant now = Instant.now(clock);
            interview.setStatus(InterviewStatus.FAILED);
            interview.setFailureReason(reason.trim());
            interview.setEndTime(now);
            interview.setUpdatedAt(now);
            tx.saveInterview(interview);
            tx.appendAudit(auditEntryFactory.create(interview.getOrgId(), caller.callerId(),
                    AuditAction.INTERVIEW_FAILED, AuditEntryFactory.TARGET_INTERVIEW, interviewId,
                    Map.of("reason", reason.trim())));
            return interview;
        });

        logTransition(log, "info", "Interview {} failed: {}", failed.getOrgId(), interviewId,
                failed.getStatus().wireName(), interviewId, failed.getFailureReason());
        return interviewMapper.toDto(failed);
    }

    @Override
    public InterviewDto get(CallerContext caller, UUID interviewId) {
        return ledgerStore.read(tx -> interviewMapper.toDto(requireAccessible(tx, caller, interviewId)));
    }

    private Interview requireAccessible(LedgerTransaction tx, CallerContext caller, UUID interviewId) {
        Interview interview = requireInterview(tx, interviewId);
        accessPolicy.requireSelfOrAdmin(caller, interview.getUserId(), interview.getOrgId());
        return interview;
    }

    private static Interview requireInterview(LedgerTransaction tx, UUID interviewId) {
        return tx.findInterview(interviewId)
                .orElseThrow(() -> ResourceNotFoundException.of("Interview", interviewId));
    }

    private static void requireTransition(Interview interview, InterviewStatus target) {
        if (!interview.getStatus().canTransitionTo(target)) {
            throw new InvalidStateException("Interview " + interview.getId() + " cannot move from "
                    + interview.getStatus().wireName() + " to " + target.wireName());
        }
    }
}
