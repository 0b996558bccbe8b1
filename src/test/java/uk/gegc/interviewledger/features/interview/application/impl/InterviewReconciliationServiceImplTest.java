package uk.gegc.interviewledger.features.interview.application.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import uk.gegc.interviewledger.features.audit.application.AuditEntryFactory;
import uk.gegc.interviewledger.features.audit.domain.model.AuditAction;
import uk.gegc.interviewledger.features.audit.domain.model.AuditEntry;
import uk.gegc.interviewledger.features.interview.api.dto.InterviewReconciliationResult;
import uk.gegc.interviewledger.features.interview.application.InterviewProperties;
import uk.gegc.interviewledger.features.interview.application.InterviewReconciliationService;
import uk.gegc.interviewledger.features.interview.domain.model.CreditSource;
import uk.gegc.interviewledger.features.interview.domain.model.Interview;
import uk.gegc.interviewledger.features.interview.domain.model.InterviewStatus;
import uk.gegc.interviewledger.features.ledger.application.LedgerMetricsService;
import uk.gegc.interviewledger.features.ledger.domain.LedgerStoreException;
import uk.gegc.interviewledger.features.ledger.support.InMemoryLedgerStore;
import uk.gegc.interviewledger.features.scoring.domain.model.ScoreReport;
import uk.gegc.interviewledger.shared.exception.InvalidRequestException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
@DisplayName("InterviewReconciliationService Tests")
class InterviewReconciliationServiceImplTest {

    private static final Instant NOW = Instant.parse("2026-05-20T12:00:00Z");

    @Mock
    private LedgerMetricsService metricsService;

    private InMemoryLedgerStore store;
    private InterviewReconciliationServiceImpl service;
    private UUID orgId;

    @BeforeEach
    void setUp() {
        store = new InMemoryLedgerStore();
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        service = new InterviewReconciliationServiceImpl(store, new AuditEntryFactory(new ObjectMapper(), clock),
                metricsService, new InterviewProperties(), clock);
        orgId = UUID.randomUUID();
    }

    private Interview interview(InterviewStatus status, Duration age) {
        Interview interview = new Interview();
        interview.setId(UUID.randomUUID());
        interview.setOrgId(orgId);
        interview.setUserId(UUID.randomUUID());
        interview.setRoute("usa_f1");
        interview.setStatus(status);
        interview.setCreditSource(CreditSource.STUDENT);
        interview.setCreatedAt(NOW.minus(age));
        interview.setStartTime(NOW.minus(age));
        return interview;
    }

    private static ScoreReport report(int overall) {
        return ScoreReport.builder()
                .decision("green")
                .overall(overall)
                .dimensions(Map.of("relevance", 85, "speech", 80))
                .summary("Strong")
                .strengths(List.of("relevance"))
                .weaknesses(List.of())
                .profile("usa_f1")
                .bodyEnabled(false)
                .perAnswerMean(overall)
                .classificationScore(overall)
                .adjustments(List.of())
                .consistencyWarnings(List.of())
                .recommendations(List.of())
                .answerScores(List.of((double) overall))
                .build();
    }

    private List<AuditAction> auditActions(UUID interviewId) {
        return store.audit().stream()
                .filter(entry -> interviewId.equals(entry.getTargetId()))
                .map(AuditEntry::getAction)
                .toList();
    }

    @Test
    @DisplayName("fails in-progress interviews older than the staleness window as abandoned")
    void reconcile_stale_failedAsAbandoned() {
        Interview stale = store.put(interview(InterviewStatus.IN_PROGRESS, Duration.ofHours(3)));

        InterviewReconciliationResult result = service.reconcile(Duration.ofHours(2));

        assertThat(result).isEqualTo(new InterviewReconciliationResult(1, 0, 0, 1));
        Interview stored = store.interview(stale.getId());
        assertThat(stored.getStatus()).isEqualTo(InterviewStatus.FAILED);
        assertThat(stored.getFailureReason()).isEqualTo(InterviewReconciliationService.ABANDONED_REASON);
        assertThat(stored.getEndTime()).isEqualTo(NOW);
        assertThat(auditActions(stale.getId())).containsExactly(AuditAction.INTERVIEW_RECONCILED_FAILED);
        verify(metricsService).recordInterviewReconciliation(0, 1, 0, 0);
    }

    @Test
    @DisplayName("completes in-progress interviews that already carry a report and backfills scores")
    void reconcile_withReport_completed() {
        Interview finished = interview(InterviewStatus.IN_PROGRESS, Duration.ofMinutes(20));
        finished.setFinalReport(report(82));
        store.put(finished);

        InterviewReconciliationResult result = service.reconcile(Duration.ofHours(2));

        assertThat(result.fixed()).isEqualTo(1);
        Interview stored = store.interview(finished.getId());
        assertThat(stored.getStatus()).isEqualTo(InterviewStatus.COMPLETED);
        assertThat(stored.getScore()).isEqualTo(82);
        assertThat(stored.getFinalScore()).isEqualTo(82);
        assertThat(stored.getScoreDetails()).containsEntry("relevance", 85);
        assertThat(stored.getEndTime()).isEqualTo(NOW);
        assertThat(auditActions(finished.getId())).containsExactly(AuditAction.INTERVIEW_RECONCILED_COMPLETED);
    }

    @Test
    @DisplayName("keeps an existing score when completing from a report")
    void reconcile_withReport_keepsExistingScore() {
        Interview finished = interview(InterviewStatus.IN_PROGRESS, Duration.ofHours(5));
        finished.setFinalReport(report(82));
        finished.setScore(79);
        store.put(finished);

        service.reconcile(Duration.ofHours(2));

        Interview stored = store.interview(finished.getId());
        assertThat(stored.getStatus()).isEqualTo(InterviewStatus.COMPLETED);
        assertThat(stored.getScore()).isEqualTo(79);
        assertThat(stored.getFinalScore()).isEqualTo(79);
    }

    @Test
    @DisplayName("leaves fresh and terminal interviews alone")
    void reconcile_freshAndTerminal_untouched() {
        Interview fresh = store.put(interview(InterviewStatus.IN_PROGRESS, Duration.ofMinutes(30)));
        Interview scheduled = store.put(interview(InterviewStatus.SCHEDULED, Duration.ofDays(2)));
        Interview completed = store.put(interview(InterviewStatus.COMPLETED, Duration.ofDays(2)));

        InterviewReconciliationResult result = service.reconcile(Duration.ofHours(2));

        assertThat(result).isEqualTo(new InterviewReconciliationResult(0, 1, 0, 1));
        assertThat(store.interview(fresh.getId()).getStatus()).isEqualTo(InterviewStatus.IN_PROGRESS);
        assertThat(store.interview(scheduled.getId()).getStatus()).isEqualTo(InterviewStatus.SCHEDULED);
        assertThat(store.interview(completed.getId()).getStatus()).isEqualTo(InterviewStatus.COMPLETED);
        assertThat(store.audit()).isEmpty();
    }

    @Test
    @DisplayName("running the sweep twice changes nothing the second time")
    void reconcile_idempotent() {
        Interview stale = store.put(interview(InterviewStatus.IN_PROGRESS, Duration.ofHours(3)));
        Interview finished = interview(InterviewStatus.IN_PROGRESS, Duration.ofMinutes(10));
        finished.setFinalReport(report(70));
        store.put(finished);

        InterviewReconciliationResult first = service.reconcile(Duration.ofHours(2));
        InterviewReconciliationResult second = service.reconcile(Duration.ofHours(2));

        assertThat(first.fixed()).isEqualTo(2);
        assertThat(second).isEqualTo(new InterviewReconciliationResult(0, 0, 0, 0));
        assertThat(store.audit()).hasSize(2);
        assertThat(store.interview(stale.getId()).getStatus()).isEqualTo(InterviewStatus.FAILED);
    }

    @Test
    @DisplayName("a conflicting writer turns the repair into a skip")
    void reconcile_conflict_skipped() {
        store.put(interview(InterviewStatus.IN_PROGRESS, Duration.ofHours(3)));
        store.failNextCommitsWithConflict(1);

        InterviewReconciliationResult result = service.reconcile(Duration.ofHours(2));

        assertThat(result).isEqualTo(new InterviewReconciliationResult(0, 1, 0, 1));
        assertThat(store.audit()).isEmpty();
    }

    @Test
    @DisplayName("a failing repair is counted and the remaining interviews are still repaired")
    void reconcile_failureIsolatedPerInterview() {
        Interview broken = store.put(interview(InterviewStatus.IN_PROGRESS, Duration.ofHours(4)));
        Interview stale = store.put(interview(InterviewStatus.IN_PROGRESS, Duration.ofHours(3)));
        Interview finished = interview(InterviewStatus.IN_PROGRESS, Duration.ofMinutes(15));
        finished.setFinalReport(report(74));
        store.put(finished);
        store.failCommitsWritingInterview(broken.getId(),
                () -> new LedgerStoreException("Ledger store operation failed", null));

        InterviewReconciliationResult result = service.reconcile(Duration.ofHours(2));

        assertThat(result).isEqualTo(new InterviewReconciliationResult(2, 0, 1, 3));
        assertThat(store.interview(broken.getId()).getStatus()).isEqualTo(InterviewStatus.IN_PROGRESS);
        assertThat(store.interview(stale.getId()).getStatus()).isEqualTo(InterviewStatus.FAILED);
        assertThat(store.interview(finished.getId()).getStatus()).isEqualTo(InterviewStatus.COMPLETED);
        assertThat(auditActions(broken.getId())).isEmpty();
        verify(metricsService).recordInterviewReconciliation(1, 1, 0, 1);
    }

    @Test
    @DisplayName("uses the configured window by default and rejects non-positive windows")
    void reconcile_windowValidation() {
        store.put(interview(InterviewStatus.IN_PROGRESS, Duration.ofMinutes(150)));

        assertThat(service.reconcile().fixed()).isEqualTo(1);
        assertThatThrownBy(() -> service.reconcile(Duration.ZERO))
                .isInstanceOf(InvalidRequestException.class);
        assertThatThrownBy(() -> service.reconcile(null))
                .isInstanceOf(InvalidRequestException.class);
    }
}
