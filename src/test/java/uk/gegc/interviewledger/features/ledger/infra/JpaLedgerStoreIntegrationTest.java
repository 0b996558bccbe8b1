package uk.gegc.interviewledger.features.ledger.infra;

import jakarta.persistence.EntityManager;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;
import uk.gegc.interviewledger.features.audit.api.dto.AuditEntryDto;
import uk.gegc.interviewledger.features.audit.application.AuditQueryService;
import uk.gegc.interviewledger.features.audit.domain.model.AuditAction;
import uk.gegc.interviewledger.features.credit.api.dto.CreditHistoryEntryDto;
import uk.gegc.interviewledger.features.credit.api.dto.CreditSummaryDto;
import uk.gegc.interviewledger.features.credit.application.CreditAllocationService;
import uk.gegc.interviewledger.features.credit.application.CreditReconciliationService;
import uk.gegc.interviewledger.features.credit.application.CreditReconciliationService.StudentReconciliationResult;
import uk.gegc.interviewledger.features.credit.domain.exception.NoCreditsRemainingException;
import uk.gegc.interviewledger.features.credit.domain.model.CreditHistoryType;
import uk.gegc.interviewledger.features.credit.domain.model.Organization;
import uk.gegc.interviewledger.features.credit.domain.model.Student;
import uk.gegc.interviewledger.features.interview.api.dto.InterviewDto;
import uk.gegc.interviewledger.features.interview.application.InterviewLifecycleService;
import uk.gegc.interviewledger.features.interview.application.InterviewReconciliationService;
import uk.gegc.interviewledger.features.interview.domain.model.InterviewStatus;
import uk.gegc.interviewledger.features.ledger.domain.LedgerStore;
import uk.gegc.interviewledger.features.scoring.domain.model.AnswerInput;
import uk.gegc.interviewledger.features.scoring.domain.model.ScoreReport;
import uk.gegc.interviewledger.shared.security.CallerContext;
import uk.gegc.interviewledger.shared.security.CallerRole;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest
@ActiveProfiles("test")
class JpaLedgerStoreIntegrationTest {

    @Autowired
    CreditAllocationService creditAllocationService;

    @Autowired
    InterviewLifecycleService lifecycleService;

    @Autowired
    InterviewReconciliationService interviewReconciliationService;

    @Autowired
    CreditReconciliationService creditReconciliationService;

    @Autowired
    AuditQueryService auditQueryService;

    @Autowired
    LedgerStore ledgerStore;

    @Autowired
    EntityManager entityManager;

    @Autowired
    PlatformTransactionManager transactionManager;

    private UUID orgId;
    private UUID studentId;
    private CallerContext admin;
    private CallerContext student;

    @BeforeEach
    void seed() {
        orgId = UUID.randomUUID();
        studentId = UUID.randomUUID();
        admin = new CallerContext(UUID.randomUUID(), orgId, CallerRole.ORG_ADMIN);
        student = new CallerContext(studentId, orgId, CallerRole.STUDENT);

        Organization organization = new Organization();
        organization.setId(orgId);
        organization.setName("Northfield College");

        Student record = new Student();
        record.setId(studentId);
        record.setOrgId(orgId);
        record.setName("Student One");
        record.setCanSelfStartInterviews(true);
        record.setDefaultRoute("usa_f1");

        new TransactionTemplate(transactionManager).executeWithoutResult(status -> {
            entityManager.persist(organization);
            entityManager.persist(record);
        });
    }

    private static AnswerInput answer(double content, double speech) {
        return new AnswerInput(
                Map.of("relevance", content, "specificity", content, "selfConsistency", content, "plausibility", content),
                Map.of("fluency", speech, "clarity", speech, "tone", speech),
                Map.of(),
                null, null, null, false, false, false);
    }

    @Test
    @DisplayName("allocate, reserve, start and finalize persist a consistent ledger")
    void fullLifecycle() {
        creditAllocationService.adjustCredits(admin, studentId, 2, "term allowance");

        UUID interviewId = creditAllocationService.reserve(student, studentId, null);
        lifecycleService.start(student, interviewId);
        ScoreReport report = lifecycleService.finalizeInterview(student, interviewId,
                List.of(answer(80, 60)), null, false);

        assertThat(report.overall()).isEqualTo(76);
        assertThat(report.decision()).isEqualTo("amber");

        InterviewDto stored = lifecycleService.get(student, interviewId);
        assertThat(stored.status()).isEqualTo(InterviewStatus.COMPLETED);
        assertThat(stored.score()).isEqualTo(76);
        assertThat(stored.finalScore()).isEqualTo(76);
        assertThat(stored.route()).isEqualTo("usa_f1");
        assertThat(stored.finalReport().overall()).isEqualTo(76);

        CreditSummaryDto summary = creditAllocationService.getCreditSummary(student, studentId);
        assertThat(summary.creditsAllocated()).isEqualTo(2);
        assertThat(summary.creditsUsed()).isEqualTo(1);
        assertThat(summary.creditsRemaining()).isEqualTo(1);
        assertThat(summary.history()).extracting(CreditHistoryEntryDto::type)
                .containsExactly(CreditHistoryType.USED, CreditHistoryType.ALLOCATED);

        assertThat(auditQueryService.getInterviewAuditTrail(admin, interviewId))
                .extracting(AuditEntryDto::action)
                .containsExactly(AuditAction.INTERVIEW_STARTED, AuditAction.SCORE_COMPUTED);

        StudentReconciliationResult reconciliation = creditReconciliationService.reconcileStudent(studentId);
        assertThat(reconciliation.isBalanced()).isTrue();
        assertThat(reconciliation.chainBreaks()).isZero();
    }

    @Test
    @DisplayName("a failed interview's credit is restored once and the history stays balanced")
    void failAndRestore() {
        creditAllocationService.adjustCredits(admin, studentId, 1, "single credit");
        UUID interviewId = creditAllocationService.reserve(student, studentId, "uk_student");

        assertThatThrownBy(() -> creditAllocationService.reserve(student, studentId, null))
                .isInstanceOf(NoCreditsRemainingException.class);

        lifecycleService.start(student, interviewId);
        lifecycleService.fail(student, interviewId, "connection dropped");

        CreditSummaryDto restored = creditAllocationService.restoreCredit(admin, interviewId, null);
        CreditSummaryDto again = creditAllocationService.restoreCredit(admin, interviewId, null);

        assertThat(restored.creditsRemaining()).isEqualTo(1);
        assertThat(again.creditsRemaining()).isEqualTo(1);
        assertThat(again.history()).extracting(CreditHistoryEntryDto::type)
                .containsExactly(CreditHistoryType.RESTORED, CreditHistoryType.USED, CreditHistoryType.ALLOCATED);
        assertThat(lifecycleService.get(admin, interviewId).creditRestored()).isTrue();
        assertThat(creditReconciliationService.reconcileStudent(studentId).isBalanced()).isTrue();
    }

    @Test
    @DisplayName("reconciliation leaves fresh in-progress interviews alone")
    void reconciliationKeepsFreshInterviews() {
        creditAllocationService.adjustCredits(admin, studentId, 1, null);
        UUID interviewId = creditAllocationService.reserve(student, studentId, null);
        lifecycleService.start(student, interviewId);

        interviewReconciliationService.reconcile(Duration.ofHours(2));

        assertThat(lifecycleService.get(student, interviewId).status()).isEqualTo(InterviewStatus.IN_PROGRESS);
    }

    @Test
    @DisplayName("organization-paid reservations consume quota without touching student credits")
    void organizationReservation() {
        UUID interviewId = creditAllocationService.reserveForOrganization(admin, studentId, null);

        Organization organization = ledgerStore.read(tx -> tx.findOrganization(orgId).orElseThrow());
        assertThat(organization.getQuotaUsed()).isEqualTo(1);
        assertThat(lifecycleService.get(admin, interviewId).status()).isEqualTo(InterviewStatus.SCHEDULED);
        assertThat(creditAllocationService.getCreditSummary(admin, studentId).history()).isEmpty();
    }
}
