package uk.gegc.interviewledger.features.ledger.domain;

import uk.gegc.interviewledger.features.audit.domain.model.AuditEntry;
import uk.gegc.interviewledger.features.credit.domain.model.CreditHistoryEntry;
import uk.gegc.interviewledger.features.credit.domain.model.Organization;
import uk.gegc.interviewledger.features.credit.domain.model.Student;
import uk.gegc.interviewledger.features.interview.domain.model.Interview;
import uk.gegc.interviewledger.features.interview.domain.model.InterviewStatus;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Typed read-modify-write view of the ledger inside one atomic transaction. Reads observe the
 * transaction's own writes; all writes commit together or not at all.
 */
public interface LedgerTransaction {

    Optional<Organization> findOrganization(UUID orgId);

    Optional<Student> findStudent(UUID studentId);

    Optional<Interview> findInterview(UUID interviewId);

    List<Interview> findInterviewsByStatus(InterviewStatus status);

    List<UUID> findAllStudentIds();

    /**
     * History for one student, newest first, at most {@code limit} entries.
     */
    List<CreditHistoryEntry> findHistoryByStudent(UUID studentId, int limit);

    /**
     * Full history for one student, oldest first.
     */
    List<CreditHistoryEntry> findAllHistoryByStudent(UUID studentId);

    List<AuditEntry> findAuditByTarget(UUID targetId);

    void saveOrganization(Organization organization);

    void saveStudent(Student student);

    void createInterview(Interview interview);

    void saveInterview(Interview interview);

    void appendHistory(CreditHistoryEntry entry);

    void appendAudit(AuditEntry entry);
}
