package uk.gegc.interviewledger.features.ledger.infra;

import jakarta.persistence.EntityManager;
import jakarta.persistence.OptimisticLockException;
import jakarta.persistence.PersistenceException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;
import uk.gegc.interviewledger.features.audit.domain.model.AuditEntry;
import uk.gegc.interviewledger.features.audit.domain.repository.AuditEntryRepository;
import uk.gegc.interviewledger.features.credit.domain.model.CreditHistoryEntry;
import uk.gegc.interviewledger.features.credit.domain.model.Organization;
import uk.gegc.interviewledger.features.credit.domain.model.Student;
import uk.gegc.interviewledger.features.credit.domain.repository.CreditHistoryRepository;
import uk.gegc.interviewledger.features.credit.domain.repository.OrganizationRepository;
import uk.gegc.interviewledger.features.credit.domain.repository.StudentRepository;
import uk.gegc.interviewledger.features.interview.domain.model.Interview;
import uk.gegc.interviewledger.features.interview.domain.model.InterviewStatus;
import uk.gegc.interviewledger.features.interview.domain.repository.InterviewRepository;
import uk.gegc.interviewledger.features.ledger.domain.LedgerConflictException;
import uk.gegc.interviewledger.features.ledger.domain.LedgerStore;
import uk.gegc.interviewledger.features.ledger.domain.LedgerStoreException;
import uk.gegc.interviewledger.features.ledger.domain.LedgerTransaction;
import uk.gegc.interviewledger.features.ledger.domain.LedgerWork;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * {@link LedgerStore} over Spring Data JPA. Each unit of work runs in its own transaction; entity
 * {@code @Version} columns provide the optimistic conflict detection. Changes are flushed before
 * commit so conflicts surface inside the transaction boundary.
 */
@Slf4j
@Component
public class JpaLedgerStore implements LedgerStore {

    private final TransactionTemplate writeTemplate;
    private final TransactionTemplate readTemplate;
    private final EntityManager entityManager;
    private final OrganizationRepository organizationRepository;
    private final StudentRepository studentRepository;
    private final InterviewRepository interviewRepository;
    private final CreditHistoryRepository creditHistoryRepository;
    private final AuditEntryRepository auditEntryRepository;

    public JpaLedgerStore(PlatformTransactionManager transactionManager,
                          EntityManager entityManager,
                          OrganizationRepository organizationRepository,
                          StudentRepository studentRepository,
                          InterviewRepository interviewRepository,
                          CreditHistoryRepository creditHistoryRepository,
                          AuditEntryRepository auditEntryRepository) {
        this.writeTemplate = new TransactionTemplate(transactionManager);
        this.writeTemplate.setPropagationBehavior(TransactionTemplate.PROPAGATION_REQUIRES_NEW);
        this.readTemplate = new TransactionTemplate(transactionManager);
        this.readTemplate.setReadOnly(true);
        this.entityManager = entityManager;
        this.organizationRepository = organizationRepository;
        this.studentRepository = studentRepository;
        this.interviewRepository = interviewRepository;
        this.creditHistoryRepository = creditHistoryRepository;
        this.auditEntryRepository = auditEntryRepository;
    }

    @Override
    public <T> T runTransaction(LedgerWork<T> work) {
        return execute(writeTemplate, work, true);
    }

    @Override
    public <T> T read(LedgerWork<T> work) {
        return execute(readTemplate, work, false);
    }

    private <T> T execute(TransactionTemplate template, LedgerWork<T> work, boolean flush) {
        try {
            return template.execute(status -> {
                T result = work.execute(new JpaLedgerTransaction());
                if (flush) {
                    entityManager.flush();
                }
                return result;
            });
        } catch (OptimisticLockingFailureException | OptimisticLockException ex) {
            throw new LedgerConflictException("Concurrent ledger update detected", ex);
        } catch (DataAccessException | TransactionException | PersistenceException ex) {
            log.error("Ledger store failure: {}", ex.getMessage(), ex);
            throw new LedgerStoreException("Ledger store operation failed", ex);
        }
    }

    private final class JpaLedgerTransaction implements LedgerTransaction {

        @Override
        public Optional<Organization> findOrganization(UUID orgId) {
            return organizationRepository.findById(orgId);
        }

        @Override
        public Optional<Student> findStudent(UUID studentId) {
            return studentRepository.findById(studentId);
        }

        @Override
        public Optional<Interview> findInterview(UUID interviewId) {
            return interviewRepository.findById(interviewId);
        }

        @Override
        public List<Interview> findInterviewsByStatus(InterviewStatus status) {
            return interviewRepository.findByStatus(status);
        }

        @Override
        public List<UUID> findAllStudentIds() {
            return studentRepository.findAllIds();
        }

        @Override
        public List<CreditHistoryEntry> findHistoryByStudent(UUID studentId, int limit) {
            return creditHistoryRepository.findByStudentIdOrderByTimestampDescSequenceNoDesc(studentId, PageRequest.of(0, limit));
        }

        @Override
        public List<CreditHistoryEntry> findAllHistoryByStudent(UUID studentId) {
            return creditHistoryRepository.findByStudentIdOrderByTimestampAscSequenceNoAsc(studentId);
        }

        @Override
        public List<AuditEntry> findAuditByTarget(UUID targetId) {
            return auditEntryRepository.findByTargetIdOrderByTimestampAsc(targetId);
        }

        @Override
        public void saveOrganization(Organization organization) {
            organizationRepository.save(organization);
        }

        @Override
        public void saveStudent(Student student) {
            studentRepository.save(student);
        }

        @Override
        public void createInterview(Interview interview) {
            entityManager.persist(interview);
        }

        @Override
        public void saveInterview(Interview interview) {
            interviewRepository.save(interview);
        }

        @Override
        public void appendHistory(CreditHistoryEntry entry) {
            creditHistoryRepository.save(entry);
        }

        @Override
        public void appendAudit(AuditEntry entry) {
            auditEntryRepository.save(entry);
        }
    }
}
