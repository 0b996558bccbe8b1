package uk.gegc.interviewledger.features.ledger.support;

import uk.gegc.interviewledger.features.audit.domain.model.AuditEntry;
import uk.gegc.interviewledger.features.credit.domain.model.CreditHistoryEntry;
import uk.gegc.interviewledger.features.credit.domain.model.Organization;
import uk.gegc.interviewledger.features.credit.domain.model.Student;
import uk.gegc.interviewledger.features.interview.domain.model.Interview;
import uk.gegc.interviewledger.features.interview.domain.model.InterviewStatus;
import uk.gegc.interviewledger.features.ledger.domain.LedgerConflictException;
import uk.gegc.interviewledger.features.ledger.domain.LedgerStore;
import uk.gegc.interviewledger.features.ledger.domain.LedgerStoreException;
import uk.gegc.interviewledger.features.ledger.domain.LedgerTransaction;
import uk.gegc.interviewledger.features.ledger.domain.LedgerWork;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Optimistic in-memory ledger for service tests. Every transaction works on copies and commits
 * under a lock after checking the versions it read, like the JPA store does.
 */
public class InMemoryLedgerStore implements LedgerStore {

    private final Map<UUID, Organization> organizations = new ConcurrentHashMap<>();
    private final Map<UUID, Student> students = new ConcurrentHashMap<>();
    private final Map<UUID, Interview> interviews = new ConcurrentHashMap<>();
    private final List<CreditHistoryEntry> history = new CopyOnWriteArrayList<>();
    private final List<AuditEntry> audit = new CopyOnWriteArrayList<>();

    private final AtomicInteger forcedConflicts = new AtomicInteger();
    private final AtomicInteger commits = new AtomicInteger();
    private final AtomicInteger transactions = new AtomicInteger();
    private volatile Supplier<RuntimeException> commitFailure;
    private volatile Runnable beforeCommit;
    private final Map<UUID, Supplier<RuntimeException>> interviewWriteFailures = new ConcurrentHashMap<>();

    // seeding, bypasses versioning

    public Organization put(Organization organization) {
        organizations.put(organization.getId(), copy(organization));
        return organization;
    }

    public Student put(Student student) {
        students.put(student.getId(), copy(student));
        return student;
    }

    public Interview put(Interview interview) {
        interviews.put(interview.getId(), copy(interview));
        return interview;
    }

    public void putHistory(CreditHistoryEntry entry) {
        if (entry.getId() == null) {
            entry.setId(UUID.randomUUID());
        }
        history.add(entry);
    }

    // inspection

    public Organization organization(UUID id) {
        return copy(organizations.get(id));
    }

    public Student student(UUID id) {
        return copy(students.get(id));
    }

    public Interview interview(UUID id) {
        return copy(interviews.get(id));
    }

    public List<Interview> interviews() {
        return interviews.values().stream().map(InMemoryLedgerStore::copy).toList();
    }

    public List<CreditHistoryEntry> history(UUID studentId) {
        return history.stream().filter(e -> studentId.equals(e.getStudentId())).toList();
    }

    public List<CreditHistoryEntry> history() {
        return List.copyOf(history);
    }

    public List<AuditEntry> audit() {
        return List.copyOf(audit);
    }

    public int commitCount() {
        return commits.get();
    }

    public int transactionCount() {
        return transactions.get();
    }

    // fault injection

    /**
     * The next {@code count} write transactions fail their commit with a conflict.
     */
    public void failNextCommitsWithConflict(int count) {
        forcedConflicts.set(count);
    }

    /**
     * Every write transaction fails its commit with the supplied exception until cleared.
     */
    public void failCommitsWith(Supplier<RuntimeException> failure) {
        this.commitFailure = failure;
    }

    /**
     * Write transactions that update the given interview fail their commit with the supplied exception.
     */
    public void failCommitsWritingInterview(UUID interviewId, Supplier<RuntimeException> failure) {
        interviewWriteFailures.put(interviewId, failure);
    }

    /**
     * Runs after the work of a write transaction and before its commit.
     */
    public void beforeCommit(Runnable hook) {
        this.beforeCommit = hook;
    }

    @Override
    public <T> T runTransaction(LedgerWork<T> work) {
        transactions.incrementAndGet();
        Tx tx = new Tx();
        T result = work.execute(tx);
        Runnable hook = beforeCommit;
        if (hook != null) {
            hook.run();
        }
        Supplier<RuntimeException> failure = commitFailure;
        if (failure != null) {
            throw failure.get();
        }
        for (UUID interviewId : tx.dirtyInterviews.keySet()) {
            Supplier<RuntimeException> interviewFailure = interviewWriteFailures.get(interviewId);
            if (interviewFailure != null) {
                throw interviewFailure.get();
            }
        }
        if (forcedConflicts.getAndUpdate(n -> n > 0 ? n - 1 : 0) > 0) {
            throw new LedgerConflictException("Forced conflict");
        }
        tx.commit();
        commits.incrementAndGet();
        return result;
    }

    @Override
    public <T> T read(LedgerWork<T> work) {
        return work.execute(new Tx());
    }

    private class Tx implements LedgerTransaction {

        private final Map<UUID, Organization> dirtyOrganizations = new LinkedHashMap<>();
        private final Map<UUID, Student> dirtyStudents = new LinkedHashMap<>();
        private final Map<UUID, Interview> dirtyInterviews = new LinkedHashMap<>();
        private final Map<UUID, Interview> newInterviews = new LinkedHashMap<>();
        private final List<CreditHistoryEntry> newHistory = new ArrayList<>();
        private final List<AuditEntry> newAudit = new ArrayList<>();

        @Override
        public Optional<Organization> findOrganization(UUID orgId) {
            if (dirtyOrganizations.containsKey(orgId)) {
                return Optional.of(dirtyOrganizations.get(orgId));
            }
            return Optional.ofNullable(copy(organizations.get(orgId)));
        }

        @Override
        public Optional<Student> findStudent(UUID studentId) {
            if (dirtyStudents.containsKey(studentId)) {
                return Optional.of(dirtyStudents.get(studentId));
            }
            return Optional.ofNullable(copy(students.get(studentId)));
        }

        @Override
        public Optional<Interview> findInterview(UUID interviewId) {
            if (newInterviews.containsKey(interviewId)) {
                return Optional.of(newInterviews.get(interviewId));
            }
            if (dirtyInterviews.containsKey(interviewId)) {
                return Optional.of(dirtyInterviews.get(interviewId));
            }
            return Optional.ofNullable(copy(interviews.get(interviewId)));
        }

        @Override
        public List<Interview> findInterviewsByStatus(InterviewStatus status) {
            List<Interview> result = new ArrayList<>();
            for (UUID id : interviews.keySet()) {
                findInterview(id).filter(i -> i.getStatus() == status).ifPresent(result::add);
            }
            newInterviews.values().stream().filter(i -> i.getStatus() == status).forEach(result::add);
            return result;
        }

        @Override
        public List<UUID> findAllStudentIds() {
            return new ArrayList<>(students.keySet());
        }

        @Override
        public List<CreditHistoryEntry> findHistoryByStudent(UUID studentId, int limit) {
            List<CreditHistoryEntry> all = new ArrayList<>(findAllHistoryByStudent(studentId));
            Collections.reverse(all);
            return all.stream().limit(limit).toList();
        }

        @Override
        public List<CreditHistoryEntry> findAllHistoryByStudent(UUID studentId) {
            List<CreditHistoryEntry> all = new ArrayList<>(history);
            all.addAll(newHistory);
            return all.stream()
                    .filter(e -> studentId.equals(e.getStudentId()))
                    .sorted(Comparator.comparing(CreditHistoryEntry::getTimestamp)
                            .thenComparingLong(CreditHistoryEntry::getSequenceNo))
                    .toList();
        }

        @Override
        public List<AuditEntry> findAuditByTarget(UUID targetId) {
            List<AuditEntry> all = new ArrayList<>(audit);
            all.addAll(newAudit);
            return all.stream()
                    .filter(e -> targetId.equals(e.getTargetId()))
                    .sorted(Comparator.comparing(AuditEntry::getTimestamp))
                    .toList();
        }

        @Override
        public void saveOrganization(Organization organization) {
            dirtyOrganizations.put(organization.getId(), organization);
        }

        @Override
        public void saveStudent(Student student) {
            dirtyStudents.put(student.getId(), student);
        }

        @Override
        public void createInterview(Interview interview) {
            newInterviews.put(interview.getId(), interview);
        }

        @Override
        public void saveInterview(Interview interview) {
            if (!newInterviews.containsKey(interview.getId())) {
                dirtyInterviews.put(interview.getId(), interview);
            }
        }

        @Override
        public void appendHistory(CreditHistoryEntry entry) {
            if (entry.getId() == null) {
                entry.setId(UUID.randomUUID());
            }
            newHistory.add(entry);
        }

        @Override
        public void appendAudit(AuditEntry entry) {
            if (entry.getId() == null) {
                entry.setId(UUID.randomUUID());
            }
            newAudit.add(entry);
        }

        void commit() {
            synchronized (InMemoryLedgerStore.this) {
                for (Organization o : dirtyOrganizations.values()) {
                    requireVersion("Organization", o.getId(), o.getVersion(),
                            organizations.get(o.getId()) == null ? null : organizations.get(o.getId()).getVersion());
                }
                for (Student s : dirtyStudents.values()) {
                    requireVersion("Student", s.getId(), s.getVersion(),
                            students.get(s.getId()) == null ? null : students.get(s.getId()).getVersion());
                }
                for (Interview i : dirtyInterviews.values()) {
                    requireVersion("Interview", i.getId(), i.getVersion(),
                            interviews.get(i.getId()) == null ? null : interviews.get(i.getId()).getVersion());
                }
                for (Interview i : newInterviews.values()) {
                    if (interviews.containsKey(i.getId())) {
                        throw new LedgerStoreException("Duplicate interview id " + i.getId(), null);
                    }
                }

                dirtyOrganizations.values().forEach(o -> {
                    o.setVersion(o.getVersion() + 1);
                    organizations.put(o.getId(), copy(o));
                });
                dirtyStudents.values().forEach(s -> {
                    s.setVersion(s.getVersion() + 1);
                    students.put(s.getId(), copy(s));
                });
                dirtyInterviews.values().forEach(i -> {
                    i.setVersion(i.getVersion() + 1);
                    interviews.put(i.getId(), copy(i));
                });
                newInterviews.values().forEach(i -> interviews.put(i.getId(), copy(i)));
                history.addAll(newHistory);
                audit.addAll(newAudit);
            }
        }

        private void requireVersion(String type, UUID id, long read, Long current) {
            if (current == null || current != read) {
                throw new LedgerConflictException(type + " " + id + " was modified concurrently");
            }
        }
    }

    static Organization copy(Organization source) {
        if (source == null) {
            return null;
        }
        Organization o = new Organization();
        o.setId(source.getId());
        o.setName(source.getName());
        o.setQuotaLimit(source.getQuotaLimit());
        o.setQuotaUsed(source.getQuotaUsed());
        o.setStudentCreditsAllocated(source.getStudentCreditsAllocated());
        o.setStudentCreditsUsed(source.getStudentCreditsUsed());
        o.setVersion(source.getVersion());
        o.setUpdatedAt(source.getUpdatedAt());
        return o;
    }

    static Student copy(Student source) {
        if (source == null) {
            return null;
        }
        Student s = new Student();
        s.setId(source.getId());
        s.setOrgId(source.getOrgId());
        s.setName(source.getName());
        s.setCreditsAllocated(source.getCreditsAllocated());
        s.setCreditsUsed(source.getCreditsUsed());
        s.setCanSelfStartInterviews(source.isCanSelfStartInterviews());
        s.setDashboardEnabled(source.isDashboardEnabled());
        s.setDefaultRoute(source.getDefaultRoute());
        s.setVersion(source.getVersion());
        s.setUpdatedAt(source.getUpdatedAt());
        return s;
    }

    static Interview copy(Interview source) {
        if (source == null) {
            return null;
        }
        Interview i = new Interview();
        i.setId(source.getId());
        i.setOrgId(source.getOrgId());
        i.setUserId(source.getUserId());
        i.setRoute(source.getRoute());
        i.setStatus(source.getStatus());
        i.setCreditSource(source.getCreditSource());
        i.setScore(source.getScore());
        i.setFinalScore(source.getFinalScore());
        i.setScoreDetails(source.getScoreDetails() == null ? null : new LinkedHashMap<>(source.getScoreDetails()));
        i.setFinalReport(source.getFinalReport());
        i.setFailureReason(source.getFailureReason());
        i.setCreditRestored(source.isCreditRestored());
        i.setStartTime(source.getStartTime());
        i.setEndTime(source.getEndTime());
        i.setCreatedAt(source.getCreatedAt());
        i.setUpdatedAt(source.getUpdatedAt());
        i.setVersion(source.getVersion());
        return i;
    }
}
