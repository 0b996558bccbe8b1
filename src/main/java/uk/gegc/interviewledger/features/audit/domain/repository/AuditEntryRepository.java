package uk.gegc.interviewledger.features.audit.domain.repository;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import uk.gegc.interviewledger.features.audit.domain.model.AuditEntry;

import java.util.List;
import java.util.UUID;

public interface AuditEntryRepository extends JpaRepository<AuditEntry, UUID> {

    List<AuditEntry> findByTargetIdOrderByTimestampAsc(UUID targetId);

    List<AuditEntry> findByOrgIdOrderByTimestampDesc(UUID orgId, Pageable pageable);
}
