package uk.gegc.interviewledger.features.credit.domain.repository;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import uk.gegc.interviewledger.features.credit.domain.model.CreditHistoryEntry;

import java.util.List;
import java.util.UUID;

public interface CreditHistoryRepository extends JpaRepository<CreditHistoryEntry, UUID> {

    List<CreditHistoryEntry> findByStudentIdOrderByTimestampDescSequenceNoDesc(UUID studentId, Pageable pageable);

    List<CreditHistoryEntry> findByStudentIdOrderByTimestampAscSequenceNoAsc(UUID studentId);
}
