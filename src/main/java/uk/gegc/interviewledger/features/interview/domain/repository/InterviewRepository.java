package uk.gegc.interviewledger.features.interview.domain.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import uk.gegc.interviewledger.features.interview.domain.model.Interview;
import uk.gegc.interviewledger.features.interview.domain.model.InterviewStatus;

import java.util.List;
import java.util.UUID;

public interface InterviewRepository extends JpaRepository<Interview, UUID> {

    List<Interview> findByStatus(InterviewStatus status);

    long countByStatus(InterviewStatus status);
}
