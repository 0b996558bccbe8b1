package uk.gegc.interviewledger.features.credit.domain.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import uk.gegc.interviewledger.features.credit.domain.model.Student;

import java.util.List;
import java.util.UUID;

public interface StudentRepository extends JpaRepository<Student, UUID> {

    @Query("SELECT s.id FROM Student s ORDER BY s.id")
    List<UUID> findAllIds();
}
