package uk.gegc.interviewledger.features.credit.domain.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import uk.gegc.interviewledger.features.credit.domain.model.Organization;

import java.util.UUID;

public interface OrganizationRepository extends JpaRepository<Organization, UUID> {
}
