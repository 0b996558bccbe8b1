package uk.gegc.interviewledger.features.audit.infra.mapping;

import org.mapstruct.Mapper;
import org.mapstruct.ReportingPolicy;
import uk.gegc.interviewledger.features.audit.api.dto.AuditEntryDto;
import uk.gegc.interviewledger.features.audit.domain.model.AuditEntry;

import java.util.List;

@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.ERROR)
public interface AuditEntryMapper {
    AuditEntryDto toDto(AuditEntry entity);
    List<AuditEntryDto> toDtos(List<AuditEntry> entities);
}
