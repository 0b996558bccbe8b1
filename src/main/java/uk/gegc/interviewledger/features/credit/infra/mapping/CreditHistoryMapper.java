package uk.gegc.interviewledger.features.credit.infra.mapping;

import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.ReportingPolicy;
import uk.gegc.interviewledger.features.credit.api.dto.CreditHistoryEntryDto;
import uk.gegc.interviewledger.features.credit.api.dto.CreditSummaryDto;
import uk.gegc.interviewledger.features.credit.domain.model.CreditHistoryEntry;
import uk.gegc.interviewledger.features.credit.domain.model.Student;

import java.util.List;

@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.ERROR)
public interface CreditHistoryMapper {

    CreditHistoryEntryDto toDto(CreditHistoryEntry entity);

    List<CreditHistoryEntryDto> toDtos(List<CreditHistoryEntry> entities);

    @Mapping(target = "studentId", source = "student.id")
    @Mapping(target = "orgId", source = "student.orgId")
    @Mapping(target = "creditsAllocated", source = "student.creditsAllocated")
    @Mapping(target = "creditsUsed", source = "student.creditsUsed")
    @Mapping(target = "creditsRemaining", source = "student.creditsRemaining")
    @Mapping(target = "history", source = "history")
    CreditSummaryDto toSummary(Student student, List<CreditHistoryEntry> history);
}
