package uk.gegc.interviewledger.features.interview.infra.mapping;

import org.mapstruct.Mapper;
import org.mapstruct.ReportingPolicy;
import uk.gegc.interviewledger.features.interview.api.dto.AnswerScoreRequest;
import uk.gegc.interviewledger.features.interview.api.dto.InterviewDto;
import uk.gegc.interviewledger.features.interview.domain.model.Interview;
import uk.gegc.interviewledger.features.scoring.domain.model.AnswerInput;

import java.util.List;

@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.ERROR)
public interface InterviewMapper {

    InterviewDto toDto(Interview interview);

    AnswerInput toAnswerInput(AnswerScoreRequest request);

    List<AnswerInput> toAnswerInputs(List<AnswerScoreRequest> requests);
}
