package uk.gegc.interviewledger.features.interview.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.interviewledger.features.interview.domain.model.CreditSource;
import uk.gegc.interviewledger.features.interview.domain.model.InterviewStatus;
import uk.gegc.interviewledger.features.scoring.domain.model.ScoreReport;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

@Schema(name = "InterviewDto", description = "Interview session and its lifecycle state")
public record InterviewDto(
        UUID id,
        UUID orgId,
        @Schema(description = "Student the interview belongs to")
        UUID userId,
        @Schema(example = "usa_f1")
        String route,
        @Schema(example = "in_progress")
        InterviewStatus status,
        @Schema(example = "student")
        CreditSource creditSource,
        Integer score,
        Integer finalScore,
        Map<String, Integer> scoreDetails,
        ScoreReport finalReport,
        String failureReason,
        boolean creditRestored,
        Instant startTime,
        Instant endTime,
        Instant createdAt,
        Instant updatedAt
) {}
