package uk.gegc.interviewledger.features.credit.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;
import java.util.UUID;

@Schema(name = "CreditSummaryDto", description = "Student credit balance with recent history")
public record CreditSummaryDto(
        UUID studentId,
        UUID orgId,
        @Schema(example = "5")
        int creditsAllocated,
        @Schema(example = "2")
        int creditsUsed,
        @Schema(example = "3")
        int creditsRemaining,
        @Schema(description = "Most recent entries, newest first")
        List<CreditHistoryEntryDto> history
) {}
