package uk.gegc.interviewledger.features.credit.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.interviewledger.features.credit.domain.model.CreditHistoryType;

import java.time.Instant;
import java.util.UUID;

@Schema(name = "CreditHistoryEntryDto", description = "One credit mutation; balances are credits remaining")
public record CreditHistoryEntryDto(
        UUID id,
        UUID orgId,
        UUID studentId,
        @Schema(example = "used")
        CreditHistoryType type,
        @Schema(example = "1")
        int amount,
        String reason,
        UUID performedBy,
        UUID interviewId,
        @Schema(example = "3")
        int balanceBefore,
        @Schema(example = "2")
        int balanceAfter,
        Instant timestamp
) {}
