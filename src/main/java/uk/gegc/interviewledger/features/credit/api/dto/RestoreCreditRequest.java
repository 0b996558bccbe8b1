package uk.gegc.interviewledger.features.credit.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Size;

@Schema(name = "RestoreCreditRequest")
public record RestoreCreditRequest(
        @Schema(description = "Reason recorded in the credit history", example = "Connection dropped")
        @Size(max = 255, message = "reason must be at most 255 characters")
        String reason
) {}
