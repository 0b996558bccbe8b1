package uk.gegc.interviewledger.features.credit.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

@Schema(name = "AdjustCreditsRequest", description = "Allocate (positive) or deallocate (negative) student credits")
public record AdjustCreditsRequest(
        @Schema(description = "Signed credit delta", example = "5", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotNull(message = "amount is required")
        @Min(value = -AdjustCreditsRequest.MAX_ADJUSTMENT, message = "amount must be at least -" + AdjustCreditsRequest.MAX_ADJUSTMENT)
        @Max(value = AdjustCreditsRequest.MAX_ADJUSTMENT, message = "amount must be at most " + AdjustCreditsRequest.MAX_ADJUSTMENT)
        Integer amount,

        @Schema(description = "Reason recorded in the credit history", example = "Spring term allowance")
        @Size(max = 255, message = "reason must be at most 255 characters")
        String reason
) {
    public static final int MAX_ADJUSTMENT = 10_000;
}
