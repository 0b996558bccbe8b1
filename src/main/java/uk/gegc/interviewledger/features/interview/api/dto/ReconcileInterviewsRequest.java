package uk.gegc.interviewledger.features.interview.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Positive;

@Schema(name = "ReconcileInterviewsRequest")
public record ReconcileInterviewsRequest(
        @Schema(description = "Age after which an in-progress interview is abandoned; defaults to configuration", example = "7200")
        @Positive
        Long stalenessWindowSeconds
) {}
