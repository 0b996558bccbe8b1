package uk.gegc.interviewledger.features.credit.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.util.UUID;

@Schema(name = "ReserveInterviewRequest", description = "Request to reserve an interview for a student")
public record ReserveInterviewRequest(
        @Schema(description = "Student the interview is for", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotNull(message = "studentId is required")
        UUID studentId,

        @Schema(description = "Interview route; defaults to the student's route", example = "usa_f1")
        @Size(max = 64, message = "route must be at most 64 characters")
        String route
) {}
