package uk.gegc.interviewledger.features.interview.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record FailInterviewRequest(
        @NotBlank(message = "reason is required")
        @Size(max = 255)
        String reason
) {}
