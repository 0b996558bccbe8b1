package uk.gegc.interviewledger.features.interview.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(name = "InterviewReconciliationResult", description = "Outcome of one reconciliation sweep")
public record InterviewReconciliationResult(
        @Schema(description = "Interviews moved to a terminal state")
        int fixed,
        @Schema(description = "Interviews left untouched")
        int skipped,
        @Schema(description = "Interviews whose repair raised an error")
        int failed,
        @Schema(description = "In-progress interviews examined")
        int total
) {}
