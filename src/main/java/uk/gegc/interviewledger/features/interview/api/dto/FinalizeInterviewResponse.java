package uk.gegc.interviewledger.features.interview.api.dto;

import uk.gegc.interviewledger.features.scoring.domain.model.ScoreReport;

public record FinalizeInterviewResponse(ScoreReport finalReport) {}
