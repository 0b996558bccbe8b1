package uk.gegc.interviewledger.features.interview.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.PositiveOrZero;

import java.util.Map;

@Schema(name = "AnswerScoreRequest", description = "Evaluator sub-scores for one answer (each 0-100)")
public record AnswerScoreRequest(
        @Schema(description = "Content sub-metrics", example = "{\"relevance\":80,\"specificity\":75,\"selfConsistency\":90,\"plausibility\":85}")
        @NotEmpty(message = "content sub-scores are required")
        Map<String, Double> content,

        @Schema(description = "Speech sub-metrics", example = "{\"fluency\":70,\"clarity\":80,\"tone\":75}")
        @NotEmpty(message = "speech sub-scores are required")
        Map<String, Double> speech,

        @Schema(description = "Body-language sub-metrics; required only when body tracking is enabled")
        Map<String, Double> body,

        @PositiveOrZero
        Integer sentenceCount,

        @PositiveOrZero
        Double durationSeconds,

        @Schema(example = "financial")
        String questionCategory,

        boolean statesTotalAmount,

        boolean statesNumericSplit,

        boolean majorContradiction
) {}
