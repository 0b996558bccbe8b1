package uk.gegc.interviewledger.features.scoring.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;

import java.util.List;
import java.util.Map;

/**
 * Final report attached to a completed interview. Immutable once stored.
 */
@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
public record ScoreReport(
        String decision,
        int overall,
        Map<String, Integer> dimensions,
        String summary,
        List<String> strengths,
        List<String> weaknesses,
        String profile,
        boolean bodyEnabled,
        double perAnswerMean,
        Double holisticScore,
        double classificationScore,
        List<AppliedAdjustment> adjustments,
        List<ConsistencyWarning> consistencyWarnings,
        List<String> recommendations,
        List<Double> answerScores
) {
}
