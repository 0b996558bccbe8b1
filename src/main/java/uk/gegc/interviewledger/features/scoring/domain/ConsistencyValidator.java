package uk.gegc.interviewledger.features.scoring.domain;

import uk.gegc.interviewledger.features.scoring.domain.model.ConsistencyPolicy;
import uk.gegc.interviewledger.features.scoring.domain.model.ConsistencyWarning;
import uk.gegc.interviewledger.features.scoring.domain.model.ConsistencyWarningType;
import uk.gegc.interviewledger.features.scoring.domain.model.ScoreRange;

import java.util.ArrayList;
import java.util.List;

/**
 * Compares the per-answer mean with an independently produced holistic score. Findings are
 * reported as warnings; neither score is ever changed.
 */
public class ConsistencyValidator {

    public static final String HOLISTIC_METRIC = "holisticScore";

    public List<ConsistencyWarning> validate(ConsistencyPolicy policy, double perAnswerMean, Double holisticScore) {
        if (holisticScore == null) {
            return List.of();
        }
        ScoreRange.require(HOLISTIC_METRIC, holisticScore);

        double discrepancy = Math.abs(perAnswerMean - holisticScore);
        List<ConsistencyWarning> warnings = new ArrayList<>();
        if (discrepancy > policy.warningThreshold()) {
            warnings.add(new ConsistencyWarning(
                    ConsistencyWarningType.DRIFT_WARNING,
                    perAnswerMean,
                    holisticScore,
                    discrepancy,
                    String.format("Holistic score differs from the per-answer mean by %.1f points (threshold %.1f)",
                            discrepancy, policy.warningThreshold())
            ));
        }
        if (perAnswerMean >= policy.highPerformerFloor() && discrepancy > policy.maxDiscrepancy()) {
            warnings.add(new ConsistencyWarning(
                    ConsistencyWarningType.HIGH_PERFORMER_DRIFT,
                    perAnswerMean,
                    holisticScore,
                    discrepancy,
                    String.format("High performer (mean %.1f) drifted %.1f points from the holistic score (limit %.1f)",
                            perAnswerMean, discrepancy, policy.maxDiscrepancy())
            ));
        }
        return List.copyOf(warnings);
    }
}
