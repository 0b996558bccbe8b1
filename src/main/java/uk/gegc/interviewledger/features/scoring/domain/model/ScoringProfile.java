package uk.gegc.interviewledger.features.scoring.domain.model;

import lombok.Builder;
import uk.gegc.interviewledger.features.scoring.domain.exception.InvalidWeightsException;

import java.util.List;
import java.util.Set;

/**
 * Complete, validated scoring configuration for one interview route.
 *
 * @param categoryWeights weights of the {@code content}, {@code speech} and {@code body} composites
 */
@Builder(toBuilder = true)
public record ScoringProfile(
        String name,
        WeightSet categoryWeights,
        WeightSet contentWeights,
        WeightSet speechWeights,
        WeightSet bodyWeights,
        List<SessionRule> rules,
        DecisionScale decisionScale,
        DimensionFloor dimensionFloor,
        ConsistencyPolicy consistencyPolicy
) {

    public static final String CONTENT = "content";
    public static final String SPEECH = "speech";
    public static final String BODY = "body";

    private static final Set<String> CATEGORIES = Set.of(CONTENT, SPEECH, BODY);

    public ScoringProfile {
        if (name == null || name.isBlank()) {
            throw new InvalidWeightsException("Scoring profile needs a name");
        }
        if (categoryWeights == null || contentWeights == null || speechWeights == null
                || bodyWeights == null || decisionScale == null) {
            throw new InvalidWeightsException("Scoring profile '" + name + "' is incomplete");
        }
        if (!CATEGORIES.equals(categoryWeights.metrics())) {
            throw new InvalidWeightsException("Category weights of '" + name + "' must name exactly "
                    + CATEGORIES + " but named " + categoryWeights.metrics());
        }
        rules = rules == null ? List.of() : List.copyOf(rules);
        dimensionFloor = dimensionFloor == null ? DimensionFloor.DISABLED : dimensionFloor;
        consistencyPolicy = consistencyPolicy == null ? ConsistencyPolicy.DEFAULT : consistencyPolicy;
    }
}
