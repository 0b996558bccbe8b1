package uk.gegc.interviewledger.features.scoring.domain;

import uk.gegc.interviewledger.features.scoring.domain.model.ConsistencyPolicy;
import uk.gegc.interviewledger.features.scoring.domain.model.DecisionScale;
import uk.gegc.interviewledger.features.scoring.domain.model.DecisionTier;
import uk.gegc.interviewledger.features.scoring.domain.model.DimensionFloor;
import uk.gegc.interviewledger.features.scoring.domain.model.ScoringProfile;
import uk.gegc.interviewledger.features.scoring.domain.model.SessionRule;
import uk.gegc.interviewledger.features.scoring.domain.model.SessionRules;
import uk.gegc.interviewledger.features.scoring.domain.model.WeightSet;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Built-in scoring profiles. Properties under {@code scoring.profiles} override or extend them.
 */
public final class ScoringProfiles {

    public static final String USA_F1 = "usa_f1";
    public static final String UK_STUDENT = "uk_student";

    public static final double BREVITY_BONUS = 3.0;
    public static final int BREVITY_MAX_SENTENCES = 2;
    public static final double BREVITY_MAX_SECONDS = 35.0;
    public static final double FINANCE_NUMBERS_BONUS = 2.0;
    public static final double MAJOR_CONTRADICTION_PENALTY = 5.0;
    public static final int MAJOR_CONTRADICTION_MINIMUM = 2;

    private ScoringProfiles() {
    }

    public static Map<String, ScoringProfile> builtIn() {
        Map<String, ScoringProfile> profiles = new LinkedHashMap<>();
        profiles.put(USA_F1, usaF1());
        profiles.put(UK_STUDENT, ukStudent());
        return profiles;
    }

    public static ScoringProfile usaF1() {
        return ScoringProfile.builder()
                .name(USA_F1)
                .categoryWeights(defaultCategoryWeights())
                .contentWeights(WeightSet.of(ordered(
                        "relevance", 0.25,
                        "specificity", 0.25,
                        "selfConsistency", 0.25,
                        "plausibility", 0.25)))
                .speechWeights(defaultSpeechWeights())
                .bodyWeights(defaultBodyWeights())
                .rules(defaultRules(BREVITY_BONUS, FINANCE_NUMBERS_BONUS, MAJOR_CONTRADICTION_PENALTY))
                .decisionScale(DecisionScale.of(List.of(
                        new DecisionTier("red", 0, "Several answers raised red flags; work through targeted drills before the real interview."),
                        new DecisionTier("amber", 65, "A solid base that needs two or three concrete fixes."),
                        new DecisionTier("green", 80, "Strong and consistent answers across the session."))))
                .dimensionFloor(DimensionFloor.DISABLED)
                .consistencyPolicy(ConsistencyPolicy.DEFAULT)
                .build();
    }

    public static ScoringProfile ukStudent() {
        return ScoringProfile.builder()
                .name(UK_STUDENT)
                .categoryWeights(defaultCategoryWeights())
                .contentWeights(WeightSet.of(ordered(
                        "communication", 0.15,
                        "relevance", 0.15,
                        "specificity", 0.20,
                        "consistency", 0.15,
                        "courseAndUniversityFit", 0.15,
                        "financialRequirement", 0.10,
                        "complianceAndIntent", 0.10)))
                .speechWeights(defaultSpeechWeights())
                .bodyWeights(defaultBodyWeights())
                .rules(defaultRules(BREVITY_BONUS, FINANCE_NUMBERS_BONUS, MAJOR_CONTRADICTION_PENALTY))
                .decisionScale(DecisionScale.of(List.of(
                        new DecisionTier("rejected", 0, "Major gaps in course fit, finances or intent would likely lead to a refusal."),
                        new DecisionTier("borderline", 55, "Credible overall, with weak spots an officer may probe."),
                        new DecisionTier("accepted", 75, "Clear, well-evidenced answers that meet the credibility bar."))))
                .dimensionFloor(DimensionFloor.of(0.8, 0.2))
                .consistencyPolicy(ConsistencyPolicy.DEFAULT)
                .build();
    }

    public static List<SessionRule> defaultRules(double brevityBonus, double financeBonus, double contradictionPenalty) {
        return List.of(
                SessionRules.brevity(brevityBonus, BREVITY_MAX_SENTENCES, BREVITY_MAX_SECONDS),
                SessionRules.financeNumbers(financeBonus),
                SessionRules.majorContradictions(contradictionPenalty, MAJOR_CONTRADICTION_MINIMUM)
        );
    }

    private static WeightSet defaultCategoryWeights() {
        return WeightSet.of(ordered(
                ScoringProfile.CONTENT, 0.7,
                ScoringProfile.SPEECH, 0.2,
                ScoringProfile.BODY, 0.1));
    }

    private static WeightSet defaultSpeechWeights() {
        return WeightSet.of(ordered("fluency", 0.5, "clarity", 0.3, "tone", 0.2));
    }

    private static WeightSet defaultBodyWeights() {
        return WeightSet.of(ordered("posture", 0.45, "expressions", 0.35, "gestures", 0.20));
    }

    private static Map<String, Double> ordered(Object... pairs) {
        Map<String, Double> map = new LinkedHashMap<>();
        for (int i = 0; i < pairs.length; i += 2) {
            map.put((String) pairs[i], ((Number) pairs[i + 1]).doubleValue());
        }
        return map;
    }
}
