package uk.gegc.interviewledger.features.scoring.domain;

import uk.gegc.interviewledger.features.scoring.domain.model.AnswerInput;
import uk.gegc.interviewledger.features.scoring.domain.model.AnswerScore;
import uk.gegc.interviewledger.features.scoring.domain.model.AppliedAdjustment;
import uk.gegc.interviewledger.features.scoring.domain.model.ConsistencyWarning;
import uk.gegc.interviewledger.features.scoring.domain.model.DecisionTier;
import uk.gegc.interviewledger.features.scoring.domain.model.ScoreRange;
import uk.gegc.interviewledger.features.scoring.domain.model.ScoreReport;
import uk.gegc.interviewledger.features.scoring.domain.model.ScoringProfile;
import uk.gegc.interviewledger.features.scoring.domain.model.SessionRule;
import uk.gegc.interviewledger.features.scoring.domain.model.SessionScore;
import uk.gegc.interviewledger.features.scoring.domain.model.WeightSet;
import uk.gegc.interviewledger.shared.exception.InvalidRequestException;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Stateless scoring pipeline: answer composites, session rollup, dimensions, consistency checks,
 * classification and report assembly. Performs no I/O and is safe to share between threads.
 */
public class ScoringEngine {

    static final double STRENGTH_FLOOR = 75.0;
    static final double WEAKNESS_CEILING = 70.0;
    static final int HIGHLIGHT_LIMIT = 3;

    static final double CONTENT_RECOMMENDATION_CEILING = 70.0;
    static final double SPEECH_RECOMMENDATION_CEILING = 70.0;
    static final double BODY_RECOMMENDATION_CEILING = 50.0;

    private final ConsistencyValidator consistencyValidator;

    public ScoringEngine() {
        this(new ConsistencyValidator());
    }

    public ScoringEngine(ConsistencyValidator consistencyValidator) {
        this.consistencyValidator = consistencyValidator;
    }

    /**
     * Weighted answer total from category composites. With body tracking off the body weight is
     * moved onto content rather than dropped.
     */
    public double combine(WeightSet categoryWeights, double content, double speech, double body, boolean bodyEnabled) {
        ScoreRange.require(ScoringProfile.CONTENT, content);
        ScoreRange.require(ScoringProfile.SPEECH, speech);
        double wc = categoryWeights.weightOf(ScoringProfile.CONTENT);
        double ws = categoryWeights.weightOf(ScoringProfile.SPEECH);
        double wb = categoryWeights.weightOf(ScoringProfile.BODY);
        if (!bodyEnabled) {
            return (wc + wb) * content + ws * speech;
        }
        ScoreRange.require(ScoringProfile.BODY, body);
        return wc * content + ws * speech + wb * body;
    }

    public AnswerScore scoreAnswer(ScoringProfile profile, AnswerInput answer, boolean bodyEnabled) {
        double content = profile.contentWeights().apply(answer.content());
        double speech = profile.speechWeights().apply(answer.speech());
        double body = bodyEnabled ? profile.bodyWeights().apply(answer.body()) : 0.0;
        double total = combine(profile.categoryWeights(), content, speech, body, bodyEnabled);
        return new AnswerScore(content, speech, body, total);
    }

    public SessionScore rollup(List<SessionRule> rules, List<AnswerInput> answers, List<Double> answerTotals) {
        if (answerTotals.isEmpty()) {
            throw new InvalidRequestException("At least one answer score is required");
        }
        double mean = answerTotals.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
        List<AppliedAdjustment> applied = new ArrayList<>();
        double adjusted = mean;
        for (SessionRule rule : rules) {
            if (rule.appliesTo(answers)) {
                applied.add(new AppliedAdjustment(rule.name(), rule.adjustment()));
                adjusted += rule.adjustment();
            }
        }
        return new SessionScore(mean, List.copyOf(applied), ScoreRange.clamp(adjusted));
    }

    /**
     * Session-level dimensions: the mean of every content sub-metric, then the speech and
     * (when tracked) body composites.
     */
    public Map<String, Double> dimensions(ScoringProfile profile, List<AnswerInput> answers,
                                          List<AnswerScore> scores, boolean bodyEnabled) {
        Map<String, Double> dimensions = new LinkedHashMap<>();
        for (String metric : profile.contentWeights().metrics()) {
            dimensions.put(metric, answers.stream()
                    .mapToDouble(a -> a.content().get(metric))
                    .average().orElse(0.0));
        }
        dimensions.put(ScoringProfile.SPEECH, scores.stream().mapToDouble(AnswerScore::speech).average().orElse(0.0));
        if (bodyEnabled) {
            dimensions.put(ScoringProfile.BODY, scores.stream().mapToDouble(AnswerScore::body).average().orElse(0.0));
        }
        return dimensions;
    }

    public ScoreReport evaluate(ScoringProfile profile, List<AnswerInput> answers, Double holisticScore, boolean bodyEnabled) {
        if (answers == null || answers.isEmpty()) {
            throw new InvalidRequestException("At least one answer score is required");
        }
        List<AnswerScore> scores = answers.stream()
                .map(answer -> scoreAnswer(profile, answer, bodyEnabled))
                .toList();
        List<Double> totals = scores.stream().map(AnswerScore::total).toList();

        SessionScore session = rollup(profile.rules(), answers, totals);
        Map<String, Double> dimensions = dimensions(profile, answers, scores, bodyEnabled);
        List<ConsistencyWarning> warnings = consistencyValidator.validate(
                profile.consistencyPolicy(), session.perAnswerMean(), holisticScore);

        double minDimension = dimensions.values().stream().mapToDouble(Double::doubleValue).min().orElse(session.score());
        double classificationScore = profile.dimensionFloor().blend(session.score(), minDimension);
        DecisionTier tier = profile.decisionScale().classify(classificationScore);

        return ScoreReport.builder()
                .decision(tier.label())
                .overall((int) Math.round(session.score()))
                .dimensions(roundValues(dimensions))
                .summary(tier.summary())
                .strengths(strengths(dimensions))
                .weaknesses(weaknesses(dimensions))
                .profile(profile.name())
                .bodyEnabled(bodyEnabled)
                .perAnswerMean(session.perAnswerMean())
                .holisticScore(holisticScore)
                .classificationScore(classificationScore)
                .adjustments(session.adjustments())
                .consistencyWarnings(warnings)
                .recommendations(recommendations(scores, bodyEnabled))
                .answerScores(totals)
                .build();
    }

    private List<String> strengths(Map<String, Double> dimensions) {
        return dimensions.entrySet().stream()
                .filter(e -> e.getValue() >= STRENGTH_FLOOR)
                .sorted(Map.Entry.<String, Double>comparingByValue(Comparator.reverseOrder()))
                .limit(HIGHLIGHT_LIMIT)
                .map(Map.Entry::getKey)
                .toList();
    }

    private List<String> weaknesses(Map<String, Double> dimensions) {
        return dimensions.entrySet().stream()
                .filter(e -> e.getValue() < WEAKNESS_CEILING)
                .sorted(Map.Entry.comparingByValue())
                .limit(HIGHLIGHT_LIMIT)
                .map(Map.Entry::getKey)
                .toList();
    }

    private List<String> recommendations(List<AnswerScore> scores, boolean bodyEnabled) {
        List<String> recommendations = new ArrayList<>();
        double content = scores.stream().mapToDouble(AnswerScore::content).average().orElse(0.0);
        double speech = scores.stream().mapToDouble(AnswerScore::speech).average().orElse(0.0);
        if (content < CONTENT_RECOMMENDATION_CEILING) {
            recommendations.add("Give specific, verifiable details: name the program, the funding source and concrete amounts.");
        }
        if (speech < SPEECH_RECOMMENDATION_CEILING) {
            recommendations.add("Practise answering aloud at a steady pace and cut filler words.");
        }
        if (bodyEnabled) {
            double body = scores.stream().mapToDouble(AnswerScore::body).average().orElse(0.0);
            if (body < BODY_RECOMMENDATION_CEILING) {
                recommendations.add("Keep an upright posture and steady eye contact with the officer.");
            }
        }
        return List.copyOf(recommendations);
    }

    private static Map<String, Integer> roundValues(Map<String, Double> values) {
        Map<String, Integer> rounded = new LinkedHashMap<>();
        values.forEach((key, value) -> rounded.put(key, (int) Math.round(value)));
        return rounded;
    }
}
