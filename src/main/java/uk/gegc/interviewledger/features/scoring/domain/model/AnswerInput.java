package uk.gegc.interviewledger.features.scoring.domain.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Sub-scores and observations the upstream evaluator produced for a single answer.
 *
 * @param content             content sub-metric scores keyed by metric name
 * @param speech              speech sub-metric scores
 * @param body                body-language sub-metric scores; ignored when body tracking is off
 * @param sentenceCount       sentences in the transcribed answer, if known
 * @param durationSeconds     speaking time, if known
 * @param questionCategory    category of the question asked (e.g. {@code financial})
 * @param statesTotalAmount   the answer names a total funding amount
 * @param statesNumericSplit  the answer breaks the total down numerically
 * @param majorContradiction  the evaluator flagged a major contradiction with earlier answers
 */
public record AnswerInput(
        Map<String, Double> content,
        Map<String, Double> speech,
        Map<String, Double> body,
        Integer sentenceCount,
        Double durationSeconds,
        String questionCategory,
        boolean statesTotalAmount,
        boolean statesNumericSplit,
        boolean majorContradiction
) {

    public static final String FINANCIAL_CATEGORY = "financial";

    public AnswerInput {
        content = copyOf(content);
        speech = copyOf(speech);
        body = copyOf(body);
    }

    /**
     * Null sub-scores are kept so the range check reports them as missing by name.
     */
    private static Map<String, Double> copyOf(Map<String, Double> scores) {
        return scores == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(scores));
    }

    public boolean isFinancial() {
        return questionCategory != null && FINANCIAL_CATEGORY.equalsIgnoreCase(questionCategory.trim());
    }
}
