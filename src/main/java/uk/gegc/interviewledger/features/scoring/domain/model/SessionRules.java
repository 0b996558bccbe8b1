package uk.gegc.interviewledger.features.scoring.domain.model;

/**
 * Factories for the stock session rules.
 */
public final class SessionRules {

    public static final String BREVITY = "brevity";
    public static final String FINANCE_NUMBERS = "financeNumbers";
    public static final String MAJOR_CONTRADICTIONS = "majorContradictions";

    private SessionRules() {
    }

    /**
     * Bonus when every answer is at most {@code maxSentences} sentences and {@code maxSeconds} long.
     * Answers without a sentence count or duration never qualify.
     */
    public static SessionRule brevity(double bonus, int maxSentences, double maxSeconds) {
        return new SessionRule(BREVITY, answers -> !answers.isEmpty() && answers.stream().allMatch(a ->
                a.sentenceCount() != null && a.sentenceCount() <= maxSentences
                        && a.durationSeconds() != null && a.durationSeconds() <= maxSeconds), bonus);
    }

    /**
     * Bonus when there is at least one financial answer and each of them states a total and a numeric split.
     */
    public static SessionRule financeNumbers(double bonus) {
        return new SessionRule(FINANCE_NUMBERS, answers -> {
            var financial = answers.stream().filter(AnswerInput::isFinancial).toList();
            return !financial.isEmpty()
                    && financial.stream().allMatch(a -> a.statesTotalAmount() && a.statesNumericSplit());
        }, bonus);
    }

    /**
     * Penalty when at least {@code minimum} answers were flagged with a major contradiction.
     */
    public static SessionRule majorContradictions(double penalty, int minimum) {
        return new SessionRule(MAJOR_CONTRADICTIONS,
                answers -> answers.stream().filter(AnswerInput::majorContradiction).count() >= minimum,
                -Math.abs(penalty));
    }
}
