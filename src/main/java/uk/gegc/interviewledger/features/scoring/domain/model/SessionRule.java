package uk.gegc.interviewledger.features.scoring.domain.model;

import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Declarative session-level bonus (positive adjustment) or penalty (negative adjustment)
 * applied when its predicate holds over the full answer set.
 */
public record SessionRule(String name, Predicate<List<AnswerInput>> predicate, double adjustment) {

    public SessionRule {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(predicate, "predicate");
    }

    public boolean appliesTo(List<AnswerInput> answers) {
        return predicate.test(answers);
    }
}
