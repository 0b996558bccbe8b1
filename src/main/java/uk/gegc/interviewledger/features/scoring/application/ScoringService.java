package uk.gegc.interviewledger.features.scoring.application;

import uk.gegc.interviewledger.features.scoring.domain.model.AnswerInput;
import uk.gegc.interviewledger.features.scoring.domain.model.ScoreReport;

import java.util.List;

/**
 * Produces final reports for finished interviews.
 */
public interface ScoringService {

    /**
     * Score a session with the profile configured for {@code route}.
     *
     * @throws uk.gegc.interviewledger.features.scoring.domain.exception.ScoreOutOfRangeException
     *         when a sub-score is missing or outside [0, 100]
     */
    ScoreReport score(String route, List<AnswerInput> answers, Double holisticScore, boolean bodyEnabled);
}
