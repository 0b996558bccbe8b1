package uk.gegc.interviewledger.features.interview.application;

import uk.gegc.interviewledger.features.interview.api.dto.InterviewDto;
import uk.gegc.interviewledger.features.scoring.domain.model.AnswerInput;
import uk.gegc.interviewledger.features.scoring.domain.model.ScoreReport;
import uk.gegc.interviewledger.shared.security.CallerContext;

import java.util.List;
import java.util.UUID;

/**
 * Drives an interview through {@code scheduled -> in_progress -> completed | failed}.
 * Illegal transitions fail with {@link uk.gegc.interviewledger.shared.exception.InvalidStateException}.
 */
public interface InterviewLifecycleService {

    InterviewDto start(CallerContext caller, UUID interviewId);

    /**
     * Score the session with the route's profile and complete the interview with the report.
     */
    ScoreReport finalizeInterview(CallerContext caller, UUID interviewId, List<AnswerInput> answers,
                         Double holisticScore, boolean bodyEnabled);

    InterviewDto fail(CallerContext caller, UUID interviewId, String reason);

    InterviewDto get(CallerContext caller, UUID interviewId);
}
