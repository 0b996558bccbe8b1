package uk.gegc.interviewledger.features.interview.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;

import java.util.List;

@Schema(name = "FinalizeInterviewRequest")
public record FinalizeInterviewRequest(
        @NotEmpty(message = "perAnswerScores must contain at least one answer")
        List<@Valid AnswerScoreRequest> perAnswerScores,

        @Schema(description = "Optional holistic score from a separate evaluation pass", example = "78")
        Double holisticScore,

        @Schema(description = "Whether body language was tracked; defaults to true")
        Boolean bodyEnabled
) {
    public boolean bodyTrackingEnabled() {
        return bodyEnabled == null || bodyEnabled;
    }
}
