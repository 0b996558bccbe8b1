package uk.gegc.interviewledger.features.interview.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.ArraySchema;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import uk.gegc.interviewledger.features.audit.api.dto.AuditEntryDto;
import uk.gegc.interviewledger.features.audit.application.AuditQueryService;
import uk.gegc.interviewledger.features.credit.api.dto.ReservationResponse;
import uk.gegc.interviewledger.features.credit.api.dto.ReserveInterviewRequest;
import uk.gegc.interviewledger.features.credit.application.CreditAllocationService;
import uk.gegc.interviewledger.features.interview.api.dto.FailInterviewRequest;
import uk.gegc.interviewledger.features.interview.api.dto.FinalizeInterviewRequest;
import uk.gegc.interviewledger.features.interview.api.dto.FinalizeInterviewResponse;
import uk.gegc.interviewledger.features.interview.api.dto.InterviewDto;
import uk.gegc.interviewledger.features.interview.application.InterviewLifecycleService;
import uk.gegc.interviewledger.features.interview.infra.mapping.InterviewMapper;
import uk.gegc.interviewledger.features.scoring.domain.model.ScoreReport;
import uk.gegc.interviewledger.shared.security.CallerContext;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/v1/interviews")
@RequiredArgsConstructor
@Tag(name = "Interviews", description = "Student interview reservation, lifecycle and scoring")
public class InterviewController {

    private final CreditAllocationService creditAllocationService;
    private final InterviewLifecycleService lifecycleService;
    private final AuditQueryService auditQueryService;
    private final InterviewMapper interviewMapper;

    @Operation(
            summary = "Reserve an interview with a student credit",
            description = "Consumes one student credit and creates a scheduled interview. Students may only reserve for themselves."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Interview reserved",
                    content = @Content(schema = @Schema(implementation = ReservationResponse.class))),
            @ApiResponse(responseCode = "400", description = "No credits remaining or invalid request",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "403", description = "Cross-tenant call, self-start disabled or quota exhausted",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "409", description = "Concurrent updates exhausted the retry budget",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping("/reserve")
    public ResponseEntity<ReservationResponse> reserve(@RequestBody @Valid ReserveInterviewRequest request,
                                                       @Parameter(hidden = true) CallerContext caller) {
        UUID interviewId = creditAllocationService.reserve(caller, request.studentId(), request.route());
        return ResponseEntity.status(HttpStatus.CREATED).body(new ReservationResponse(interviewId));
    }

    @Operation(summary = "Start a scheduled interview")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Interview in progress"),
            @ApiResponse(responseCode = "404", description = "Interview not found"),
            @ApiResponse(responseCode = "409", description = "Interview is not scheduled")
    })
    @PostMapping("/{interviewId}/start")
    public ResponseEntity<InterviewDto> start(@PathVariable UUID interviewId,
                                              @Parameter(hidden = true) CallerContext caller) {
        return ResponseEntity.ok(lifecycleService.start(caller, interviewId));
    }

    @Operation(
            summary = "Finalize an interview with evaluator scores",
            description = "Scores every answer with the route's profile, rolls the session up and completes the interview with the resulting report."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Interview completed",
                    content = @Content(schema = @Schema(implementation = FinalizeInterviewResponse.class))),
            @ApiResponse(responseCode = "400", description = "Missing or out-of-range sub-scores",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "409", description = "Interview is not in progress",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping("/{interviewId}/finalize")
    public ResponseEntity<FinalizeInterviewResponse> finalizeInterview(
            @PathVariable UUID interviewId,
            @RequestBody @Valid FinalizeInterviewRequest request,
            @Parameter(hidden = true) CallerContext caller) {
        ScoreReport report = lifecycleService.finalizeInterview(caller, interviewId,
                interviewMapper.toAnswerInputs(request.perAnswerScores()),
                request.holisticScore(), request.bodyTrackingEnabled());
        return ResponseEntity.ok(new FinalizeInterviewResponse(report));
    }

    @Operation(summary = "Mark an interview as failed")
    @PostMapping("/{interviewId}/fail")
    public ResponseEntity<InterviewDto> fail(@PathVariable UUID interviewId,
                                             @RequestBody @Valid FailInterviewRequest request,
                                             @Parameter(hidden = true) CallerContext caller) {
        return ResponseEntity.ok(lifecycleService.fail(caller, interviewId, request.reason()));
    }

    @Operation(summary = "Get an interview")
    @GetMapping("/{interviewId}")
    public ResponseEntity<InterviewDto> get(@PathVariable UUID interviewId,
                                            @Parameter(hidden = true) CallerContext caller) {
        return ResponseEntity.ok(lifecycleService.get(caller, interviewId));
    }

    @Operation(
            summary = "Get the audit trail of an interview",
            description = "Returns audit entries oldest first. Requires the organization admin role."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Audit trail",
                    content = @Content(array = @ArraySchema(schema = @Schema(implementation = AuditEntryDto.class)))),
            @ApiResponse(responseCode = "403", description = "Caller is not an organization admin")
    })
    @GetMapping("/{interviewId}/audit")
    public ResponseEntity<List<AuditEntryDto>> auditTrail(@PathVariable UUID interviewId,
                                                          @Parameter(hidden = true) CallerContext caller) {
        return ResponseEntity.ok(auditQueryService.getInterviewAuditTrail(caller, interviewId));
    }
}
