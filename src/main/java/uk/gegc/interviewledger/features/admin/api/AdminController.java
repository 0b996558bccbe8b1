package uk.gegc.interviewledger.features.admin.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import uk.gegc.interviewledger.features.credit.application.CreditReconciliationService;
import uk.gegc.interviewledger.features.credit.application.CreditReconciliationService.ReconciliationSummary;
import uk.gegc.interviewledger.features.interview.api.dto.InterviewReconciliationResult;
import uk.gegc.interviewledger.features.interview.api.dto.ReconcileInterviewsRequest;
import uk.gegc.interviewledger.features.interview.application.InterviewReconciliationService;
import uk.gegc.interviewledger.shared.security.AccessPolicy;
import uk.gegc.interviewledger.shared.security.CallerContext;

import java.time.Duration;

@RestController
@RequestMapping("/api/v1/admin")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Operations", description = "Reconciliation sweeps, restricted to system callers")
public class AdminController {

    private final InterviewReconciliationService interviewReconciliationService;
    private final CreditReconciliationService creditReconciliationService;
    private final AccessPolicy accessPolicy;

    @Operation(
            summary = "Reconcile interviews stuck in progress",
            description = "Completes in-progress interviews that already carry a report and fails those older than the staleness window."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Sweep finished",
                    content = @Content(schema = @Schema(implementation = InterviewReconciliationResult.class))),
            @ApiResponse(responseCode = "403", description = "Caller is not a system caller")
    })
    @PostMapping("/interviews/reconcile")
    public ResponseEntity<InterviewReconciliationResult> reconcileInterviews(
            @RequestBody(required = false) @Valid ReconcileInterviewsRequest request,
            @Parameter(hidden = true) CallerContext caller) {
        accessPolicy.requireSystem(caller);
        log.info("Interview reconciliation requested by {}", caller.callerId());
        InterviewReconciliationResult result = request == null || request.stalenessWindowSeconds() == null
                ? interviewReconciliationService.reconcile()
                : interviewReconciliationService.reconcile(Duration.ofSeconds(request.stalenessWindowSeconds()));
        return ResponseEntity.ok(result);
    }

    @Operation(
            summary = "Reconcile student credits against the credit history",
            description = "Reports students whose stored counters disagree with their history. Nothing is corrected."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Reconciliation report"),
            @ApiResponse(responseCode = "403", description = "Caller is not a system caller")
    })
    @PostMapping("/credits/reconcile")
    public ResponseEntity<ReconciliationSummary> reconcileCredits(@Parameter(hidden = true) CallerContext caller) {
        accessPolicy.requireSystem(caller);
        log.info("Credit reconciliation requested by {}", caller.callerId());
        return ResponseEntity.ok(creditReconciliationService.reconcileAllStudents());
    }
}
