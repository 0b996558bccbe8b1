package uk.gegc.interviewledger.features.credit.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
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
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import uk.gegc.interviewledger.features.credit.api.dto.AdjustCreditsRequest;
import uk.gegc.interviewledger.features.credit.api.dto.CreditSummaryDto;
import uk.gegc.interviewledger.features.credit.api.dto.ReservationResponse;
import uk.gegc.interviewledger.features.credit.api.dto.ReserveInterviewRequest;
import uk.gegc.interviewledger.features.credit.api.dto.RestoreCreditRequest;
import uk.gegc.interviewledger.features.credit.application.CreditAllocationService;
import uk.gegc.interviewledger.shared.security.CallerContext;

import java.util.UUID;

@RestController
@RequestMapping("/api/v1/org")
@RequiredArgsConstructor
@Tag(name = "Organization Credits", description = "Quota-funded interviews and student credit administration")
public class OrgCreditController {

    private final CreditAllocationService creditAllocationService;

    @Operation(
            summary = "Reserve an interview from the organization quota",
            description = "Creates a scheduled interview paid by the organization. Requires the organization admin role."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Interview reserved",
                    content = @Content(schema = @Schema(implementation = ReservationResponse.class))),
            @ApiResponse(responseCode = "403", description = "Quota exhausted or caller is not an organization admin",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping("/interviews")
    public ResponseEntity<ReservationResponse> reserveForOrganization(
            @RequestBody @Valid ReserveInterviewRequest request,
            @Parameter(hidden = true) CallerContext caller) {
        UUID interviewId = creditAllocationService.reserveForOrganization(caller, request.studentId(), request.route());
        return ResponseEntity.status(HttpStatus.CREATED).body(new ReservationResponse(interviewId));
    }

    @Operation(
            summary = "Allocate or deallocate student credits",
            description = "A positive amount allocates credits within the organization's allocatable pool; a negative amount removes unused credits."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Credits adjusted",
                    content = @Content(schema = @Schema(implementation = CreditSummaryDto.class))),
            @ApiResponse(responseCode = "400", description = "Zero amount or deallocation below credits used",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "403", description = "Allocation exceeds the organization quota",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PatchMapping("/students/{studentId}/credits")
    public ResponseEntity<CreditSummaryDto> adjustCredits(@PathVariable UUID studentId,
                                                          @RequestBody @Valid AdjustCreditsRequest request,
                                                          @Parameter(hidden = true) CallerContext caller) {
        return ResponseEntity.ok(
                creditAllocationService.adjustCredits(caller, studentId, request.amount(), request.reason()));
    }

    @Operation(summary = "Get a student's credit balance and recent history")
    @GetMapping("/students/{studentId}/credits")
    public ResponseEntity<CreditSummaryDto> getCreditSummary(@PathVariable UUID studentId,
                                                             @Parameter(hidden = true) CallerContext caller) {
        return ResponseEntity.ok(creditAllocationService.getCreditSummary(caller, studentId));
    }

    @Operation(
            summary = "Restore the credit of a failed interview",
            description = "Returns the student credit spent on a failed, student-paid interview. Repeated calls do not restore twice."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Credit restored or already restored",
                    content = @Content(schema = @Schema(implementation = CreditSummaryDto.class))),
            @ApiResponse(responseCode = "409", description = "Interview is not failed",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping("/interviews/{interviewId}/restore-credit")
    public ResponseEntity<CreditSummaryDto> restoreCredit(@PathVariable UUID interviewId,
                                                          @RequestBody(required = false) @Valid RestoreCreditRequest request,
                                                          @Parameter(hidden = true) CallerContext caller) {
        String reason = request != null ? request.reason() : null;
        return ResponseEntity.ok(creditAllocationService.restoreCredit(caller, interviewId, reason));
    }
}
