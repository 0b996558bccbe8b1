package uk.gegc.interviewledger.features.admin.api;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;
import uk.gegc.interviewledger.features.credit.application.CreditReconciliationService;
import uk.gegc.interviewledger.features.credit.application.CreditReconciliationService.ReconciliationSummary;
import uk.gegc.interviewledger.features.interview.api.dto.InterviewReconciliationResult;
import uk.gegc.interviewledger.features.interview.application.InterviewReconciliationService;
import uk.gegc.interviewledger.shared.security.AccessPolicy;
import uk.gegc.interviewledger.shared.security.CallerContext;

import java.time.Duration;
import java.util.List;
import java.util.UUID;

import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(AdminController.class)
@Import(AccessPolicy.class)
class AdminControllerTest {

    @Autowired
    MockMvc mockMvc;

    @MockitoBean
    InterviewReconciliationService interviewReconciliationService;

    @MockitoBean
    CreditReconciliationService creditReconciliationService;

    private final String serviceId = UUID.randomUUID().toString();

    @Test
    @DisplayName("system callers run the interview sweep with the configured window")
    void reconcileInterviews_defaultWindow() throws Exception {
        when(interviewReconciliationService.reconcile()).thenReturn(new InterviewReconciliationResult(2, 1, 0, 3));

        mockMvc.perform(post("/api/v1/admin/interviews/reconcile")
                        .header(CallerContext.CALLER_ID_HEADER, serviceId)
                        .header(CallerContext.ROLE_HEADER, "system"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.fixed").value(2))
                .andExpect(jsonPath("$.skipped").value(1))
                .andExpect(jsonPath("$.total").value(3));
    }

    @Test
    @DisplayName("an explicit window overrides the configured one")
    void reconcileInterviews_explicitWindow() throws Exception {
        when(interviewReconciliationService.reconcile(Duration.ofSeconds(600)))
                .thenReturn(new InterviewReconciliationResult(0, 0, 0, 0));

        mockMvc.perform(post("/api/v1/admin/interviews/reconcile")
                        .header(CallerContext.CALLER_ID_HEADER, serviceId)
                        .header(CallerContext.ROLE_HEADER, "system")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"stalenessWindowSeconds\":600}"))
                .andExpect(status().isOk());

        verify(interviewReconciliationService).reconcile(Duration.ofSeconds(600));
    }

    @Test
    @DisplayName("a non-positive window fails validation")
    void reconcileInterviews_invalidWindow() throws Exception {
        mockMvc.perform(post("/api/v1/admin/interviews/reconcile")
                        .header(CallerContext.CALLER_ID_HEADER, serviceId)
                        .header(CallerContext.ROLE_HEADER, "system")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"stalenessWindowSeconds\":0}"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(interviewReconciliationService);
    }

    @Test
    @DisplayName("organization admins cannot trigger sweeps")
    void reconcile_orgAdminForbidden() throws Exception {
        mockMvc.perform(post("/api/v1/admin/credits/reconcile")
                        .header(CallerContext.CALLER_ID_HEADER, UUID.randomUUID().toString())
                        .header(CallerContext.ORG_ID_HEADER, UUID.randomUUID().toString())
                        .header(CallerContext.ROLE_HEADER, "org_admin"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("Forbidden"));

        verifyNoInteractions(creditReconciliationService);
    }

    @Test
    @DisplayName("credit reconciliation returns the drift report")
    void reconcileCredits_report() throws Exception {
        when(creditReconciliationService.reconcileAllStudents())
                .thenReturn(new ReconciliationSummary(4, 4, 0, 0, List.of()));

        mockMvc.perform(post("/api/v1/admin/credits/reconcile")
                        .header(CallerContext.CALLER_ID_HEADER, serviceId)
                        .header(CallerContext.ROLE_HEADER, "system"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalStudents").value(4))
                .andExpect(jsonPath("$.studentsWithDrift").value(0));
    }
}
