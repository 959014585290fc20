package com.oatcode.backend.revision;

import com.oatcode.backend.common.web.RequestIdFilter;
import com.oatcode.backend.notify.repo.NotificationLogRepository;
import com.oatcode.backend.revision.controller.PublicSiteController;
import com.oatcode.backend.revision.controller.ReviewController;
import com.oatcode.backend.revision.controller.RevisionRequestController;
import com.oatcode.backend.revision.model.RequestStatus;
import com.oatcode.backend.revision.model.RequestType;
import com.oatcode.backend.revision.service.ReviewGateService;
import com.oatcode.backend.revision.service.RevisionRequestService;
import com.oatcode.backend.revision.service.SubmissionResult;
import com.oatcode.backend.revision.web.IllegalTransitionException;
import com.oatcode.backend.revision.web.RequestAlreadyHandledException;
import com.oatcode.backend.revision.web.RevisionExceptionAdvice;
import com.oatcode.backend.revision.web.SubmissionCooldownException;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;

import static org.hamcrest.Matchers.containsString;
import static org.mockito.ArgumentMatchers.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@ActiveProfiles("test")
@WebMvcTest(controllers = {
        RevisionRequestController.class,
        ReviewController.class,
        PublicSiteController.class
})
@Import({RevisionExceptionAdvice.class, RequestIdFilter.class})
class RevisionExceptionAdviceTest {

    @Autowired MockMvc mvc;

    @MockitoBean RevisionRequestService requests;
    @MockitoBean ReviewGateService gate;
    @MockitoBean NotificationLogRepository notificationRepo;

    @Test
    void submit_should_202_with_request_id() throws Exception {
        Mockito.when(requests.submitCustomerRevision(isNull(), eq("a@b.com"), eq("Make it blue")))
                .thenReturn(new SubmissionResult(10L, 1L, RequestType.REVISION, RequestStatus.PROCESSING, false));

        mvc.perform(post("/api/v1/requests")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"email\":\"a@b.com\",\"description\":\"Make it blue\"}"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.requestId").value(10))
                .andExpect(jsonPath("$.status").value("PROCESSING"))
                .andExpect(jsonPath("$.coalesced").value(false));
    }

    @Test
    void blank_description_should_400_validation_failed() throws Exception {
        mvc.perform(post("/api/v1/requests")
                        .contentType(MediaType.APPLICATION_JSON)
                        .header("X-Request-Id", "RID-V")
                        .content("{\"email\":\"a@b.com\",\"description\":\"  \"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("VALIDATION_FAILED"))
                .andExpect(jsonPath("$.requestId").value("RID-V"));

        Mockito.verifyNoInteractions(requests);
    }

    @Test
    void cooldown_should_429_with_retry_after() throws Exception {
        Mockito.when(requests.submitCustomerRevision(any(), anyString(), anyString()))
                .thenThrow(new SubmissionCooldownException("DUPLICATE_SUBMISSION",
                        Instant.parse("2026-01-01T01:00:00Z"), 1800));

        mvc.perform(post("/api/v1/requests")
                        .contentType(MediaType.APPLICATION_JSON)
                        .header("X-Request-Id", "RID-123")
                        .content("{\"email\":\"a@b.com\",\"description\":\"again\"}"))
                .andExpect(status().isTooManyRequests())
                .andExpect(header().string("Retry-After", "1800"))
                .andExpect(header().string("X-Request-Id", "RID-123"))
                .andExpect(jsonPath("$.errorCode").value("DUPLICATE_SUBMISSION"))
                .andExpect(jsonPath("$.retryAfterSec").value(1800))
                .andExpect(jsonPath("$.requestId").value("RID-123"));
    }

    @Test
    void already_handled_should_409() throws Exception {
        Mockito.when(gate.approve(1L, 10L))
                .thenThrow(new RequestAlreadyHandledException(10L, RequestStatus.PROCESSING));

        mvc.perform(get("/admin/approve").param("customerId", "1").param("requestId", "10"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.errorCode").value("REQUEST_ALREADY_HANDLED"))
                .andExpect(jsonPath("$.currentStatus").value("PROCESSING"));
    }

    @Test
    void illegal_transition_should_409() throws Exception {
        Mockito.when(gate.approve(1L, 10L))
                .thenThrow(new IllegalTransitionException(RequestStatus.PROCESSING, RequestStatus.APPROVED));

        mvc.perform(get("/admin/approve").param("customerId", "1").param("requestId", "10"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.errorCode").value("ILLEGAL_TRANSITION"));
    }

    @Test
    void no_pending_should_404() throws Exception {
        Mockito.when(gate.review(1L, null)).thenThrow(new IllegalArgumentException("NO_PENDING_REQUEST"));

        mvc.perform(get("/admin/review").param("customerId", "1"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.errorCode").value("NO_PENDING_REQUEST"));
    }

    @Test
    void regenerate_requires_feedback() throws Exception {
        mvc.perform(post("/admin/regenerate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"customerId\":1}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("VALIDATION_FAILED"));
    }

    @Test
    void version_html_is_served_as_html() throws Exception {
        Mockito.when(gate.versionHtml(100L)).thenReturn("<html><body>v1</body></html>");

        mvc.perform(get("/admin/websites/version/100"))
                .andExpect(status().isOk())
                .andExpect(content().contentTypeCompatibleWith(MediaType.TEXT_HTML))
                .andExpect(content().string(containsString("v1")));
    }
}
