package com.oatcode.backend.revision.controller;

import com.oatcode.backend.common.web.RequestIdFilter;
import com.oatcode.backend.revision.dto.InitialPurchaseRequest;
import com.oatcode.backend.revision.dto.RevisionAcceptedResponse;
import com.oatcode.backend.revision.dto.RevisionSubmitRequest;
import com.oatcode.backend.revision.service.RevisionRequestService;
import com.oatcode.backend.revision.service.SubmissionResult;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * 客戶端入口：都是 202，產站在背景跑
 */
@Slf4j
@Tag(name = "Revision", description = "Customer revision submissions + purchase-triggered generation")
@RequiredArgsConstructor
@RestController
@RequestMapping("/api/v1")
public class RevisionRequestController {

    private final RevisionRequestService service;

    @PostMapping("/requests")
    public ResponseEntity<RevisionAcceptedResponse> submit(
            @Valid @RequestBody RevisionSubmitRequest body,
            HttpServletRequest req
    ) {
        log.info("revision submit. rid={} customerId={}", RequestIdFilter.getOrCreate(req), body.customerId());
        SubmissionResult r = service.submitCustomerRevision(body.customerId(), body.email(), body.description());
        String msg = r.coalesced()
                ? "Your changes were added to the request already in progress."
                : "We received your request. You'll hear from us within 24-48 hours.";
        return ResponseEntity.accepted().body(RevisionAcceptedResponse.from(r, msg));
    }

    /**
     * 付款流程完成後呼叫（Stripe webhook 處理那邊）
     */
    @PostMapping("/purchases/{customerId}/website")
    public ResponseEntity<RevisionAcceptedResponse> purchased(
            @PathVariable Long customerId,
            @Valid @RequestBody(required = false) InitialPurchaseRequest body
    ) {
        SubmissionResult r = service.startInitialPurchase(customerId, body == null ? null : body.onboardingNotes());
        return ResponseEntity.accepted().body(RevisionAcceptedResponse.from(r, "Website generation started."));
    }
}
