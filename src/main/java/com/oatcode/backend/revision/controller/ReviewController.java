package com.oatcode.backend.revision.controller;

import com.oatcode.backend.notify.repo.NotificationLogRepository;
import com.oatcode.backend.revision.dto.*;
import com.oatcode.backend.revision.service.ReviewGateService;
import com.oatcode.backend.revision.service.RevisionRequestService;
import com.oatcode.backend.revision.service.SubmissionResult;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * 管理員審核介面；approve 用 GET 是為了讓信裡的連結可以直接點
 */
@Tag(name = "Review", description = "Admin review gate: review / approve / regenerate + website history")
@RequiredArgsConstructor
@RestController
@RequestMapping("/admin")
public class ReviewController {

    private static final int MAX_NOTIFICATIONS = 200;

    private final ReviewGateService gate;
    private final RevisionRequestService requests;
    private final NotificationLogRepository notificationRepo;

    @GetMapping("/review")
    public ReviewView review(@RequestParam Long customerId,
                             @RequestParam(required = false) Long requestId) {
        return gate.review(customerId, requestId);
    }

    @GetMapping("/approve")
    public ApprovalResponse approve(@RequestParam Long customerId,
                                    @RequestParam(required = false) Long requestId) {
        return gate.approve(customerId, requestId);
    }

    @PostMapping("/regenerate")
    public ResponseEntity<RevisionAcceptedResponse> regenerate(@Valid @RequestBody RegenerateRequest body) {
        SubmissionResult r = gate.reject(body.customerId(), body.requestId(), body.feedback());
        return ResponseEntity.accepted().body(RevisionAcceptedResponse.from(r, "Regeneration queued with your feedback."));
    }

    @GetMapping("/pending")
    public PendingQueueResponse pending() {
        return gate.pendingQueue();
    }

    @PostMapping("/requests/{requestId}/retry")
    public ResponseEntity<RevisionAcceptedResponse> retry(@PathVariable Long requestId) {
        SubmissionResult r = requests.retryStuck(requestId);
        return ResponseEntity.accepted().body(RevisionAcceptedResponse.from(r, "Regeneration queued."));
    }

    @GetMapping("/websites")
    public List<WebsiteSummary> websites() {
        return gate.websites();
    }

    @PostMapping("/websites/{customerId}/revisions")
    public ResponseEntity<RevisionAcceptedResponse> adminRevision(@PathVariable Long customerId,
                                                                  @Valid @RequestBody AdminRevisionRequest body) {
        SubmissionResult r = requests.startAdminRevision(customerId, body.description());
        return ResponseEntity.accepted().body(RevisionAcceptedResponse.from(r, "Regeneration queued."));
    }

    @GetMapping("/websites/{customerId}/versions")
    public List<VersionSummary> versions(@PathVariable Long customerId) {
        return gate.versions(customerId);
    }

    @GetMapping(value = "/websites/version/{versionId}", produces = MediaType.TEXT_HTML_VALUE)
    public String versionHtml(@PathVariable Long versionId) {
        return gate.versionHtml(versionId);
    }

    @GetMapping("/notifications")
    public List<NotificationLogView> notifications(@RequestParam(required = false) Long customerId) {
        var rows = (customerId == null)
                ? notificationRepo.findAllByOrderBySentAtUtcDesc(PageRequest.of(0, MAX_NOTIFICATIONS))
                : notificationRepo.findByCustomerIdOrderBySentAtUtcDesc(customerId);
        return rows.stream().map(NotificationLogView::from).toList();
    }
}
