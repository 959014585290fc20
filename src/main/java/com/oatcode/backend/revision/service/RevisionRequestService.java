package com.oatcode.backend.revision.service;

import com.oatcode.backend.customer.entity.Customer;
import com.oatcode.backend.customer.repo.CustomerRepo;
import com.oatcode.backend.customer.service.CustomerService;
import com.oatcode.backend.notify.NotificationContext;
import com.oatcode.backend.notify.NotificationDispatcher;
import com.oatcode.backend.notify.TemplateKind;
import com.oatcode.backend.revision.config.RevisionProperties;
import com.oatcode.backend.revision.entity.CustomizationRequestEntity;
import com.oatcode.backend.revision.entity.RevisionSubmissionEntity;
import com.oatcode.backend.revision.model.RequestStatus;
import com.oatcode.backend.revision.model.RequestType;
import com.oatcode.backend.revision.repo.CustomizationRequestRepository;
import com.oatcode.backend.revision.repo.RevisionSubmissionRepository;
import com.oatcode.backend.revision.web.RequestAlreadyHandledException;
import com.oatcode.backend.revision.web.SubmissionCooldownException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionOperations;

import java.time.Duration;
import java.time.Instant;

/**
 * 三個入口：客戶自助送修改、付款後首次產站、管理員退回重產
 * 全部都只做「寫 request + 排任務」，真正產站交給 RegenerationTaskWorker
 * 通知一律在交易 commit 之後才寄
 */
@Slf4j
@RequiredArgsConstructor
@Service
public class RevisionRequestService {

    static final String DEFAULT_INITIAL_TEXT = "Initial website generation";

    private final CustomerService customerService;
    private final CustomerRepo customerRepo;
    private final CustomizationRequestRepository requestRepo;
    private final RevisionSubmissionRepository submissionRepo;
    private final RegenerationQueue queue;
    private final NotificationDispatcher notifier;
    private final RevisionLinks links;
    private final RevisionProperties props;
    private final TransactionOperations tx;

    /**
     * 客戶自助送修改（有 customerId 用 id，沒有就用 email 找或建 prospect）
     * 同一 email 在冷卻期內重送 -> SubmissionCooldownException，不動任何資料
     * 冷卻期看 revision_submissions（併進既有 request 的也算一次送出）
     */
    public SubmissionResult submitCustomerRevision(Long customerId, String email, String description) {
        String text = requireText(description, "DESCRIPTION_REQUIRED");
        Instant now = Instant.now();

        Customer known = (customerId != null) ? customerService.require(customerId) : null;
        String rawEmail = (email != null && !email.isBlank()) || known == null ? email : known.getEmail();
        String submitter = CustomerService.normalizeEmail(rawEmail);

        checkCooldown(submitter, now);

        Customer customer = (known != null) ? known : customerService.findOrCreateByEmail(submitter);

        SubmissionResult result = tx.execute(s -> {
            customerRepo.findByIdForUpdate(customer.getId())
                    .orElseThrow(() -> new IllegalArgumentException("CUSTOMER_NOT_FOUND"));
            // 鎖住客戶後再查一次：同 email 併發送出只會有一筆過
            checkCooldown(submitter, now);

            SubmissionResult r = openOrCoalesce(customer.getId(), RequestType.REVISION, text, submitter, now);
            submissionRepo.save(RevisionSubmissionEntity.of(submitter, customer.getId(), r.requestId(), r.coalesced(), now));
            return r;
        });

        log.info("customer revision accepted. customerId={} requestId={} coalesced={}",
                customer.getId(), result.requestId(), result.coalesced());

        sendAck(customer, submitter, result, text);
        return result;
    }

    /**
     * 付款完成：開一筆 INITIAL_PURCHASE（已有進行中的就併進去，並升級成 INITIAL_PURCHASE）
     */
    public SubmissionResult startInitialPurchase(Long customerId, String onboardingNotes) {
        Customer customer = customerService.require(customerId);
        String text = (onboardingNotes == null || onboardingNotes.isBlank())
                ? DEFAULT_INITIAL_TEXT
                : onboardingNotes.trim();
        Instant now = Instant.now();

        SubmissionResult result = tx.execute(s ->
                openOrCoalesce(customer.getId(), RequestType.INITIAL_PURCHASE, text, null, now));

        log.info("initial purchase accepted. customerId={} requestId={} coalesced={}",
                customerId, result.requestId(), result.coalesced());

        sendAck(customer, customer.getEmail(), result, text);
        return result;
    }

    /**
     * 管理員主動幫已上線的網站開一筆修改（網站列表上的操作）
     */
    public SubmissionResult startAdminRevision(Long customerId, String description) {
        Customer customer = customerService.require(customerId);
        String text = requireText(description, "DESCRIPTION_REQUIRED");
        Instant now = Instant.now();

        SubmissionResult result = tx.execute(s ->
                openOrCoalesce(customer.getId(), RequestType.ADMIN_REVISION, text, null, now));

        log.info("admin revision accepted. customerId={} requestId={} coalesced={}",
                customerId, result.requestId(), result.coalesced());
        return result;
    }

    /**
     * 管理員退回：回饋接在原描述後面，request 退回 PROCESSING 再排一次
     * 不會新開 request；requestId 沒給就找該客戶最新的 PENDING_APPROVAL
     */
    public SubmissionResult adminRegenerate(Long customerId, Long requestId, String feedback) {
        String fb = requireText(feedback, "FEEDBACK_REQUIRED");
        customerService.require(customerId);
        Instant now = Instant.now();

        SubmissionResult result = tx.execute(s -> {
            CustomizationRequestEntity r = resolve(customerId, requestId);

            if (r.getStatus() == RequestStatus.PROCESSING) {
                throw new RequestAlreadyHandledException(r.getId(), r.getStatus());
            }
            r.getStatus().assertTransition(RequestStatus.PROCESSING);

            String newText = CustomizationRequestEntity.withAdminFeedback(r.getRequestText(), fb);
            int n = requestRepo.reopenWithFeedback(r.getId(), newText, now);
            if (n == 0) {
                RequestStatus current = requestRepo.findById(r.getId())
                        .map(CustomizationRequestEntity::getStatus)
                        .orElse(null);
                throw new RequestAlreadyHandledException(r.getId(), current);
            }

            queue.enqueue(r.getId(), r.getCustomerId(), now);
            return new SubmissionResult(r.getId(), r.getCustomerId(), r.getRequestType(), RequestStatus.PROCESSING, false);
        });

        log.info("admin feedback applied, regenerating. customerId={} requestId={}", customerId, result.requestId());
        return result;
    }

    /**
     * 卡在 PROCESSING（任務已放棄）時手動再排一次；已經在排隊就不重複排
     */
    public SubmissionResult retryStuck(Long requestId) {
        Instant now = Instant.now();
        return tx.execute(s -> {
            CustomizationRequestEntity r = requestRepo.findById(requestId)
                    .orElseThrow(() -> new IllegalArgumentException("REQUEST_NOT_FOUND"));
            if (r.getStatus() != RequestStatus.PROCESSING) {
                throw new RequestAlreadyHandledException(r.getId(), r.getStatus());
            }
            if (!queue.hasPendingRun(r.getId())) {
                queue.enqueue(r.getId(), r.getCustomerId(), now);
                log.info("stuck request requeued. requestId={} lastError={}", r.getId(), r.getLastErrorCode());
            }
            return new SubmissionResult(r.getId(), r.getCustomerId(), r.getRequestType(), r.getStatus(), false);
        });
    }

    /**
     * 依 id（要屬於該客戶）或該客戶最新的 PENDING_APPROVAL 找 request
     */
    public CustomizationRequestEntity resolve(Long customerId, Long requestId) {
        if (requestId != null) {
            return requestRepo.findById(requestId)
                    .filter(r -> r.getCustomerId().equals(customerId))
                    .orElseThrow(() -> new IllegalArgumentException("REQUEST_NOT_FOUND"));
        }
        return requestRepo.findFirstByCustomerIdAndStatusOrderByCreatedAtUtcDesc(customerId, RequestStatus.PENDING_APPROVAL)
                .orElseThrow(() -> new IllegalArgumentException("NO_PENDING_REQUEST"));
    }

    // ===== internal =====

    /**
     * 先鎖客戶 row，再看有沒有進行中的 request：有就併進去，沒有才開新的
     * ux_customization_requests_active 是最後一道防線
     */
    private SubmissionResult openOrCoalesce(Long customerId, RequestType type, String text, String submitter, Instant now) {
        customerRepo.findByIdForUpdate(customerId)
                .orElseThrow(() -> new IllegalArgumentException("CUSTOMER_NOT_FOUND"));

        var active = requestRepo.findActiveByCustomerIdForUpdate(customerId);
        if (active.isPresent()) {
            CustomizationRequestEntity r = active.get();
            r.coalesce(text, now);
            // 付款優先：併進去的 request 之後要寄 welcome
            if (type == RequestType.INITIAL_PURCHASE) r.setRequestType(RequestType.INITIAL_PURCHASE);
            requestRepo.saveAndFlush(r);
            queue.enqueue(r.getId(), customerId, now);
            return new SubmissionResult(r.getId(), customerId, r.getRequestType(), r.getStatus(), true);
        }

        CustomizationRequestEntity r = CustomizationRequestEntity.open(customerId, type, text, submitter);
        r.setCreatedAtUtc(now);
        r.setUpdatedAtUtc(now);
        CustomizationRequestEntity saved = requestRepo.saveAndFlush(r);
        queue.enqueue(saved.getId(), customerId, now);
        return new SubmissionResult(saved.getId(), customerId, type, saved.getStatus(), false);
    }

    private void checkCooldown(String submitter, Instant now) {
        Duration cooldown = props.getSubmissionCooldown();
        if (cooldown == null || cooldown.isZero() || cooldown.isNegative()) return;

        submissionRepo.findFirstBySubmitterEmailAndSubmittedAtUtcAfterOrderBySubmittedAtUtcDesc(
                        submitter, now.minus(cooldown))
                .ifPresent(last -> {
                    Instant nextAllowed = last.getSubmittedAtUtc().plus(cooldown);
                    int retryAfter = (int) Math.max(1, Duration.between(now, nextAllowed).getSeconds());
                    log.info("submission rejected by cooldown. email={} lastRequestId={} retryAfterSec={}",
                            submitter, last.getRequestId(), retryAfter);
                    throw new SubmissionCooldownException("DUPLICATE_SUBMISSION", nextAllowed, retryAfter);
                });
    }

    private void sendAck(Customer customer, String recipient, SubmissionResult result, String text) {
        notifier.send(TemplateKind.CUSTOMER_ACK, recipient, NotificationContext.builder()
                .customerId(customer.getId())
                .requestId(result.requestId())
                .customerEmail(recipient)
                .businessName(customer.displayName())
                .payingCustomer(customer.isPaying())
                .requestType(result.requestType().name())
                .description(text)
                .revisionFormUrl(links.revisionFormUrl(customer.getId()))
                .build());
    }

    private static String requireText(String s, String code) {
        if (s == null || s.isBlank()) throw new IllegalArgumentException(code);
        return s.trim();
    }
}
