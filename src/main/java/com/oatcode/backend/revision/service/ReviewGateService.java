package com.oatcode.backend.revision.service;

import com.oatcode.backend.customer.entity.Customer;
import com.oatcode.backend.customer.repo.CustomerRepo;
import com.oatcode.backend.customer.service.CustomerService;
import com.oatcode.backend.notify.NotificationContext;
import com.oatcode.backend.notify.NotificationDispatcher;
import com.oatcode.backend.notify.TemplateKind;
import com.oatcode.backend.revision.dto.ApprovalResponse;
import com.oatcode.backend.revision.dto.PendingQueueResponse;
import com.oatcode.backend.revision.dto.ReviewView;
import com.oatcode.backend.revision.dto.VersionSummary;
import com.oatcode.backend.revision.dto.WebsiteSummary;
import com.oatcode.backend.revision.entity.CustomizationRequestEntity;
import com.oatcode.backend.revision.entity.WebsiteVersionEntity;
import com.oatcode.backend.revision.model.RequestStatus;
import com.oatcode.backend.revision.model.RequestType;
import com.oatcode.backend.revision.repo.CustomizationRequestRepository;
import com.oatcode.backend.revision.repo.WebsiteVersionRepository;
import com.oatcode.backend.revision.web.RequestAlreadyHandledException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionOperations;

import java.time.Instant;
import java.util.Collection;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * 人工審核關卡：沒有 approve 過的版本，客戶永遠看不到
 */
@Slf4j
@RequiredArgsConstructor
@Service
public class ReviewGateService {

    private static final Set<RequestType> REVISION_TYPES = EnumSet.of(RequestType.REVISION, RequestType.ADMIN_REVISION);

    private final CustomerService customerService;
    private final CustomerRepo customerRepo;
    private final CustomizationRequestRepository requestRepo;
    private final WebsiteVersionRepository versionRepo;
    private final WebsiteVersionService versionService;
    private final RevisionRequestService requestService;
    private final NotificationDispatcher notifier;
    private final RevisionLinks links;
    private final TransactionOperations tx;

    @Transactional(readOnly = true)
    public ReviewView review(Long customerId, Long requestId) {
        Customer customer = customerService.require(customerId);
        CustomizationRequestEntity r = requestService.resolve(customerId, requestId);

        WebsiteVersionEntity v = (r.getVersionId() == null)
                ? null
                : versionRepo.findById(r.getVersionId()).orElse(null);

        return new ReviewView(
                r.getId(),
                customer.getId(),
                customer.getEmail(),
                customer.displayName(),
                customer.isPaying(),
                r.getRequestType(),
                r.getStatus(),
                r.getRequestText(),
                v == null ? null : v.getId(),
                v == null ? null : v.getVersionNumber(),
                v == null ? null : v.getHtmlContent(),
                r.getLastErrorCode(),
                r.getCompletedAtUtc(),
                links.approveUrl(customerId, r.getId()),
                links.regenerateUrl()
        );
    }

    /**
     * 核准：request -> APPROVED、版本設為 current、寄信給客戶
     * - 已經 APPROVED：no-op（不重寄）
     * - 搶輸（同時有人核准或退回）：RequestAlreadyHandledException
     */
    public ApprovalResponse approve(Long customerId, Long requestId) {
        Customer customer = customerService.require(customerId);
        Instant now = Instant.now();

        Approval a = tx.execute(s -> {
            CustomizationRequestEntity r = requestService.resolve(customerId, requestId);

            if (r.getStatus() == RequestStatus.APPROVED) {
                return new Approval(r, versionNumberOf(r.getVersionId()), true);
            }
            r.getStatus().assertTransition(RequestStatus.APPROVED);
            if (r.getVersionId() == null) throw new IllegalStateException("VERSION_MISSING");

            int n = requestRepo.markApproved(r.getId(), now);
            if (n == 0) {
                RequestStatus current = requestRepo.findById(r.getId())
                        .map(CustomizationRequestEntity::getStatus)
                        .orElse(null);
                throw new RequestAlreadyHandledException(r.getId(), current);
            }

            versionService.promoteToCurrent(r.getVersionId());

            // 第一次上線：記下對外網址
            Customer c = customerRepo.findById(customerId).orElseThrow();
            if (c.getWebsiteUrl() == null || c.getWebsiteUrl().isBlank()) {
                c.setWebsiteUrl(links.websiteUrl(customerId));
                customerRepo.save(c);
            }
            return new Approval(r, versionNumberOf(r.getVersionId()), false);
        });

        CustomizationRequestEntity r = a.request();
        String websiteUrl = links.websiteUrl(customerId);

        if (a.alreadyApproved()) {
            log.info("approve no-op, already approved. customerId={} requestId={}", customerId, r.getId());
        } else {
            log.info("request approved. customerId={} requestId={} versionId={} version={}",
                    customerId, r.getId(), r.getVersionId(), a.versionNumber());
            notifier.send(deliveryKind(customer, r.getRequestType()), customer.getEmail(), NotificationContext.builder()
                    .customerId(customerId)
                    .requestId(r.getId())
                    .customerEmail(customer.getEmail())
                    .businessName(customer.displayName())
                    .payingCustomer(customer.isPaying())
                    .requestType(r.getRequestType().name())
                    .versionNumber(a.versionNumber())
                    .websiteUrl(websiteUrl)
                    .revisionFormUrl(links.revisionFormUrl(customerId))
                    .build());
        }

        return new ApprovalResponse(r.getId(), customerId, RequestStatus.APPROVED, r.getVersionId(),
                a.versionNumber(), a.alreadyApproved(), websiteUrl);
    }

    /** 退回 = 帶回饋重產，跟 admin regenerate 同一條路 */
    public SubmissionResult reject(Long customerId, Long requestId, String feedback) {
        return requestService.adminRegenerate(customerId, requestId, feedback);
    }

    /**
     * 待審核清單：付款首產跟修改分開列，越早完成的排越前面
     */
    @Transactional(readOnly = true)
    public PendingQueueResponse pendingQueue() {
        List<CustomizationRequestEntity> initial = requestRepo.findByStatusAndRequestTypeInOrderByCompletedAtUtcAsc(
                RequestStatus.PENDING_APPROVAL, EnumSet.of(RequestType.INITIAL_PURCHASE));
        List<CustomizationRequestEntity> revisions = requestRepo.findByStatusAndRequestTypeInOrderByCompletedAtUtcAsc(
                RequestStatus.PENDING_APPROVAL, REVISION_TYPES);

        Set<Long> ids = new HashSet<>();
        initial.forEach(r -> ids.add(r.getCustomerId()));
        revisions.forEach(r -> ids.add(r.getCustomerId()));
        Map<Long, Customer> customers = customersById(ids);

        return new PendingQueueResponse(
                initial.stream().map(r -> toItem(r, customers.get(r.getCustomerId()))).toList(),
                revisions.stream().map(r -> toItem(r, customers.get(r.getCustomerId()))).toList(),
                requestRepo.countByStatus(RequestStatus.PROCESSING)
        );
    }

    @Transactional(readOnly = true)
    public List<WebsiteSummary> websites() {
        return customerRepo.findAll().stream()
                .map(c -> {
                    long count = versionRepo.countByCustomerId(c.getId());
                    Integer current = versionRepo.findFirstByCustomerIdAndCurrentTrue(c.getId())
                            .map(WebsiteVersionEntity::getVersionNumber)
                            .orElse(null);
                    RequestStatus active = requestRepo.findByActiveCustomerId(c.getId())
                            .map(CustomizationRequestEntity::getStatus)
                            .orElse(null);
                    return new WebsiteSummary(c.getId(), c.getEmail(), c.displayName(), c.isPaying(),
                            count, current, c.getWebsiteUrl(), active);
                })
                .filter(w -> w.versionCount() > 0 || w.activeRequestStatus() != null)
                .toList();
    }

    @Transactional(readOnly = true)
    public List<VersionSummary> versions(Long customerId) {
        customerService.require(customerId);
        return versionService.history(customerId).stream().map(VersionSummary::from).toList();
    }

    @Transactional(readOnly = true)
    public String versionHtml(Long versionId) {
        return versionService.require(versionId).getHtmlContent();
    }

    /** 對外頁面：只給 current（已核准）的版本 */
    @Transactional(readOnly = true)
    public String liveHtml(Long customerId) {
        return versionService.findCurrent(customerId)
                .map(WebsiteVersionEntity::getHtmlContent)
                .orElseThrow(() -> new IllegalArgumentException("SITE_NOT_FOUND"));
    }

    static TemplateKind deliveryKind(Customer customer, RequestType type) {
        return (customer.isPaying() && type == RequestType.INITIAL_PURCHASE)
                ? TemplateKind.PAID_WELCOME
                : TemplateKind.REVISION_DELIVERED;
    }

    // ===== internal =====

    private record Approval(CustomizationRequestEntity request, Integer versionNumber, boolean alreadyApproved) {}

    private Integer versionNumberOf(Long versionId) {
        if (versionId == null) return null;
        return versionRepo.findById(versionId).map(WebsiteVersionEntity::getVersionNumber).orElse(null);
    }

    private Map<Long, Customer> customersById(Collection<Long> ids) {
        return customerRepo.findAllById(ids).stream()
                .collect(Collectors.toMap(Customer::getId, Function.identity()));
    }

    private PendingQueueResponse.Item toItem(CustomizationRequestEntity r, Customer c) {
        return new PendingQueueResponse.Item(
                r.getId(),
                r.getCustomerId(),
                c == null ? null : c.getEmail(),
                c == null ? null : c.displayName(),
                c != null && c.isPaying(),
                r.getRequestType(),
                r.getRequestText(),
                r.getCompletedAtUtc(),
                links.reviewUrl(r.getCustomerId(), r.getId())
        );
    }
}
