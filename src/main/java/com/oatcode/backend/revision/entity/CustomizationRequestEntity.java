package com.oatcode.backend.revision.entity;

import com.oatcode.backend.revision.model.RequestStatus;
import com.oatcode.backend.revision.model.RequestType;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;

@Getter
@Setter
@Entity
@Table(name = "customization_requests",
        // active_customer_id 只在 PROCESSING / PENDING_APPROVAL 時有值 -> 每個客戶最多一筆進行中的 request
        uniqueConstraints = @UniqueConstraint(name = "ux_customization_requests_active", columnNames = "active_customer_id"),
        indexes = {
                @Index(name = "idx_customization_requests_customer", columnList = "customer_id,status"),
                @Index(name = "idx_customization_requests_status", columnList = "status,request_type")
        }
)
public class CustomizationRequestEntity {

    public static final String ADMIN_FEEDBACK_MARKER = "(Admin feedback)";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "customer_id", nullable = false)
    private Long customerId;

    @Enumerated(EnumType.STRING)
    @Column(name = "request_type", length = 32, nullable = false)
    private RequestType requestType;

    @Lob
    @Column(name = "request_text", nullable = false)
    private String requestText;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private RequestStatus status;

    /** 每次 requestText 被改寫就 +1；worker 完成時拿來比對，避免用舊描述產出的版本進審核 */
    @Column(name = "input_revision", nullable = false)
    private int inputRevision = 1;

    @Column(name = "version_id")
    private Long versionId;

    @Column(name = "submitter_email", length = 255)
    private String submitterEmail;

    @Column(name = "active_customer_id")
    private Long activeCustomerId;

    @Column(name = "last_error_code", length = 64)
    private String lastErrorCode;

    @Column(name = "last_error_message", length = 2000)
    private String lastErrorMessage;

    @Column(name = "created_at_utc", nullable = false)
    private Instant createdAtUtc;

    @Column(name = "completed_at_utc")
    private Instant completedAtUtc;

    @Column(name = "approved_at_utc")
    private Instant approvedAtUtc;

    @Column(name = "updated_at_utc", nullable = false)
    private Instant updatedAtUtc;

    @PrePersist
    void prePersist() {
        Instant now = Instant.now();
        if (createdAtUtc == null) createdAtUtc = now;
        if (updatedAtUtc == null) updatedAtUtc = now;
        if (status == null) status = RequestStatus.PROCESSING;
        activeCustomerId = status.isActive() ? customerId : null;
    }

    @PreUpdate
    void preUpdate() {
        updatedAtUtc = Instant.now();
        activeCustomerId = status.isActive() ? customerId : null;
    }

    public static CustomizationRequestEntity open(Long customerId, RequestType type, String text, String submitterEmail) {
        CustomizationRequestEntity r = new CustomizationRequestEntity();
        r.setCustomerId(customerId);
        r.setRequestType(type);
        r.setRequestText(text);
        r.setStatus(RequestStatus.PROCESSING);
        r.setSubmitterEmail(submitterEmail);
        r.setActiveCustomerId(customerId);
        return r;
    }

    /**
     * 同一客戶又送進來的需求：併進現有 request（不另開一筆）
     * PENDING_APPROVAL 的版本已經不包含新需求 -> 退回 PROCESSING 重產
     */
    public void coalesce(String additionalText, Instant now) {
        this.requestText = appendBlock(this.requestText, additionalText);
        this.inputRevision += 1;
        if (this.status == RequestStatus.PENDING_APPROVAL) {
            this.status.assertTransition(RequestStatus.PROCESSING);
            this.status = RequestStatus.PROCESSING;
            this.approvedAtUtc = null;
        }
        this.updatedAtUtc = now;
    }

    public static String withAdminFeedback(String original, String feedback) {
        return appendBlock(original, feedback.trim() + " " + ADMIN_FEEDBACK_MARKER);
    }

    static String appendBlock(String original, String addition) {
        if (addition == null || addition.isBlank()) return original;
        if (original == null || original.isBlank()) return addition.trim();
        return original + "\n\n" + addition.trim();
    }
}
