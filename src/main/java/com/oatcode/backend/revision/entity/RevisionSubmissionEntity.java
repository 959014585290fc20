package com.oatcode.backend.revision.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;

/**
 * 客戶自助送出的紀錄（每送一次一筆，不管有沒有併進既有 request）
 * 冷卻期只看這張表
 */
@Getter
@Setter
@Entity
@Table(
        name = "revision_submissions",
        indexes = {
                @Index(name = "idx_revision_submissions_email", columnList = "submitter_email,submitted_at_utc"),
                @Index(name = "idx_revision_submissions_request", columnList = "request_id")
        }
)
public class RevisionSubmissionEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "submitter_email", length = 255, nullable = false)
    private String submitterEmail;

    @Column(name = "customer_id", nullable = false)
    private Long customerId;

    @Column(name = "request_id", nullable = false)
    private Long requestId;

    @Column(nullable = false)
    private boolean coalesced;

    @Column(name = "submitted_at_utc", nullable = false)
    private Instant submittedAtUtc;

    @PrePersist
    void prePersist() {
        if (submittedAtUtc == null) submittedAtUtc = Instant.now();
    }

    public static RevisionSubmissionEntity of(String email, Long customerId, Long requestId, boolean coalesced, Instant now) {
        RevisionSubmissionEntity s = new RevisionSubmissionEntity();
        s.setSubmitterEmail(email);
        s.setCustomerId(customerId);
        s.setRequestId(requestId);
        s.setCoalesced(coalesced);
        s.setSubmittedAtUtc(now);
        return s;
    }
}
