package com.oatcode.backend.revision.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;

/**
 * 產出的網站快照：建立後內容不再改，只有 current 旗標會在審核通過時被切換
 */
@Getter
@Setter
@Entity
@Table(name = "website_versions",
        uniqueConstraints = @UniqueConstraint(name = "ux_website_versions_customer_no", columnNames = {"customer_id", "version_number"}),
        indexes = @Index(name = "idx_website_versions_current", columnList = "customer_id,is_current")
)
public class WebsiteVersionEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "customer_id", nullable = false, updatable = false)
    private Long customerId;

    @Column(name = "request_id", updatable = false)
    private Long requestId;

    @Column(name = "version_number", nullable = false, updatable = false)
    private int versionNumber;

    @Lob
    @Column(name = "html_content", nullable = false, updatable = false)
    private String htmlContent;

    @Column(name = "change_description", length = 2000, updatable = false)
    private String changeDescription;

    @Column(name = "is_current", nullable = false)
    private boolean current;

    @Column(name = "created_at_utc", nullable = false, updatable = false)
    private Instant createdAtUtc;

    @PrePersist
    void prePersist() {
        if (createdAtUtc == null) createdAtUtc = Instant.now();
    }
}
