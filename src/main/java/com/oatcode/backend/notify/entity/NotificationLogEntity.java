package com.oatcode.backend.notify.entity;

import com.oatcode.backend.notify.TemplateKind;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;

@Getter
@Setter
@Entity
@Table(name = "notification_log",
        indexes = @Index(name = "idx_notification_log_customer", columnList = "customer_id,sent_at_utc"))
public class NotificationLogEntity {

    public enum Outcome { SENT, FAILED }

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(length = 32, nullable = false)
    private TemplateKind kind;

    @Column(nullable = false, length = 255)
    private String recipient;

    @Column(length = 255)
    private String subject;

    @Column(name = "customer_id")
    private Long customerId;

    @Column(name = "request_id")
    private Long requestId;

    @Enumerated(EnumType.STRING)
    @Column(length = 16, nullable = false)
    private Outcome outcome;

    @Column(length = 1000)
    private String error;

    @Column(name = "sent_at_utc", nullable = false)
    private Instant sentAtUtc;

    @PrePersist
    void prePersist() {
        if (sentAtUtc == null) sentAtUtc = Instant.now();
    }
}
