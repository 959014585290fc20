package com.oatcode.backend.revision.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.util.UUID;

@Getter
@Setter
@Entity
@Table(name = "regeneration_tasks",
        indexes = {
                @Index(name = "idx_regeneration_tasks_status", columnList = "task_status,next_retry_at_utc"),
                @Index(name = "idx_regeneration_tasks_request", columnList = "request_id")
        }
)
public class RegenerationTaskEntity {

    public enum TaskStatus { QUEUED, RUNNING, SUCCEEDED, FAILED, CANCELLED }

    @Id
    @Column(length = 36, nullable = false)
    private String id;

    @Column(name = "request_id", nullable = false)
    private Long requestId;

    @Column(name = "customer_id", nullable = false)
    private Long customerId;

    @Enumerated(EnumType.STRING)
    @Column(name = "task_status", length = 16, nullable = false)
    private TaskStatus taskStatus;

    @Column(nullable = false)
    private int attempts = 0;

    /** RUNNING 時拿到的 request.inputRevision */
    @Column(name = "input_revision")
    private Integer inputRevision;

    @Column(name = "next_retry_at_utc")
    private Instant nextRetryAtUtc;

    @Column(name = "last_error_code", length = 64)
    private String lastErrorCode;

    @Column(name = "last_error_message", length = 2000)
    private String lastErrorMessage;

    @Column(name = "created_at_utc", nullable = false)
    private Instant createdAtUtc;

    @Column(name = "updated_at_utc", nullable = false)
    private Instant updatedAtUtc;

    @PrePersist
    void prePersist() {
        if (id == null || id.isBlank()) id = UUID.randomUUID().toString();
        Instant now = Instant.now();
        if (createdAtUtc == null) createdAtUtc = now;
        if (updatedAtUtc == null) updatedAtUtc = now;
        if (taskStatus == null) taskStatus = TaskStatus.QUEUED;
    }

    @PreUpdate
    void preUpdate() {
        updatedAtUtc = Instant.now();
    }

    public static RegenerationTaskEntity queued(Long requestId, Long customerId) {
        RegenerationTaskEntity t = new RegenerationTaskEntity();
        t.setRequestId(requestId);
        t.setCustomerId(customerId);
        t.setTaskStatus(TaskStatus.QUEUED);
        return t;
    }

    public boolean isPending() {
        return taskStatus == TaskStatus.QUEUED
               || taskStatus == TaskStatus.RUNNING
               || (taskStatus == TaskStatus.FAILED && nextRetryAtUtc != null);
    }

    public void requeue(Instant now) {
        this.taskStatus = TaskStatus.QUEUED;
        this.attempts = 0;
        this.nextRetryAtUtc = null;
        this.lastErrorCode = null;
        this.lastErrorMessage = null;
        this.updatedAtUtc = now;
    }

    public void markRunning(Instant now, int inputRevision) {
        this.taskStatus = TaskStatus.RUNNING;
        this.attempts += 1;
        this.inputRevision = inputRevision;
        this.updatedAtUtc = now;
    }

    public void markSucceeded(Instant now) {
        this.taskStatus = TaskStatus.SUCCEEDED;
        this.nextRetryAtUtc = null;
        this.updatedAtUtc = now;
    }

    public void markFailed(Instant now, String code, String message, int retryAfterSec) {
        this.taskStatus = TaskStatus.FAILED;
        this.lastErrorCode = code;
        this.lastErrorMessage = message;
        this.nextRetryAtUtc = now.plusSeconds(retryAfterSec);
        this.updatedAtUtc = now;
    }

    public void markCancelled(Instant now, String code, String message) {
        this.taskStatus = TaskStatus.CANCELLED;
        this.lastErrorCode = code;
        this.lastErrorMessage = message;
        this.nextRetryAtUtc = null;
        this.updatedAtUtc = now;
    }
}
