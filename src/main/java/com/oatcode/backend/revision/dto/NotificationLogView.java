package com.oatcode.backend.revision.dto;

import com.oatcode.backend.notify.TemplateKind;
import com.oatcode.backend.notify.entity.NotificationLogEntity;

import java.time.Instant;

public record NotificationLogView(
        Long id,
        TemplateKind kind,
        String recipient,
        String subject,
        Long customerId,
        Long requestId,
        NotificationLogEntity.Outcome outcome,
        String error,
        Instant sentAtUtc
) {
    public static NotificationLogView from(NotificationLogEntity e) {
        return new NotificationLogView(e.getId(), e.getKind(), e.getRecipient(), e.getSubject(),
                e.getCustomerId(), e.getRequestId(), e.getOutcome(), e.getError(), e.getSentAtUtc());
    }
}
