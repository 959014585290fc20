package com.oatcode.backend.revision.dto;

import com.oatcode.backend.revision.model.RequestStatus;
import com.oatcode.backend.revision.model.RequestType;

import java.time.Instant;

public record ReviewView(
        Long requestId,
        Long customerId,
        String customerEmail,
        String businessName,
        boolean payingCustomer,
        RequestType requestType,
        RequestStatus status,
        String requestText,
        Long versionId,
        Integer versionNumber,
        String html,
        String lastErrorCode,
        Instant completedAtUtc,
        String approveUrl,
        String regenerateUrl
) {}
