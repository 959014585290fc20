package com.oatcode.backend.revision.dto;

import com.oatcode.backend.revision.model.RequestType;

import java.time.Instant;
import java.util.List;

public record PendingQueueResponse(
        List<Item> initialPurchases,
        List<Item> revisions,
        long processingCount
) {
    public record Item(
            Long requestId,
            Long customerId,
            String customerEmail,
            String businessName,
            boolean payingCustomer,
            RequestType requestType,
            String requestText,
            Instant completedAtUtc,
            String reviewUrl
    ) {}
}
