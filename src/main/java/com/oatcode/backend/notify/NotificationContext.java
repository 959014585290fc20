package com.oatcode.backend.notify;

import lombok.Builder;

/**
 * 寄信需要的欄位；沒用到的留 null
 */
@Builder
public record NotificationContext(
        Long customerId,
        Long requestId,
        String customerEmail,
        String businessName,
        boolean payingCustomer,
        String requestType,
        String description,
        Integer versionNumber,
        String reviewUrl,
        String websiteUrl,
        String revisionFormUrl,
        String errorCode,
        String errorMessage,
        Integer attempt,
        Integer maxAttempts,
        boolean willRetry
) {}
