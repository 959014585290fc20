package com.oatcode.backend.revision.dto;

import com.oatcode.backend.revision.model.RequestStatus;

public record WebsiteSummary(
        Long customerId,
        String email,
        String businessName,
        boolean payingCustomer,
        long versionCount,
        Integer currentVersionNumber,
        String websiteUrl,
        RequestStatus activeRequestStatus
) {}
