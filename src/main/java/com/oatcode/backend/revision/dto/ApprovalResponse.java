package com.oatcode.backend.revision.dto;

import com.oatcode.backend.revision.model.RequestStatus;

/**
 * @param alreadyApproved true = 之前就核准過，這次什麼都沒做（也沒寄信）
 */
public record ApprovalResponse(
        Long requestId,
        Long customerId,
        RequestStatus status,
        Long versionId,
        Integer versionNumber,
        boolean alreadyApproved,
        String websiteUrl
) {}
