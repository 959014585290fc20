package com.oatcode.backend.revision.dto;

import com.oatcode.backend.revision.entity.WebsiteVersionEntity;

import java.time.Instant;

public record VersionSummary(
        Long versionId,
        int versionNumber,
        boolean current,
        Long requestId,
        String changeDescription,
        Instant createdAtUtc
) {
    public static VersionSummary from(WebsiteVersionEntity v) {
        return new VersionSummary(v.getId(), v.getVersionNumber(), v.isCurrent(),
                v.getRequestId(), v.getChangeDescription(), v.getCreatedAtUtc());
    }
}
