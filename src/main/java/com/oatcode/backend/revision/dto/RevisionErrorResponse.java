package com.oatcode.backend.revision.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record RevisionErrorResponse(
        String errorCode,
        String message,
        String requestId,          // X-Request-Id，不是 customization request 的 id
        Integer retryAfterSec,
        String nextAllowedAtUtc,
        String currentStatus
) {
    public RevisionErrorResponse(String errorCode, String message, String requestId) {
        this(errorCode, message, requestId, null, null, null);
    }
}
