package com.oatcode.backend.revision.dto;

import com.oatcode.backend.revision.model.RequestStatus;
import com.oatcode.backend.revision.model.RequestType;
import com.oatcode.backend.revision.service.SubmissionResult;

public record RevisionAcceptedResponse(
        Long requestId,
        Long customerId,
        RequestType requestType,
        RequestStatus status,
        boolean coalesced,
        String message
) {
    public static RevisionAcceptedResponse from(SubmissionResult r, String message) {
        return new RevisionAcceptedResponse(
                r.requestId(), r.customerId(), r.requestType(), r.status(), r.coalesced(), message);
    }
}
