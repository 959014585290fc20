package com.oatcode.backend.revision.service;

import com.oatcode.backend.revision.model.RequestStatus;
import com.oatcode.backend.revision.model.RequestType;

/**
 * @param coalesced true = 併進既有的進行中 request，沒有新開一筆
 */
public record SubmissionResult(
        Long requestId,
        Long customerId,
        RequestType requestType,
        RequestStatus status,
        boolean coalesced
) {}
