package com.oatcode.backend.revision.web;

import com.oatcode.backend.revision.model.RequestStatus;

public class RequestAlreadyHandledException extends RuntimeException {

    private final Long requestId;
    private final RequestStatus currentStatus;

    public RequestAlreadyHandledException(Long requestId, RequestStatus currentStatus) {
        super("REQUEST_ALREADY_HANDLED");
        this.requestId = requestId;
        this.currentStatus = currentStatus;
    }

    public Long requestId() { return requestId; }
    public RequestStatus currentStatus() { return currentStatus; }
}
