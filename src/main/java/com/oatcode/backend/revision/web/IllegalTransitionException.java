package com.oatcode.backend.revision.web;

import com.oatcode.backend.revision.model.RequestStatus;

public class IllegalTransitionException extends RuntimeException {

    private final RequestStatus from;
    private final RequestStatus to;

    public IllegalTransitionException(RequestStatus from, RequestStatus to) {
        super("ILLEGAL_TRANSITION: " + from + " -> " + to);
        this.from = from;
        this.to = to;
    }

    public RequestStatus from() { return from; }
    public RequestStatus to() { return to; }
}
