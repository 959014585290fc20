package com.oatcode.backend.revision.web;

import java.time.Instant;

public class SubmissionCooldownException extends RuntimeException {

    private final Instant nextAllowedAtUtc;
    private final int retryAfterSec;

    public SubmissionCooldownException(String message, Instant nextAllowedAtUtc, int retryAfterSec) {
        super(message);
        this.nextAllowedAtUtc = nextAllowedAtUtc;
        this.retryAfterSec = retryAfterSec;
    }

    public Instant nextAllowedAtUtc() { return nextAllowedAtUtc; }
    public int retryAfterSec() { return retryAfterSec; }
}
