package com.sporehub.backend.common.web;

public class RateLimitedException extends ApiException {

    private final int retryAfterSec;

    public RateLimitedException(String message, int retryAfterSec) {
        super(ErrorKind.RATE_LIMITED, message);
        this.retryAfterSec = retryAfterSec;
    }

    public int retryAfterSec() { return retryAfterSec; }
}
