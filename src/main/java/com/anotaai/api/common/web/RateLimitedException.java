package com.anotaai.api.common.web;

import org.springframework.http.HttpStatus;

public class RateLimitedException extends ApiException {

    private final int retryAfterSec;

    public RateLimitedException(String message, int retryAfterSec) {
        super(message, null);
        this.retryAfterSec = retryAfterSec;
    }

    public int retryAfterSec() { return retryAfterSec; }

    @Override
    public HttpStatus status() { return HttpStatus.TOO_MANY_REQUESTS; }
}
