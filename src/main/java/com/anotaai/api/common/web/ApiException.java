package com.anotaai.api.common.web;

import org.springframework.http.HttpStatus;

/**
 * Expected failure with a fixed HTTP status. The status is the only signal callers get;
 * {@link #detail()} goes into the envelope's {@code error} field.
 */
public abstract class ApiException extends RuntimeException {

    private final String detail;

    protected ApiException(String message, String detail) {
        super(message);
        this.detail = detail;
    }

    public abstract HttpStatus status();

    public String detail() { return detail; }
}
