package com.anotaai.api.common.web;

import org.springframework.http.HttpStatus;

public class ValidationException extends ApiException {

    public ValidationException(String message) {
        super(message, null);
    }

    public ValidationException(String message, String detail) {
        super(message, detail);
    }

    @Override
    public HttpStatus status() { return HttpStatus.BAD_REQUEST; }
}
