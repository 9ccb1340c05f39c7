package com.anotaai.api.common.web;

import org.springframework.http.HttpStatus;

public class ConflictException extends ApiException {

    public ConflictException(String message) {
        super(message, null);
    }

    @Override
    public HttpStatus status() { return HttpStatus.CONFLICT; }
}
