package com.anotaai.api.common.web;

import org.springframework.http.HttpStatus;

public class NotFoundException extends ApiException {

    public NotFoundException(String message) {
        super(message, null);
    }

    @Override
    public HttpStatus status() { return HttpStatus.NOT_FOUND; }
}
