package com.anotaai.api.common.web;

import org.springframework.http.HttpStatus;

public class ForbiddenException extends ApiException {

    public ForbiddenException(String message) {
        super(message, null);
    }

    @Override
    public HttpStatus status() { return HttpStatus.FORBIDDEN; }
}
