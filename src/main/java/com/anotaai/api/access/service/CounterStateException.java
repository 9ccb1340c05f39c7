package com.anotaai.api.access.service;

import com.anotaai.api.common.web.ApiException;
import org.springframework.http.HttpStatus;

/** The counter row failed its integrity check (duplicate rows or a negative count). */
public class CounterStateException extends ApiException {

    public CounterStateException(String message) {
        super(message, null);
    }

    @Override
    public HttpStatus status() { return HttpStatus.INTERNAL_SERVER_ERROR; }
}
