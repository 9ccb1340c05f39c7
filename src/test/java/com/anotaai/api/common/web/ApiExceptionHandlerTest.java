package com.anotaai.api.common.web;

import com.anotaai.api.config.ExecutionMode;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.mock.http.MockHttpInputMessage;
import org.springframework.mock.web.MockHttpServletRequest;

import static org.junit.jupiter.api.Assertions.*;

class ApiExceptionHandlerTest {

    private static ApiExceptionHandler handler(boolean development) {
        ExecutionMode mode = Mockito.mock(ExecutionMode.class);
        Mockito.when(mode.isDevelopment()).thenReturn(development);
        return new ApiExceptionHandler(mode);
    }

    @Test
    void internal_error_detail_only_in_development() {
        MockHttpServletRequest req = new MockHttpServletRequest("GET", "/api/x");
        RuntimeException boom = new RuntimeException("wrapper", new IllegalStateException("db exploded"));

        ResponseEntity<ApiResponse<Void>> prod = handler(false).handleUnknown(boom, req);
        assertEquals(HttpStatus.INTERNAL_SERVER_ERROR, prod.getStatusCode());
        assertEquals("Internal server error", prod.getBody().message());
        assertNull(prod.getBody().error());

        ResponseEntity<ApiResponse<Void>> dev = handler(true).handleUnknown(boom, req);
        assertEquals(HttpStatus.INTERNAL_SERVER_ERROR, dev.getStatusCode());
        assertEquals("wrapper", dev.getBody().message());
        assertEquals("java.lang.IllegalStateException: db exploded", dev.getBody().error());
    }

    @Test
    void rate_limited_carries_retry_after() {
        ResponseEntity<ApiResponse<Void>> res = handler(false)
                .handleApi(new RateLimitedException("slow down", 42));

        assertEquals(HttpStatus.TOO_MANY_REQUESTS, res.getStatusCode());
        assertEquals("42", res.getHeaders().getFirst(HttpHeaders.RETRY_AFTER));
        assertFalse(res.getBody().success());
        assertEquals("slow down", res.getBody().message());
    }

    @Test
    void api_exceptions_keep_their_status() {
        ApiExceptionHandler h = handler(false);

        assertEquals(HttpStatus.NOT_FOUND, h.handleApi(new NotFoundException("User not found")).getStatusCode());
        assertEquals(HttpStatus.CONFLICT, h.handleApi(new ConflictException("Email already in use")).getStatusCode());
        assertEquals(HttpStatus.FORBIDDEN, h.handleApi(new ForbiddenException("no")).getStatusCode());
        assertEquals(HttpStatus.BAD_REQUEST, h.handleApi(new ValidationException("bad")).getStatusCode());
    }

    @Test
    void capped_body_inside_converter_failure_keeps_its_message() {
        HttpMessageNotReadableException wrapped = new HttpMessageNotReadableException(
                "I/O error while reading input message",
                new RuntimeException(new ValidationException("Request payload too large", "Maximum is 64 bytes")),
                new MockHttpInputMessage(new byte[0]));

        ResponseEntity<ApiResponse<Void>> res = handler(false).handleUnreadable(wrapped);

        assertEquals(HttpStatus.BAD_REQUEST, res.getStatusCode());
        assertEquals("Request payload too large", res.getBody().message());
        assertEquals("Maximum is 64 bytes", res.getBody().error());
    }

    @Test
    void plain_unreadable_body_is_invalid_json() {
        HttpMessageNotReadableException ex = new HttpMessageNotReadableException(
                "JSON parse error", new MockHttpInputMessage(new byte[0]));

        ResponseEntity<ApiResponse<Void>> res = handler(false).handleUnreadable(ex);

        assertEquals(HttpStatus.BAD_REQUEST, res.getStatusCode());
        assertEquals("Invalid JSON in request body", res.getBody().message());
    }
}
