package com.anotaai.api.common.web;

import com.anotaai.api.config.ExecutionMode;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.validation.ObjectError;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.async.AsyncRequestTimeoutException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.NoHandlerFoundException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Single translation point from exceptions to the envelope:
 * - 400 validation / malformed body / bad params
 * - 403 / 404 / 409 / 429 from {@link ApiException}
 * - 504 request budget exceeded
 * - 500 everything else (detail only in development mode)
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    private final ExecutionMode mode;

    public ApiExceptionHandler(ExecutionMode mode) {
        this.mode = mode;
    }

    @ExceptionHandler(ApiException.class)
    public ResponseEntity<ApiResponse<Void>> handleApi(ApiException ex) {
        ResponseEntity.BodyBuilder b = ResponseEntity.status(ex.status());
        if (ex instanceof RateLimitedException rl) {
            b.header(HttpHeaders.RETRY_AFTER, String.valueOf(Math.max(0, rl.retryAfterSec())));
        }
        return b.body(ApiResponse.fail(ex.getMessage(), ex.detail()));
    }

    // ===== 400 =====

    /** Every violated rule is reported, joined in one line. */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiResponse<Void>> handleInvalidBody(MethodArgumentNotValidException ex) {
        Set<String> messages = new LinkedHashSet<>();
        for (FieldError fe : ex.getBindingResult().getFieldErrors()) {
            messages.add(fe.getDefaultMessage());
        }
        for (ObjectError ge : ex.getBindingResult().getGlobalErrors()) {
            messages.add(ge.getDefaultMessage());
        }
        return badRequest("Invalid data", String.join(", ", messages));
    }

    /** A body cut off by the payload cap arrives here wrapped by the message converter. */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiResponse<Void>> handleUnreadable(HttpMessageNotReadableException ex) {
        for (Throwable t = ex.getCause(); t != null && t != t.getCause(); t = t.getCause()) {
            if (t instanceof ApiException api) return handleApi(api);
        }
        return badRequest("Invalid JSON in request body", null);
    }

    @ExceptionHandler({
            MethodArgumentTypeMismatchException.class,
            MissingServletRequestParameterException.class
    })
    public ResponseEntity<ApiResponse<Void>> handleBadParam(Exception ex) {
        return badRequest("Invalid request parameters", ex.getMessage());
    }

    @ExceptionHandler(HttpMediaTypeNotSupportedException.class)
    public ResponseEntity<ApiResponse<Void>> handleMediaType(HttpMediaTypeNotSupportedException ex) {
        return badRequest("Unsupported content type", ex.getMessage());
    }

    // ===== 404 / 405 =====

    @ExceptionHandler({NoResourceFoundException.class, NoHandlerFoundException.class})
    public ResponseEntity<ApiResponse<Void>> handleNoRoute(Exception ex, HttpServletRequest req) {
        log.warn("route_not_found method={} uri={} ip={}", req.getMethod(), req.getRequestURI(), req.getRemoteAddr());
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(ApiResponse.fail("Route " + req.getMethod() + " " + req.getRequestURI() + " not found"));
    }

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<ApiResponse<Void>> handleMethod(HttpRequestMethodNotSupportedException ex) {
        return ResponseEntity.status(HttpStatus.METHOD_NOT_ALLOWED)
                .body(ApiResponse.fail("Method " + ex.getMethod() + " not allowed"));
    }

    // ===== 409 safety net for the unique email index =====

    @ExceptionHandler(DataIntegrityViolationException.class)
    public ResponseEntity<ApiResponse<Void>> handleIntegrity(DataIntegrityViolationException ex) {
        log.warn("integrity_violation cause={}", rootCause(ex).getMessage());
        return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(ApiResponse.fail("Duplicate data"));
    }

    // ===== 504 =====

    @ExceptionHandler(AsyncRequestTimeoutException.class)
    public ResponseEntity<ApiResponse<Void>> handleTimeout(AsyncRequestTimeoutException ex, HttpServletRequest req) {
        log.warn("request_timeout method={} uri={} ip={}", req.getMethod(), req.getRequestURI(), req.getRemoteAddr());
        return ResponseEntity.status(HttpStatus.GATEWAY_TIMEOUT)
                .body(ApiResponse.fail("Request timeout"));
    }

    // ===== 500 fallback =====

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiResponse<Void>> handleUnknown(Exception ex, HttpServletRequest req) {
        log.error("unhandled_error rid={} method={} uri={} ip={} ua={}",
                req.getAttribute(RequestIdFilter.ATTR), req.getMethod(), req.getRequestURI(),
                req.getRemoteAddr(), req.getHeader(HttpHeaders.USER_AGENT), ex);

        if (mode.isDevelopment()) {
            Throwable root = rootCause(ex);
            String detail = root.getClass().getName() + ": " + root.getMessage();
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(ApiResponse.fail(String.valueOf(ex.getMessage()), detail));
        }
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ApiResponse.fail("Internal server error"));
    }

    private static ResponseEntity<ApiResponse<Void>> badRequest(String message, String error) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(ApiResponse.fail(message, error));
    }

    private static Throwable rootCause(Throwable t) {
        Throwable cur = t, next;
        while ((next = cur.getCause()) != null && next != cur) cur = next;
        return cur;
    }
}
