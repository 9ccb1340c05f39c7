package com.anotaai.api.access.controller;

import com.anotaai.api.access.dto.AccessDtos;
import com.anotaai.api.access.service.AccessCounterService;
import com.anotaai.api.access.service.CounterStateException;
import com.anotaai.api.common.web.ApiResponse;
import com.anotaai.api.common.web.ForbiddenException;
import com.anotaai.api.config.ExecutionMode;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.concurrent.Callable;

@Slf4j
@RestController
@RequestMapping("/api/access")
public class AccessCounterController {

    private final AccessCounterService service;
    private final ExecutionMode mode;

    public AccessCounterController(AccessCounterService service, ExecutionMode mode) {
        this.service = service;
        this.mode = mode;
    }

    @PostMapping("/increment")
    public Callable<ResponseEntity<ApiResponse<AccessDtos.CounterDto>>> increment(HttpServletRequest req) {
        log.info("counter_increment_requested ip={} ua={}", req.getRemoteAddr(), req.getHeader(HttpHeaders.USER_AGENT));
        return () -> ResponseEntity.ok(ApiResponse.ok("Access incremented successfully", service.increment()));
    }

    @GetMapping("/count")
    public Callable<ResponseEntity<ApiResponse<AccessDtos.CounterDto>>> count() {
        return () -> ResponseEntity.ok(ApiResponse.ok("Counter retrieved successfully", service.currentCount()));
    }

    @GetMapping("/statistics")
    public Callable<ResponseEntity<ApiResponse<AccessDtos.CounterStatisticsDto>>> statistics() {
        return () -> ResponseEntity.ok(ApiResponse.ok("Statistics retrieved successfully", service.statistics()));
    }

    /** 500 envelope when the integrity check fails */
    @GetMapping("/health")
    public Callable<ResponseEntity<ApiResponse<AccessDtos.CounterHealthDto>>> health() {
        return () -> {
            if (!service.validateIntegrity()) {
                throw new CounterStateException("Counter in inconsistent state");
            }
            return ResponseEntity.ok(ApiResponse.ok("Counter is healthy",
                    new AccessDtos.CounterHealthDto("healthy", true)));
        };
    }

    /**
     * Maintenance only. The execution mode is checked on each call, not at startup.
     */
    @PostMapping("/reset")
    public Callable<ResponseEntity<ApiResponse<AccessDtos.CounterDto>>> reset(HttpServletRequest req) {
        if (mode.isProduction()) {
            throw new ForbiddenException("Operation not allowed in production");
        }
        log.warn("counter_reset_requested ip={} ua={}", req.getRemoteAddr(), req.getHeader(HttpHeaders.USER_AGENT));
        return () -> ResponseEntity.ok(ApiResponse.ok("Counter reset successfully", service.reset()));
    }
}
