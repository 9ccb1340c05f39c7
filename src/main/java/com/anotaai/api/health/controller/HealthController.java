package com.anotaai.api.health.controller;

import com.anotaai.api.common.web.ApiResponse;
import com.anotaai.api.config.AppProperties;
import com.anotaai.api.config.ExecutionMode;
import com.anotaai.api.health.service.SystemHealthService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.net.URI;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Callable;

/** Operational endpoints. Not rate limited under /health. */
@RestController
public class HealthController {

    private final SystemHealthService health;
    private final ExecutionMode mode;
    private final AppProperties props;

    public HealthController(SystemHealthService health, ExecutionMode mode, AppProperties props) {
        this.health = health;
        this.mode = mode;
        this.props = props;
    }

    @GetMapping("/health")
    public ResponseEntity<ApiResponse<Map<String, Object>>> health() {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("status", "healthy");
        data.put("timestamp", Instant.now());
        data.put("uptime", health.uptimeSeconds());
        data.put("environment", mode.current());
        data.put("version", props.getVersion());
        return ResponseEntity.ok(ApiResponse.ok("Application is running", data));
    }

    /** 503 when any dependency is unhealthy */
    @GetMapping("/health/detailed")
    public Callable<ResponseEntity<ApiResponse<Map<String, Object>>>> detailed() {
        return () -> {
            SystemHealthService.DatabaseCheck db = health.checkDatabase();

            Map<String, Object> application = new LinkedHashMap<>();
            application.put("status", "healthy");
            application.put("uptime", health.uptimeSeconds());
            application.put("memory", health.memory());
            application.put("timestamp", Instant.now());

            Map<String, Object> checks = new LinkedHashMap<>();
            checks.put("application", application);
            checks.put("database", db);

            if (!db.healthy()) {
                return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                        .body(ApiResponse.fail("Some services are unhealthy"));
            }

            Map<String, Object> data = new LinkedHashMap<>();
            data.put("status", "healthy");
            data.put("timestamp", Instant.now());
            data.put("checks", checks);
            return ResponseEntity.ok(ApiResponse.ok("All services are running", data));
        };
    }

    @GetMapping("/info")
    public ResponseEntity<ApiResponse<Map<String, Object>>> info() {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("name", props.getName());
        data.put("description", "Access counting and user management API");
        data.put("version", props.getVersion());
        data.put("environment", mode.current());
        data.putAll(health.runtime());
        data.put("uptime", health.uptimeSeconds());
        data.put("timestamp", Instant.now());
        data.put("endpoints", endpointMap());
        return ResponseEntity.ok(ApiResponse.ok("Application information", data));
    }

    @GetMapping("/metrics")
    public ResponseEntity<ApiResponse<Map<String, Object>>> metrics() {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("timestamp", Instant.now());
        data.put("uptime", health.uptimeSeconds());
        data.put("memory", health.memory());
        data.put("runtime", health.runtime());
        return ResponseEntity.ok(ApiResponse.ok("Application metrics", data));
    }

    @GetMapping("/api")
    public ResponseEntity<ApiResponse<Map<String, Object>>> apiIndex() {
        Map<String, Object> endpoints = new LinkedHashMap<>();
        endpoints.put("access", "/api/access");
        endpoints.put("users", "/api/users");
        endpoints.put("health", "/health");
        endpoints.put("info", "/info");
        endpoints.put("metrics", "/metrics");

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("name", props.getName());
        data.put("version", props.getVersion());
        data.put("endpoints", endpoints);
        return ResponseEntity.ok(ApiResponse.ok(props.getName() + " is running", data));
    }

    @GetMapping("/")
    public ResponseEntity<Void> root() {
        return ResponseEntity.status(HttpStatus.FOUND).location(URI.create("/info")).build();
    }

    private static Map<String, Object> endpointMap() {
        Map<String, Object> access = new LinkedHashMap<>();
        access.put("increment", "POST /api/access/increment");
        access.put("count", "GET /api/access/count");
        access.put("statistics", "GET /api/access/statistics");
        access.put("health", "GET /api/access/health");
        access.put("reset", "POST /api/access/reset");

        Map<String, Object> users = new LinkedHashMap<>();
        users.put("create", "POST /api/users");
        users.put("list", "GET /api/users");
        users.put("getById", "GET /api/users/:id");
        users.put("exists", "GET /api/users/:id/exists");
        users.put("searchByEmail", "GET /api/users/search/email?email=");
        users.put("update", "PUT /api/users/:id");
        users.put("delete", "DELETE /api/users/:id");
        users.put("statistics", "GET /api/users/statistics");

        Map<String, Object> ops = new LinkedHashMap<>();
        ops.put("basic", "GET /health");
        ops.put("detailed", "GET /health/detailed");
        ops.put("info", "GET /info");
        ops.put("metrics", "GET /metrics");

        Map<String, Object> m = new LinkedHashMap<>();
        m.put("access", access);
        m.put("users", users);
        m.put("health", ops);
        return m;
    }
}
