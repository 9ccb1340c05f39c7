package com.anotaai.api.health.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import javax.sql.DataSource;
import java.lang.management.ManagementFactory;
import java.lang.management.MemoryMXBean;
import java.lang.management.MemoryUsage;
import java.sql.Connection;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Process and store introspection for the /health, /metrics and /info endpoints.
 */
@Slf4j
@Service
public class SystemHealthService {

    private static final int VALIDATION_TIMEOUT_SEC = 2;
    private static final long MB = 1024L * 1024L;

    private final DataSource dataSource;

    public SystemHealthService(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    public record DatabaseCheck(String status, boolean connected, long responseTimeMs) {
        public boolean healthy() { return connected; }
    }

    public DatabaseCheck checkDatabase() {
        long start = System.nanoTime();
        try (Connection c = dataSource.getConnection()) {
            boolean valid = c.isValid(VALIDATION_TIMEOUT_SEC);
            long ms = Duration.ofNanos(System.nanoTime() - start).toMillis();
            return new DatabaseCheck(valid ? "healthy" : "unhealthy", valid, ms);
        } catch (Exception e) {
            log.error("db_health_check_failed err={}", e.toString());
            return new DatabaseCheck("unhealthy", false, 0L);
        }
    }

    /** seconds since JVM start */
    public double uptimeSeconds() {
        return ManagementFactory.getRuntimeMXBean().getUptime() / 1000.0;
    }

    public Map<String, Object> memory() {
        MemoryMXBean mx = ManagementFactory.getMemoryMXBean();
        MemoryUsage heap = mx.getHeapMemoryUsage();
        MemoryUsage nonHeap = mx.getNonHeapMemoryUsage();
        Runtime rt = Runtime.getRuntime();

        Map<String, Object> formatted = new LinkedHashMap<>();
        formatted.put("heapUsed", heap.getUsed() / MB + " MB");
        formatted.put("heapCommitted", heap.getCommitted() / MB + " MB");
        formatted.put("nonHeapUsed", nonHeap.getUsed() / MB + " MB");
        formatted.put("maxMemory", rt.maxMemory() / MB + " MB");

        Map<String, Object> m = new LinkedHashMap<>();
        m.put("heapUsed", heap.getUsed());
        m.put("heapCommitted", heap.getCommitted());
        m.put("heapMax", heap.getMax());
        m.put("nonHeapUsed", nonHeap.getUsed());
        m.put("freeMemory", rt.freeMemory());
        m.put("totalMemory", rt.totalMemory());
        m.put("maxMemory", rt.maxMemory());
        m.put("formatted", formatted);
        return m;
    }

    public Map<String, Object> runtime() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("javaVersion", System.getProperty("java.version"));
        m.put("vendor", System.getProperty("java.vendor"));
        m.put("platform", System.getProperty("os.name"));
        m.put("architecture", System.getProperty("os.arch"));
        m.put("availableProcessors", Runtime.getRuntime().availableProcessors());
        m.put("threads", ManagementFactory.getThreadMXBean().getThreadCount());
        m.put("systemLoadAverage", ManagementFactory.getOperatingSystemMXBean().getSystemLoadAverage());
        return m;
    }
}
