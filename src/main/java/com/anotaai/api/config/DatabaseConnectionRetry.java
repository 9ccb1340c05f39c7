package com.anotaai.api.config;

import lombok.extern.slf4j.Slf4j;

import javax.sql.DataSource;
import java.sql.Connection;
import java.time.Duration;

/**
 * Startup connectivity probe: fixed number of attempts with a fixed pause in between.
 * Giving up throws, which fails the context and ends the process.
 */
@Slf4j
public class DatabaseConnectionRetry {

    private final int maxRetries;
    private final Duration delay;

    public DatabaseConnectionRetry(int maxRetries, Duration delay) {
        this.maxRetries = Math.max(1, maxRetries);
        this.delay = (delay == null || delay.isNegative()) ? Duration.ZERO : delay;
    }

    public void awaitConnection(DataSource dataSource) {
        Exception last = null;
        for (int attempt = 1; attempt <= maxRetries; attempt++) {
            try (Connection ignored = dataSource.getConnection()) {
                log.info("db_connected attempt={}/{}", attempt, maxRetries);
                return;
            } catch (Exception e) {
                last = e;
                log.warn("db_connect_failed attempt={}/{} retryInMs={} cause={}",
                        attempt, maxRetries, delay.toMillis(), e.getMessage());
            }
            if (attempt < maxRetries) pause();
        }
        log.error("db_connect_gave_up attempts={}", maxRetries);
        throw new IllegalStateException("DATABASE_UNAVAILABLE after " + maxRetries + " attempts", last);
    }

    private void pause() {
        if (delay.isZero()) return;
        try {
            Thread.sleep(delay.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("DATABASE_CONNECT_INTERRUPTED", e);
        }
    }
}
