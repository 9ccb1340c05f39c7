package com.anotaai.api.ratelimit;

import com.anotaai.api.common.web.RateLimitedException;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class FixedWindowRateLimiterTest {

    private static FixedWindowRateLimiter limiter(int limit) {
        return new FixedWindowRateLimiter(Duration.ofMinutes(15), limit, Duration.ofHours(1), "slow down");
    }

    @Test
    void rejects_the_request_after_the_budget() {
        FixedWindowRateLimiter limiter = limiter(3);
        Instant now = Instant.parse("2026-01-14T00:00:10Z");

        assertEquals(2, limiter.acquireOrThrow("1.2.3.4", now).remaining());
        assertEquals(1, limiter.acquireOrThrow("1.2.3.4", now).remaining());
        assertEquals(0, limiter.acquireOrThrow("1.2.3.4", now).remaining());

        RateLimitedException ex = assertThrows(RateLimitedException.class,
                () -> limiter.acquireOrThrow("1.2.3.4", now));
        assertEquals("slow down", ex.getMessage());
        // window is 00:00:00..00:15:00
        assertEquals(890, ex.retryAfterSec());
    }

    @Test
    void keys_are_independent() {
        FixedWindowRateLimiter limiter = limiter(1);
        Instant now = Instant.parse("2026-01-14T00:00:10Z");

        limiter.acquireOrThrow("1.1.1.1", now);
        assertDoesNotThrow(() -> limiter.acquireOrThrow("2.2.2.2", now));
        assertThrows(RateLimitedException.class, () -> limiter.acquireOrThrow("1.1.1.1", now));
    }

    @Test
    void next_window_starts_fresh() {
        FixedWindowRateLimiter limiter = limiter(1);
        Instant now = Instant.parse("2026-01-14T00:14:59Z");

        limiter.acquireOrThrow("1.1.1.1", now);
        assertThrows(RateLimitedException.class, () -> limiter.acquireOrThrow("1.1.1.1", now));

        FixedWindowRateLimiter.Permit p = limiter.acquireOrThrow("1.1.1.1", now.plusSeconds(1));
        assertEquals(0, p.remaining());
        assertEquals(1, p.limit());
    }
}
