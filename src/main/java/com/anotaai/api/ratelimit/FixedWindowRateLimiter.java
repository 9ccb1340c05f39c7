package com.anotaai.api.ratelimit;

import com.anotaai.api.common.web.RateLimitedException;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fixed-window limiter: one window per key (client ip), aligned to multiples of the window size.
 * Idle keys expire from the Caffeine cache after {@code keyTtl}.
 * Single-node only; a shared store would be needed behind a load balancer.
 */
public class FixedWindowRateLimiter {

    private static final class Window {
        volatile long windowStartEpochSec;
        final AtomicInteger count = new AtomicInteger(0);

        Window(long start) {
            this.windowStartEpochSec = start;
        }
    }

    /** outcome of one admitted request, used for the X-RateLimit-* headers */
    public record Permit(int limit, int remaining) {}

    private final long windowSec;
    private final int limit;
    private final String rejectMessage;
    private final Cache<String, Window> windows;

    public FixedWindowRateLimiter(Duration window, int limit, Duration keyTtl, String rejectMessage) {
        this.windowSec = Math.max(1L, window.getSeconds());
        this.limit = Math.max(1, limit);
        this.rejectMessage = rejectMessage;
        Duration ttl = keyTtl.compareTo(window) < 0 ? window : keyTtl;
        this.windows = Caffeine.newBuilder()
                .expireAfterAccess(ttl)
                .maximumSize(100_000)
                .build();
    }

    public Permit acquireOrThrow(String key, Instant now) {
        long nowSec = now.getEpochSecond();
        long start = (nowSec / windowSec) * windowSec;

        Window w = windows.get(key, k -> new Window(start));

        // entering a new window: reset
        if (w.windowStartEpochSec != start) {
            synchronized (w) {
                if (w.windowStartEpochSec != start) {
                    w.windowStartEpochSec = start;
                    w.count.set(0);
                }
            }
        }

        int n = w.count.incrementAndGet();
        if (n > limit) {
            int retryAfter = (int) Math.max(0, (start + windowSec) - nowSec);
            throw new RateLimitedException(rejectMessage, retryAfter);
        }
        return new Permit(limit, limit - n);
    }
}
