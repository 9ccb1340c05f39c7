package com.anotaai.api.ratelimit;

import com.anotaai.api.common.web.RateLimitedException;
import com.anotaai.api.config.AppProperties;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;
import org.springframework.web.servlet.HandlerExceptionResolver;

import java.io.IOException;
import java.time.Clock;

/**
 * Per-ip budgets: a global one on every route except /health*,
 * plus a stricter one on user creation (POST /api/users).
 */
@Slf4j
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 3)
public class RateLimitFilter extends OncePerRequestFilter {

    public static final String HEADER_LIMIT = "X-RateLimit-Limit";
    public static final String HEADER_REMAINING = "X-RateLimit-Remaining";

    static final String GLOBAL_MESSAGE = "Too many requests, please try again in a few minutes";
    static final String USER_CREATION_MESSAGE = "Too many user creation attempts, please try again in 15 minutes";

    private final FixedWindowRateLimiter global;
    private final FixedWindowRateLimiter userCreation;
    private final Clock clock;
    private final HandlerExceptionResolver resolver;

    public RateLimitFilter(AppProperties props,
                           Clock clock,
                           @Qualifier("handlerExceptionResolver") HandlerExceptionResolver resolver) {
        AppProperties.RateLimit rl = props.getRateLimit();
        this.global = new FixedWindowRateLimiter(
                rl.getWindow(), rl.getMaxRequests(), rl.getKeyTtl(), GLOBAL_MESSAGE);
        this.userCreation = new FixedWindowRateLimiter(
                rl.getUserCreationWindow(), rl.getUserCreationMax(), rl.getKeyTtl(), USER_CREATION_MESSAGE);
        this.clock = clock;
        this.resolver = resolver;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        String path = request.getRequestURI();
        return path.equals("/health") || path.startsWith("/health/");
    }

    @Override
    protected void doFilterInternal(HttpServletRequest req, HttpServletResponse res, FilterChain chain)
            throws ServletException, IOException {

        String ip = req.getRemoteAddr();
        try {
            FixedWindowRateLimiter.Permit permit = global.acquireOrThrow(ip, clock.instant());
            res.setHeader(HEADER_LIMIT, String.valueOf(permit.limit()));
            res.setHeader(HEADER_REMAINING, String.valueOf(permit.remaining()));

            if (isUserCreation(req)) {
                userCreation.acquireOrThrow(ip, clock.instant());
            }
        } catch (RateLimitedException ex) {
            log.warn("rate_limited ip={} method={} uri={} retryAfterSec={}",
                    ip, req.getMethod(), req.getRequestURI(), ex.retryAfterSec());
            res.setHeader(HEADER_REMAINING, "0");
            resolver.resolveException(req, res, null, ex);
            return;
        }

        chain.doFilter(req, res);
    }

    private static boolean isUserCreation(HttpServletRequest req) {
        if (!"POST".equalsIgnoreCase(req.getMethod())) return false;
        String path = req.getRequestURI();
        return path.equals("/api/users") || path.equals("/api/users/");
    }
}
