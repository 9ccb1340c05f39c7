package com.anotaai.api.common.web;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/**
 * One access-log line per request. For async handlers the line is written on the
 * re-dispatch, once the final status is known.
 */
@Slf4j
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 1)
public class RequestLoggingFilter extends OncePerRequestFilter {

    private static final String START_ATTR = RequestLoggingFilter.class.getName() + ".start";

    @Override
    protected void doFilterInternal(HttpServletRequest req, HttpServletResponse res, FilterChain chain)
            throws ServletException, IOException {

        Object started = req.getAttribute(START_ATTR);
        long start;
        if (started instanceof Long l) {
            start = l;
        } else {
            start = System.nanoTime();
            req.setAttribute(START_ATTR, start);
        }

        try {
            chain.doFilter(req, res);
        } finally {
            if (!isAsyncStarted(req)) {
                long latencyMs = (System.nanoTime() - start) / 1_000_000;
                log.info("http_request method={} uri={} status={} latencyMs={} ip={}",
                        req.getMethod(), req.getRequestURI(), res.getStatus(), latencyMs, req.getRemoteAddr());
            }
        }
    }

    @Override
    protected boolean shouldNotFilterAsyncDispatch() {
        return false;
    }
}
