package com.anotaai.api.common.web;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Correlation id for every request: taken from {@code X-Request-Id} when the caller sends a sane one,
 * generated otherwise. It is echoed back, stored as a request attribute and put in the MDC as {@code rid}.
 * <p>
 * Runs on async re-dispatch too, reusing the attribute, so the second half of a Callable handler
 * logs under the same id.
 */
@Slf4j
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class RequestIdFilter extends OncePerRequestFilter {

    public static final String HEADER = "X-Request-Id";
    public static final String ATTR = "requestId";
    public static final String MDC_KEY = "rid";

    // ids end up in log lines and a response header: no spaces, no control characters
    private static final Pattern ACCEPTED = Pattern.compile("[A-Za-z0-9._:-]{1,128}");

    @Override
    protected void doFilterInternal(HttpServletRequest req, HttpServletResponse res, FilterChain chain)
            throws ServletException, IOException {

        Object existing = req.getAttribute(ATTR);
        String rid = (existing != null) ? existing.toString() : fromHeader(req);

        req.setAttribute(ATTR, rid);
        MDC.put(MDC_KEY, rid);
        if (!res.containsHeader(HEADER)) res.setHeader(HEADER, rid);

        try {
            chain.doFilter(req, res);
        } finally {
            MDC.remove(MDC_KEY);
        }
    }

    @Override
    protected boolean shouldNotFilterAsyncDispatch() {
        return false;
    }

    static String fromHeader(HttpServletRequest req) {
        String sent = req.getHeader(HEADER);
        if (sent == null || sent.isBlank()) {
            return UUID.randomUUID().toString();
        }
        String trimmed = sent.trim();
        if (ACCEPTED.matcher(trimmed).matches()) {
            return trimmed;
        }
        String rid = UUID.randomUUID().toString();
        log.warn("request_id_replaced rid={} ip={} length={}", rid, req.getRemoteAddr(), sent.length());
        return rid;
    }
}
