package com.anotaai.api.common.web;

import com.anotaai.api.config.AppProperties;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ReadListener;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletInputStream;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletRequestWrapper;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;
import org.springframework.web.servlet.HandlerExceptionResolver;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.net.URLDecoder;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.Enumeration;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Coarse request screening in front of everything else:
 * blocks known scanner user agents, rejects oversized bodies, strips host-rewrite headers
 * and logs requests that look like injection attempts.
 * <p>
 * A declared Content-Length over the cap is refused here. Bodies without one (chunked) are
 * counted while the handler reads them and fail with the same {@link ValidationException}.
 */
@Slf4j
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 2)
public class RequestScreeningFilter extends OncePerRequestFilter {

    private static final List<Pattern> BLOCKED_AGENTS = List.of(
            Pattern.compile("sqlmap", Pattern.CASE_INSENSITIVE),
            Pattern.compile("nikto", Pattern.CASE_INSENSITIVE),
            Pattern.compile("nessus", Pattern.CASE_INSENSITIVE),
            Pattern.compile("masscan", Pattern.CASE_INSENSITIVE),
            Pattern.compile("nmap", Pattern.CASE_INSENSITIVE)
    );

    private static final List<Pattern> SUSPICIOUS = List.of(
            Pattern.compile("\\.\\."),
            Pattern.compile("<script", Pattern.CASE_INSENSITIVE),
            Pattern.compile("union.*select", Pattern.CASE_INSENSITIVE),
            Pattern.compile("javascript:", Pattern.CASE_INSENSITIVE),
            Pattern.compile("'.*or.*'", Pattern.CASE_INSENSITIVE)
    );

    static final Set<String> STRIPPED_HEADERS = Set.of("x-forwarded-host", "x-original-url", "x-rewrite-url");

    private final AppProperties props;
    private final HandlerExceptionResolver resolver;

    public RequestScreeningFilter(AppProperties props,
                                  @Qualifier("handlerExceptionResolver") HandlerExceptionResolver resolver) {
        this.props = props;
        this.resolver = resolver;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest req, HttpServletResponse res, FilterChain chain)
            throws ServletException, IOException {

        String ua = req.getHeader(HttpHeaders.USER_AGENT);
        if (ua != null && BLOCKED_AGENTS.stream().anyMatch(p -> p.matcher(ua).find())) {
            log.warn("blocked_agent ip={} ua={}", req.getRemoteAddr(), ua);
            resolver.resolveException(req, res, null, new ForbiddenException("Access denied"));
            return;
        }

        long max = props.getRequest().getMaxPayloadBytes();
        if (req.getContentLengthLong() > max) {
            log.warn("payload_too_large ip={} uri={} length={} max={}",
                    req.getRemoteAddr(), req.getRequestURI(), req.getContentLengthLong(), max);
            resolver.resolveException(req, res, null, payloadTooLarge(max));
            return;
        }

        String target = decode(req.getRequestURI() + (req.getQueryString() == null ? "" : "?" + req.getQueryString()));
        if (looksSuspicious(target) || (ua != null && looksSuspicious(ua))) {
            log.warn("suspicious_request ip={} method={} target={} ua={}", req.getRemoteAddr(), req.getMethod(), target, ua);
        }

        chain.doFilter(new ScreenedRequest(req, max), res);
    }

    static ValidationException payloadTooLarge(long max) {
        return new ValidationException("Request payload too large", "Maximum is " + max + " bytes");
    }

    static boolean looksSuspicious(String s) {
        return SUSPICIOUS.stream().anyMatch(p -> p.matcher(s).find());
    }

    private static String decode(String s) {
        try {
            return URLDecoder.decode(s, StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            return s;
        }
    }

    /** Hides the host-rewrite headers and caps the body at {@code maxBytes}. */
    static final class ScreenedRequest extends HttpServletRequestWrapper {

        private final long maxBytes;
        private ServletInputStream body;

        ScreenedRequest(HttpServletRequest request, long maxBytes) {
            super(request);
            this.maxBytes = maxBytes;
        }

        @Override
        public ServletInputStream getInputStream() throws IOException {
            if (body == null) {
                body = new CappedInputStream(super.getInputStream(), maxBytes, getRequestURI());
            }
            return body;
        }

        @Override
        public BufferedReader getReader() throws IOException {
            String enc = getCharacterEncoding();
            Charset cs = (enc == null) ? StandardCharsets.UTF_8 : Charset.forName(enc);
            return new BufferedReader(new InputStreamReader(getInputStream(), cs));
        }

        @Override
        public String getHeader(String name) {
            return stripped(name) ? null : super.getHeader(name);
        }

        @Override
        public Enumeration<String> getHeaders(String name) {
            return stripped(name) ? Collections.emptyEnumeration() : super.getHeaders(name);
        }

        @Override
        public Enumeration<String> getHeaderNames() {
            List<String> names = Collections.list(super.getHeaderNames());
            names.removeIf(ScreenedRequest::stripped);
            return Collections.enumeration(names);
        }

        private static boolean stripped(String name) {
            return name != null && STRIPPED_HEADERS.contains(name.toLowerCase());
        }
    }

    static final class CappedInputStream extends ServletInputStream {

        private final ServletInputStream in;
        private final long maxBytes;
        private final String uri;
        private long consumed;

        CappedInputStream(ServletInputStream in, long maxBytes, String uri) {
            this.in = in;
            this.maxBytes = maxBytes;
            this.uri = uri;
        }

        @Override
        public int read() throws IOException {
            int b = in.read();
            if (b != -1) count(1);
            return b;
        }

        @Override
        public int read(byte[] buf, int off, int len) throws IOException {
            int n = in.read(buf, off, len);
            if (n > 0) count(n);
            return n;
        }

        private void count(int n) {
            consumed += n;
            if (consumed > maxBytes) {
                log.warn("payload_too_large uri={} read={} max={}", uri, consumed, maxBytes);
                throw payloadTooLarge(maxBytes);
            }
        }

        @Override
        public boolean isFinished() {
            return in.isFinished();
        }

        @Override
        public boolean isReady() {
            return in.isReady();
        }

        @Override
        public void setReadListener(ReadListener listener) {
            in.setReadListener(listener);
        }
    }
}
