package com.anotaai.api.ratelimit;

import com.anotaai.api.common.web.RateLimitedException;
import com.anotaai.api.config.AppProperties;
import jakarta.servlet.FilterChain;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mockito;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.web.servlet.HandlerExceptionResolver;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.isNull;

class RateLimitFilterTest {

    private HandlerExceptionResolver resolver;
    private RateLimitFilter filter;

    @BeforeEach
    void setUp() {
        AppProperties props = new AppProperties();
        props.getRateLimit().setMaxRequests(3);
        props.getRateLimit().setUserCreationMax(1);

        resolver = Mockito.mock(HandlerExceptionResolver.class);
        Clock clock = Clock.fixed(Instant.parse("2026-01-14T00:00:10Z"), ZoneOffset.UTC);
        filter = new RateLimitFilter(props, clock, resolver);
    }

    private MockHttpServletResponse run(String method, String uri, FilterChain chain) throws Exception {
        MockHttpServletRequest req = new MockHttpServletRequest(method, uri);
        req.setRemoteAddr("10.0.0.1");
        MockHttpServletResponse res = new MockHttpServletResponse();
        filter.doFilter(req, res, chain);
        return res;
    }

    @Test
    void sets_headers_and_rejects_over_budget() throws Exception {
        FilterChain chain = Mockito.mock(FilterChain.class);

        MockHttpServletResponse first = run("GET", "/api/access/count", chain);
        assertThat(first.getHeader(RateLimitFilter.HEADER_LIMIT)).isEqualTo("3");
        assertThat(first.getHeader(RateLimitFilter.HEADER_REMAINING)).isEqualTo("2");

        run("GET", "/api/access/count", chain);
        run("GET", "/api/access/count", chain);
        MockHttpServletResponse rejected = run("GET", "/api/access/count", chain);

        Mockito.verify(chain, Mockito.times(3)).doFilter(any(), any());
        ArgumentCaptor<Exception> ex = ArgumentCaptor.forClass(Exception.class);
        Mockito.verify(resolver).resolveException(any(), any(), isNull(), ex.capture());
        assertThat(ex.getValue()).isInstanceOf(RateLimitedException.class)
                .hasMessage("Too many requests, please try again in a few minutes");
        assertThat(rejected.getHeader(RateLimitFilter.HEADER_REMAINING)).isEqualTo("0");
    }

    @Test
    void health_routes_are_not_limited() throws Exception {
        FilterChain chain = Mockito.mock(FilterChain.class);

        for (int i = 0; i < 10; i++) {
            MockHttpServletResponse res = run("GET", i % 2 == 0 ? "/health" : "/health/detailed", chain);
            assertThat(res.getHeader(RateLimitFilter.HEADER_LIMIT)).isNull();
        }

        Mockito.verify(chain, Mockito.times(10)).doFilter(any(), any());
        Mockito.verifyNoInteractions(resolver);
    }

    @Test
    void user_creation_has_its_own_stricter_budget() throws Exception {
        FilterChain chain = Mockito.mock(FilterChain.class);

        run("POST", "/api/users", chain);
        run("POST", "/api/users", chain);

        Mockito.verify(chain, Mockito.times(1)).doFilter(any(), any());
        ArgumentCaptor<Exception> ex = ArgumentCaptor.forClass(Exception.class);
        Mockito.verify(resolver).resolveException(any(), any(), isNull(), ex.capture());
        assertThat(ex.getValue())
                .hasMessage("Too many user creation attempts, please try again in 15 minutes");

        // listing is still within the global budget
        run("GET", "/api/users", chain);
        Mockito.verify(chain, Mockito.times(2)).doFilter(any(), any());
    }
}
