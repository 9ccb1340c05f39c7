package com.anotaai.api.config;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configurers.AbstractHttpConfigurer;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.web.cors.CorsConfiguration;
import org.springframework.web.cors.CorsConfigurationSource;

import java.time.Duration;
import java.util.List;

/**
 * No authentication on this API: the chain only contributes CORS and the
 * security response headers (HSTS, CSP, nosniff, frame deny).
 */
@Configuration
public class SecurityConfig {

    private static final List<String> METHODS = List.of("GET", "POST", "PUT", "DELETE", "OPTIONS");
    private static final List<String> ALLOWED_HEADERS = List.of(
            "Origin", "X-Requested-With", "Content-Type", "Accept", "Authorization", "Cache-Control", "Pragma"
    );
    private static final List<String> EXPOSED_HEADERS = List.of(
            "X-RateLimit-Limit", "X-RateLimit-Remaining", "X-Request-Id"
    );

    private static final String CSP = String.join("; ",
            "default-src 'self'",
            "style-src 'self' 'unsafe-inline'",
            "script-src 'self'",
            "img-src 'self' data: https:",
            "connect-src 'self'",
            "font-src 'self'",
            "object-src 'none'",
            "media-src 'self'",
            "frame-src 'none'"
    );

    @Bean
    public PasswordEncoder passwordEncoder(AppProperties props) {
        return new BCryptPasswordEncoder(props.getSecurity().getBcryptRounds());
    }

    @Bean
    public SecurityFilterChain securityFilterChain(
            HttpSecurity http,
            @Qualifier("corsConfigurationSource") CorsConfigurationSource corsConfigurationSource) throws Exception {
        http
                .csrf(AbstractHttpConfigurer::disable)
                .httpBasic(AbstractHttpConfigurer::disable)
                .formLogin(AbstractHttpConfigurer::disable)
                .logout(AbstractHttpConfigurer::disable)
                .sessionManagement(sm -> sm.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
                .cors(c -> c.configurationSource(corsConfigurationSource))
                .headers(h -> h
                        .contentSecurityPolicy(csp -> csp.policyDirectives(CSP))
                        .httpStrictTransportSecurity(hsts -> hsts
                                .maxAgeInSeconds(Duration.ofDays(365).toSeconds())
                                .includeSubDomains(true)
                                .preload(true))
                        .frameOptions(f -> f.deny())
                )
                .authorizeHttpRequests(reg -> reg.anyRequest().permitAll());

        return http.build();
    }

    /** Any origin in development; the configured allow-list otherwise. Decided per request. */
    @Bean
    public CorsConfigurationSource corsConfigurationSource(ExecutionMode mode, AppProperties props) {
        return request -> {
            CorsConfiguration c = new CorsConfiguration();
            if (mode.isDevelopment()) {
                c.addAllowedOriginPattern("*");
            } else {
                c.setAllowedOrigins(props.getCors().getAllowedOrigins());
            }
            c.setAllowCredentials(true);
            c.setAllowedMethods(METHODS);
            c.setAllowedHeaders(ALLOWED_HEADERS);
            c.setExposedHeaders(EXPOSED_HEADERS);
            c.setMaxAge(Duration.ofHours(24));
            return c;
        };
    }
}
