package com.anotaai.api.config;

import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

/**
 * Process-wide execution mode. Resolved from the {@link Environment} on every call,
 * never cached, so a changed property source is honoured by the next request.
 */
@Component
public class ExecutionMode {

    public static final String PROPERTY = "app.execution-mode";

    public static final String DEVELOPMENT = "development";
    public static final String PRODUCTION = "production";
    public static final String TEST = "test";

    private final Environment env;

    public ExecutionMode(Environment env) {
        this.env = env;
    }

    public String current() {
        String raw = env.getProperty(PROPERTY, DEVELOPMENT);
        return raw.trim().toLowerCase();
    }

    public boolean isProduction() {
        return PRODUCTION.equals(current());
    }

    public boolean isDevelopment() {
        return DEVELOPMENT.equals(current());
    }
}
