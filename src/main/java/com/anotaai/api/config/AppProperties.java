package com.anotaai.api.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * app.* — bound and validated at startup; a missing mandatory value aborts the boot.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "app")
public class AppProperties {

    @NotBlank
    private String name = "Anota AI API";

    @NotBlank
    private String version = "1.0.0";

    /** development / production / test (read per request through {@link ExecutionMode}) */
    @NotBlank
    private String executionMode = ExecutionMode.DEVELOPMENT;

    @Valid
    private Security security = new Security();

    @Valid
    private RateLimit rateLimit = new RateLimit();

    @Valid
    private Request request = new Request();

    @Valid
    private Cors cors = new Cors();

    @Valid
    private Database database = new Database();

    @Data
    public static class Security {

        /** token signing secret; mandatory even though no endpoint issues tokens yet */
        @NotBlank
        private String jwtSecret;

        /** BCrypt work factor */
        @Min(4)
        @Max(31)
        private int bcryptRounds = 10;
    }

    @Data
    public static class RateLimit {

        @NotNull
        private Duration window = Duration.ofMinutes(15);

        @Min(1)
        private int maxRequests = 100;

        @NotNull
        private Duration userCreationWindow = Duration.ofMinutes(15);

        @Min(1)
        private int userCreationMax = 5;

        /** idle windows are dropped after this long */
        @NotNull
        private Duration keyTtl = Duration.ofHours(1);
    }

    @Data
    public static class Request {

        /** wall-clock budget per request (504 when exceeded) */
        @NotNull
        private Duration timeout = Duration.ofSeconds(30);

        @Min(1)
        private long maxPayloadBytes = 10L * 1024 * 1024;
    }

    @Data
    public static class Cors {

        private List<String> allowedOrigins = new ArrayList<>(List.of(
                "https://anotaai.com",
                "https://www.anotaai.com",
                "https://app.anotaai.com"
        ));
    }

    @Data
    public static class Database {

        @Min(1)
        private int maxRetries = 5;

        @NotNull
        private Duration retryDelay = Duration.ofSeconds(5);

        @Min(1)
        private int maxPoolSize = 10;

        @NotNull
        private Duration connectionTimeout = Duration.ofSeconds(5);
    }
}
