package com.anotaai.api.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class ClockConfig {

    /** server-local zone: "today" and "this month" in statistics follow it */
    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
