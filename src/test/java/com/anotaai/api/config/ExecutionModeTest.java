package com.anotaai.api.config;

import org.junit.jupiter.api.Test;
import org.springframework.mock.env.MockEnvironment;

import static org.assertj.core.api.Assertions.assertThat;

class ExecutionModeTest {

    @Test
    void defaults_to_development() {
        ExecutionMode mode = new ExecutionMode(new MockEnvironment());

        assertThat(mode.current()).isEqualTo(ExecutionMode.DEVELOPMENT);
        assertThat(mode.isDevelopment()).isTrue();
        assertThat(mode.isProduction()).isFalse();
    }

    @Test
    void is_read_on_every_call() {
        MockEnvironment env = new MockEnvironment().withProperty(ExecutionMode.PROPERTY, "test");
        ExecutionMode mode = new ExecutionMode(env);
        assertThat(mode.isProduction()).isFalse();

        env.setProperty(ExecutionMode.PROPERTY, " Production ");

        assertThat(mode.isProduction()).isTrue();
        assertThat(mode.current()).isEqualTo(ExecutionMode.PRODUCTION);
    }
}
