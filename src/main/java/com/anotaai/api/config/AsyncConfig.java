package com.anotaai.api.config;

import org.slf4j.MDC;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.servlet.config.annotation.AsyncSupportConfigurer;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import java.util.Map;

/**
 * Store-bound handlers return {@code Callable}; they run on {@code requestExecutor}
 * under the per-request wall-clock budget (app.request.timeout).
 */
@Configuration
public class AsyncConfig implements WebMvcConfigurer {

    private final AppProperties props;

    public AsyncConfig(AppProperties props) {
        this.props = props;
    }

    @Bean("requestExecutor")
    public ThreadPoolTaskExecutor requestExecutor() {
        ThreadPoolTaskExecutor ex = new ThreadPoolTaskExecutor();
        ex.setCorePoolSize(8);
        ex.setMaxPoolSize(32);
        ex.setQueueCapacity(500);
        ex.setThreadNamePrefix("req-");
        ex.setTaskDecorator(mdcPropagating());
        ex.initialize();
        return ex;
    }

    @Override
    public void configureAsyncSupport(AsyncSupportConfigurer configurer) {
        configurer.setTaskExecutor(requestExecutor());
        configurer.setDefaultTimeout(props.getRequest().getTimeout().toMillis());
    }

    // carries rid into worker threads
    static TaskDecorator mdcPropagating() {
        return runnable -> {
            Map<String, String> ctx = MDC.getCopyOfContextMap();
            return () -> {
                Map<String, String> previous = MDC.getCopyOfContextMap();
                if (ctx == null) MDC.clear(); else MDC.setContextMap(ctx);
                try {
                    runnable.run();
                } finally {
                    if (previous == null) MDC.clear(); else MDC.setContextMap(previous);
                }
            };
        };
    }
}
