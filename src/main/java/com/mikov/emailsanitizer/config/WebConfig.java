package com.mikov.emailsanitizer.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.servlet.config.annotation.AsyncSupportConfigurer;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Web configuration for asynchronous sanitization requests
 */
@Configuration
public class WebConfig implements WebMvcConfigurer {

    private final SanitizerProperties properties;

    public WebConfig(final SanitizerProperties properties) {
        this.properties = properties;
    }

    @Override
    public void configureAsyncSupport(final AsyncSupportConfigurer configurer) {
        configurer.setDefaultTimeout(responseTimeoutMillis(properties));
        configurer.setTaskExecutor(asyncTaskExecutor());
    }

    /**
     * Runs sanitization requests off the servlet threads. Each request then fans its MX lookups
     * out to the shared lookup pool.
     */
    @Bean
    public AsyncTaskExecutor asyncTaskExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(4);
        executor.setMaxPoolSize(16);
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix("Sanitizer-");
        executor.initialize();
        return executor;
    }

    /**
     * The batch deadline plus slack for normalizing and rendering the report.
     */
    public static long responseTimeoutMillis(final SanitizerProperties properties) {
        return properties.getBatchTimeout().plusSeconds(30).toMillis();
    }
}
