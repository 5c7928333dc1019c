package com.mikov.emailsanitizer.config;

import com.mikov.emailsanitizer.validation.DisposableDomainList;
import com.mikov.emailsanitizer.validation.DisposableDomainValidator;
import com.mikov.emailsanitizer.validation.EmailSanitizationPipeline;
import com.mikov.emailsanitizer.validation.MXRecordValidator;
import com.mikov.emailsanitizer.validation.SyntaxValidator;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.List;
import java.util.concurrent.Executor;

@Configuration
public class SanitizerConfiguration {

    @Bean
    public DisposableDomainList disposableDomainList(final SanitizerProperties properties,
                                                     final ResourceLoader resourceLoader) {
        return DisposableDomainList.load(resourceLoader.getResource(properties.getDisposableDomains().getLocation()));
    }

    /**
     * Fixed-size pool for MX lookups. Its size is the concurrency bound on DNS traffic.
     */
    @Bean
    public ThreadPoolTaskExecutor mxLookupExecutor(final SanitizerProperties properties) {
        final ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getMaxConcurrentLookups());
        executor.setMaxPoolSize(properties.getMaxConcurrentLookups());
        executor.setThreadNamePrefix("MxLookup-");
        executor.initialize();
        return executor;
    }

    @Bean
    public EmailSanitizationPipeline emailSanitizationPipeline(final SyntaxValidator syntaxValidator,
                                                               final DisposableDomainValidator disposableDomainValidator,
                                                               final MXRecordValidator mxRecordValidator,
                                                               @Qualifier("mxLookupExecutor") final Executor mxLookupExecutor) {
        return new EmailSanitizationPipeline(List.of(syntaxValidator, disposableDomainValidator),
                mxRecordValidator, mxLookupExecutor);
    }
}
