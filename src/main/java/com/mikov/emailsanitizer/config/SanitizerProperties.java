package com.mikov.emailsanitizer.config;

import jakarta.annotation.PostConstruct;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Tunables of the sanitization pipeline, bound from {@code sanitizer.*}.
 *
 * @author zahari.mikov
 */
@Data
@Component
@ConfigurationProperties(prefix = "sanitizer")
public class SanitizerProperties {

    /**
     * Upper bound on MX lookups in flight at once, across all batches.
     */
    private int maxConcurrentLookups = 20;

    /**
     * Deadline of a batch when the caller gives none.
     */
    private Duration batchTimeout = Duration.ofSeconds(120);

    private final Mx mx = new Mx();
    private final Dns dns = new Dns();
    private final DisposableDomains disposableDomains = new DisposableDomains();

    @PostConstruct
    public void validate() {
        if (maxConcurrentLookups < 1) {
            throw new IllegalArgumentException("sanitizer.max-concurrent-lookups must be positive, got " + maxConcurrentLookups);
        }
        if (batchTimeout == null || batchTimeout.isNegative() || batchTimeout.isZero()) {
            throw new IllegalArgumentException("sanitizer.batch-timeout must be positive, got " + batchTimeout);
        }
        if (mx.retries < 0) {
            throw new IllegalArgumentException("sanitizer.mx.retries must not be negative, got " + mx.retries);
        }
        if (mx.backoff == null || mx.backoff.isNegative()) {
            throw new IllegalArgumentException("sanitizer.mx.backoff must not be negative, got " + mx.backoff);
        }
        if (mx.attemptTimeout == null || mx.attemptTimeout.isNegative() || mx.attemptTimeout.isZero()) {
            throw new IllegalArgumentException("sanitizer.mx.attempt-timeout must be positive, got " + mx.attemptTimeout);
        }
    }

    @Data
    public static class Mx {
        /**
         * Retries after the first attempt, for temporary DNS failures only.
         */
        private int retries = 2;

        /**
         * Linear back-off unit: the n-th retry waits {@code backoff * n}.
         */
        private Duration backoff = Duration.ofMillis(300);

        private Duration attemptTimeout = Duration.ofSeconds(3);
    }

    @Data
    public static class Dns {
        /**
         * Nameservers to query; the system configuration is used when empty.
         */
        private List<String> servers = new ArrayList<>();
    }

    @Data
    public static class DisposableDomains {
        private String location = "classpath:disposable_domains.txt";
    }
}
