package com.mikov.emailsanitizer.services;

import com.mikov.emailsanitizer.config.SanitizerProperties;
import com.mikov.emailsanitizer.dtos.SanitizationReport;
import com.mikov.emailsanitizer.dtos.ValidationResult;
import com.mikov.emailsanitizer.model.ValidationOptions;
import com.mikov.emailsanitizer.util.EmailCsvWriter;
import com.mikov.emailsanitizer.util.EmailDeduplicator;
import com.mikov.emailsanitizer.util.EmailNormalizer;
import com.mikov.emailsanitizer.validation.EmailSanitizationPipeline;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Collection;
import java.util.List;

/**
 * Service for sanitizing email lists.
 * Normalizes and deduplicates the input, validates what is left and partitions it into
 * valid and invalid addresses. Bad addresses never fail the run.
 *
 * @author zahari.mikov
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EmailSanitizationService {

    private final EmailNormalizer emailNormalizer;
    private final EmailDeduplicator emailDeduplicator;
    private final EmailSanitizationPipeline pipeline;
    private final EmailCsvWriter csvWriter;
    private final SanitizerProperties properties;

    public SanitizationReport sanitizeText(final String text, final ValidationOptions options) {
        return sanitize(emailNormalizer.split(text), options);
    }

    public SanitizationReport sanitize(final Collection<String> rawAddresses, final ValidationOptions options) {
        return sanitize(rawAddresses, options, properties.getBatchTimeout());
    }

    /**
     * Sanitizes a list of raw addresses. Entries may hold several addresses separated by
     * newlines, commas or semicolons.
     *
     * @param rawAddresses Raw address entries
     * @param options Which steps to run, defaults when null
     * @param timeout Deadline for the whole batch; MX lookups still running then count as unknown
     * @return The partitioned report
     */
    public SanitizationReport sanitize(final Collection<String> rawAddresses, final ValidationOptions options,
                                       final Duration timeout) {
        final var effectiveOptions = options != null ? options : ValidationOptions.defaults();
        final var normalized = emailNormalizer.normalize(rawAddresses);
        if (normalized.isEmpty()) {
            log.info("Nothing to sanitize, input had no addresses");
            return SanitizationReport.empty();
        }

        final var deduplicated = emailDeduplicator.deduplicate(normalized, effectiveOptions.isRemoveDuplicates());
        log.info("Sanitizing {} address(es), {} after deduplication, options {}",
                deduplicated.totalCount(), deduplicated.emails().size(), effectiveOptions);

        final var startTime = System.currentTimeMillis();
        final var results = pipeline.validateBatch(deduplicated.emails(), effectiveOptions, timeout);
        final var report = SanitizationReport.from(results, deduplicated.totalCount(), deduplicated.duplicateCount());

        log.info("Sanitized {} address(es) in {} ms: {} valid, {} invalid, {} duplicate(s)",
                report.getStats().getTotal(), System.currentTimeMillis() - startTime,
                report.getStats().getValid(), report.getStats().getInvalid(), report.getStats().getDuplicates());
        return report;
    }

    /**
     * Validates a single address without deduplication or batching.
     */
    public ValidationResult validateEmail(final String email, final ValidationOptions options) {
        final var effectiveOptions = options != null ? options : ValidationOptions.defaults();
        return pipeline.validate(emailNormalizer.normalize(email), effectiveOptions);
    }

    public String exportCsv(final List<String> validEmails) {
        return csvWriter.write(validEmails);
    }
}
