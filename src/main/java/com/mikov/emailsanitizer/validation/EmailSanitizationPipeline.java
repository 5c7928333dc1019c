package com.mikov.emailsanitizer.validation;

import com.mikov.emailsanitizer.dns.MxLookupOutcome;
import com.mikov.emailsanitizer.dtos.ValidationResult;
import com.mikov.emailsanitizer.model.ValidationOptions;
import com.mikov.emailsanitizer.services.SanitizationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs the validators over each address in a fixed order, stopping at the first rejection:
 * syntax, disposable domain, then MX records. Disabled validators are skipped.
 * <p>
 * For a batch, syntax and disposable checks run inline while MX lookups go to a bounded executor,
 * one lookup per distinct domain shared by every address of that domain.
 * Lookups still pending at the batch deadline count as unknown and are cancelled: queued ones never
 * reach DNS, while one already querying keeps its pool thread until its own attempt timeouts and
 * retries run out.
 *
 * @author zahari.mikov
 */
public class EmailSanitizationPipeline {
    private static final Logger logger = LoggerFactory.getLogger(EmailSanitizationPipeline.class);

    private final List<EmailValidator> validators;
    private final MXRecordValidator mxRecordValidator;
    private final Executor executor;

    public EmailSanitizationPipeline(final List<EmailValidator> validators,
                                     final MXRecordValidator mxRecordValidator,
                                     final Executor executor) {
        this.validators = new ArrayList<>(validators);
        this.mxRecordValidator = mxRecordValidator;
        this.executor = executor;
        for (final var validator : validators) {
            logger.debug("Loaded validator: {}", validator.getName());
        }
    }

    /**
     * Validates a single address on the calling thread.
     *
     * @param email The normalized email
     * @param options Which checks to run
     * @return The validation result
     */
    public ValidationResult validate(final String email, final ValidationOptions options) {
        final var rejection = runLocalValidators(email, options);
        if (rejection != null) {
            return rejection;
        }
        if (mxRecordValidator.isEnabled(options)) {
            return mxRecordValidator.validate(email);
        }
        return ValidationResult.valid(email);
    }

    /**
     * Validates a batch of addresses, resolving MX records once per domain and in parallel.
     *
     * @param emails Normalized addresses
     * @param options Which checks to run
     * @param timeout Batch deadline, measured from this call
     * @return One result per input address, in input order
     */
    public List<ValidationResult> validateBatch(final List<String> emails, final ValidationOptions options,
                                                final Duration timeout) {
        if (emails == null || emails.isEmpty()) {
            return new ArrayList<>();
        }

        final var deadline = System.nanoTime() + timeout.toNanos();
        final var domainLookups = new HashMap<String, CompletableFuture<MxLookupOutcome>>();
        final var localResults = new ArrayList<ValidationResult>(emails.size());

        for (final var email : emails) {
            final var rejection = runLocalValidators(email, options);
            if (rejection != null) {
                localResults.add(rejection);
            } else if (!mxRecordValidator.isEnabled(options)) {
                localResults.add(ValidationResult.valid(email));
            } else {
                // resolved below from the shared domain lookup
                localResults.add(null);
                domainLookups.computeIfAbsent(EmailValidator.extractDomain(email), d -> submitLookup(d, deadline));
            }
        }

        if (!domainLookups.isEmpty()) {
            logger.debug("Resolving MX records of {} distinct domain(s) for {} address(es)",
                    domainLookups.size(), emails.size());
            awaitLookups(domainLookups, deadline);
        }

        final var results = new ArrayList<ValidationResult>(emails.size());
        var unresolved = 0;
        for (var i = 0; i < emails.size(); i++) {
            final var email = emails.get(i);
            final var localResult = localResults.get(i);
            if (localResult != null) {
                results.add(localResult);
                continue;
            }

            final var lookup = domainLookups.get(EmailValidator.extractDomain(email));
            if (!lookup.isDone() || lookup.isCancelled()) {
                unresolved++;
                results.add(mxRecordValidator.toResult(email, MxLookupOutcome.UNKNOWN));
                continue;
            }
            try {
                results.add(mxRecordValidator.toResult(email, lookup.join()));
            } catch (final CompletionException e) {
                throw new SanitizationException("MX validation failed for " + email, e.getCause());
            }
        }

        if (unresolved > 0) {
            logger.warn("Batch deadline of {} ms reached, {} address(es) left with unknown MX status",
                    timeout.toMillis(), unresolved);
        }
        return results;
    }

    private ValidationResult runLocalValidators(final String email, final ValidationOptions options) {
        for (final var validator : validators) {
            if (!validator.isEnabled(options)) {
                continue;
            }
            final var result = validator.validate(email);
            if (!result.isValid()) {
                return result;
            }
        }
        return null;
    }

    private CompletableFuture<MxLookupOutcome> submitLookup(final String domain, final long deadline) {
        try {
            return CompletableFuture.supplyAsync(() -> {
                if (System.nanoTime() - deadline >= 0) {
                    return MxLookupOutcome.UNKNOWN;
                }
                return mxRecordValidator.lookup(domain);
            }, executor);
        } catch (final RejectedExecutionException e) {
            logger.error("MX lookup pool rejected domain {}: {}", domain, e.getMessage());
            throw new SanitizationException("MX lookup pool is not accepting work", e);
        }
    }

    private void awaitLookups(final Map<String, CompletableFuture<MxLookupOutcome>> lookups, final long deadline) {
        final var all = CompletableFuture.allOf(lookups.values().toArray(new CompletableFuture[0]));
        try {
            all.get(Math.max(deadline - System.nanoTime(), 0L), TimeUnit.NANOSECONDS);
        } catch (final TimeoutException e) {
            final var pending = cancelPending(lookups);
            logger.warn("{} of {} MX lookup(s) still pending at batch deadline", pending, lookups.size());
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            cancelPending(lookups);
            logger.warn("Interrupted while waiting for MX lookups, treating pending domains as unknown");
        } catch (final ExecutionException e) {
            logger.error("MX lookup failed unexpectedly: {}", e.getCause().getMessage());
            throw new SanitizationException("MX lookup failed unexpectedly", e.getCause());
        }
    }

    private static long cancelPending(final Map<String, CompletableFuture<MxLookupOutcome>> lookups) {
        return lookups.values().stream()
                .filter(lookup -> !lookup.isDone())
                .filter(lookup -> lookup.cancel(false))
                .count();
    }
}
