package com.mikov.emailsanitizer.dns;

import lombok.extern.slf4j.Slf4j;
import org.springframework.retry.RecoveryCallback;
import org.springframework.retry.RetryCallback;
import org.springframework.retry.RetryContext;
import org.springframework.retry.backoff.BackOffInterruptedException;
import org.springframework.retry.backoff.BackOffPolicy;
import org.springframework.retry.support.RetryTemplate;

/**
 * Decides whether a domain can receive mail.
 * <p>
 * Temporary DNS failures are retried under {@link DnsRetryPolicy} with the given back-off.
 * "No such domain" and "no MX data" end the lookup at once as {@link MxLookupOutcome#ABSENT}.
 * When every attempt failed temporarily the answer is {@link MxLookupOutcome#UNKNOWN}:
 * a flaky DNS path does not prove the domain cannot receive mail.
 * Expected DNS outcomes never throw.
 *
 * @author zahari.mikov
 */
@Slf4j
public class MxResolver {

    private final MxLookup mxLookup;
    private final RetryTemplate retryTemplate;

    public MxResolver(final MxLookup mxLookup, final int retries, final BackOffPolicy backOffPolicy) {
        this.mxLookup = mxLookup;
        this.retryTemplate = new RetryTemplate();
        this.retryTemplate.setRetryPolicy(new DnsRetryPolicy(retries));
        this.retryTemplate.setBackOffPolicy(backOffPolicy);
    }

    public MxLookupOutcome resolve(final String domain) {
        if (domain == null || domain.isBlank()) {
            return MxLookupOutcome.ABSENT;
        }

        final RetryCallback<MxLookupOutcome, MxLookupException> attempt = context -> attempt(domain, context);
        final RecoveryCallback<MxLookupOutcome> recovery = context -> recover(domain, context);
        try {
            return retryTemplate.execute(attempt, recovery);
        } catch (final BackOffInterruptedException e) {
            log.warn("MX lookup for {} interrupted while waiting to retry", domain);
            return MxLookupOutcome.UNKNOWN;
        } catch (final MxLookupException e) {
            log.error("MX lookup for {} escaped recovery: {}", domain, e.getMessage());
            return MxLookupOutcome.UNKNOWN;
        }
    }

    private MxLookupOutcome attempt(final String domain, final RetryContext context) throws MxLookupException {
        if (context.getRetryCount() > 0) {
            log.debug("Retrying MX lookup for {} (attempt {})", domain, context.getRetryCount() + 1);
        }
        final var records = mxLookup.lookup(domain);
        log.debug("Domain {} has {} MX record(s)", domain, records.size());
        return records.isEmpty() ? MxLookupOutcome.ABSENT : MxLookupOutcome.PRESENT;
    }

    private MxLookupOutcome recover(final String domain, final RetryContext context) {
        final var lastError = context.getLastThrowable();
        if (lastError instanceof MxLookupException && !((MxLookupException) lastError).isTemporary()) {
            log.debug("No mail exchanger for {}: {}", domain, ((MxLookupException) lastError).getErrorCode());
            return MxLookupOutcome.ABSENT;
        }
        log.warn("MX status of {} unknown after {} attempt(s): {}", domain, context.getRetryCount(),
                lastError != null ? lastError.getMessage() : "no answer");
        return MxLookupOutcome.UNKNOWN;
    }
}
