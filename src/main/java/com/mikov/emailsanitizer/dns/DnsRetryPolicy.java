package com.mikov.emailsanitizer.dns;

import org.springframework.retry.RetryContext;
import org.springframework.retry.policy.SimpleRetryPolicy;

/**
 * Retries MX queries a bounded number of times, but never after an authoritative negative answer.
 *
 * @author zahari.mikov
 */
public class DnsRetryPolicy extends SimpleRetryPolicy {

    public DnsRetryPolicy(final int retries) {
        super(retries + 1);
        if (retries < 0) {
            throw new IllegalArgumentException("Retries must not be negative: " + retries);
        }
    }

    @Override
    public boolean canRetry(final RetryContext context) {
        final var lastError = context.getLastThrowable();
        if (lastError instanceof MxLookupException && !((MxLookupException) lastError).isTemporary()) {
            return false;
        }
        return super.canRetry(context);
    }
}
