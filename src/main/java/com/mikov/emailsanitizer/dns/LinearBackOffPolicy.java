package com.mikov.emailsanitizer.dns;

import org.springframework.retry.RetryContext;
import org.springframework.retry.backoff.BackOffContext;
import org.springframework.retry.backoff.BackOffInterruptedException;
import org.springframework.retry.backoff.BackOffPolicy;
import org.springframework.retry.backoff.Sleeper;
import org.springframework.retry.backoff.ThreadWaitSleeper;

import java.time.Duration;

/**
 * Back-off that waits {@code interval * n} before the n-th retry.
 * MX checks run while a user waits on the result, so the delay grows linearly, not exponentially.
 *
 * @author zahari.mikov
 */
public class LinearBackOffPolicy implements BackOffPolicy {

    private final long intervalMillis;
    private final Sleeper sleeper;

    public LinearBackOffPolicy(final Duration interval) {
        this(interval, new ThreadWaitSleeper());
    }

    public LinearBackOffPolicy(final Duration interval, final Sleeper sleeper) {
        if (interval.isNegative()) {
            throw new IllegalArgumentException("Back-off interval must not be negative: " + interval);
        }
        this.intervalMillis = interval.toMillis();
        this.sleeper = sleeper;
    }

    @Override
    public BackOffContext start(final RetryContext context) {
        return new LinearBackOffContext(context);
    }

    @Override
    public void backOff(final BackOffContext backOffContext) throws BackOffInterruptedException {
        final var retryContext = ((LinearBackOffContext) backOffContext).retryContext;
        try {
            sleeper.sleep(delayFor(retryContext.getRetryCount()));
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BackOffInterruptedException("Thread interrupted while backing off", e);
        }
    }

    /**
     * @param attempt Number of failed attempts so far, starting at 1
     * @return Delay in milliseconds before the next attempt
     */
    public long delayFor(final int attempt) {
        return intervalMillis * Math.max(attempt, 1);
    }

    private static final class LinearBackOffContext implements BackOffContext {
        private final transient RetryContext retryContext;

        private LinearBackOffContext(final RetryContext retryContext) {
            this.retryContext = retryContext;
        }
    }
}
