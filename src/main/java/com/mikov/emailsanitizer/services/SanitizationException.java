package com.mikov.emailsanitizer.services;

/**
 * A failure of the sanitization machinery itself, as opposed to a bad address.
 * Aborts the whole run.
 *
 * @author zahari.mikov
 */
public class SanitizationException extends RuntimeException {

    public SanitizationException(final String message) {
        super(message);
    }

    public SanitizationException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
