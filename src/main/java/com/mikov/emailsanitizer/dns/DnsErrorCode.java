package com.mikov.emailsanitizer.dns;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.xbill.DNS.Lookup;

import java.util.Locale;

/**
 * Classified outcome of a failed MX query.
 * Temporary codes are retried, the others are authoritative negative answers.
 *
 * @author zahari.mikov
 */
@Getter
@RequiredArgsConstructor
public enum DnsErrorCode {
    // Authoritative answers
    NOT_FOUND(false),
    NO_DATA(false),
    INVALID_NAME(false),

    // Retryable
    TIMEOUT(true),
    SERVER_FAILURE(true),
    UNEXPECTED(true);

    private final boolean temporary;

    public static DnsErrorCode fromLookupResult(final int lookupResult, final String errorString) {
        switch (lookupResult) {
            case Lookup.HOST_NOT_FOUND:
                return NOT_FOUND;
            case Lookup.TYPE_NOT_FOUND:
                return NO_DATA;
            case Lookup.TRY_AGAIN:
                if (errorString != null && errorString.toLowerCase(Locale.ROOT).contains("timed out")) {
                    return TIMEOUT;
                }
                return SERVER_FAILURE;
            case Lookup.UNRECOVERABLE:
                return SERVER_FAILURE;
            default:
                return UNEXPECTED;
        }
    }
}
