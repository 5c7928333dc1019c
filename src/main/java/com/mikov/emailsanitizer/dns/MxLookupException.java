package com.mikov.emailsanitizer.dns;

import lombok.Getter;

/**
 * Raised by an {@link MxLookup} when a domain's MX query did not produce an answer.
 *
 * @author zahari.mikov
 */
@Getter
public class MxLookupException extends Exception {

    private final String domain;
    private final DnsErrorCode errorCode;

    public MxLookupException(final String domain, final DnsErrorCode errorCode, final String message) {
        super("MX lookup for " + domain + " failed with " + errorCode + ": " + message);
        this.domain = domain;
        this.errorCode = errorCode;
    }

    public MxLookupException(final String domain, final DnsErrorCode errorCode, final Throwable cause) {
        super("MX lookup for " + domain + " failed with " + errorCode + ": " + cause.getMessage(), cause);
        this.domain = domain;
        this.errorCode = errorCode;
    }

    public boolean isTemporary() {
        return errorCode.isTemporary();
    }
}
