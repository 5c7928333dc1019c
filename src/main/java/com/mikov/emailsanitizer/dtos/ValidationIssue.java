package com.mikov.emailsanitizer.dtos;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Why an address was rejected, or the caveat attached to an address that was kept.
 *
 * @author zahari.mikov
 */
@Getter
@RequiredArgsConstructor
public enum ValidationIssue {
    INVALID_FORMAT("Invalid email format", true),
    DISPOSABLE_DOMAIN("Disposable/temporary email domain", true),
    NO_MX_RECORDS("Domain has no valid MX records", true),

    // Informational only, the address stays valid
    DNS_UNCERTAIN("MX records could not be verified (network issue)", false);

    private final String message;
    private final boolean rejecting;
}
