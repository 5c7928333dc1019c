package com.mikov.emailsanitizer.dns;

/**
 * Tri-state answer to "can this domain receive mail".
 */
public enum MxLookupOutcome {
    PRESENT,
    ABSENT,
    UNKNOWN
}
