package com.mikov.emailsanitizer.dns;

import java.util.List;

/**
 * A single MX query against DNS, without any retrying.
 *
 * @author zahari.mikov
 */
@FunctionalInterface
public interface MxLookup {

    /**
     * Queries the MX records of a domain.
     *
     * @param domain The domain to query, lowercased
     * @return The mail exchangers ordered by priority, empty if the domain publishes none
     * @throws MxLookupException if the query failed, classified as temporary or permanent
     */
    List<MxRecord> lookup(final String domain) throws MxLookupException;

    record MxRecord(String hostname, int priority) { }
}
