package com.mikov.emailsanitizer.util;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Collapses normalized addresses into an order-preserving unique list, first occurrence wins.
 *
 * @author zahari.mikov
 */
@Component
public class EmailDeduplicator {

    public DeduplicationResult deduplicate(final List<String> normalizedEmails, final boolean removeDuplicates) {
        final var total = normalizedEmails.size();
        if (!removeDuplicates) {
            return new DeduplicationResult(new ArrayList<>(normalizedEmails), 0, total);
        }

        final var unique = new ArrayList<>(new LinkedHashSet<>(normalizedEmails));
        return new DeduplicationResult(unique, total - unique.size(), total);
    }

    /**
     * @param emails Addresses left to validate
     * @param duplicateCount Entries removed as duplicates
     * @param totalCount Normalized entries seen before deduplication
     */
    public record DeduplicationResult(List<String> emails, int duplicateCount, int totalCount) { }
}
