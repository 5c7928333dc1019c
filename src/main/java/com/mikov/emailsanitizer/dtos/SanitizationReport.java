package com.mikov.emailsanitizer.dtos;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Partitioned result of sanitizing an address list. Every validated address appears in exactly
 * one of {@code validEmails} and {@code invalidEmails}, in input order.
 *
 * @author zahari.mikov
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SanitizationReport {

    private List<String> validEmails = new ArrayList<>();
    private List<ValidationResult> invalidEmails = new ArrayList<>();
    private SanitizationStats stats = SanitizationStats.empty();

    public static SanitizationReport empty() {
        return new SanitizationReport();
    }

    public static SanitizationReport from(final List<ValidationResult> results, final int total, final int duplicates) {
        final var validEmails = new ArrayList<String>();
        final var invalidEmails = new ArrayList<ValidationResult>();

        for (final var result : results) {
            if (result.isValid()) {
                validEmails.add(result.getEmail());
            } else {
                invalidEmails.add(result);
            }
        }

        final var stats = new SanitizationStats(total, validEmails.size(), invalidEmails.size(), duplicates);
        return new SanitizationReport(validEmails, invalidEmails, stats);
    }
}
