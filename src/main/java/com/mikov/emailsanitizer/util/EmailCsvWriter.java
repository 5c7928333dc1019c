package com.mikov.emailsanitizer.util;

import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Renders addresses as a one-column CSV: an {@code email} header, then one address per line.
 */
@Component
public class EmailCsvWriter {

    private static final String HEADER = "email";

    public String write(final List<String> emails) {
        final var csv = new StringBuilder(HEADER).append('\n');
        if (emails != null) {
            csv.append(String.join("\n", emails));
        }
        return csv.toString();
    }
}
