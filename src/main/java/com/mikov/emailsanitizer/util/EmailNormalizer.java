package com.mikov.emailsanitizer.util;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Lexical clean-up of raw address input: splits on newlines, commas and semicolons,
 * trims, lowercases and drops empty entries. Order of first appearance is kept.
 *
 * @author zahari.mikov
 */
@Component
public class EmailNormalizer {

    private static final Pattern DELIMITERS = Pattern.compile("[\\n,;]");

    public List<String> split(final String text) {
        if (text == null || text.isEmpty()) {
            return new ArrayList<>();
        }
        return normalize(List.of(text));
    }

    public List<String> normalize(final Collection<String> rawAddresses) {
        final var normalized = new ArrayList<String>();
        if (rawAddresses == null) {
            return normalized;
        }

        for (final var raw : rawAddresses) {
            if (raw == null) {
                continue;
            }
            for (final var candidate : DELIMITERS.split(raw)) {
                final var email = normalize(candidate);
                if (!email.isEmpty()) {
                    normalized.add(email);
                }
            }
        }
        return normalized;
    }

    public String normalize(final String candidate) {
        return candidate == null ? "" : candidate.trim().toLowerCase(Locale.ROOT);
    }
}
