package com.mikov.emailsanitizer.validation;

import com.mikov.emailsanitizer.dtos.ValidationResult;
import com.mikov.emailsanitizer.model.ValidationOptions;

import java.util.Locale;

/**
 * Interface for all email validators in the sanitization pipeline.
 * Validators receive addresses that are already trimmed and lowercased.
 *
 * @author zahari.mikov
 */
public interface EmailValidator {

    /**
     * Validates an email and returns the validation result.
     *
     * @param email The normalized email to validate
     * @return The validation result
     */
    ValidationResult validate(final String email);

    /**
     * Returns the name of this validator, used for identification in results.
     *
     * @return The validator name
     */
    String getName();

    /**
     * Tells whether the options switch this validator on.
     *
     * @param options The options of the current run
     * @return true if the validator should run
     */
    boolean isEnabled(final ValidationOptions options);

    /**
     * Returns the part after the single {@code @}, or an empty string when there is not exactly one.
     */
    static String extractDomain(final String email) {
        if (email == null) {
            return "";
        }
        final var parts = email.split("@", -1);
        return parts.length == 2 ? parts[1].toLowerCase(Locale.ROOT) : "";
    }
}
