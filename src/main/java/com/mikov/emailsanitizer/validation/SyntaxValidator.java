package com.mikov.emailsanitizer.validation;

import com.mikov.emailsanitizer.dtos.ValidationIssue;
import com.mikov.emailsanitizer.dtos.ValidationResult;
import com.mikov.emailsanitizer.model.ValidationOptions;
import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

/**
 * Validator for email syntax.
 * A local part of allowed characters, an {@code @}, then dot-separated DNS labels of 1-63
 * alphanumerics with inner hyphens only. Says nothing about deliverability.
 *
 * @author zahari.mikov
 */
@Component
public class SyntaxValidator implements EmailValidator {

    private static final Pattern EMAIL_PATTERN = Pattern.compile(
            "^[a-zA-Z0-9.!#$%&'*+/=?^_`{|}~-]+"
                    + "@[a-zA-Z0-9](?:[a-zA-Z0-9-]{0,61}[a-zA-Z0-9])?"
                    + "(?:\\.[a-zA-Z0-9](?:[a-zA-Z0-9-]{0,61}[a-zA-Z0-9])?)*$");

    @Override
    public ValidationResult validate(final String email) {
        if (email == null || !EMAIL_PATTERN.matcher(email).matches()) {
            return ValidationResult.invalid(getName(), email, ValidationIssue.INVALID_FORMAT);
        }
        return ValidationResult.valid(getName(), email);
    }

    @Override
    public String getName() {
        return "syntax";
    }

    @Override
    public boolean isEnabled(final ValidationOptions options) {
        return options.isCheckFormat();
    }
}
