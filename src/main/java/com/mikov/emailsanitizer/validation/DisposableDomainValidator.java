package com.mikov.emailsanitizer.validation;

import com.mikov.emailsanitizer.dtos.ValidationIssue;
import com.mikov.emailsanitizer.dtos.ValidationResult;
import com.mikov.emailsanitizer.model.ValidationOptions;
import org.springframework.stereotype.Component;

/**
 * Validator that checks if an email uses a disposable or temporary domain.
 * Addresses without exactly one {@code @} have no domain and never match.
 *
 * @author zahari.mikov
 */
@Component
public class DisposableDomainValidator implements EmailValidator {

    private final DisposableDomainList disposableDomains;

    public DisposableDomainValidator(final DisposableDomainList disposableDomains) {
        this.disposableDomains = disposableDomains;
    }

    @Override
    public ValidationResult validate(final String email) {
        final var domain = EmailValidator.extractDomain(email);
        if (!domain.isEmpty() && disposableDomains.contains(domain)) {
            return ValidationResult.invalid(getName(), email, ValidationIssue.DISPOSABLE_DOMAIN);
        }
        return ValidationResult.valid(getName(), email);
    }

    @Override
    public String getName() {
        return "disposable-domain";
    }

    @Override
    public boolean isEnabled(final ValidationOptions options) {
        return options.isCheckDisposable();
    }
}
