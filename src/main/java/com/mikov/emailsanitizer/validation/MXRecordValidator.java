package com.mikov.emailsanitizer.validation;

import com.mikov.emailsanitizer.dns.MxLookupOutcome;
import com.mikov.emailsanitizer.dns.MxResolver;
import com.mikov.emailsanitizer.dtos.ValidationIssue;
import com.mikov.emailsanitizer.dtos.ValidationResult;
import com.mikov.emailsanitizer.model.ValidationOptions;
import org.springframework.stereotype.Component;

/**
 * Validator that checks if a domain has MX records for email delivery.
 * An unknown MX status keeps the address valid with a caveat instead of rejecting it.
 *
 * @author zahari.mikov
 */
@Component
public class MXRecordValidator implements EmailValidator {

    private final MxResolver mxResolver;

    public MXRecordValidator(final MxResolver mxResolver) {
        this.mxResolver = mxResolver;
    }

    @Override
    public ValidationResult validate(final String email) {
        return toResult(email, lookup(EmailValidator.extractDomain(email)));
    }

    public MxLookupOutcome lookup(final String domain) {
        return mxResolver.resolve(domain);
    }

    public ValidationResult toResult(final String email, final MxLookupOutcome outcome) {
        switch (outcome) {
            case PRESENT:
                return ValidationResult.valid(getName(), email);
            case ABSENT:
                return ValidationResult.invalid(getName(), email, ValidationIssue.NO_MX_RECORDS);
            default:
                return ValidationResult.validWithCaveat(getName(), email, ValidationIssue.DNS_UNCERTAIN);
        }
    }

    @Override
    public String getName() {
        return "mx-record";
    }

    @Override
    public boolean isEnabled(final ValidationOptions options) {
        return options.isCheckMx();
    }
}
