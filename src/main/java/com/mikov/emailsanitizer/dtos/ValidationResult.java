package com.mikov.emailsanitizer.dtos;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Data;

/**
 * Outcome of validating one normalized address.
 * {@code reason} is set whenever the address is invalid, and also for a valid address
 * whose MX status could not be established.
 *
 * @author zahari.mikov
 */
@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ValidationResult {

    private final String email;

    @JsonProperty("isValid")
    private final boolean valid;

    private final String reason;

    @JsonIgnore
    private final ValidationIssue issue;

    @JsonIgnore
    private final String validatorName;

    public static ValidationResult valid(final String email) {
        return ValidationResult.builder()
                .email(email)
                .valid(true)
                .build();
    }

    public static ValidationResult valid(final String validatorName, final String email) {
        return ValidationResult.builder()
                .email(email)
                .valid(true)
                .validatorName(validatorName)
                .build();
    }

    public static ValidationResult invalid(final String validatorName, final String email, final ValidationIssue issue) {
        return ValidationResult.builder()
                .email(email)
                .valid(false)
                .reason(issue.getMessage())
                .issue(issue)
                .validatorName(validatorName)
                .build();
    }

    /**
     * A valid result that still carries an informational reason, e.g. an MX check that could not complete.
     */
    public static ValidationResult validWithCaveat(final String validatorName, final String email, final ValidationIssue issue) {
        return ValidationResult.builder()
                .email(email)
                .valid(true)
                .reason(issue.getMessage())
                .issue(issue)
                .validatorName(validatorName)
                .build();
    }
}
