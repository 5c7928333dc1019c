package com.mikov.emailsanitizer.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Which sanitization steps to run. Every step is enabled by default.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ValidationOptions {

    @Builder.Default
    private boolean checkFormat = true;

    @Builder.Default
    private boolean checkDisposable = true;

    @Builder.Default
    private boolean checkMx = true;

    @Builder.Default
    private boolean removeDuplicates = true;

    public static ValidationOptions defaults() {
        return ValidationOptions.builder().build();
    }

    public static ValidationOptions noChecks() {
        return ValidationOptions.builder()
                .checkFormat(false)
                .checkDisposable(false)
                .checkMx(false)
                .build();
    }
}
