package com.mikov.emailsanitizer.dtos;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Counters of a sanitization run.
 * {@code total} counts non-empty normalized addresses before deduplication;
 * {@code valid + invalid} is the number of addresses actually validated.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SanitizationStats {
    private int total;
    private int valid;
    private int invalid;
    private int duplicates;

    public static SanitizationStats empty() {
        return new SanitizationStats(0, 0, 0, 0);
    }
}
