package com.mikov.emailsanitizer.services;

import com.mikov.emailsanitizer.SanitizerFixtures;
import com.mikov.emailsanitizer.dns.DnsErrorCode;
import com.mikov.emailsanitizer.dns.FakeMxLookup;
import com.mikov.emailsanitizer.dtos.SanitizationReport;
import com.mikov.emailsanitizer.dtos.ValidationIssue;
import com.mikov.emailsanitizer.dtos.ValidationResult;
import com.mikov.emailsanitizer.model.ValidationOptions;
import com.mikov.emailsanitizer.validation.DisposableDomainList;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

@DisplayName("EmailSanitizationService")
class EmailSanitizationServiceTest {

    private FakeMxLookup dns;
    private ExecutorService executor;
    private EmailSanitizationService service;

    @BeforeEach
    void setUp() {
        dns = new FakeMxLookup();
        executor = Executors.newFixedThreadPool(4);
        service = SanitizerFixtures.service(dns, DisposableDomainList.of("mailinator.com"), executor);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    @DisplayName("Should partition a pasted list with duplicates, bad format and disposable domains")
    void shouldSanitizeMixedList() {
        // Given
        final var input = "a@b.com, A@B.com ,bad-email, user@mailinator.com";

        // When
        final var report = service.sanitizeText(input, ValidationOptions.defaults());

        // Then
        assertThat(report.getValidEmails()).containsExactly("a@b.com");
        assertThat(report.getInvalidEmails())
                .extracting(ValidationResult::getEmail, ValidationResult::getIssue)
                .containsExactlyInAnyOrder(
                        tuple("bad-email", ValidationIssue.INVALID_FORMAT),
                        tuple("user@mailinator.com", ValidationIssue.DISPOSABLE_DOMAIN));
        assertThat(report.getStats().getTotal()).isEqualTo(4);
        assertThat(report.getStats().getDuplicates()).isEqualTo(1);
        assertThat(report.getStats().getValid()).isEqualTo(1);
        assertThat(report.getStats().getInvalid()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should keep an address valid with a reason when DNS keeps timing out")
    void shouldKeepAddressWhenDnsTimesOut() {
        dns.failing("slow.example", DnsErrorCode.TIMEOUT);

        final var report = service.sanitizeText("user@slow.example", ValidationOptions.defaults());

        assertThat(report.getValidEmails()).containsExactly("user@slow.example");
        assertThat(report.getInvalidEmails()).isEmpty();
        assertThat(dns.callsFor("slow.example")).isEqualTo(3);
    }

    @Test
    @DisplayName("Should reject at once a domain that does not exist")
    void shouldRejectNonexistentDomainWithoutRetry() {
        dns.failing("nxdomain.example", DnsErrorCode.NOT_FOUND);

        final var report = service.sanitizeText("user@nxdomain.example", ValidationOptions.defaults());

        assertThat(report.getValidEmails()).isEmpty();
        assertThat(report.getInvalidEmails()).singleElement()
                .satisfies(result -> {
                    assertThat(result.getIssue()).isEqualTo(ValidationIssue.NO_MX_RECORDS);
                    assertThat(result.getReason()).isEqualTo("Domain has no valid MX records");
                });
        assertThat(dns.callsFor("nxdomain.example")).isEqualTo(1);
    }

    @Test
    @DisplayName("Should return zero stats for empty input")
    void shouldHandleEmptyInput() {
        for (final var input : new String[] {"", "   ", " ,;\n ", null}) {
            final var report = service.sanitizeText(input, ValidationOptions.defaults());

            assertThat(report.getValidEmails()).isEmpty();
            assertThat(report.getInvalidEmails()).isEmpty();
            assertThat(report.getStats().getTotal()).isZero();
            assertThat(report.getStats().getValid()).isZero();
            assertThat(report.getStats().getInvalid()).isZero();
            assertThat(report.getStats().getDuplicates()).isZero();
        }
        assertThat(dns.totalCalls()).isZero();
    }

    @Test
    @DisplayName("Should not count blank entries as duplicates")
    void shouldIgnoreBlankEntriesInDuplicateCount() {
        final var report = service.sanitizeText(" , ,\n a@b.com ; ;", ValidationOptions.defaults());

        assertThat(report.getStats().getTotal()).isEqualTo(1);
        assertThat(report.getStats().getDuplicates()).isZero();
    }

    @Test
    @DisplayName("Should validate every entry when deduplication is off")
    void shouldKeepDuplicatesWhenDisabled() {
        final var options = ValidationOptions.builder().removeDuplicates(false).build();

        final var report = service.sanitizeText("a@b.com\nA@B.com", options);

        assertThat(report.getValidEmails()).containsExactly("a@b.com", "a@b.com");
        assertThat(report.getStats().getTotal()).isEqualTo(2);
        assertThat(report.getStats().getDuplicates()).isZero();
        assertThat(report.getStats().getValid()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should accept every address when all checks are off")
    void shouldAcceptEverythingWithChecksOff() {
        final var report = service.sanitizeText("bad-email, user@mailinator.com, x@y.com", ValidationOptions.noChecks());

        assertThat(report.getValidEmails()).containsExactly("bad-email", "user@mailinator.com", "x@y.com");
        assertThat(report.getStats().getInvalid()).isZero();
    }

    @Test
    @DisplayName("Should produce no invalid addresses when sanitizing its own output again")
    void shouldBeIdempotent() {
        dns.failing("nxdomain.example", DnsErrorCode.NOT_FOUND).failing("slow.example", DnsErrorCode.SERVER_FAILURE);
        final var input = List.of("Good@Example.com", "bad@", "user@nxdomain.example", "user@slow.example",
                "temp@mailinator.com", "good@example.com", "other@example.org");

        final var first = service.sanitize(input, ValidationOptions.defaults());
        final var second = service.sanitize(first.getValidEmails(), ValidationOptions.defaults());

        assertThat(second.getStats().getInvalid()).isZero();
        assertThat(second.getValidEmails()).containsExactlyElementsOf(first.getValidEmails());
    }

    @Test
    @DisplayName("Should keep the report counters consistent")
    void shouldKeepStatsConsistent() {
        dns.failing("nxdomain.example", DnsErrorCode.NO_DATA);
        final var input = List.of("a@example.com", "A@example.com", "b@nxdomain.example", "nope", "c@mailinator.com",
                "d@example.com; d@example.com", "e@unknown.example");

        final SanitizationReport report = service.sanitize(input, ValidationOptions.defaults());
        final var stats = report.getStats();

        assertThat(stats.getTotal()).isEqualTo(8);
        assertThat(stats.getValid()).isEqualTo(report.getValidEmails().size());
        assertThat(stats.getInvalid()).isEqualTo(report.getInvalidEmails().size());
        assertThat(stats.getValid() + stats.getInvalid()).isEqualTo(stats.getTotal() - stats.getDuplicates());
        assertThat(new HashSet<>(report.getValidEmails())).hasSameSizeAs(report.getValidEmails());
        assertThat(report.getValidEmails())
                .doesNotContainAnyElementsOf(report.getInvalidEmails().stream().map(ValidationResult::getEmail).toList());
    }

    @Test
    @DisplayName("Should fall back to default options when none are given")
    void shouldUseDefaultsForNullOptions() {
        final var report = service.sanitizeText("a@b.com, a@b.com, bad", null);

        assertThat(report.getStats().getDuplicates()).isEqualTo(1);
        assertThat(report.getInvalidEmails()).extracting(ValidationResult::getEmail).containsExactly("bad");
    }

    @Test
    @DisplayName("Should validate a single address after normalizing it")
    void shouldValidateSingleEmail() {
        final var result = service.validateEmail("  User@Mailinator.COM ", ValidationOptions.defaults());

        assertThat(result.getEmail()).isEqualTo("user@mailinator.com");
        assertThat(result.getIssue()).isEqualTo(ValidationIssue.DISPOSABLE_DOMAIN);
    }

    @Test
    @DisplayName("Should export valid addresses as a one-column CSV")
    void shouldExportCsv() {
        final var report = service.sanitizeText("a@b.com\nc@d.com", ValidationOptions.defaults());

        assertThat(service.exportCsv(report.getValidEmails())).isEqualTo("email\na@b.com\nc@d.com");
    }
}
