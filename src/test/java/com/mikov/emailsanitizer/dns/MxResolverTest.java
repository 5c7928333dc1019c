package com.mikov.emailsanitizer.dns;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.retry.backoff.Sleeper;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("MxResolver retry and classification")
class MxResolverTest {

    private final List<Long> sleeps = new CopyOnWriteArrayList<>();
    private final Sleeper recordingSleeper = sleeps::add;

    private FakeMxLookup dns;
    private MxResolver resolver;

    @BeforeEach
    void setUp() {
        dns = new FakeMxLookup();
        resolver = new MxResolver(dns, 2, new LinearBackOffPolicy(Duration.ofMillis(300), recordingSleeper));
    }

    @AfterEach
    void clearInterruptFlag() {
        Thread.interrupted();
    }

    @Test
    @DisplayName("Domain with MX records is present after a single query")
    void shouldReportPresentWhenRecordsExist() {
        dns.withRecords("example.com", "mx1.example.com", "mx2.example.com");

        assertThat(resolver.resolve("example.com")).isEqualTo(MxLookupOutcome.PRESENT);
        assertThat(dns.callsFor("example.com")).isEqualTo(1);
        assertThat(sleeps).isEmpty();
    }

    @Test
    @DisplayName("Successful answer without records is absent")
    void shouldReportAbsentWhenAnswerIsEmpty() {
        dns.withNoRecords("norecords.com");

        assertThat(resolver.resolve("norecords.com")).isEqualTo(MxLookupOutcome.ABSENT);
        assertThat(dns.callsFor("norecords.com")).isEqualTo(1);
    }

    @Test
    @DisplayName("No such domain is final on the first attempt")
    void shouldNotRetryNotFound() {
        dns.failing("missing.invalid", DnsErrorCode.NOT_FOUND);

        assertThat(resolver.resolve("missing.invalid")).isEqualTo(MxLookupOutcome.ABSENT);
        assertThat(dns.callsFor("missing.invalid")).isEqualTo(1);
        assertThat(sleeps).isEmpty();
    }

    @Test
    @DisplayName("No data for the MX type is final on the first attempt")
    void shouldNotRetryNoData() {
        dns.failing("webonly.com", DnsErrorCode.NO_DATA);

        assertThat(resolver.resolve("webonly.com")).isEqualTo(MxLookupOutcome.ABSENT);
        assertThat(dns.callsFor("webonly.com")).isEqualTo(1);
        assertThat(sleeps).isEmpty();
    }

    @Test
    @DisplayName("Timeouts on every attempt give unknown after three attempts with linear back-off")
    void shouldGiveUpAsUnknownAfterRetries() {
        dns.failing("slow.com", DnsErrorCode.TIMEOUT);

        assertThat(resolver.resolve("slow.com")).isEqualTo(MxLookupOutcome.UNKNOWN);
        assertThat(dns.callsFor("slow.com")).isEqualTo(3);
        assertThat(sleeps).containsExactly(300L, 600L);
    }

    @Test
    @DisplayName("A transient failure followed by an answer is present")
    void shouldRecoverFromTransientFailure() {
        dns.flaky("flaky.com", 1);

        assertThat(resolver.resolve("flaky.com")).isEqualTo(MxLookupOutcome.PRESENT);
        assertThat(dns.callsFor("flaky.com")).isEqualTo(2);
        assertThat(sleeps).containsExactly(300L);
    }

    @Test
    @DisplayName("A permanent answer after a transient failure stops retrying")
    void shouldStopOnPermanentFailureAfterRetry() {
        dns.answering("gone.com", (domain, attempt) -> {
            if (attempt == 1) {
                throw new MxLookupException(domain, DnsErrorCode.SERVER_FAILURE, "SERVFAIL");
            }
            throw new MxLookupException(domain, DnsErrorCode.NOT_FOUND, "NXDOMAIN");
        });

        assertThat(resolver.resolve("gone.com")).isEqualTo(MxLookupOutcome.ABSENT);
        assertThat(dns.callsFor("gone.com")).isEqualTo(2);
        assertThat(sleeps).containsExactly(300L);
    }

    @Test
    @DisplayName("Unexpected runtime errors are retried and end as unknown")
    void shouldTreatUnexpectedErrorsAsUnknown() {
        dns.answering("broken.com", (domain, attempt) -> {
            throw new IllegalStateException("resolver exploded");
        });

        assertThat(resolver.resolve("broken.com")).isEqualTo(MxLookupOutcome.UNKNOWN);
        assertThat(dns.callsFor("broken.com")).isEqualTo(3);
    }

    @Test
    @DisplayName("Zero retries means a single attempt")
    void shouldHonourZeroRetries() {
        dns.failing("slow.com", DnsErrorCode.TIMEOUT);
        final var noRetry = new MxResolver(dns, 0, new LinearBackOffPolicy(Duration.ofMillis(300), recordingSleeper));

        assertThat(noRetry.resolve("slow.com")).isEqualTo(MxLookupOutcome.UNKNOWN);
        assertThat(dns.callsFor("slow.com")).isEqualTo(1);
        assertThat(sleeps).isEmpty();
    }

    @Test
    @DisplayName("Blank domain is absent without querying DNS")
    void shouldNotQueryBlankDomain() {
        assertThat(resolver.resolve("")).isEqualTo(MxLookupOutcome.ABSENT);
        assertThat(resolver.resolve(null)).isEqualTo(MxLookupOutcome.ABSENT);
        assertThat(dns.totalCalls()).isZero();
    }

    @Test
    @DisplayName("Interrupted back-off ends as unknown")
    void shouldReportUnknownWhenBackOffIsInterrupted() {
        dns.failing("slow.com", DnsErrorCode.TIMEOUT);
        final Sleeper interrupted = backOffPeriod -> {
            throw new InterruptedException("shutting down");
        };
        final var interruptible = new MxResolver(dns, 2, new LinearBackOffPolicy(Duration.ofMillis(300), interrupted));

        assertThat(interruptible.resolve("slow.com")).isEqualTo(MxLookupOutcome.UNKNOWN);
        assertThat(dns.callsFor("slow.com")).isEqualTo(1);
        assertThat(Thread.currentThread().isInterrupted()).isTrue();
    }
}
