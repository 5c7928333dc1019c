package com.mikov.emailsanitizer.validation;

import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collection;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Read-only set of known disposable / temporary mail domains. Exact, lowercase matches only.
 *
 * @author zahari.mikov
 */
@Slf4j
public final class DisposableDomainList {

    static final Set<String> BUILT_IN_DOMAINS = Set.of(
            "10minutemail.com", "guerrillamail.com", "temp-mail.org", "tempmail.com",
            "throwaway.email", "mailinator.com", "maildrop.cc", "yopmail.com",
            "getnada.com", "trashmail.com", "guerrillamailblock.com", "sharklasers.com",
            "guerrillamail.net", "guerrillamail.biz", "spam4.me", "grr.la",
            "guerrillamail.de", "trbvm.com", "tmails.net", "mohmal.com",
            "emailondeck.com", "fakeinbox.com", "mintemail.com", "dispostable.com",
            "throwam.com", "mt2015.com", "mt2014.com", "mailcatch.com",
            "mailnesia.com", "tempinbox.com", "getairmail.com", "mytemp.email",
            "anonbox.net", "mvrht.net", "mailtemporaire.fr", "correotemporal.org",
            "rootfest.net", "disposableemailaddresses.com", "33mail.com", "tempr.email",
            "fakemail.net", "gettempmail.com"
    );

    private final Set<String> domains;

    private DisposableDomainList(final Set<String> domains) {
        this.domains = domains;
    }

    public static DisposableDomainList of(final String... domains) {
        return of(Arrays.asList(domains));
    }

    public static DisposableDomainList of(final Collection<String> domains) {
        return new DisposableDomainList(domains.stream()
                .map(domain -> domain.trim().toLowerCase(Locale.ROOT))
                .filter(domain -> !domain.isEmpty())
                .collect(Collectors.toUnmodifiableSet()));
    }

    public static DisposableDomainList builtIn() {
        return of(BUILT_IN_DOMAINS);
    }

    /**
     * Loads one domain per line, skipping blank lines and {@code #} comments.
     * Falls back to the built-in list when the resource does not exist.
     */
    public static DisposableDomainList load(final Resource resource) {
        if (resource == null || !resource.exists()) {
            log.warn("Disposable domain list {} not found, using built-in list", resource);
            return builtIn();
        }

        try (final var reader = new BufferedReader(new InputStreamReader(resource.getInputStream(), StandardCharsets.UTF_8))) {
            final var domains = reader.lines()
                    .map(String::trim)
                    .filter(line -> !line.isEmpty() && !line.startsWith("#"))
                    .collect(Collectors.toList());
            final var list = of(domains);
            log.info("Loaded {} disposable domains from {}", list.size(), resource.getDescription());
            return list;
        } catch (final IOException e) {
            throw new UncheckedIOException("Could not read disposable domain list " + resource.getDescription(), e);
        }
    }

    public boolean contains(final String domain) {
        return domain != null && domains.contains(domain.toLowerCase(Locale.ROOT));
    }

    public int size() {
        return domains.size();
    }
}
