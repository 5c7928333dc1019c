package com.mikov.emailsanitizer.config;

import com.mikov.emailsanitizer.dns.DnsJavaMxLookup;
import com.mikov.emailsanitizer.dns.LinearBackOffPolicy;
import com.mikov.emailsanitizer.dns.MxLookup;
import com.mikov.emailsanitizer.dns.MxResolver;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.xbill.DNS.ExtendedResolver;
import org.xbill.DNS.Resolver;

import java.net.UnknownHostException;

@Slf4j
@Configuration
public class DnsConfig {

    @Bean
    public Resolver mxQueryResolver(final SanitizerProperties properties) throws UnknownHostException {
        final var servers = properties.getDns().getServers();
        final ExtendedResolver resolver = servers.isEmpty()
                ? new ExtendedResolver()
                : new ExtendedResolver(servers.toArray(new String[0]));
        resolver.setTimeout(properties.getMx().getAttemptTimeout());
        // one pass over the servers per attempt, MxResolver does the retrying
        resolver.setRetries(1);
        log.info("MX queries go to {} with a {} ms timeout per attempt",
                servers.isEmpty() ? "the system resolvers" : servers, properties.getMx().getAttemptTimeout().toMillis());
        return resolver;
    }

    @Bean
    public MxLookup mxLookup(final Resolver mxQueryResolver) {
        return new DnsJavaMxLookup(mxQueryResolver);
    }

    @Bean
    public MxResolver mxResolver(final MxLookup mxLookup, final SanitizerProperties properties) {
        return new MxResolver(mxLookup, properties.getMx().getRetries(),
                new LinearBackOffPolicy(properties.getMx().getBackoff()));
    }
}
