package com.mikov.emailsanitizer.dns;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.xbill.DNS.Lookup;
import org.xbill.DNS.MXRecord;
import org.xbill.DNS.Name;
import org.xbill.DNS.Record;
import org.xbill.DNS.Resolver;
import org.xbill.DNS.TextParseException;
import org.xbill.DNS.Type;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * {@link MxLookup} backed by dnsjava. One call sends one query through the configured resolver;
 * the resolver's timeout bounds each attempt.
 * <p>
 * Domains are queried as absolute names so no search-path fallback is tried, and each call uses
 * its own temporary cache instead of dnsjava's process-wide one.
 *
 * @author zahari.mikov
 */
@Slf4j
@RequiredArgsConstructor
public class DnsJavaMxLookup implements MxLookup {

    private final Resolver resolver;

    @Override
    public List<MxRecord> lookup(final String domain) throws MxLookupException {
        final Lookup lookup;
        try {
            lookup = new Lookup(Name.fromString(domain, Name.root), Type.MX);
        } catch (final TextParseException e) {
            throw new MxLookupException(domain, DnsErrorCode.INVALID_NAME, e);
        }
        lookup.setResolver(resolver);
        lookup.setCache(null);

        final Record[] records = lookup.run();
        final var result = lookup.getResult();
        if (result != Lookup.SUCCESSFUL) {
            final var errorCode = DnsErrorCode.fromLookupResult(result, lookup.getErrorString());
            throw new MxLookupException(domain, errorCode, lookup.getErrorString());
        }

        final var mxRecords = new ArrayList<MxRecord>();
        if (records != null) {
            for (final Record record : records) {
                if (!(record instanceof MXRecord)) {
                    continue;
                }
                final MXRecord mx = (MXRecord) record;
                // "0 ." is a null MX: the domain explicitly accepts no mail
                if (Name.root.equals(mx.getTarget())) {
                    log.debug("Domain {} publishes a null MX record", domain);
                    continue;
                }
                mxRecords.add(new MxRecord(mx.getTarget().toString(true), mx.getPriority()));
            }
        }

        mxRecords.sort(Comparator.comparingInt(MxRecord::priority));
        return mxRecords;
    }
}
