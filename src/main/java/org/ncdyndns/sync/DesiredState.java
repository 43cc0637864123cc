package org.ncdyndns.sync;

import org.ncdyndns.dns.Record;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.OptionalInt;

/**
 * What one domain should look like: the records to merge, in order, and optionally a zone ttl.
 */
public final class DesiredState {

    private final String domain;
    private final List<Record> records;
    private final OptionalInt ttl;

    public DesiredState(String domain, List<Record> records, OptionalInt ttl) {
        this.domain = domain;
        this.records = Collections.unmodifiableList(new ArrayList<>(records));
        this.ttl = ttl;
    }

    public String getDomain() {
        return domain;
    }

    public List<Record> getRecords() {
        return records;
    }

    public OptionalInt getTtl() {
        return ttl;
    }

    public DesiredState withTtl(OptionalInt ttl) {
        return new DesiredState(domain, records, ttl);
    }

    @Override
    public String toString() {
        return "DesiredState{" +
                "domain='" + domain + '\'' +
                ", records=" + records +
                ", ttl=" + ttl +
                '}';
    }
}
