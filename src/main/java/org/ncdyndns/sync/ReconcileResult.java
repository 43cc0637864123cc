package org.ncdyndns.sync;

import org.ncdyndns.dns.RecordSet;
import org.ncdyndns.dns.Zone;

/**
 * Outcome of merging a desired state into the fetched state of a domain. Nothing has been
 * written at this point.
 */
public final class ReconcileResult {

    private final String domain;
    private final Zone currentZone;
    private final Zone mergedZone;
    private final RecordSet currentRecords;
    private final RecordSet mergedRecords;
    private final boolean recordsChanged;
    private final boolean ttlChanged;

    public ReconcileResult(String domain, Zone currentZone, Zone mergedZone, RecordSet currentRecords,
                           RecordSet mergedRecords, boolean recordsChanged, boolean ttlChanged) {
        this.domain = domain;
        this.currentZone = currentZone;
        this.mergedZone = mergedZone;
        this.currentRecords = currentRecords;
        this.mergedRecords = mergedRecords;
        this.recordsChanged = recordsChanged;
        this.ttlChanged = ttlChanged;
    }

    public String getDomain() {
        return domain;
    }

    public Zone getCurrentZone() {
        return currentZone;
    }

    public Zone getMergedZone() {
        return mergedZone;
    }

    public RecordSet getCurrentRecords() {
        return currentRecords;
    }

    public RecordSet getMergedRecords() {
        return mergedRecords;
    }

    public boolean isRecordsChanged() {
        return recordsChanged;
    }

    public boolean isTtlChanged() {
        return ttlChanged;
    }
}
