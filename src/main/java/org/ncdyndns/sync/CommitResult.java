package org.ncdyndns.sync;

import org.ncdyndns.dns.RecordSet;
import org.ncdyndns.dns.Zone;

/**
 * What a commit wrote, with the state re-read from the remote after each write.
 * A field is null when the corresponding write did not happen.
 */
public final class CommitResult {

    private static final CommitResult NOTHING_WRITTEN = new CommitResult(null, null);

    private final Zone confirmedZone;
    private final RecordSet confirmedRecords;

    public CommitResult(Zone confirmedZone, RecordSet confirmedRecords) {
        this.confirmedZone = confirmedZone;
        this.confirmedRecords = confirmedRecords;
    }

    public static CommitResult nothingWritten() {
        return NOTHING_WRITTEN;
    }

    public Zone getConfirmedZone() {
        return confirmedZone;
    }

    public RecordSet getConfirmedRecords() {
        return confirmedRecords;
    }

    public boolean isZoneWritten() {
        return confirmedZone != null;
    }

    public boolean isRecordsWritten() {
        return confirmedRecords != null;
    }
}
