package org.ncdyndns.sync;

import org.ncdyndns.api.ApiException;
import org.ncdyndns.api.ApiSession;
import org.ncdyndns.api.TransportException;
import org.ncdyndns.dns.Record;
import org.ncdyndns.dns.RecordSet;
import org.ncdyndns.dns.Zone;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.OptionalInt;

/**
 * Runs one reconciliation pass against a logged in session.
 * {@link #reconcile} only reads; {@link #commit} writes what changed.
 */
public class SyncEngine {

    private static final Logger log = LoggerFactory.getLogger(SyncEngine.class);

    private final ApiSession session;

    public SyncEngine(ApiSession session) {
        this.session = session;
    }

    /**
     * Fetches the zone and its records and merges the desired records and ttl into copies of them.
     */
    public ReconcileResult reconcile(String domain, List<Record> desired, OptionalInt desiredTtl)
            throws ApiException, TransportException {
        Zone currentZone = session.infoZone(domain);
        RecordSet currentRecords = session.infoRecords(domain);
        log.debug("Fetched zone {} with {} records", domain, currentRecords.size());

        RecordSet mergedRecords = new RecordSet(currentRecords);
        boolean recordsChanged = mergedRecords.mergeAll(desired);

        Zone mergedZone = new Zone(currentZone);
        boolean ttlChanged = desiredTtl.isPresent() && desiredTtl.getAsInt() != currentZone.getTtl();
        if (ttlChanged) {
            mergedZone.setTtl(desiredTtl.getAsInt());
        }

        log.info("Reconciled {}: recordsChanged={}, ttlChanged={}", domain, recordsChanged, ttlChanged);
        return new ReconcileResult(domain, currentZone, mergedZone, currentRecords, mergedRecords,
                recordsChanged, ttlChanged);
    }

    /**
     * Writes the reconciled state. In dry-run mode ({@code update == false}) nothing is written.
     * Otherwise the zone is written first if its ttl changed and the records second if they changed;
     * each write is followed by a re-read. The two writes are independent remote calls, so a failed
     * record write can follow a successful zone write.
     */
    public CommitResult commit(ReconcileResult result, boolean update) throws ApiException, TransportException {
        if (!update) {
            log.info("Dry run for {}, nothing written", result.getDomain());
            return CommitResult.nothingWritten();
        }

        Zone confirmedZone = null;
        if (result.isTtlChanged()) {
            session.updateZone(result.getMergedZone());
            confirmedZone = session.infoZone(result.getDomain());
        } else {
            log.info("ttl of {} has not changed, leaving it alone", result.getDomain());
        }

        RecordSet confirmedRecords = null;
        if (result.isRecordsChanged()) {
            session.updateRecords(result.getDomain(), result.getMergedRecords());
            confirmedRecords = session.infoRecords(result.getDomain());
        } else {
            log.info("Records of {} did not change, leaving them alone", result.getDomain());
        }

        return new CommitResult(confirmedZone, confirmedRecords);
    }
}
