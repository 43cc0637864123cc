package org.ncdyndns.sync;

import com.google.gson.JsonArray;
import org.ncdyndns.dns.Record;
import org.ncdyndns.dns.RecordSet;
import org.ncdyndns.dns.Zone;
import org.ncdyndns.util.TablePrinter;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Human-readable account of one sync pass.
 */
public final class SyncReport {

    private final ReconcileResult reconcile;
    private final CommitResult commit;
    private final boolean update;

    public SyncReport(ReconcileResult reconcile, CommitResult commit, boolean update) {
        this.reconcile = reconcile;
        this.commit = commit;
        this.update = update;
    }

    public ReconcileResult getReconcile() {
        return reconcile;
    }

    public CommitResult getCommit() {
        return commit;
    }

    public boolean isUpdate() {
        return update;
    }

    public String render() {
        StringBuilder sb = new StringBuilder();
        sb.append(zoneTable(reconcile.getCurrentZone())).append('\n');
        sb.append(recordTable(reconcile.getCurrentRecords())).append('\n');
        sb.append("updated set:\n");
        sb.append(recordTable(reconcile.getMergedRecords())).append('\n');
        sb.append("records changed:\t").append(reconcile.isRecordsChanged()).append('\n');
        sb.append("ttl changed:\t\t").append(reconcile.isTtlChanged()).append('\n');

        if (!update) {
            sb.append("dry run, nothing was written\n");
            return sb.toString();
        }
        if (commit.isZoneWritten()) {
            sb.append("\nzone after update:\n").append(zoneTable(commit.getConfirmedZone()));
        }
        if (commit.isRecordsWritten()) {
            sb.append("\nrecords after update:\n").append(recordTable(commit.getConfirmedRecords()));
        }
        if (!commit.isZoneWritten() && !commit.isRecordsWritten()) {
            sb.append("nothing changed, leaving it alone\n");
        }
        return sb.toString();
    }

    /**
     * Structured form of the report for JSON responses.
     */
    public Map<String, Object> summary() {
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("domain", reconcile.getDomain());
        summary.put("update", update);
        summary.put("recordsChanged", reconcile.isRecordsChanged());
        summary.put("ttlChanged", reconcile.isTtlChanged());
        summary.put("zoneWritten", commit.isZoneWritten());
        summary.put("recordsWritten", commit.isRecordsWritten());

        Zone zone = commit.isZoneWritten() ? commit.getConfirmedZone() : reconcile.getMergedZone();
        RecordSet records = commit.isRecordsWritten() ? commit.getConfirmedRecords() : reconcile.getMergedRecords();
        summary.put("zone", zone.toWire());
        JsonArray array = new JsonArray();
        for (Record record : records.records()) {
            array.add(record.toWire());
        }
        summary.put("records", array);
        return summary;
    }

    public static String zoneTable(Zone zone) {
        List<List<Object>> rows = new ArrayList<>();
        rows.add(List.of("domain", zone.getName()));
        rows.add(List.of("ttl", zone.getTtl()));
        rows.add(List.of("serial", zone.getSerial()));
        rows.add(List.of("refresh", zone.getRefresh()));
        rows.add(List.of("retry", zone.getRetry()));
        rows.add(List.of("expire", zone.getExpire()));
        rows.add(List.of("dnssec", zone.isDnssecStatus()));
        return TablePrinter.render(List.of("zone info", ""), rows);
    }

    public static String recordTable(RecordSet records) {
        List<List<Object>> rows = new ArrayList<>();
        for (Record record : records.records()) {
            rows.add(row(record));
        }
        for (Record deleted : records.pendingDeletions()) {
            rows.add(row(deleted));
        }
        return TablePrinter.render(List.of("records", "type", "destination", "state"), rows);
    }

    private static List<Object> row(Record record) {
        List<Object> row = new ArrayList<>();
        row.add(record.getHostname());
        row.add(record.getType());
        row.add(record.getDestination());
        row.add(record.isMarkedForDeletion() ? "delete" : record.getState());
        return row;
    }
}
