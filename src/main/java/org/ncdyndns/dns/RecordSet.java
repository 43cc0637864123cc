package org.ncdyndns.dns;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Insertion-ordered records of one zone.
 * <p>
 * Within a set the pair (hostname, type) is unique, except that one hostname may own
 * an A and an AAAA record at the same time (dual-stack). Records are only changed through
 * {@link #merge(Record)}. Records removed by a merge are kept as pending deletions so that
 * {@link #toWire()} can tell the remote to delete them.
 */
public class RecordSet {

    private final List<Record> records = new ArrayList<>();
    private final List<Record> pendingDeletions = new ArrayList<>();

    public RecordSet() {
    }

    public RecordSet(List<Record> records) {
        for (Record record : records) {
            this.records.add(new Record(record));
        }
    }

    public RecordSet(RecordSet other) {
        this(other.records);
        for (Record deleted : other.pendingDeletions) {
            this.pendingDeletions.add(new Record(deleted));
        }
    }

    /**
     * Merges one desired record into this set.
     *
     * @param desired the record the zone should contain
     * @return true if the set changed
     * @throws RecordSetConsistencyException if the set already violates the hostname invariant
     */
    public boolean merge(Record desired) {
        if (desired.isMarkedForDeletion()) {
            return delete(desired);
        }

        List<Record> matches = findAll(desired.getHostname());
        return switch (matches.size()) {
            case 0 -> append(desired);
            case 1 -> mergeSingle(matches.get(0), desired);
            case 2 -> mergeDualStack(matches.get(0), matches.get(1), desired);
            default -> throw new RecordSetConsistencyException(
                    matches.size() + " records share hostname '" + desired.getHostname() + "'");
        };
    }

    /**
     * Merges every desired record in order. All records are processed even after the first change.
     *
     * @return true if any merge changed the set
     */
    public boolean mergeAll(Iterable<Record> desired) {
        boolean changed = false;
        for (Record record : desired) {
            changed |= merge(record);
        }
        return changed;
    }

    private boolean append(Record desired) {
        Record added = new Record(desired);
        added.setMarkedForDeletion(false);
        records.add(added);
        return true;
    }

    private boolean mergeSingle(Record existing, Record desired) {
        if (RecordType.isDualStackPair(existing.getType(), desired.getType())) {
            return append(desired);
        }
        return existing.applyUpdate(desired);
    }

    private boolean mergeDualStack(Record first, Record second, Record desired) {
        if (!RecordType.isDualStackPair(first.getType(), second.getType())) {
            throw new RecordSetConsistencyException("hostname '" + desired.getHostname()
                    + "' owns " + first.getType() + " and " + second.getType() + " records");
        }

        if (desired.getType().isAddress()) {
            Record sameType = first.getType() == desired.getType() ? first : second;
            if (sameType.getType() != desired.getType()) {
                throw new RecordSetConsistencyException("no " + desired.getType()
                        + " record for dual-stack hostname '" + desired.getHostname() + "'");
            }
            return sameType.applyUpdate(desired);
        }

        // back to single-stack: the first record takes the new value, the second goes
        first.applyUpdate(desired);
        remove(second);
        return true;
    }

    private boolean delete(Record desired) {
        for (Record existing : findAll(desired.getHostname())) {
            if (existing.getType() == desired.getType()) {
                remove(existing);
                return true;
            }
        }
        return false;
    }

    private void remove(Record record) {
        records.removeIf(r -> r == record);
        if (record.getId() != null) {
            record.setMarkedForDeletion(true);
            pendingDeletions.add(record);
        }
    }

    public boolean contains(String hostname) {
        for (Record record : records) {
            if (record.getHostname().equals(hostname)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Returns the first record with the given hostname.
     *
     * @throws NoSuchElementException if there is none
     */
    public Record getByHostname(String hostname) {
        for (Record record : records) {
            if (record.getHostname().equals(hostname)) {
                return record;
            }
        }
        throw new NoSuchElementException("there is no record with hostname " + hostname);
    }

    public List<Record> findAll(String hostname) {
        List<Record> matches = new ArrayList<>();
        for (Record record : records) {
            if (record.getHostname().equals(hostname)) {
                matches.add(record);
            }
        }
        return matches;
    }

    public List<Record> records() {
        return Collections.unmodifiableList(records);
    }

    public List<Record> pendingDeletions() {
        return Collections.unmodifiableList(pendingDeletions);
    }

    public int size() {
        return records.size();
    }

    /**
     * The {@code dnsrecordset} parameter of {@code updateDnsRecords}.
     */
    public JsonObject toWire() {
        JsonArray array = new JsonArray();
        for (Record record : records) {
            array.add(record.toWire());
        }
        for (Record deleted : pendingDeletions) {
            array.add(deleted.toWire());
        }
        JsonObject json = new JsonObject();
        json.add("dnsrecords", array);
        return json;
    }

    @Override
    public String toString() {
        return "RecordSet{" +
                "records=" + records +
                ", pendingDeletions=" + pendingDeletions +
                '}';
    }
}
