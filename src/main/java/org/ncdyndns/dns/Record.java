package org.ncdyndns.dns;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;

import java.util.Objects;

/**
 * Record represents one DNS resource record of a zone as the remote control API stores it.
 */
public class Record {
    private final Integer id;             // remote-assigned, null for records not yet created
    private final String hostname;        // relative to the zone, e.g. "www" or "@"
    private RecordType type;
    private String destination;           // e.g. "1.2.3.4" for A
    private final int priority;
    private boolean markedForDeletion;
    private final String state;           // remote-reported status, read-only

    public Record(String hostname, RecordType type, String destination) {
        this(null, hostname, type, destination, 0, false, null);
    }

    public Record(Integer id, String hostname, RecordType type, String destination,
                  int priority, boolean markedForDeletion, String state) {
        this.id = id;
        this.hostname = hostname;
        this.type = type;
        this.destination = destination;
        this.priority = priority;
        this.markedForDeletion = markedForDeletion;
        this.state = state;
    }

    public Record(Record other) {
        this(other.id, other.hostname, other.type, other.destination,
                other.priority, other.markedForDeletion, other.state);
    }

    /**
     * Checks whether this record differs from {@code other} in the fields that matter for syncing.
     * Only destination and type are compared; id, priority, state and the deletion flag are metadata.
     *
     * @param other the desired record
     * @return true if an update is needed
     */
    public boolean needsUpdate(Record other) {
        return !Objects.equals(destination, other.destination) || type != other.type;
    }

    /**
     * Copies destination and type from {@code other}.
     *
     * @param other the desired record
     * @return true if any field actually changed
     */
    public boolean applyUpdate(Record other) {
        if (!needsUpdate(other)) {
            return false;
        }
        this.destination = other.destination;
        this.type = other.type;
        return true;
    }

    public JsonObject toWire() {
        JsonObject json = new JsonObject();
        if (id != null) {
            json.addProperty("id", id);
        }
        json.addProperty("hostname", hostname);
        json.addProperty("type", type.name());
        json.addProperty("priority", priority);
        json.addProperty("destination", destination);
        json.addProperty("deleterecord", markedForDeletion);
        if (state != null) {
            json.addProperty("state", state);
        }
        return json;
    }

    /**
     * Parses a record as returned by {@code infoDnsRecords}. Numeric fields may arrive as strings.
     */
    public static Record fromWire(JsonObject json) {
        if (json == null) {
            throw new IllegalArgumentException("DNS record is null");
        }
        JsonElement hostname = json.get("hostname");
        JsonElement type = json.get("type");
        if (isMissing(hostname) || isMissing(type)) {
            throw new IllegalArgumentException("DNS record without hostname or type: " + json);
        }

        JsonElement id = json.get("id");
        JsonElement destination = json.get("destination");
        JsonElement priority = json.get("priority");
        JsonElement delete = json.get("deleterecord");
        JsonElement state = json.get("state");

        return new Record(
                isMissing(id) ? null : exactInt(id, "id"),
                hostname.getAsString(),
                RecordType.fromString(type.getAsString()),
                isMissing(destination) ? null : destination.getAsString(),
                isMissing(priority) || priority.getAsString().isBlank() ? 0 : exactInt(priority, "priority"),
                !isMissing(delete) && delete.getAsBoolean(),
                isMissing(state) ? null : state.getAsString()
        );
    }

    /**
     * Reads a number that may arrive as a string. Fractions and values outside the int range
     * are rejected instead of being truncated.
     */
    static int exactInt(JsonElement element, String name) {
        try {
            return element.getAsBigDecimal().intValueExact();
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException("'" + name + "' is not an int: " + element, e);
        } catch (IllegalStateException | UnsupportedOperationException e) {
            throw new IllegalArgumentException("'" + name + "' is not a number: " + element, e);
        }
    }

    private static boolean isMissing(JsonElement element) {
        return element == null || element.isJsonNull();
    }

    public Integer getId() {
        return id;
    }

    public String getHostname() {
        return hostname;
    }

    public RecordType getType() {
        return type;
    }

    public String getDestination() {
        return destination;
    }

    public int getPriority() {
        return priority;
    }

    public boolean isMarkedForDeletion() {
        return markedForDeletion;
    }

    public void setMarkedForDeletion(boolean markedForDeletion) {
        this.markedForDeletion = markedForDeletion;
    }

    public String getState() {
        return state;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Record record = (Record) o;
        return priority == record.priority
                && markedForDeletion == record.markedForDeletion
                && Objects.equals(id, record.id)
                && Objects.equals(hostname, record.hostname)
                && type == record.type
                && Objects.equals(destination, record.destination)
                && Objects.equals(state, record.state);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, hostname, type, destination, priority, markedForDeletion, state);
    }

    @Override
    public String toString() {
        return "Record{" +
                "id=" + id +
                ", hostname='" + hostname + '\'' +
                ", type=" + type +
                ", destination='" + destination + '\'' +
                ", priority=" + priority +
                ", deleterecord=" + markedForDeletion +
                ", state='" + state + '\'' +
                '}';
    }
}
