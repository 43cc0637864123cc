package org.ncdyndns.dns;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;

import java.util.Objects;

/**
 * Zone-level settings of one domain. Only the ttl may be changed locally;
 * all other fields are owned by the remote.
 */
public class Zone {
    private final String name;
    private int ttl;
    private final String serial;
    private final int refresh;
    private final int retry;
    private final int expire;
    private final boolean dnssecStatus;

    public Zone(String name, int ttl, String serial, int refresh, int retry, int expire, boolean dnssecStatus) {
        this.name = name;
        this.ttl = ttl;
        this.serial = serial;
        this.refresh = refresh;
        this.retry = retry;
        this.expire = expire;
        this.dnssecStatus = dnssecStatus;
    }

    public Zone(Zone other) {
        this(other.name, other.ttl, other.serial, other.refresh, other.retry, other.expire, other.dnssecStatus);
    }

    public JsonObject toWire() {
        JsonObject json = new JsonObject();
        json.addProperty("name", name);
        json.addProperty("ttl", ttl);
        json.addProperty("serial", serial);
        json.addProperty("refresh", refresh);
        json.addProperty("retry", retry);
        json.addProperty("expire", expire);
        json.addProperty("dnssecstatus", dnssecStatus);
        return json;
    }

    /**
     * Parses the response data of {@code infoDnsZone}. The remote reports numbers as strings.
     */
    public static Zone fromWire(String domain, JsonObject json) {
        if (json == null) {
            throw new IllegalArgumentException("DNS zone is null");
        }
        return new Zone(
                domain,
                requireInt(json, "ttl"),
                require(json, "serial").getAsString(),
                requireInt(json, "refresh"),
                requireInt(json, "retry"),
                requireInt(json, "expire"),
                require(json, "dnssecstatus").getAsBoolean()
        );
    }

    private static int requireInt(JsonObject json, String key) {
        return Record.exactInt(require(json, key), key);
    }

    private static JsonElement require(JsonObject json, String key) {
        JsonElement element = json.get(key);
        if (element == null || element.isJsonNull()) {
            throw new IllegalArgumentException("DNS zone is missing '" + key + "'");
        }
        return element;
    }

    public String getName() {
        return name;
    }

    public int getTtl() {
        return ttl;
    }

    public void setTtl(int ttl) {
        this.ttl = ttl;
    }

    public String getSerial() {
        return serial;
    }

    public int getRefresh() {
        return refresh;
    }

    public int getRetry() {
        return retry;
    }

    public int getExpire() {
        return expire;
    }

    public boolean isDnssecStatus() {
        return dnssecStatus;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Zone zone = (Zone) o;
        return ttl == zone.ttl && refresh == zone.refresh && retry == zone.retry && expire == zone.expire
                && dnssecStatus == zone.dnssecStatus && Objects.equals(name, zone.name)
                && Objects.equals(serial, zone.serial);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, ttl, serial, refresh, retry, expire, dnssecStatus);
    }

    @Override
    public String toString() {
        return "Zone{" +
                "name='" + name + '\'' +
                ", ttl=" + ttl +
                ", serial='" + serial + '\'' +
                ", refresh=" + refresh +
                ", retry=" + retry +
                ", expire=" + expire +
                ", dnssecstatus=" + dnssecStatus +
                '}';
    }
}
