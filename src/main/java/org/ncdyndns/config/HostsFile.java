package org.ncdyndns.config;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import org.ncdyndns.dns.Record;
import org.ncdyndns.dns.RecordType;
import org.ncdyndns.net.ExternalIpException;
import org.ncdyndns.net.ExternalIpProvider;
import org.ncdyndns.sync.DesiredState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;

/**
 * Loads the desired state of one domain from a hosts file:
 * <pre>
 * {
 *   "zone":  {"domainname": "example.com", "ttl": 300},
 *   "hosts": [{"hostname": "www", "type": "A"},
 *             {"hostname": "mail", "type": "CNAME", "destination": "www"}]
 * }
 * </pre>
 * {@code hostname} and {@code type} are required. Hosts without a destination point at the
 * current external IP. The content of records is not validated.
 */
public final class HostsFile {

    private static final Logger log = LoggerFactory.getLogger(HostsFile.class);

    private HostsFile() {
    }

    public static DesiredState load(Path file, ExternalIpProvider ipProvider)
            throws ConfigurationException, ExternalIpException {
        return parse(Settings.readObject(file), file.toString(), ipProvider);
    }

    static DesiredState parse(JsonObject json, String source, ExternalIpProvider ipProvider)
            throws ConfigurationException, ExternalIpException {
        JsonObject zone = object(json, "zone", source);
        String domain = string(zone, "domainname");
        if (domain == null || domain.isBlank()) {
            throw new ConfigurationException("Missing zone.domainname in " + source);
        }

        OptionalInt ttl = OptionalInt.empty();
        JsonElement ttlElement = zone.get("ttl");
        if (ttlElement != null && !ttlElement.isJsonNull()) {
            ttl = OptionalInt.of(integer(ttlElement, "zone.ttl", source));
        }

        JsonElement hostsElement = json.get("hosts");
        if (hostsElement == null || !hostsElement.isJsonArray()) {
            throw new ConfigurationException("Missing hosts list in " + source);
        }
        JsonArray hosts = hostsElement.getAsJsonArray();

        String externalIp = null;
        List<Record> records = new ArrayList<>();
        for (int i = 0; i < hosts.size(); i++) {
            if (!hosts.get(i).isJsonObject()) {
                throw new ConfigurationException("hosts[" + i + "] is not an object in " + source);
            }
            JsonObject host = hosts.get(i).getAsJsonObject();

            String hostname = string(host, "hostname");
            String type = string(host, "type");
            if (hostname == null || hostname.isBlank() || type == null || type.isBlank()) {
                throw new ConfigurationException("hosts[" + i + "] needs a hostname and a type in " + source);
            }

            RecordType recordType;
            try {
                recordType = RecordType.fromString(type);
            } catch (IllegalArgumentException e) {
                throw new ConfigurationException("hosts[" + i + "]: " + e.getMessage(), e);
            }

            boolean delete = host.has("deleterecord") && !host.get("deleterecord").isJsonNull()
                    && host.get("deleterecord").getAsBoolean();
            String destination = string(host, "destination");
            if (destination == null && !delete) {
                if (externalIp == null) {
                    externalIp = ipProvider.currentIp().getHostAddress();
                    log.info("Found external ip {}", externalIp);
                }
                destination = externalIp;
            }

            int priority = 0;
            if (host.has("priority") && !host.get("priority").isJsonNull()) {
                priority = integer(host.get("priority"), "hosts[" + i + "].priority", source);
            }

            records.add(new Record(null, hostname, recordType, destination, priority, delete, null));
        }

        log.debug("Loaded {} hosts for {} from {}", records.size(), domain, source);
        return new DesiredState(domain, records, ttl);
    }

    private static JsonObject object(JsonObject json, String key, String source) throws ConfigurationException {
        JsonElement element = json.get(key);
        if (element == null || !element.isJsonObject()) {
            throw new ConfigurationException("Missing " + key + " section in " + source);
        }
        return element.getAsJsonObject();
    }

    private static String string(JsonObject json, String key) {
        JsonElement element = json.get(key);
        if (element == null || element.isJsonNull() || !element.isJsonPrimitive()) {
            return null;
        }
        return element.getAsString();
    }

    private static int integer(JsonElement element, String name, String source) throws ConfigurationException {
        try {
            return element.getAsBigDecimal().intValueExact();
        } catch (ArithmeticException e) {
            throw new ConfigurationException(name + " is not an int in " + source + ": " + element, e);
        } catch (NumberFormatException | IllegalStateException | UnsupportedOperationException e) {
            throw new ConfigurationException(name + " is not a number in " + source, e);
        }
    }
}
