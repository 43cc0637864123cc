package org.ncdyndns.config;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps webhook keys to the hostname each key may update:
 * <pre>
 * {"domainname": "example.com", "hosts": [{"key": "s3cr3t", "hostname": "home"}]}
 * </pre>
 */
public final class SubdomainKeys {

    private final String domain;
    private final Map<String, String> hostnames;

    public SubdomainKeys(String domain, Map<String, String> hostnames) {
        this.domain = domain;
        this.hostnames = Collections.unmodifiableMap(new LinkedHashMap<>(hostnames));
    }

    public static SubdomainKeys load(Path file) throws ConfigurationException {
        if (file == null) {
            throw new ConfigurationException("No " + ConfigKey.SUBDOMAINS.key() + " file configured");
        }
        JsonObject json = Settings.readObject(file);

        JsonElement domain = json.get("domainname");
        if (domain == null || domain.isJsonNull() || domain.getAsString().isBlank()) {
            throw new ConfigurationException("Missing domainname in " + file);
        }

        JsonElement hosts = json.get("hosts");
        if (hosts == null || !hosts.isJsonArray()) {
            throw new ConfigurationException("Missing hosts list in " + file);
        }

        Map<String, String> hostnames = new LinkedHashMap<>();
        for (JsonElement element : hosts.getAsJsonArray()) {
            if (!element.isJsonObject()) {
                throw new ConfigurationException("Malformed host entry in " + file);
            }
            JsonObject host = element.getAsJsonObject();
            JsonElement key = host.get("key");
            JsonElement hostname = host.get("hostname");
            if (key == null || key.isJsonNull() || hostname == null || hostname.isJsonNull()) {
                throw new ConfigurationException("Host entry without key or hostname in " + file);
            }
            hostnames.put(key.getAsString(), hostname.getAsString());
        }
        return new SubdomainKeys(domain.getAsString(), hostnames);
    }

    public String getDomain() {
        return domain;
    }

    /**
     * @return the hostname for {@code key}, or null if the key is unknown
     */
    public String hostnameFor(String key) {
        if (key == null) {
            return null;
        }
        return hostnames.get(key);
    }
}
