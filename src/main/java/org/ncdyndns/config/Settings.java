package org.ncdyndns.config;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import org.ncdyndns.util.ConversionUtil;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Process settings, read once at startup from a JSON file and passed explicitly
 * to whatever needs them.
 */
public final class Settings {

    public static final String DEFAULT_API_URL =
            "https://ccp.netcup.net/run/webservice/servers/endpoint.php?JSON";
    public static final Duration DEFAULT_HTTP_TIMEOUT = Duration.ofSeconds(30);

    private final String apiUrl;
    private final String apiKey;
    private final String apiPassword;
    private final String customerId;
    private final String fritzboxIp;
    private final String logLevel;
    private final Path subdomainsFile;
    private final Duration httpTimeout;

    public Settings(String apiUrl, String apiKey, String apiPassword, String customerId) {
        this(apiUrl, apiKey, apiPassword, customerId, null, "INFO", null, DEFAULT_HTTP_TIMEOUT);
    }

    public Settings(String apiUrl, String apiKey, String apiPassword, String customerId, String fritzboxIp,
                    String logLevel, Path subdomainsFile, Duration httpTimeout) {
        this.apiUrl = apiUrl;
        this.apiKey = apiKey;
        this.apiPassword = apiPassword;
        this.customerId = customerId;
        this.fritzboxIp = fritzboxIp;
        this.logLevel = logLevel;
        this.subdomainsFile = subdomainsFile;
        this.httpTimeout = httpTimeout;
    }

    /**
     * Reads the settings file. {@code SUBDOMAINS} is resolved against the file's directory.
     *
     * @throws ConfigurationException if the file cannot be read or a required key is missing
     */
    public static Settings load(Path file) throws ConfigurationException {
        JsonObject json = readObject(file);

        String subdomains = optional(json, ConfigKey.SUBDOMAINS);
        Path parent = file.toAbsolutePath().getParent();
        Path subdomainsFile = subdomains == null ? null
                : (parent == null ? Path.of(subdomains) : parent.resolve(subdomains));

        String apiUrl = optional(json, ConfigKey.API_URL);
        String logLevel = optional(json, ConfigKey.LOG_LEVEL);
        String timeout = optional(json, ConfigKey.HTTP_TIMEOUT_SECONDS);

        Duration httpTimeout = DEFAULT_HTTP_TIMEOUT;
        if (timeout != null) {
            try {
                httpTimeout = Duration.ofSeconds(Long.parseLong(timeout.trim()));
            } catch (NumberFormatException e) {
                throw new ConfigurationException(ConfigKey.HTTP_TIMEOUT_SECONDS.key() + " is not a number: " + timeout);
            }
            if (httpTimeout.isNegative() || httpTimeout.isZero()) {
                throw new ConfigurationException(ConfigKey.HTTP_TIMEOUT_SECONDS.key() + " must be > 0");
            }
        }

        return new Settings(
                apiUrl == null ? DEFAULT_API_URL : apiUrl,
                required(json, ConfigKey.API_KEY, file),
                required(json, ConfigKey.API_PASSWORD, file),
                required(json, ConfigKey.CUSTOMER_ID, file),
                optional(json, ConfigKey.FRITZBOX_IP),
                logLevel == null ? "INFO" : logLevel,
                subdomainsFile,
                httpTimeout
        );
    }

    static JsonObject readObject(Path file) throws ConfigurationException {
        String content;
        try {
            content = Files.readString(file);
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read " + file + ": " + e.getMessage(), e);
        }

        try {
            JsonObject json = ConversionUtil.parseObject(content);
            if (json == null) {
                throw new ConfigurationException(file + " does not contain a JSON object");
            }
            return json;
        } catch (JsonParseException | IllegalStateException e) {
            throw new ConfigurationException("Malformed JSON in " + file + ": " + e.getMessage(), e);
        }
    }

    private static String required(JsonObject json, ConfigKey key, Path file) throws ConfigurationException {
        String value = optional(json, key);
        if (value == null || value.isBlank()) {
            throw new ConfigurationException("Missing required setting " + key.key() + " in " + file);
        }
        return value;
    }

    private static String optional(JsonObject json, ConfigKey key) {
        JsonElement element = json.get(key.key());
        if (element == null || element.isJsonNull()) {
            return null;
        }
        return element.getAsString();
    }

    public String getApiUrl() {
        return apiUrl;
    }

    public String getApiKey() {
        return apiKey;
    }

    public String getApiPassword() {
        return apiPassword;
    }

    public String getCustomerId() {
        return customerId;
    }

    public String getFritzboxIp() {
        return fritzboxIp;
    }

    public String getLogLevel() {
        return logLevel;
    }

    public Path getSubdomainsFile() {
        return subdomainsFile;
    }

    public Duration getHttpTimeout() {
        return httpTimeout;
    }

    @Override
    public String toString() {
        return "Settings{" +
                "apiUrl='" + apiUrl + '\'' +
                ", customerId='" + customerId + '\'' +
                ", fritzboxIp='" + fritzboxIp + '\'' +
                ", logLevel='" + logLevel + '\'' +
                ", subdomainsFile=" + subdomainsFile +
                ", httpTimeout=" + httpTimeout +
                '}';
    }
}
