package org.ncdyndns.config;

/**
 * Keys of the settings file.
 */
public enum ConfigKey {

    API_URL("API_URL"),
    API_KEY("API_KEY"),
    API_PASSWORD("API_PASSWORD"),
    CUSTOMER_ID("CUSTOMER_ID"),
    FRITZBOX_IP("FRITZBOX_IP"),
    LOG_LEVEL("LOG_LEVEL"),
    SUBDOMAINS("SUBDOMAINS"),
    HTTP_TIMEOUT_SECONDS("HTTP_TIMEOUT_SECONDS");

    private final String key;

    ConfigKey(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }
}
