package org.ncdyndns.api;

/**
 * Actions of the remote control API used by this client.
 */
public enum ApiAction {

    LOGIN("login"),
    LOGOUT("logout"),
    INFO_DNS_ZONE("infoDnsZone"),
    INFO_DNS_RECORDS("infoDnsRecords"),
    UPDATE_DNS_ZONE("updateDnsZone"),
    UPDATE_DNS_RECORDS("updateDnsRecords");

    private final String wireName;

    ApiAction(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    @Override
    public String toString() {
        return wireName;
    }
}
