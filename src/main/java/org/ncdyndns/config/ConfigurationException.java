package org.ncdyndns.config;

import org.ncdyndns.DynDnsException;

/**
 * Settings or desired-state input is missing, unreadable or incomplete.
 * Raised before any remote call is made.
 */
public class ConfigurationException extends DynDnsException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
