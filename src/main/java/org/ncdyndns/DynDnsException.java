package org.ncdyndns;

/**
 * Base of the checked failures a sync pass reports to its caller.
 */
public class DynDnsException extends Exception {

    public DynDnsException(String message) {
        super(message);
    }

    public DynDnsException(String message, Throwable cause) {
        super(message, cause);
    }
}
