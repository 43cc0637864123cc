package org.ncdyndns.api;

import org.ncdyndns.DynDnsException;

/**
 * The remote control API answered with a non-success status. The message is the remote's
 * {@code longmessage}, unchanged.
 */
public class ApiException extends DynDnsException {

    private final Integer statusCode;

    public ApiException(String message) {
        this(message, null);
    }

    public ApiException(String message, Integer statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    /**
     * The remote's numeric {@code statuscode}, or null if it sent none.
     */
    public Integer getStatusCode() {
        return statusCode;
    }
}
