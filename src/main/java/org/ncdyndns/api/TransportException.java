package org.ncdyndns.api;

import org.ncdyndns.DynDnsException;

/**
 * The endpoint could not be reached or answered with a non-2xx HTTP status.
 */
public class TransportException extends DynDnsException {

    private final int httpStatus;

    public TransportException(String message, int httpStatus) {
        super(message);
        this.httpStatus = httpStatus;
    }

    public TransportException(String message, Throwable cause) {
        super(message, cause);
        this.httpStatus = -1;
    }

    /**
     * The HTTP status code, or -1 if no response was received.
     */
    public int getHttpStatus() {
        return httpStatus;
    }
}
