package org.ncdyndns.net;

import org.ncdyndns.DynDnsException;

/**
 * The external IPv4 address could not be determined.
 */
public class ExternalIpException extends DynDnsException {

    public ExternalIpException(String message) {
        super(message);
    }

    public ExternalIpException(String message, Throwable cause) {
        super(message, cause);
    }
}
