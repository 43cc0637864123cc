package org.ncdyndns.api;

/**
 * Sends one JSON request body to the control API endpoint and returns the response body.
 */
public interface ApiTransport {

    String post(String url, String jsonBody) throws TransportException;
}
