package org.ncdyndns.api;

/**
 * Opens a logged in {@link ApiSession} for one sync pass.
 */
@FunctionalInterface
public interface ApiSessionFactory {

    ApiSession open() throws ApiException, TransportException;
}
