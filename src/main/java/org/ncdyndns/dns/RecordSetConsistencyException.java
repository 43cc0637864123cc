package org.ncdyndns.dns;

/**
 * Thrown when a record set breaks the hostname invariant: more than two records for one
 * hostname, or two records that are not an A/AAAA pair.
 */
public class RecordSetConsistencyException extends IllegalStateException {

    public RecordSetConsistencyException(String message) {
        super(message);
    }
}
