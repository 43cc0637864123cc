package org.ncdyndns.dns;

/**
 * Record types accepted by the remote DNS control API.
 */
public enum RecordType {
    A,
    AAAA,
    MX,
    CNAME,
    CAA,
    SRV,
    TXT,
    TLSA,
    NS,
    DS,
    OPENPGPKEY,
    SMIMEA,
    SSHFP,
    PTR,
    SOA;

    public static RecordType fromString(String s) {
        if (s == null || s.isBlank()) {
            throw new IllegalArgumentException("Record type string is null or empty");
        }

        String t = s.trim().toUpperCase();
        for (RecordType type : values()) {
            if (type.name().equals(t)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown DNS record type: " + s);
    }

    /**
     * True iff the two types are the two different members of {A, AAAA}.
     */
    public static boolean isDualStackPair(RecordType first, RecordType second) {
        return (first == A && second == AAAA) || (first == AAAA && second == A);
    }

    public boolean isAddress() {
        return this == A || this == AAAA;
    }
}
