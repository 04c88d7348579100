package io.synclane.model;

import java.util.Locale;
import java.util.regex.Pattern;

public record PointerRecord(String oid, long size) {
    private static final Pattern OID = Pattern.compile("^[0-9a-f]{64}$");

    public PointerRecord {
        if (oid == null) {
            throw new IllegalArgumentException("oid is required");
        }
        oid = oid.trim().toLowerCase(Locale.ROOT);
        if (!OID.matcher(oid).matches()) {
            throw new IllegalArgumentException("oid must be 64 hex characters: " + oid);
        }
        if (size < 0L) {
            throw new IllegalArgumentException("size must be >= 0");
        }
    }
}
