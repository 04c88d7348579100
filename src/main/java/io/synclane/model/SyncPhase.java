package io.synclane.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum SyncPhase {
    IDLE("idle"),
    COMMITTING("committing"),
    FETCHING("fetching"),
    MERGING("merging"),
    PUSHING("pushing");

    private final String wireName;

    SyncPhase(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public boolean isNetworkPhase() {
        return this == FETCHING || this == PUSHING;
    }

    @JsonCreator
    public static SyncPhase fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return IDLE;
        }
        for (SyncPhase value : values()) {
            if (value.name().equalsIgnoreCase(raw) || value.wireName.equalsIgnoreCase(raw)) {
                return value;
            }
        }
        // Lock records written by newer releases may carry phases we do not know.
        return IDLE;
    }
}
