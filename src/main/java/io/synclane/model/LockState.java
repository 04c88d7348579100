package io.synclane.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum LockState {
    ABSENT("absent"),
    ACTIVE("active"),
    STUCK("stuck"),
    DEAD("dead");

    private final String wireName;

    LockState(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
