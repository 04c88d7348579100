package io.synclane.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum TransferDirection {
    UPLOAD("upload"),
    DOWNLOAD("download");

    private final String operation;

    TransferDirection(String operation) {
        this.operation = operation;
    }

    @JsonValue
    public String operation() {
        return operation;
    }
}
