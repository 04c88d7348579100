package io.synclane.metadata;

import com.fasterxml.jackson.databind.node.ObjectNode;

public record MetadataUpdateResult(
        boolean success,
        ObjectNode document,
        MetadataError error,
        String message,
        int attempts
) {
    static MetadataUpdateResult ok(ObjectNode document, int attempts) {
        return new MetadataUpdateResult(true, document, null, "", attempts);
    }

    static MetadataUpdateResult failed(MetadataError error, String message, int attempts) {
        return new MetadataUpdateResult(false, null, error, message, attempts);
    }
}
