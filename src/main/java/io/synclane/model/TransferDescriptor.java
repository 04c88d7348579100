package io.synclane.model;

import java.util.Map;

public record TransferDescriptor(
        String oid,
        long size,
        TransferDirection direction,
        String url,
        Map<String, String> headers
) {
    public TransferDescriptor {
        headers = headers == null ? Map.of() : Map.copyOf(headers);
    }
}
