package io.synclane.metadata;

public final class MetadataCorruptionException extends RuntimeException {
    public MetadataCorruptionException(String message, Throwable cause) {
        super(message, cause);
    }
}
