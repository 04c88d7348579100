package io.synclane.metadata;

public enum MetadataError {
    METADATA_CORRUPTION,
    ATOMIC_WRITE_FAILURE,
    LOCK_UNAVAILABLE,
    TRANSFORM_FAILED
}
