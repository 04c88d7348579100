package io.synclane.model;

public enum SyncTrigger {
    MANUAL,
    AUTOMATIC
}
