package io.synclane.model;

public enum SyncOutcome {
    COMPLETED,
    CONFLICTS,
    OFFLINE,
    LOCK_BUSY,
    SKIPPED,
    VERSION_BLOCKED
}
