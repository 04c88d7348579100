package io.synclane.lock;

import io.synclane.config.SyncSettings;

public record LockTimeouts(long heartbeatIntervalMs, long heartbeatTimeoutMs, long progressTimeoutMs) {
    public static LockTimeouts from(SyncSettings settings) {
        return new LockTimeouts(
                settings.heartbeatIntervalMs(),
                settings.heartbeatTimeoutMs(),
                settings.progressTimeoutMs()
        );
    }
}
