package io.synclane.sync;

import java.nio.file.Path;

public final class SyncLockUnavailableException extends RuntimeException {
    public SyncLockUnavailableException(Path lockFile) {
        super("Sync already in progress (lock held at " + lockFile + ")");
    }
}
