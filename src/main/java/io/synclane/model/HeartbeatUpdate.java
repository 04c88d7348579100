package io.synclane.model;

public record HeartbeatUpdate(SyncPhase phase, LockProgress progress, boolean madeProgress) {
    public static HeartbeatUpdate keepAlive() {
        return new HeartbeatUpdate(null, null, false);
    }

    public static HeartbeatUpdate phase(SyncPhase phase) {
        return new HeartbeatUpdate(phase, null, true);
    }

    public static HeartbeatUpdate progress(SyncPhase phase, LockProgress progress) {
        return new HeartbeatUpdate(phase, progress, true);
    }
}
