package io.synclane.model;

public record LockStatus(
        boolean exists,
        LockState state,
        long ageMs,
        long progressAgeMs,
        boolean isStuck,
        boolean isDead,
        SyncPhase phase,
        LockProgress progress,
        String ownerId
) {
    public static LockStatus absent() {
        return new LockStatus(false, LockState.ABSENT, 0L, 0L, false, false, null, null, null);
    }

    public boolean isActive() {
        return state == LockState.ACTIVE;
    }
}
