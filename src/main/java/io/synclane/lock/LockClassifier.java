package io.synclane.lock;

import io.synclane.model.LockState;
import io.synclane.model.LockStatus;
import io.synclane.model.SyncLockRecord;

public final class LockClassifier {
    private LockClassifier() {
    }

    public static LockStatus classify(LockStore.Snapshot snapshot, long nowMs, LockTimeouts timeouts) {
        if (snapshot == null) {
            return LockStatus.absent();
        }
        if (snapshot.isCorrupt()) {
            long age = snapshot.modifiedAtMs() > 0L ? Math.max(0L, nowMs - snapshot.modifiedAtMs()) : 0L;
            return new LockStatus(true, LockState.DEAD, age, age, false, true, null, null, null);
        }
        return classify(snapshot.record(), nowMs, timeouts);
    }

    public static LockStatus classify(SyncLockRecord record, long nowMs, LockTimeouts timeouts) {
        if (record == null) {
            return LockStatus.absent();
        }
        long age = Math.max(0L, nowMs - record.lastHeartbeatAt());
        long progressAge = Math.max(0L, nowMs - record.lastProgressAt());
        LockState state;
        if (age > timeouts.heartbeatTimeoutMs()) {
            state = LockState.DEAD;
        } else if (record.phase().isNetworkPhase() && progressAge > timeouts.progressTimeoutMs()) {
            state = LockState.STUCK;
        } else {
            state = LockState.ACTIVE;
        }
        return new LockStatus(
                true,
                state,
                age,
                progressAge,
                state == LockState.STUCK,
                state == LockState.DEAD,
                record.phase(),
                record.progress(),
                record.ownerId()
        );
    }
}
