package io.synclane.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SyncLockRecord(
        String ownerId,
        long pid,
        long acquiredAt,
        long lastHeartbeatAt,
        long lastProgressAt,
        SyncPhase phase,
        long phaseChangedAt,
        LockProgress progress
) {
    public SyncLockRecord {
        phase = phase == null ? SyncPhase.IDLE : phase;
    }

    public static SyncLockRecord fresh(String ownerId, long pid, long nowMs) {
        return new SyncLockRecord(ownerId, pid, nowMs, nowMs, nowMs, SyncPhase.IDLE, nowMs, null);
    }

    /**
     * Applies a heartbeat. Timestamps never move backwards and {@code phaseChangedAt} only moves when
     * the phase actually changes.
     */
    public SyncLockRecord merge(HeartbeatUpdate update, long nowMs) {
        long heartbeat = Math.max(lastHeartbeatAt, nowMs);
        long progressAt = update.madeProgress() ? Math.max(lastProgressAt, nowMs) : lastProgressAt;
        SyncPhase nextPhase = update.phase() == null ? phase : update.phase();
        boolean phaseChanged = nextPhase != phase;
        long changedAt = phaseChanged ? Math.max(phaseChangedAt, nowMs) : phaseChangedAt;
        LockProgress nextProgress = update.progress() != null
                ? update.progress()
                : phaseChanged ? null : progress;
        return new SyncLockRecord(ownerId, pid, acquiredAt, heartbeat, progressAt, nextPhase, changedAt, nextProgress);
    }
}
