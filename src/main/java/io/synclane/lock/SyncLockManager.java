package io.synclane.lock;

import io.synclane.config.SyncLaneConfig;
import io.synclane.config.SyncSettings;
import io.synclane.model.HeartbeatUpdate;
import io.synclane.model.LockState;
import io.synclane.model.LockStatus;
import io.synclane.model.SyncLockRecord;
import io.synclane.observability.AuditLogger;
import io.synclane.observability.NonFatalErrors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.LongSupplier;

/**
 * Acquire/heartbeat/release protocol for the sync lock of one repository. One instance is created
 * per repository path and shared by every operation on it.
 */
public final class SyncLockManager {
    private static final Logger logger = LoggerFactory.getLogger(SyncLockManager.class);

    private final LockStore store;
    private final String ownerId;
    private final long pid;
    private final LockTimeouts timeouts;
    private final LongSupplier clock;
    private final NonFatalErrors nonFatalErrors;
    private final AuditLogger auditLogger;
    private volatile boolean held;

    public SyncLockManager(
            LockStore store,
            String ownerId,
            LockTimeouts timeouts,
            LongSupplier clock,
            NonFatalErrors nonFatalErrors,
            AuditLogger auditLogger
    ) {
        this.store = store;
        this.ownerId = ownerId;
        this.pid = ProcessHandle.current().pid();
        this.timeouts = timeouts;
        this.clock = clock == null ? System::currentTimeMillis : clock;
        this.nonFatalErrors = nonFatalErrors == null ? new NonFatalErrors() : nonFatalErrors;
        this.auditLogger = auditLogger;
    }

    public static SyncLockManager forRepository(
            SyncLaneConfig config,
            SyncSettings settings,
            NonFatalErrors nonFatalErrors,
            AuditLogger auditLogger
    ) {
        return new SyncLockManager(
                new LockStore(config.syncLockFile()),
                newOwnerId(),
                LockTimeouts.from(settings),
                System::currentTimeMillis,
                nonFatalErrors,
                auditLogger
        );
    }

    public static String newOwnerId() {
        String host;
        try {
            host = InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            host = "localhost";
        }
        return ProcessHandle.current().pid() + "@" + host + "#" + UUID.randomUUID().toString().substring(0, 8);
    }

    public String ownerId() {
        return ownerId;
    }

    public Path lockFile() {
        return store.lockFile();
    }

    public LockTimeouts timeouts() {
        return timeouts;
    }

    public boolean isHeld() {
        return held;
    }

    public synchronized boolean acquire() {
        if (held) {
            return false;
        }
        try {
            return tryAcquire(true);
        } catch (IOException e) {
            throw new RuntimeException("Failed to acquire sync lock: " + store.lockFile(), e);
        }
    }

    private boolean tryAcquire(boolean allowCleanupRetry) throws IOException {
        Optional<LockStore.Snapshot> current = store.read();
        if (current.isPresent()) {
            LockStatus status = LockClassifier.classify(current.get(), clock.getAsLong(), timeouts);
            if (status.state() != LockState.DEAD) {
                logger.info("Sync lock {} is {} (owner {}, phase {})",
                        store.lockFile(), status.state().wireName(), status.ownerId(), status.phase());
                return false;
            }
            removeStale(current.get(), status);
        }
        SyncLockRecord record = SyncLockRecord.fresh(ownerId, pid, clock.getAsLong());
        if (store.create(record)) {
            held = true;
            logger.info("Acquired sync lock {} as {}", store.lockFile(), ownerId);
            audit("lock.acquire", "ok", Map.of("owner", ownerId));
            return true;
        }
        // Lost the create race; only a dead winner justifies one more attempt.
        if (allowCleanupRetry) {
            Optional<LockStore.Snapshot> winner = store.read();
            if (winner.isEmpty()) {
                return tryAcquire(false);
            }
            LockStatus status = LockClassifier.classify(winner.get(), clock.getAsLong(), timeouts);
            if (status.state() == LockState.DEAD) {
                return tryAcquire(false);
            }
        }
        return false;
    }

    /**
     * Merges a heartbeat into the held record. Never throws: a failed heartbeat write is reported to
     * the non-fatal channel and the caller carries on.
     */
    public synchronized void updateHeartbeat(HeartbeatUpdate update) {
        if (!held) {
            nonFatalErrors.record("lock.heartbeat", "No sync lock held by " + ownerId);
            return;
        }
        try {
            Optional<LockStore.Snapshot> current = store.read();
            if (current.isEmpty() || current.get().isCorrupt() || !ownerId.equals(current.get().record().ownerId())) {
                held = false;
                nonFatalErrors.record("lock.heartbeat", "Sync lock " + store.lockFile() + " is no longer owned by " + ownerId);
                return;
            }
            SyncLockRecord next = current.get().record().merge(update, clock.getAsLong());
            if (!store.replaceOwned(next)) {
                held = false;
                nonFatalErrors.record("lock.heartbeat", "Sync lock " + store.lockFile() + " was taken over before heartbeat of " + ownerId);
                return;
            }
            if (update.phase() != null && update.phase() != current.get().record().phase()) {
                logger.debug("Sync phase {} -> {}", current.get().record().phase().wireName(), next.phase().wireName());
            }
        } catch (IOException | RuntimeException e) {
            nonFatalErrors.record("lock.heartbeat", e);
        }
    }

    public LockStatus checkStatus() {
        try {
            return LockClassifier.classify(store.read().orElse(null), clock.getAsLong(), timeouts);
        } catch (IOException e) {
            throw new RuntimeException("Failed to read sync lock: " + store.lockFile(), e);
        }
    }

    /**
     * Deletes the record if this manager owns it. Safe to call repeatedly.
     */
    public synchronized void release() {
        if (!held) {
            return;
        }
        held = false;
        try {
            Optional<LockStore.Snapshot> current = store.read();
            if (current.isPresent() && !current.get().isCorrupt()
                    && ownerId.equals(current.get().record().ownerId())) {
                store.delete(current.get());
                logger.info("Released sync lock {}", store.lockFile());
                audit("lock.release", "ok", Map.of("owner", ownerId));
            } else {
                nonFatalErrors.record("lock.release", "Sync lock " + store.lockFile() + " no longer owned by " + ownerId);
            }
        } catch (IOException e) {
            nonFatalErrors.record("lock.release", e);
        }
    }

    /**
     * Removes the record only when it is dead.
     *
     * @return true if a dead record was removed
     */
    public synchronized boolean cleanupStale() {
        try {
            Optional<LockStore.Snapshot> current = store.read();
            if (current.isEmpty()) {
                return false;
            }
            LockStatus status = LockClassifier.classify(current.get(), clock.getAsLong(), timeouts);
            if (status.state() != LockState.DEAD) {
                return false;
            }
            return removeStale(current.get(), status);
        } catch (IOException | RuntimeException e) {
            nonFatalErrors.record("lock.cleanup", e);
            return false;
        }
    }

    /**
     * Removes a stuck or dead record on explicit request. An active record is never removed.
     */
    public synchronized boolean forceReclaim() {
        try {
            Optional<LockStore.Snapshot> current = store.read();
            if (current.isEmpty()) {
                return false;
            }
            LockStatus status = LockClassifier.classify(current.get(), clock.getAsLong(), timeouts);
            if (status.state() == LockState.ACTIVE) {
                return false;
            }
            boolean removed = store.delete(current.get());
            if (removed) {
                logger.warn("Force-reclaimed {} sync lock held by {}", status.state().wireName(), status.ownerId());
                audit("lock.force_reclaim", status.state().wireName(), describe(status));
            }
            return removed;
        } catch (IOException e) {
            throw new RuntimeException("Failed to reclaim sync lock: " + store.lockFile(), e);
        }
    }

    private boolean removeStale(LockStore.Snapshot snapshot, LockStatus status) {
        try {
            boolean removed = store.delete(snapshot);
            if (removed) {
                logger.info("Removed dead sync lock {} (owner {}, silent for {} ms)",
                        store.lockFile(), status.ownerId(), status.ageMs());
                audit("lock.stale_recovered", "ok", describe(status));
            }
            return removed;
        } catch (IOException e) {
            nonFatalErrors.record("lock.cleanup", e);
            return false;
        }
    }

    private Map<String, Object> describe(LockStatus status) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("previous_owner", status.ownerId() == null ? "" : status.ownerId());
        details.put("age_ms", status.ageMs());
        details.put("progress_age_ms", status.progressAgeMs());
        details.put("phase", status.phase() == null ? "" : status.phase().wireName());
        return details;
    }

    private void audit(String action, String result, Map<String, Object> details) {
        if (auditLogger == null) {
            return;
        }
        try {
            auditLogger.log(AuditLogger.AuditEvent.of(action, store.lockFile().toString(), result, details));
        } catch (RuntimeException e) {
            nonFatalErrors.record("audit." + action, e);
        }
    }
}
