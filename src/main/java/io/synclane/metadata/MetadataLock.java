package io.synclane.metadata;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.synclane.model.MetadataLockRecord;
import io.synclane.observability.NonFatalErrors;
import io.synclane.storage.LockFiles;
import io.synclane.util.Jsons;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Optional;
import java.util.function.LongSupplier;

/**
 * Short-lived exclusive lock around one metadata update. Closing it removes the lock file only if
 * the file still carries this holder's record.
 */
final class MetadataLock implements AutoCloseable {
    private static final long POLL_INTERVAL_MS = 50L;

    private final Path lockFile;
    private final byte[] content;
    private final NonFatalErrors nonFatalErrors;

    private MetadataLock(Path lockFile, byte[] content, NonFatalErrors nonFatalErrors) {
        this.lockFile = lockFile;
        this.content = content;
        this.nonFatalErrors = nonFatalErrors;
    }

    static Optional<MetadataLock> tryAcquire(
            Path lockFile,
            String ownerId,
            long staleAfterMs,
            long waitMs,
            LongSupplier clock,
            NonFatalErrors nonFatalErrors
    ) throws IOException, InterruptedException {
        long deadline = clock.getAsLong() + waitMs;
        while (true) {
            long now = clock.getAsLong();
            byte[] content = Jsons.toCompactBytes(new MetadataLockRecord(ownerId, now, ProcessHandle.current().pid()));
            if (LockFiles.createExclusive(lockFile, content)) {
                return Optional.of(new MetadataLock(lockFile, content, nonFatalErrors));
            }
            Optional<byte[]> existing = LockFiles.readIfExists(lockFile);
            if (existing.isPresent() && isStale(existing.get(), now, staleAfterMs)
                    && LockFiles.deleteIfMatches(lockFile, existing.get())) {
                nonFatalErrors.record("metadata.lock", "Replaced stale metadata lock " + lockFile);
                continue;
            }
            if (clock.getAsLong() >= deadline) {
                return Optional.empty();
            }
            Thread.sleep(POLL_INTERVAL_MS);
        }
    }

    private static boolean isStale(byte[] raw, long now, long staleAfterMs) {
        try {
            MetadataLockRecord record = Jsons.mapper().readValue(raw, MetadataLockRecord.class);
            return record == null || now - record.timestamp() > staleAfterMs;
        } catch (JsonProcessingException e) {
            return true;
        } catch (IOException e) {
            throw new RuntimeException("Failed to parse metadata lock", e);
        }
    }

    @Override
    public void close() {
        try {
            if (!LockFiles.deleteIfMatches(lockFile, content)) {
                nonFatalErrors.record("metadata.unlock", "Metadata lock " + lockFile + " was taken over before release");
            }
        } catch (IOException e) {
            nonFatalErrors.record("metadata.unlock", e);
        }
    }
}
