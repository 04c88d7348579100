package io.synclane.lock;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.synclane.model.SyncLockRecord;
import io.synclane.storage.LockFiles;
import io.synclane.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Reads and writes the single sync lock record of one repository. No liveness decisions are made
 * here.
 */
public final class LockStore {
    private final Path lockFile;

    public LockStore(Path lockFile) {
        this.lockFile = lockFile;
    }

    public Path lockFile() {
        return lockFile;
    }

    public Optional<Snapshot> read() throws IOException {
        Optional<byte[]> raw = LockFiles.readIfExists(lockFile);
        if (raw.isEmpty()) {
            return Optional.empty();
        }
        long modifiedAt;
        try {
            modifiedAt = Files.getLastModifiedTime(lockFile).toMillis();
        } catch (NoSuchFileException e) {
            modifiedAt = 0L;
        }
        return Optional.of(new Snapshot(raw.get(), parse(raw.get()), modifiedAt));
    }

    public boolean create(SyncLockRecord record) throws IOException {
        return LockFiles.createExclusive(lockFile, Jsons.toCompactBytes(record));
    }

    /**
     * Writes {@code record} only while the file on disk still belongs to the record's owner.
     *
     * @return false when the lock was removed or taken over
     */
    public boolean replaceOwned(SyncLockRecord record) throws IOException {
        String owner = record.ownerId();
        return LockFiles.replaceIf(lockFile, raw -> {
            SyncLockRecord current = parse(raw);
            return current != null && owner.equals(current.ownerId());
        }, Jsons.toCompactBytes(record));
    }

    public boolean delete(Snapshot expected) throws IOException {
        return LockFiles.deleteIfMatches(lockFile, expected.raw());
    }

    private static SyncLockRecord parse(byte[] raw) {
        if (raw.length == 0) {
            return null;
        }
        try {
            SyncLockRecord record = Jsons.mapper().readValue(raw, SyncLockRecord.class);
            if (record == null || record.ownerId() == null || record.ownerId().isBlank()) {
                return null;
            }
            return record;
        } catch (JsonProcessingException e) {
            return null;
        } catch (IOException e) {
            throw new RuntimeException("Failed to parse sync lock record", e);
        }
    }

    /**
     * Raw bytes of the lock file as read, with the parsed record or {@code null} when the content is
     * not a valid record.
     */
    public record Snapshot(byte[] raw, SyncLockRecord record, long modifiedAtMs) {
        public boolean isCorrupt() {
            return record == null;
        }
    }
}
