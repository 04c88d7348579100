package io.synclane.config;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

public final class SyncLaneConfig {
    public static final String DEFAULT_REMOTE = "origin";
    public static final String CONTROL_DIR = ".git";
    public static final String SYNC_LOCK_FILE = "synclane-sync.lock";
    public static final String STATE_DIR = "synclane";
    public static final String METADATA_FILE = "metadata.json";
    public static final String METADATA_LOCK_FILE = ".metadata.lock";
    public static final String METADATA_BACKUP_FILE = ".metadata.json.backup";
    public static final String METADATA_TEMP_FILE = ".metadata.json.tmp";
    public static final String DEFAULT_POINTER_PREFIX = ".project/attachments/pointers";
    public static final String DEFAULT_PAYLOAD_PREFIX = ".project/attachments/files";
    public static final long DEFAULT_HEARTBEAT_INTERVAL_MS = 15_000L;
    public static final long DEFAULT_HEARTBEAT_TIMEOUT_MS = 45_000L;
    public static final long DEFAULT_PROGRESS_TIMEOUT_MS = 120_000L;
    public static final long DEFAULT_METADATA_LOCK_TIMEOUT_MS = 30_000L;
    public static final long DEFAULT_METADATA_ACQUIRE_WAIT_MS = 2_000L;
    public static final int DEFAULT_METADATA_MAX_RETRIES = 5;
    public static final long DEFAULT_METADATA_RETRY_DELAY_MS = 100L;
    public static final int DEFAULT_TRANSFER_MAX_ATTEMPTS = 3;
    public static final long DEFAULT_TRANSFER_BASE_BACKOFF_MS = 500L;
    public static final long DEFAULT_TRANSFER_MAX_BACKOFF_MS = 8_000L;
    public static final int DEFAULT_PUSH_MAX_ATTEMPTS = 3;
    public static final long DEFAULT_CONNECT_TIMEOUT_MS = 5_000L;

    private final Path repoDir;

    public SyncLaneConfig(Path repoDir) {
        this.repoDir = repoDir;
    }

    public static SyncLaneConfig forRepository(Path repoDir) {
        return new SyncLaneConfig(repoDir.toAbsolutePath().normalize());
    }

    public static SyncLaneConfig fromRoot(String root) {
        Path resolved = root == null || root.isBlank()
                ? Paths.get(".")
                : Paths.get(root);
        return forRepository(resolved);
    }

    public Path repoDir() {
        return repoDir;
    }

    public Path controlDir() {
        return repoDir.resolve(CONTROL_DIR);
    }

    public Path syncLockFile() {
        return controlDir().resolve(SYNC_LOCK_FILE);
    }

    public Path stateDir() {
        return controlDir().resolve(STATE_DIR);
    }

    public Path auditFile() {
        return stateDir().resolve("audit.log");
    }

    public Path settingsFile() {
        return stateDir().resolve("settings.json");
    }

    public Path excludeFile() {
        return controlDir().resolve("info").resolve("exclude");
    }

    public Path metadataFile() {
        return repoDir.resolve(METADATA_FILE);
    }

    public Path metadataLockFile() {
        return repoDir.resolve(METADATA_LOCK_FILE);
    }

    public Path metadataBackupFile() {
        return repoDir.resolve(METADATA_BACKUP_FILE);
    }

    public Path metadataTempFile() {
        return repoDir.resolve(METADATA_TEMP_FILE);
    }

    /**
     * Working-tree files that belong to one process at a time and must never be committed.
     */
    public static List<String> processLocalFiles() {
        return List.of(METADATA_LOCK_FILE, METADATA_TEMP_FILE, METADATA_BACKUP_FILE);
    }

    public Path gitAttributesFile() {
        return repoDir.resolve(".gitattributes");
    }
}
