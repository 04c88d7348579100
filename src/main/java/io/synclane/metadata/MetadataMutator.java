package io.synclane.metadata;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.synclane.config.SyncLaneConfig;
import io.synclane.config.SyncSettings;
import io.synclane.observability.NonFatalErrors;
import io.synclane.storage.LockFiles;
import io.synclane.util.Jsons;
import io.synclane.util.Versions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.LongSupplier;
import java.util.function.UnaryOperator;

/**
 * Read-modify-write of the shared {@code metadata.json} under its own lock file, with a backup and
 * an atomic rename so other processes only ever see a complete document.
 */
public final class MetadataMutator {
    private static final Logger logger = LoggerFactory.getLogger(MetadataMutator.class);
    static final String REQUIRED_VERSIONS_FIELD = "requiredVersions";

    private final SyncSettings settings;
    private final String ownerId;
    private final NonFatalErrors nonFatalErrors;
    private final LongSupplier clock;
    private final FileMover mover;

    public MetadataMutator(SyncSettings settings, String ownerId, NonFatalErrors nonFatalErrors) {
        this(settings, ownerId, nonFatalErrors, System::currentTimeMillis, LockFiles::moveReplacing);
    }

    MetadataMutator(
            SyncSettings settings,
            String ownerId,
            NonFatalErrors nonFatalErrors,
            LongSupplier clock,
            FileMover mover
    ) {
        this.settings = settings;
        this.ownerId = ownerId;
        this.nonFatalErrors = nonFatalErrors == null ? new NonFatalErrors() : nonFatalErrors;
        this.clock = clock;
        this.mover = mover;
    }

    public MetadataUpdateResult safeUpdate(Path repoDir, UnaryOperator<ObjectNode> transform) {
        SyncLaneConfig config = SyncLaneConfig.forRepository(repoDir);
        int maxAttempts = settings.metadataMaxRetries();
        MetadataUpdateResult last = null;
        for (int attempt = 0; attempt < maxAttempts; attempt++) {
            int attempts = attempt + 1;
            try (MetadataLock lock = acquire(config).orElse(null)) {
                if (lock == null) {
                    last = MetadataUpdateResult.failed(MetadataError.LOCK_UNAVAILABLE,
                            "Metadata lock " + config.metadataLockFile() + " is held by another process", attempts);
                } else {
                    last = updateLocked(config, transform, attempts);
                    if (last.success() || last.error() != MetadataError.TRANSFORM_FAILED) {
                        return last;
                    }
                }
            } catch (IOException e) {
                nonFatalErrors.record("metadata.lock", e);
                last = MetadataUpdateResult.failed(MetadataError.LOCK_UNAVAILABLE,
                        "Failed to acquire metadata lock: " + e.getMessage(), attempts);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return MetadataUpdateResult.failed(MetadataError.LOCK_UNAVAILABLE,
                        "Interrupted while waiting for metadata lock", attempts);
            }
            logger.debug("{} (attempt {}/{})", last.message(), attempts, maxAttempts);
            backoff(attempt);
        }
        return MetadataUpdateResult.failed(last.error(),
                "Failed to update metadata after " + maxAttempts + " attempts: " + last.message(), maxAttempts);
    }

    private MetadataUpdateResult updateLocked(SyncLaneConfig config, UnaryOperator<ObjectNode> transform, int attempts) {
        ObjectNode current;
        try {
            current = readFile(config.metadataFile());
        } catch (MetadataCorruptionException e) {
            logger.warn(e.getMessage());
            return MetadataUpdateResult.failed(MetadataError.METADATA_CORRUPTION, e.getMessage(), attempts);
        }
        ObjectNode updated;
        try {
            updated = transform.apply(current);
        } catch (RuntimeException e) {
            return MetadataUpdateResult.failed(MetadataError.TRANSFORM_FAILED,
                    "Metadata transform failed: " + e.getMessage(), attempts);
        }
        if (updated == null) {
            return MetadataUpdateResult.failed(MetadataError.TRANSFORM_FAILED,
                    "Metadata transform returned no document", attempts);
        }
        Optional<String> writeProblem = writeAtomically(config, updated);
        if (writeProblem.isPresent()) {
            return MetadataUpdateResult.failed(MetadataError.ATOMIC_WRITE_FAILURE, writeProblem.get(), attempts);
        }
        return MetadataUpdateResult.ok(updated, attempts);
    }

    /**
     * Reads {@code metadata.json}; an absent file is an empty document.
     */
    public ObjectNode readDocument(Path repoDir) {
        return readFile(SyncLaneConfig.forRepository(repoDir).metadataFile());
    }

    /**
     * Raises the recorded minimum version of each component. A lower version than the recorded one
     * is ignored.
     */
    public MetadataUpdateResult updateRequiredVersions(Path repoDir, Map<String, String> versions) {
        return safeUpdate(repoDir, document -> {
            ObjectNode meta = document.has("meta") && document.get("meta").isObject()
                    ? (ObjectNode) document.get("meta")
                    : document.putObject("meta");
            ObjectNode required = meta.has(REQUIRED_VERSIONS_FIELD) && meta.get(REQUIRED_VERSIONS_FIELD).isObject()
                    ? (ObjectNode) meta.get(REQUIRED_VERSIONS_FIELD)
                    : meta.putObject(REQUIRED_VERSIONS_FIELD);
            versions.forEach((component, version) -> {
                String recorded = required.path(component).asText("");
                if (recorded.isBlank() || Versions.compare(version, recorded) > 0) {
                    required.put(component, version);
                }
            });
            return document;
        });
    }

    public Map<String, String> requiredVersions(Path repoDir) {
        return requiredVersions(readDocument(repoDir));
    }

    public static Map<String, String> requiredVersions(JsonNode document) {
        Map<String, String> out = new LinkedHashMap<>();
        JsonNode required = document == null ? null : document.path("meta").path(REQUIRED_VERSIONS_FIELD);
        if (required == null || !required.isObject()) {
            return out;
        }
        Iterator<Map.Entry<String, JsonNode>> it = required.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> entry = it.next();
            if (entry.getValue().isTextual()) {
                out.put(entry.getKey(), entry.getValue().asText());
            }
        }
        return out;
    }

    public static ObjectNode parseDocument(byte[] raw, String source) {
        try {
            JsonNode node = Jsons.mapper().readTree(raw);
            if (node == null || node.isMissingNode()) {
                return Jsons.mapper().createObjectNode();
            }
            if (!node.isObject()) {
                throw new MetadataCorruptionException("Invalid JSON in " + source + ": top-level value is not an object", null);
            }
            return (ObjectNode) node;
        } catch (JsonProcessingException e) {
            throw new MetadataCorruptionException("Invalid JSON in " + source + ": " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new RuntimeException("Failed to parse " + source, e);
        }
    }

    private static ObjectNode readFile(Path file) {
        try {
            return parseDocument(Files.readAllBytes(file), file.getFileName().toString());
        } catch (NoSuchFileException e) {
            return Jsons.mapper().createObjectNode();
        } catch (IOException e) {
            throw new RuntimeException("Failed to read " + file, e);
        }
    }

    private Optional<MetadataLock> acquire(SyncLaneConfig config) throws IOException, InterruptedException {
        return MetadataLock.tryAcquire(
                config.metadataLockFile(),
                ownerId,
                settings.metadataLockTimeoutMs(),
                settings.metadataAcquireWaitMs(),
                clock,
                nonFatalErrors
        );
    }

    private Optional<String> writeAtomically(SyncLaneConfig config, ObjectNode document) {
        Path real = config.metadataFile();
        Path temp = config.metadataTempFile();
        Path backup = config.metadataBackupFile();
        boolean hadOriginal = Files.exists(real);
        try {
            if (hadOriginal) {
                Files.copy(real, backup, StandardCopyOption.REPLACE_EXISTING);
            }
            Files.write(temp, Jsons.mapper().writeValueAsBytes(document),
                    StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE);
            parseDocument(Files.readAllBytes(temp), temp.getFileName().toString());
            mover.move(temp, real);
            Files.deleteIfExists(backup);
            return Optional.empty();
        } catch (IOException | RuntimeException e) {
            logger.warn("Metadata write failed, rolling back: {}", e.getMessage());
            rollback(real, temp, backup, hadOriginal);
            return Optional.of("Failed to write metadata.json: " + e.getMessage());
        }
    }

    private void rollback(Path real, Path temp, Path backup, boolean hadOriginal) {
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            nonFatalErrors.record("metadata.rollback", e);
        }
        if (!hadOriginal) {
            return;
        }
        try {
            if (!isReadable(real)) {
                Files.copy(backup, real, StandardCopyOption.REPLACE_EXISTING);
                logger.info("Restored {} from backup", real);
            }
            Files.deleteIfExists(backup);
        } catch (IOException e) {
            nonFatalErrors.record("metadata.rollback", e);
        }
    }

    private static boolean isReadable(Path file) {
        try {
            parseDocument(Files.readAllBytes(file), file.getFileName().toString());
            return true;
        } catch (IOException | RuntimeException e) {
            return false;
        }
    }

    private void backoff(int attempt) {
        long delay = settings.metadataRetryDelayMs() * (attempt + 1L);
        if (delay <= 0L) {
            return;
        }
        try {
            Thread.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    @FunctionalInterface
    interface FileMover {
        void move(Path source, Path target) throws IOException;
    }
}
