package io.synclane.metadata;

import io.synclane.observability.NonFatalErrors;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;
import java.util.stream.Stream;

final class MetadataLockTest {

    @Test
    void lockPathThatCannotBeReadStillHonoursTheWaitDeadline() throws Exception {
        Path repo = Files.createTempDirectory("synclane-metadata-lock-vanish-");
        try {
            Path lockFile = repo.resolve(".metadata.lock");
            // Occupies the path for the create, yet reads as missing.
            Files.createSymbolicLink(lockFile, repo.resolve("gone"));

            Optional<MetadataLock> lock = Assertions.assertTimeoutPreemptively(Duration.ofSeconds(5),
                    () -> MetadataLock.tryAcquire(lockFile, "owner", 30_000L, 200L,
                            System::currentTimeMillis, new NonFatalErrors()));

            Assertions.assertTrue(lock.isEmpty());
        } finally {
            deleteRecursively(repo);
        }
    }

    @Test
    void freshLockIsAcquiredAndReleased() throws Exception {
        Path repo = Files.createTempDirectory("synclane-metadata-lock-");
        try {
            Path lockFile = repo.resolve(".metadata.lock");
            NonFatalErrors errors = new NonFatalErrors();

            Optional<MetadataLock> lock = MetadataLock.tryAcquire(lockFile, "owner", 30_000L, 0L,
                    System::currentTimeMillis, errors);
            Assertions.assertTrue(lock.isPresent());
            Assertions.assertTrue(MetadataLock.tryAcquire(lockFile, "other", 30_000L, 0L,
                    System::currentTimeMillis, errors).isEmpty());

            lock.get().close();
            Assertions.assertFalse(Files.exists(lockFile));
        } finally {
            deleteRecursively(repo);
        }
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
