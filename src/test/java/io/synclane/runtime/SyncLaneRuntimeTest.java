package io.synclane.runtime;

import io.synclane.config.SyncLaneConfig;
import io.synclane.config.SyncSettings;
import io.synclane.lfs.InMemoryLfsTransport;
import io.synclane.lfs.LargeObjectReconciler;
import io.synclane.lfs.LfsStatus;
import io.synclane.lock.SyncLockManager;
import io.synclane.metadata.MetadataUpdateResult;
import io.synclane.model.AuthorIdentity;
import io.synclane.model.Credentials;
import io.synclane.model.LockState;
import io.synclane.model.PackOutcome;
import io.synclane.model.SyncLockRecord;
import io.synclane.model.SyncPhase;
import io.synclane.observability.AuditLogger;
import io.synclane.sync.SyncLockUnavailableException;
import io.synclane.util.Hashing;
import io.synclane.util.Jsons;
import io.synclane.vcs.JGitVersionControl;
import io.synclane.vcs.VersionControl;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

final class SyncLaneRuntimeTest {
    private static final AuthorIdentity AUTHOR = new AuthorIdentity("Tester", "tester@example.com");

    @Test
    void deadLockIsRemovedWhenTheRepositoryIsFirstOpened() throws Exception {
        Path repo = Files.createTempDirectory("synclane-runtime-startup-");
        try {
            Path lockFile = SyncLaneConfig.forRepository(repo).syncLockFile();
            Files.createDirectories(lockFile.getParent());
            long longAgo = System.currentTimeMillis() - 600_000L;
            SyncLockRecord dead = new SyncLockRecord("crashed", 99999L, longAgo, longAgo, longAgo,
                    SyncPhase.FETCHING, longAgo, null);
            Files.write(lockFile, Jsons.toCompactBytes(dead));

            SyncLaneRuntime runtime = runtime(new InMemoryLfsTransport());

            Assertions.assertEquals(LockState.ABSENT, runtime.checkFilesystemLock(repo).state());
            Assertions.assertFalse(Files.exists(lockFile));
            Assertions.assertTrue(runtime.acquireSyncLock(repo));
            Assertions.assertEquals(LockState.ACTIVE, runtime.checkFilesystemLock(repo).state());
            runtime.releaseSyncLock(repo);
        } finally {
            deleteRecursively(repo);
        }
    }

    @Test
    void packIsSkippedWhileAnotherProcessSyncs() throws Exception {
        Path repo = Files.createTempDirectory("synclane-runtime-pack-busy-");
        try {
            VersionControl vcs = new JGitVersionControl();
            vcs.init(repo, "main");
            SyncLockManager other = SyncLockManager.forRepository(
                    SyncLaneConfig.forRepository(repo), SyncSettings.defaults(), null, null);
            Assertions.assertTrue(other.acquire());
            try {
                PackOutcome outcome = runtime(new InMemoryLfsTransport()).packRepository(repo, true);
                Assertions.assertTrue(outcome.skippedDueToLock());
                Assertions.assertFalse(outcome.packed());
            } finally {
                other.release();
            }
        } finally {
            deleteRecursively(repo);
        }
    }

    @Test
    void packCollectsLooseObjectsAndIsAudited() throws Exception {
        Path repo = Files.createTempDirectory("synclane-runtime-pack-");
        try {
            VersionControl vcs = new JGitVersionControl();
            vcs.init(repo, "main");
            for (int i = 0; i < 3; i++) {
                Files.writeString(repo.resolve("note-" + i + ".md"), "note " + i, StandardCharsets.UTF_8);
                vcs.addAll(repo);
                vcs.commit(repo, "note " + i, AUTHOR);
            }
            SyncLaneRuntime runtime = runtime(new InMemoryLfsTransport());

            PackOutcome outcome = runtime.packRepository(repo, false);

            Assertions.assertTrue(outcome.packed());
            Assertions.assertTrue(outcome.looseObjectsBefore() > 0L);
            Assertions.assertEquals(0L, outcome.looseObjectsAfter());
            Assertions.assertTrue(outcome.packFilesAfter() >= 1L);
            Assertions.assertFalse(Files.exists(SyncLaneConfig.forRepository(repo).syncLockFile()));
            String audit = Files.readString(SyncLaneConfig.forRepository(repo).auditFile(), StandardCharsets.UTF_8);
            Assertions.assertTrue(audit.contains("\"action\":\"repo.pack\""));
        } finally {
            deleteRecursively(repo);
        }
    }

    @Test
    void metadataUpdatesAreAuditedInAnIntactChain() throws Exception {
        Path repo = Files.createTempDirectory("synclane-runtime-metadata-");
        try {
            SyncLaneRuntime runtime = runtime(new InMemoryLfsTransport());

            MetadataUpdateResult first = runtime.safeUpdateMetadata(repo, document -> {
                document.put("title", "Field notes");
                return document;
            });
            MetadataUpdateResult second = runtime.safeUpdateMetadata(repo, document -> {
                document.put("count", document.path("count").asInt(0) + 1);
                return document;
            });

            Assertions.assertTrue(first.success());
            Assertions.assertTrue(second.success());
            Assertions.assertEquals("Field notes", runtime.metadataDocument(repo).path("title").asText());
            Assertions.assertEquals(1, runtime.metadataDocument(repo).path("count").asInt());
            Path auditFile = SyncLaneConfig.forRepository(repo).auditFile();
            List<String> rows = Files.readAllLines(auditFile, StandardCharsets.UTF_8);
            Assertions.assertEquals(2, rows.stream().filter(row -> row.contains("\"action\":\"metadata.update\"")).count());
            Assertions.assertTrue(new AuditLogger(auditFile, "verifier").verifyChain());
        } finally {
            deleteRecursively(repo);
        }
    }

    @Test
    void unwritableAuditLogDoesNotFailAMetadataUpdate() throws Exception {
        Path repo = Files.createTempDirectory("synclane-runtime-audit-broken-");
        try {
            SyncLaneRuntime runtime = runtime(new InMemoryLfsTransport());
            Assertions.assertEquals(LockState.ABSENT, runtime.checkFilesystemLock(repo).state());
            Path auditFile = SyncLaneConfig.forRepository(repo).auditFile();
            Files.delete(auditFile);
            Files.createDirectories(auditFile);

            MetadataUpdateResult result = runtime.safeUpdateMetadata(repo, document -> {
                document.put("title", "Field notes");
                return document;
            });

            Assertions.assertTrue(result.success());
            Assertions.assertEquals("Field notes", runtime.metadataDocument(repo).path("title").asText());
            Assertions.assertFalse(runtime.nonFatalErrors().forOperation("audit.metadata.update").isEmpty());
        } finally {
            deleteRecursively(repo);
        }
    }

    @Test
    void trackedPatternsShowUpInLargeObjectStatus() throws Exception {
        Path repo = Files.createTempDirectory("synclane-runtime-lfs-status-");
        try {
            SyncLaneRuntime runtime = runtime(new InMemoryLfsTransport());
            Path pointer = repo.resolve(".project/attachments/pointers/raw.bin");
            Files.createDirectories(pointer.getParent());
            Files.writeString(pointer, "not a pointer", StandardCharsets.UTF_8);

            Assertions.assertTrue(runtime.trackLargeObjects(repo, "*.psd"));
            Assertions.assertFalse(runtime.trackLargeObjects(repo, "*.psd"));
            LfsStatus status = runtime.lfsStatus(repo);

            Assertions.assertTrue(status.enabled());
            Assertions.assertTrue(status.patterns().contains("*.psd"));
            Assertions.assertTrue(status.patterns().contains(".project/attachments/pointers/**"));
            Assertions.assertEquals(1, status.pointerCount());
            Assertions.assertEquals(List.of(".project/attachments/pointers/raw.bin"), status.corruptPointers());
        } finally {
            deleteRecursively(repo);
        }
    }

    @Test
    void reconcileUploadsNewPayloadsAndRespectsTheSyncLock() throws Exception {
        Path repo = Files.createTempDirectory("synclane-runtime-reconcile-");
        try {
            VersionControl vcs = new JGitVersionControl();
            vcs.init(repo, "main");
            vcs.addRemote(repo, "origin", "https://example.com/team/notes.git");
            byte[] payload = "diagram".getBytes(StandardCharsets.UTF_8);
            Path file = repo.resolve(".project/attachments/files/diagram.svg");
            Files.createDirectories(file.getParent());
            Files.write(file, payload);
            InMemoryLfsTransport server = new InMemoryLfsTransport();
            SyncLaneRuntime runtime = runtime(server);

            LargeObjectReconciler.ReconcileReport report = runtime.reconcileLargeObjects(repo, Credentials.none());

            Assertions.assertEquals(List.of(Hashing.sha256Hex(payload)), report.uploaded());
            Assertions.assertTrue(Files.exists(repo.resolve(".project/attachments/pointers/diagram.svg")));

            Assertions.assertTrue(runtime.acquireSyncLock(repo));
            try {
                Assertions.assertThrows(SyncLockUnavailableException.class,
                        () -> runtime.reconcileLargeObjects(repo, Credentials.none()));
            } finally {
                runtime.releaseSyncLock(repo);
            }
        } finally {
            deleteRecursively(repo);
        }
    }

    private static SyncLaneRuntime runtime(InMemoryLfsTransport server) {
        return new SyncLaneRuntime(new JGitVersionControl(), settings -> url -> true, settings -> (url, credentials) -> server);
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
