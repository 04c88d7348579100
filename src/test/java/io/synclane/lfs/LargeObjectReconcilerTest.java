package io.synclane.lfs;

import io.synclane.config.SyncSettings;
import io.synclane.model.PointerRecord;
import io.synclane.model.TransferDirection;
import io.synclane.model.TransferFailure;
import io.synclane.observability.NonFatalErrors;
import io.synclane.util.Hashing;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Stream;

final class LargeObjectReconcilerTest {
    private static final String POINTERS = ".project/attachments/pointers";
    private static final String FILES = ".project/attachments/files";

    @Test
    void emptyPointerIsRegeneratedWithoutUpload() throws Exception {
        Path repo = Files.createTempDirectory("synclane-lfs-recover-");
        try {
            byte[] payload = "scanned page".getBytes(StandardCharsets.UTF_8);
            write(repo.resolve(FILES + "/scans/page1.png"), payload);
            write(repo.resolve(POINTERS + "/scans/page1.png"), new byte[0]);
            InMemoryLfsTransport server = new InMemoryLfsTransport();

            LargeObjectReconciler.ReconcileReport report = reconciler(server).reconcile(repo, Set.of());

            Assertions.assertEquals(List.of(POINTERS + "/scans/page1.png"), report.recoveredPointers());
            Assertions.assertTrue(report.rewrittenPointers().isEmpty());
            Assertions.assertEquals(0, server.batchCalls());
            Assertions.assertEquals(0, server.uploads());
            Optional<PointerRecord> pointer = PointerFiles.parse(Files.readAllBytes(repo.resolve(POINTERS + "/scans/page1.png")));
            Assertions.assertTrue(pointer.isPresent());
            Assertions.assertEquals(Hashing.sha256Hex(payload), pointer.get().oid());
            Assertions.assertEquals(payload.length, pointer.get().size());
        } finally {
            deleteRecursively(repo);
        }
    }

    @Test
    void newPayloadGetsPointerAndIsUploaded() throws Exception {
        Path repo = Files.createTempDirectory("synclane-lfs-upload-");
        try {
            byte[] payload = "raw audio".getBytes(StandardCharsets.UTF_8);
            write(repo.resolve(FILES + "/audio/take1.wav"), payload);
            InMemoryLfsTransport server = new InMemoryLfsTransport();

            LargeObjectReconciler.ReconcileReport report = reconciler(server).reconcile(repo, Set.of());

            String oid = Hashing.sha256Hex(payload);
            Assertions.assertEquals(List.of(POINTERS + "/audio/take1.wav"), report.rewrittenPointers());
            Assertions.assertEquals(List.of(oid), report.uploaded());
            Assertions.assertArrayEquals(payload, server.get(oid));
            Assertions.assertTrue(report.failures().isEmpty());
        } finally {
            deleteRecursively(repo);
        }
    }

    @Test
    void alreadyPresentObjectIsSkippedOnUpload() throws Exception {
        Path repo = Files.createTempDirectory("synclane-lfs-skip-");
        try {
            byte[] payload = "shared".getBytes(StandardCharsets.UTF_8);
            String oid = Hashing.sha256Hex(payload);
            write(repo.resolve(FILES + "/a.bin"), payload);
            write(repo.resolve(POINTERS + "/a.bin"), pointerBytes(oid, payload.length));
            InMemoryLfsTransport server = new InMemoryLfsTransport();
            server.put(oid, payload);

            LargeObjectReconciler.ReconcileReport report = reconciler(server).reconcile(repo, Set.of(POINTERS + "/a.bin"));

            Assertions.assertEquals(List.of(oid), report.skipped());
            Assertions.assertEquals(0, server.uploads());
        } finally {
            deleteRecursively(repo);
        }
    }

    @Test
    void missingPayloadsAreDownloadedToEveryPointerPath() throws Exception {
        Path repo = Files.createTempDirectory("synclane-lfs-download-");
        try {
            byte[] payload = "photo bytes".getBytes(StandardCharsets.UTF_8);
            String oid = Hashing.sha256Hex(payload);
            write(repo.resolve(POINTERS + "/one.jpg"), pointerBytes(oid, payload.length));
            write(repo.resolve(POINTERS + "/copy/two.jpg"), pointerBytes(oid, payload.length));
            InMemoryLfsTransport server = new InMemoryLfsTransport();
            server.put(oid, payload);

            LargeObjectReconciler reconciler = reconciler(server);
            Assertions.assertEquals(2, reconciler.scanMissingPayloads(repo).missing().size());
            LargeObjectReconciler.ReconcileReport report = reconciler.reconcile(repo, Set.of());

            Assertions.assertEquals(List.of(oid), report.downloaded());
            Assertions.assertEquals(1, server.downloads());
            Assertions.assertArrayEquals(payload, Files.readAllBytes(repo.resolve(FILES + "/one.jpg")));
            Assertions.assertArrayEquals(payload, Files.readAllBytes(repo.resolve(FILES + "/copy/two.jpg")));
            Assertions.assertTrue(reconciler.scanMissingPayloads(repo).missing().isEmpty());
        } finally {
            deleteRecursively(repo);
        }
    }

    @Test
    void transientFailuresAreRetried() throws Exception {
        Path repo = Files.createTempDirectory("synclane-lfs-retry-");
        try {
            byte[] payload = "flaky".getBytes(StandardCharsets.UTF_8);
            String oid = Hashing.sha256Hex(payload);
            write(repo.resolve(POINTERS + "/f.bin"), pointerBytes(oid, payload.length));
            InMemoryLfsTransport server = new InMemoryLfsTransport();
            server.put(oid, payload);
            server.failNext(oid, TransferException.forStatus("Download", 503));
            server.failNext(oid, new TransferException("connection reset", new IOException("reset")));

            LargeObjectReconciler.ReconcileReport report = reconciler(server).reconcile(repo, Set.of());

            Assertions.assertEquals(3, server.downloads());
            Assertions.assertEquals(List.of(oid), report.downloaded());
            Assertions.assertTrue(report.failures().isEmpty());
        } finally {
            deleteRecursively(repo);
        }
    }

    @Test
    void permanentFailureIsRecordedAndOthersContinue() throws Exception {
        Path repo = Files.createTempDirectory("synclane-lfs-failure-");
        try {
            byte[] denied = "denied".getBytes(StandardCharsets.UTF_8);
            byte[] fine = "fine".getBytes(StandardCharsets.UTF_8);
            String deniedOid = Hashing.sha256Hex(denied);
            String fineOid = Hashing.sha256Hex(fine);
            write(repo.resolve(POINTERS + "/denied.bin"), pointerBytes(deniedOid, denied.length));
            write(repo.resolve(POINTERS + "/fine.bin"), pointerBytes(fineOid, fine.length));
            InMemoryLfsTransport server = new InMemoryLfsTransport();
            server.put(deniedOid, denied);
            server.put(fineOid, fine);
            server.failNext(deniedOid, TransferException.forStatus("Download", 403));

            LargeObjectReconciler.ReconcileReport report = reconciler(server).reconcile(repo, Set.of());

            Assertions.assertEquals(1, report.failures().size());
            TransferFailure failure = report.failures().get(0);
            Assertions.assertEquals(deniedOid, failure.oid());
            Assertions.assertEquals(TransferDirection.DOWNLOAD, failure.direction());
            Assertions.assertEquals(1, failure.attempts());
            Assertions.assertEquals(List.of(fineOid), report.downloaded());
            Assertions.assertFalse(Files.exists(repo.resolve(FILES + "/denied.bin")));
        } finally {
            deleteRecursively(repo);
        }
    }

    @Test
    void mismatchedDownloadIsRejected() throws Exception {
        Path repo = Files.createTempDirectory("synclane-lfs-verify-");
        try {
            byte[] expected = "expected".getBytes(StandardCharsets.UTF_8);
            String oid = Hashing.sha256Hex(expected);
            write(repo.resolve(POINTERS + "/x.bin"), pointerBytes(oid, expected.length));
            InMemoryLfsTransport server = new InMemoryLfsTransport();
            server.put(oid, "tampered".getBytes(StandardCharsets.UTF_8));

            LargeObjectReconciler.ReconcileReport report = reconciler(server).reconcile(repo, Set.of());

            Assertions.assertEquals(1, report.failures().size());
            Assertions.assertFalse(Files.exists(repo.resolve(FILES + "/x.bin")));
            Assertions.assertFalse(Files.exists(repo.resolve(FILES + "/x.bin.download")));
        } finally {
            deleteRecursively(repo);
        }
    }

    @Test
    void sameSizeRemoteUpdateReplacesStalePayload() throws Exception {
        Path repo = Files.createTempDirectory("synclane-lfs-update-");
        try {
            byte[] stale = "version one".getBytes(StandardCharsets.UTF_8);
            byte[] current = "version two".getBytes(StandardCharsets.UTF_8);
            String oid = Hashing.sha256Hex(current);
            write(repo.resolve(FILES + "/photo.jpg"), stale);
            write(repo.resolve(POINTERS + "/photo.jpg"), pointerBytes(oid, current.length));
            InMemoryLfsTransport server = new InMemoryLfsTransport();
            server.put(oid, current);
            LargeObjectReconciler reconciler = reconciler(server);

            Assertions.assertEquals(Set.of(oid), reconciler.scanMissingPayloads(repo).missingOids());
            LargeObjectReconciler.ReconcileReport report = reconciler.reconcile(repo, Set.of());

            Assertions.assertEquals(List.of(oid), report.downloaded());
            Assertions.assertTrue(report.rewrittenPointers().isEmpty());
            Assertions.assertEquals(0, server.uploads());
            Assertions.assertArrayEquals(current, Files.readAllBytes(repo.resolve(FILES + "/photo.jpg")));
            Assertions.assertArrayEquals(pointerBytes(oid, current.length), Files.readAllBytes(repo.resolve(POINTERS + "/photo.jpg")));
        } finally {
            deleteRecursively(repo);
        }
    }

    @Test
    void onlyPayloadsNewerThanTheirPointerAreAdoptedAsEdits() throws Exception {
        Path repo = Files.createTempDirectory("synclane-lfs-adopt-");
        try {
            byte[] pointed = "checked out".getBytes(StandardCharsets.UTF_8);
            byte[] local = "edited here".getBytes(StandardCharsets.UTF_8);
            Path payload = repo.resolve(FILES + "/draft.psd");
            Path pointer = repo.resolve(POINTERS + "/draft.psd");
            write(payload, local);
            write(pointer, pointerBytes(Hashing.sha256Hex(pointed), pointed.length));
            FileTime pointerTime = Files.getLastModifiedTime(pointer);
            LargeObjectReconciler reconciler = reconciler(new InMemoryLfsTransport());

            Files.setLastModifiedTime(payload, FileTime.fromMillis(pointerTime.toMillis() - 60_000L));
            Assertions.assertTrue(reconciler.preparePointers(repo).rewritten().isEmpty());
            Assertions.assertArrayEquals(pointerBytes(Hashing.sha256Hex(pointed), pointed.length), Files.readAllBytes(pointer));

            Files.setLastModifiedTime(payload, FileTime.fromMillis(pointerTime.toMillis() + 60_000L));
            Assertions.assertEquals(List.of(POINTERS + "/draft.psd"), reconciler.preparePointers(repo).rewritten());
            Assertions.assertEquals(Hashing.sha256Hex(local),
                    PointerFiles.parse(Files.readAllBytes(pointer)).orElseThrow().oid());
        } finally {
            deleteRecursively(repo);
        }
    }

    @Test
    void unknownDownloadIsSkippedNotFailed() throws Exception {
        Path repo = Files.createTempDirectory("synclane-lfs-notfound-");
        try {
            String oid = Hashing.sha256Hex("nowhere".getBytes(StandardCharsets.UTF_8));
            write(repo.resolve(POINTERS + "/gone.bin"), pointerBytes(oid, 7L));

            LargeObjectReconciler.ReconcileReport report = reconciler(new InMemoryLfsTransport()).reconcile(repo, Set.of());

            Assertions.assertEquals(List.of(oid), report.skipped());
            Assertions.assertTrue(report.failures().isEmpty());
        } finally {
            deleteRecursively(repo);
        }
    }

    @Test
    void withoutEndpointEveryTransferFails() throws Exception {
        Path repo = Files.createTempDirectory("synclane-lfs-noendpoint-");
        try {
            write(repo.resolve(FILES + "/doc.pdf"), "pdf".getBytes(StandardCharsets.UTF_8));
            LargeObjectReconciler reconciler = new LargeObjectReconciler(
                    LfsLayout.from(SyncSettings.defaults()), null, SyncSettings.defaults(), new NonFatalErrors());

            LargeObjectReconciler.ReconcileReport report = reconciler.reconcile(repo, Set.of());

            Assertions.assertEquals(1, report.failures().size());
            Assertions.assertEquals(TransferDirection.UPLOAD, report.failures().get(0).direction());
            Assertions.assertTrue(Files.exists(repo.resolve(POINTERS + "/doc.pdf")));
        } finally {
            deleteRecursively(repo);
        }
    }

    @Test
    void corruptPointerWithoutPayloadIsReported() throws Exception {
        Path repo = Files.createTempDirectory("synclane-lfs-corrupt-");
        try {
            write(repo.resolve(POINTERS + "/broken.bin"), "garbage".getBytes(StandardCharsets.UTF_8));

            LargeObjectReconciler.PayloadScan scan = reconciler(new InMemoryLfsTransport()).scanMissingPayloads(repo);

            Assertions.assertEquals(1, scan.pointerCount());
            Assertions.assertEquals(List.of(POINTERS + "/broken.bin"), scan.corrupt());
            Assertions.assertTrue(scan.missing().isEmpty());
        } finally {
            deleteRecursively(repo);
        }
    }

    private static LargeObjectReconciler reconciler(LfsTransport transport) {
        SyncSettings settings = SyncSettings.defaults().withTransferRetry(3, 1L, 2L);
        return new LargeObjectReconciler(LfsLayout.from(settings), transport, settings, new NonFatalErrors());
    }

    private static byte[] pointerBytes(String oid, long size) {
        return PointerFiles.format(new PointerRecord(oid, size)).getBytes(StandardCharsets.UTF_8);
    }

    private static void write(Path file, byte[] content) throws IOException {
        Files.createDirectories(file.getParent());
        Files.write(file, content);
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
