package io.synclane.lfs;

import io.synclane.config.SyncSettings;
import io.synclane.model.PointerRecord;
import io.synclane.model.TransferDescriptor;
import io.synclane.model.TransferDirection;
import io.synclane.model.TransferFailure;
import io.synclane.observability.NonFatalErrors;
import io.synclane.storage.LockFiles;
import io.synclane.util.Hashing;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Keeps the pointer tree and the payload tree consistent: pointers for local payloads, payloads
 * for pointers, and the server copy of every payload a pushed pointer refers to.
 */
public final class LargeObjectReconciler {
    private static final Logger logger = LoggerFactory.getLogger(LargeObjectReconciler.class);

    private final LfsLayout layout;
    private final LfsTransport transport;
    private final SyncSettings settings;
    private final NonFatalErrors nonFatalErrors;

    public LargeObjectReconciler(LfsLayout layout, LfsTransport transport, SyncSettings settings, NonFatalErrors nonFatalErrors) {
        this.layout = layout;
        this.transport = transport;
        this.settings = settings;
        this.nonFatalErrors = nonFatalErrors == null ? new NonFatalErrors() : nonFatalErrors;
    }

    public LfsLayout layout() {
        return layout;
    }

    /**
     * Walks the pointer tree and reports pointers whose payload is absent or does not hash to the
     * pointer's oid, plus pointer files that do not parse.
     */
    public PayloadScan scanMissingPayloads(Path repoDir) {
        Map<String, PointerRecord> missing = new LinkedHashMap<>();
        List<String> corrupt = new ArrayList<>();
        int pointers = 0;
        for (Path file : listFiles(layout.pointerRoot(repoDir))) {
            String pointerPath = LfsLayout.relativize(repoDir, file);
            pointers++;
            Optional<PointerRecord> pointer = readPointer(file);
            if (pointer.isEmpty()) {
                corrupt.add(pointerPath);
                continue;
            }
            Path payload = repoDir.resolve(layout.payloadPathFor(pointerPath));
            if (!matchesPointer(payload, pointer.get())) {
                missing.put(pointerPath, pointer.get());
            }
        }
        return new PayloadScan(pointers, missing, corrupt);
    }

    /**
     * Writes pointers for payloads that have none or that were edited locally, and regenerates empty
     * or corrupt pointers from an existing payload. Regenerated pointers are not scheduled for upload.
     * A payload counts as edited only when it is at least as new as its pointer; an older payload is a
     * stale copy of an earlier version and is left for download.
     */
    public PointerPreparation preparePointers(Path repoDir) {
        return preparePointers(repoDir, MismatchPolicy.ADOPT_PAYLOAD);
    }

    PointerPreparation preparePointers(Path repoDir, MismatchPolicy policy) {
        List<String> rewritten = new ArrayList<>();
        List<String> recovered = new ArrayList<>();
        for (Path payload : listFiles(layout.payloadRoot(repoDir))) {
            String payloadPath = LfsLayout.relativize(repoDir, payload);
            String pointerPath = layout.pointerPathFor(payloadPath);
            Path pointerFile = repoDir.resolve(pointerPath);
            try {
                boolean pointerExists = Files.exists(pointerFile);
                Optional<PointerRecord> existing = pointerExists ? readPointer(pointerFile) : Optional.empty();
                if (pointerExists && existing.isEmpty()) {
                    writePointer(pointerFile, PointerFiles.fromPayload(payload));
                    recovered.add(pointerPath);
                    logger.info("Regenerated pointer {} from local payload", pointerPath);
                    continue;
                }
                if (existing.isPresent()) {
                    if (matchesPointer(payload, existing.get())) {
                        continue;
                    }
                    if (policy == MismatchPolicy.FOLLOW_POINTER || olderThan(payload, pointerFile)) {
                        logger.debug("Payload {} is behind pointer {}, leaving it for download", payloadPath, pointerPath);
                        continue;
                    }
                }
                writePointer(pointerFile, PointerFiles.fromPayload(payload));
                rewritten.add(pointerPath);
            } catch (IOException e) {
                throw new RuntimeException("Failed to prepare pointer for " + payloadPath, e);
            }
        }
        return new PointerPreparation(rewritten, recovered);
    }

    public BatchNegotiation negotiateBatch(List<PointerRecord> objects, TransferDirection direction) {
        List<String> skipped = new ArrayList<>();
        List<TransferFailure> failures = new ArrayList<>();
        if (objects.isEmpty()) {
            return new BatchNegotiation(List.of(), skipped, failures);
        }
        if (transport == null) {
            for (PointerRecord object : objects) {
                failures.add(new TransferFailure(object.oid(), direction, 0, "No large-object endpoint for this remote"));
            }
            return new BatchNegotiation(List.of(), skipped, failures);
        }
        LfsTransport.BatchResponse response = null;
        TransferException lastError = null;
        for (int attempt = 0; attempt < settings.transferMaxAttempts() && response == null; attempt++) {
            try {
                response = transport.batch(direction, objects);
            } catch (TransferException e) {
                lastError = e;
                if (!e.isRetryable()) {
                    break;
                }
                sleepBackoff(attempt);
            }
        }
        if (response == null) {
            String message = lastError == null ? "batch negotiation failed" : lastError.getMessage();
            for (PointerRecord object : objects) {
                failures.add(new TransferFailure(object.oid(), direction, settings.transferMaxAttempts(), message));
            }
            return new BatchNegotiation(List.of(), skipped, failures);
        }
        Set<String> offered = new LinkedHashSet<>();
        for (TransferDescriptor descriptor : response.descriptors()) {
            offered.add(descriptor.oid());
        }
        for (LfsTransport.ObjectError error : response.errors()) {
            logger.info("Server skipped {} {}: {} {}", direction.operation(), error.oid(), error.code(), error.message());
            skipped.add(error.oid());
        }
        for (PointerRecord object : objects) {
            if (!offered.contains(object.oid()) && !skipped.contains(object.oid())) {
                skipped.add(object.oid());
            }
        }
        return new BatchNegotiation(response.descriptors(), skipped, failures);
    }

    /**
     * Runs one transfer with bounded exponential backoff. Downloads land in {@code file} only after
     * the hash and size check.
     */
    public Optional<TransferFailure> transfer(TransferDescriptor descriptor, Path file) {
        if (transport == null) {
            return Optional.of(new TransferFailure(descriptor.oid(), descriptor.direction(), 0, "No large-object endpoint for this remote"));
        }
        int maxAttempts = settings.transferMaxAttempts();
        String lastMessage = "";
        for (int attempt = 0; attempt < maxAttempts; attempt++) {
            try {
                if (descriptor.direction() == TransferDirection.UPLOAD) {
                    transport.upload(descriptor, file);
                } else {
                    downloadVerified(descriptor, file);
                }
                return Optional.empty();
            } catch (TransferException e) {
                lastMessage = e.getMessage();
                logger.warn("Transfer of {} failed (attempt {}/{}): {}", descriptor.oid(), attempt + 1, maxAttempts, lastMessage);
                if (!e.isRetryable()) {
                    return Optional.of(new TransferFailure(descriptor.oid(), descriptor.direction(), attempt + 1, lastMessage));
                }
                if (attempt + 1 < maxAttempts) {
                    sleepBackoff(attempt);
                }
            }
        }
        return Optional.of(new TransferFailure(descriptor.oid(), descriptor.direction(), maxAttempts, lastMessage));
    }

    /**
     * Reconciles after a fetch: the checked-out pointers win, so a payload that no longer matches its
     * pointer is downloaded again rather than re-pointed.
     *
     * @param pendingUploadPointers pointer paths changed in commits the remote does not have yet
     */
    public ReconcileReport reconcile(Path repoDir, Set<String> pendingUploadPointers) {
        return reconcile(repoDir, pendingUploadPointers, MismatchPolicy.FOLLOW_POINTER);
    }

    /**
     * Prepares pointers under {@code policy}, uploads new payloads, then downloads missing ones.
     */
    public ReconcileReport reconcile(Path repoDir, Set<String> pendingUploadPointers, MismatchPolicy policy) {
        PointerPreparation preparation = preparePointers(repoDir, policy);
        List<String> uploaded = new ArrayList<>();
        List<String> downloaded = new ArrayList<>();
        List<String> skipped = new ArrayList<>();
        List<TransferFailure> failures = new ArrayList<>();

        Set<String> uploadPointers = new LinkedHashSet<>(preparation.rewritten());
        if (pendingUploadPointers != null) {
            uploadPointers.addAll(pendingUploadPointers);
        }
        uploadPointers.removeAll(preparation.recovered());
        Map<String, Path> uploadSources = new LinkedHashMap<>();
        Map<String, PointerRecord> uploadObjects = new LinkedHashMap<>();
        for (String pointerPath : uploadPointers) {
            Path payload = repoDir.resolve(layout.payloadPathFor(pointerPath));
            Optional<PointerRecord> pointer = readPointer(repoDir.resolve(pointerPath));
            if (pointer.isPresent() && matchesPointer(payload, pointer.get())) {
                uploadSources.putIfAbsent(pointer.get().oid(), payload);
                uploadObjects.putIfAbsent(pointer.get().oid(), pointer.get());
            }
        }
        BatchNegotiation uploads = negotiateBatch(List.copyOf(uploadObjects.values()), TransferDirection.UPLOAD);
        skipped.addAll(uploads.skipped());
        failures.addAll(uploads.failures());
        for (TransferDescriptor descriptor : uploads.descriptors()) {
            Path source = uploadSources.get(descriptor.oid());
            if (source == null) {
                continue;
            }
            Optional<TransferFailure> failure = transfer(descriptor, source);
            if (failure.isPresent()) {
                failures.add(failure.get());
            } else {
                uploaded.add(descriptor.oid());
            }
        }

        PayloadScan scan = scanMissingPayloads(repoDir);
        Map<String, List<Path>> downloadTargets = new LinkedHashMap<>();
        Map<String, PointerRecord> downloadObjects = new LinkedHashMap<>();
        scan.missing().forEach((pointerPath, pointer) -> {
            downloadTargets.computeIfAbsent(pointer.oid(), ignored -> new ArrayList<>())
                    .add(repoDir.resolve(layout.payloadPathFor(pointerPath)));
            downloadObjects.putIfAbsent(pointer.oid(), pointer);
        });
        BatchNegotiation downloads = negotiateBatch(List.copyOf(downloadObjects.values()), TransferDirection.DOWNLOAD);
        skipped.addAll(downloads.skipped());
        failures.addAll(downloads.failures());
        for (TransferDescriptor descriptor : downloads.descriptors()) {
            List<Path> targets = downloadTargets.getOrDefault(descriptor.oid(), List.of());
            if (targets.isEmpty()) {
                continue;
            }
            Optional<TransferFailure> failure = transfer(descriptor, targets.get(0));
            if (failure.isPresent()) {
                failures.add(failure.get());
                continue;
            }
            copyToRemainingTargets(targets);
            downloaded.add(descriptor.oid());
        }
        if (!failures.isEmpty()) {
            logger.warn("{} large-object transfer(s) failed", failures.size());
        }
        return new ReconcileReport(uploaded, downloaded, skipped, preparation.recovered(), preparation.rewritten(),
                scan.corrupt(), failures);
    }

    private void downloadVerified(TransferDescriptor descriptor, Path target) throws TransferException {
        Path staged = target.resolveSibling(target.getFileName() + ".download");
        try {
            Files.createDirectories(target.getParent());
            transport.download(descriptor, staged);
            long size = Files.size(staged);
            String oid = Hashing.sha256Hex(staged);
            if (!oid.equals(descriptor.oid()) || (descriptor.size() > 0L && size != descriptor.size())) {
                throw new TransferException("Downloaded content for " + descriptor.oid() + " does not match (got " + oid
                        + ", " + size + " bytes)", 0, true);
            }
            LockFiles.moveReplacing(staged, target);
        } catch (TransferException e) {
            throw e;
        } catch (IOException e) {
            throw new TransferException("Failed to store payload " + descriptor.oid() + ": " + e.getMessage(), e);
        } finally {
            try {
                Files.deleteIfExists(staged);
            } catch (IOException e) {
                nonFatalErrors.record("lfs.download.cleanup", e);
            }
        }
    }

    private void copyToRemainingTargets(List<Path> targets) {
        for (int i = 1; i < targets.size(); i++) {
            try {
                Files.createDirectories(targets.get(i).getParent());
                Files.copy(targets.get(0), targets.get(i), StandardCopyOption.REPLACE_EXISTING);
            } catch (IOException e) {
                throw new RuntimeException("Failed to write payload " + targets.get(i), e);
            }
        }
    }

    private void writePointer(Path pointerFile, PointerRecord pointer) throws IOException {
        Files.createDirectories(pointerFile.getParent());
        LockFiles.writeAtomically(pointerFile, PointerFiles.format(pointer).getBytes(StandardCharsets.UTF_8));
    }

    private Optional<PointerRecord> readPointer(Path file) {
        try {
            return PointerFiles.parse(Files.readAllBytes(file));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            throw new RuntimeException("Failed to read pointer " + file, e);
        }
    }

    private static boolean matchesPointer(Path payload, PointerRecord pointer) {
        try {
            return Files.isRegularFile(payload)
                    && Files.size(payload) == pointer.size()
                    && Hashing.sha256Hex(payload).equals(pointer.oid());
        } catch (IOException e) {
            return false;
        }
    }

    private static boolean olderThan(Path payload, Path pointerFile) throws IOException {
        return Files.getLastModifiedTime(payload).compareTo(Files.getLastModifiedTime(pointerFile)) < 0;
    }

    private static List<Path> listFiles(Path root) {
        if (!Files.isDirectory(root)) {
            return List.of();
        }
        try (Stream<Path> walk = Files.walk(root)) {
            return walk.filter(Files::isRegularFile)
                    .filter(path -> !path.getFileName().toString().endsWith(".download"))
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new RuntimeException("Failed to list " + root, e);
        }
    }

    private void sleepBackoff(int attempt) {
        long delay = Math.min(settings.transferMaxBackoffMs(), settings.transferBaseBackoffMs() * (1L << Math.min(attempt, 20)));
        if (delay <= 0L) {
            return;
        }
        try {
            Thread.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * What to do with a payload whose hash differs from its pointer.
     */
    public enum MismatchPolicy {
        /** Treat the payload as a local edit and rewrite the pointer, unless the payload is older. */
        ADOPT_PAYLOAD,
        /** Keep the pointer and download its payload. */
        FOLLOW_POINTER
    }

    public record PayloadScan(int pointerCount, Map<String, PointerRecord> missing, List<String> corrupt) {
        public Set<String> missingOids() {
            Set<String> out = new LinkedHashSet<>();
            missing.values().forEach(pointer -> out.add(pointer.oid()));
            return out;
        }
    }

    public record PointerPreparation(List<String> rewritten, List<String> recovered) {
        public boolean changedPointers() {
            return !rewritten.isEmpty() || !recovered.isEmpty();
        }
    }

    public record BatchNegotiation(List<TransferDescriptor> descriptors, List<String> skipped, List<TransferFailure> failures) {
    }

    public record ReconcileReport(
            List<String> uploaded,
            List<String> downloaded,
            List<String> skipped,
            List<String> recoveredPointers,
            List<String> rewrittenPointers,
            List<String> corruptPointers,
            List<TransferFailure> failures
    ) {
        public boolean changedPointers() {
            return !recoveredPointers.isEmpty() || !rewrittenPointers.isEmpty();
        }
    }
}
