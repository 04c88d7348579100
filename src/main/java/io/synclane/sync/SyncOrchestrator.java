package io.synclane.sync;

import com.fasterxml.jackson.databind.JsonNode;
import io.synclane.config.SyncLaneConfig;
import io.synclane.config.SyncSettings;
import io.synclane.lfs.LargeObjectReconciler;
import io.synclane.lfs.LfsAttributes;
import io.synclane.lfs.LfsLayout;
import io.synclane.lfs.LfsTransportFactory;
import io.synclane.lock.HeartbeatTicker;
import io.synclane.lock.SyncLockManager;
import io.synclane.metadata.MetadataCorruptionException;
import io.synclane.metadata.MetadataMutator;
import io.synclane.model.AuthorIdentity;
import io.synclane.model.Conflict;
import io.synclane.model.Credentials;
import io.synclane.model.HeartbeatUpdate;
import io.synclane.model.LockProgress;
import io.synclane.model.ResolvedFile;
import io.synclane.model.SyncOutcome;
import io.synclane.model.SyncPhase;
import io.synclane.model.SyncResult;
import io.synclane.model.SyncTrigger;
import io.synclane.model.TransferFailure;
import io.synclane.observability.AuditLogger;
import io.synclane.observability.NonFatalErrors;
import io.synclane.storage.LocalExcludes;
import io.synclane.util.Versions;
import io.synclane.vcs.MergeOutcome;
import io.synclane.vcs.VcsException;
import io.synclane.vcs.VersionControl;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.LongSupplier;
import java.util.function.Predicate;

/**
 * Runs one sync of a repository against its remote: local commit, fetch, merge or conflict report,
 * large-object reconciliation and push, all under the repository's sync lock.
 */
public final class SyncOrchestrator {
    private static final Logger logger = LoggerFactory.getLogger(SyncOrchestrator.class);

    static final String LOCAL_CHANGES_MESSAGE = "Local changes";
    static final String POINTER_UPDATE_MESSAGE = "Update large object pointers";
    private static final long PROGRESS_THROTTLE_MS = 500L;

    private final VersionControl vcs;
    private final SyncLockManager lockManager;
    private final SyncSettings settings;
    private final ConnectivityProbe probe;
    private final LfsTransportFactory transportFactory;
    private final NonFatalErrors nonFatalErrors;
    private final AuditLogger auditLogger;
    private final LfsLayout layout;
    private final LongSupplier clock;

    public SyncOrchestrator(
            VersionControl vcs,
            SyncLockManager lockManager,
            SyncSettings settings,
            ConnectivityProbe probe,
            LfsTransportFactory transportFactory,
            NonFatalErrors nonFatalErrors,
            AuditLogger auditLogger
    ) {
        this.vcs = vcs;
        this.lockManager = lockManager;
        this.settings = settings;
        this.probe = probe;
        this.transportFactory = transportFactory;
        this.nonFatalErrors = nonFatalErrors == null ? new NonFatalErrors() : nonFatalErrors;
        this.auditLogger = auditLogger;
        this.layout = LfsLayout.from(settings);
        this.clock = System::currentTimeMillis;
    }

    public SyncResult syncChanges(Path repoDir, Credentials credentials, AuthorIdentity author) {
        return syncChanges(repoDir, credentials, author, SyncTrigger.MANUAL);
    }

    public SyncResult syncChanges(Path repoDir, Credentials credentials, AuthorIdentity author, SyncTrigger trigger) {
        if (!lockManager.acquire()) {
            logger.info("Sync of {} not started: lock busy ({})", repoDir, trigger);
            return trigger == SyncTrigger.AUTOMATIC ? SyncResult.skipped() : SyncResult.lockBusy();
        }
        try (HeartbeatTicker ignored = HeartbeatTicker.start(lockManager, settings.heartbeatIntervalMs())) {
            SyncResult result = runSync(repoDir, credentials, author);
            audit("sync", repoDir, result);
            return result;
        } finally {
            lockManager.release();
        }
    }

    /**
     * Finishes a sync that stopped on conflicts: merges the fetched remote head, applies the caller's
     * resolutions and commits with both heads as parents, then reconciles and pushes.
     *
     * @throws SyncLockUnavailableException when another sync holds the lock
     */
    public SyncResult completeMerge(
            Path repoDir,
            Credentials credentials,
            AuthorIdentity author,
            List<ResolvedFile> resolvedFiles
    ) {
        if (!lockManager.acquire()) {
            throw new SyncLockUnavailableException(lockManager.lockFile());
        }
        try (HeartbeatTicker ignored = HeartbeatTicker.start(lockManager, settings.heartbeatIntervalMs())) {
            SyncResult result = runCompleteMerge(repoDir, credentials, author, resolvedFiles);
            audit("sync.complete_merge", repoDir, result);
            return result;
        } finally {
            lockManager.release();
        }
    }

    private SyncResult runSync(Path repoDir, Credentials credentials, AuthorIdentity author) {
        String remote = settings.remoteName();
        String branch = vcs.currentBranch(repoDir);

        enterPhase(SyncPhase.COMMITTING);
        LargeObjectReconciler localOnly = new LargeObjectReconciler(layout, null, settings, nonFatalErrors);
        localOnly.preparePointers(repoDir);
        LfsAttributes.ensurePayloadsExcluded(repoDir, layout);
        LocalExcludes.ensureProcessLocalFilesExcluded(repoDir);
        commitLocalChanges(repoDir, author);

        Optional<String> remoteUrl = vcs.remoteUrl(repoDir, remote);
        if (remoteUrl.isEmpty()) {
            return SyncResult.offline("Remote '" + remote + "' is not configured");
        }
        if (!probe.isReachable(remoteUrl.get())) {
            logger.info("Remote for {} unreachable, keeping local commit", repoDir);
            return SyncResult.offline("Remote unreachable");
        }

        enterPhase(SyncPhase.FETCHING);
        try {
            fetchWithRetry(repoDir, remote, credentials);
        } catch (VcsException e) {
            if (e.kind() != VcsException.Kind.NETWORK) {
                throw e;
            }
            logger.info("Fetch of {} failed, treating as offline: {}", repoDir, e.getMessage());
            return SyncResult.offline("Fetch failed: " + e.getMessage());
        }

        String localHead = vcs.resolveRef(repoDir, "HEAD").orElse(null);
        String remoteHead = vcs.resolveRef(repoDir, remoteRef(remote, branch)).orElse(null);
        if (remoteHead != null) {
            Optional<String> blocked = versionGate(repoDir, remoteHead);
            if (blocked.isPresent()) {
                return SyncResult.versionBlocked(blocked.get());
            }
        }

        LargeObjectReconciler reconciler = new LargeObjectReconciler(
                layout, transportFactory.create(remoteUrl.get(), credentials), settings, nonFatalErrors);

        if (remoteHead == null) {
            if (localHead == null) {
                return SyncResult.completed(null, List.of());
            }
            Set<String> pending = pointerPaths(repoDir, vcs.changedPaths(repoDir, null, localHead));
            List<TransferFailure> failures = reconcileAndCommit(repoDir, reconciler, pending, author);
            return pushAndComplete(repoDir, remote, branch, credentials, failures);
        }
        if (localHead == null || vcs.isAncestor(repoDir, localHead, remoteHead)) {
            if (!remoteHead.equals(localHead)) {
                enterPhase(SyncPhase.MERGING);
                requireSuccess(vcs.fastForward(repoDir, remoteHead), "fast-forward");
            }
            ReconcileStep step = reconcileStep(repoDir, reconciler, Set.of(), author);
            if (!step.committed()) {
                return SyncResult.completed(null, step.failures());
            }
            return pushAndComplete(repoDir, remote, branch, credentials, step.failures());
        }
        if (vcs.isAncestor(repoDir, remoteHead, localHead)) {
            Set<String> pending = pointerPaths(repoDir, vcs.changedPaths(repoDir, remoteHead, localHead));
            List<TransferFailure> failures = reconcileAndCommit(repoDir, reconciler, pending, author);
            return pushAndComplete(repoDir, remote, branch, credentials, failures);
        }

        enterPhase(SyncPhase.MERGING);
        String base = vcs.mergeBase(repoDir, localHead, remoteHead).orElse(null);
        List<String> changed = vcs.changedPaths(repoDir, base, localHead);
        List<String> remoteChanged = vcs.changedPaths(repoDir, base, remoteHead);
        List<Conflict> conflicts = detectConflicts(repoDir, base, localHead, remoteHead);
        if (!conflicts.isEmpty()) {
            logger.info("Sync of {} stopped on {} conflict(s)", repoDir, conflicts.size());
            return SyncResult.conflicts(conflicts, changed, remoteChanged);
        }
        String mergeHead = mergeRemote(repoDir, branch, author, localHead, remoteHead);
        Set<String> pending = pointerPaths(repoDir, vcs.changedPaths(repoDir, remoteHead, mergeHead));
        List<TransferFailure> failures = reconcileAndCommit(repoDir, reconciler, pending, author);
        return pushAndComplete(repoDir, remote, branch, credentials, failures).withDiagnostics(changed, remoteChanged);
    }

    private SyncResult runCompleteMerge(
            Path repoDir,
            Credentials credentials,
            AuthorIdentity author,
            List<ResolvedFile> resolvedFiles
    ) {
        String remote = settings.remoteName();
        String branch = vcs.currentBranch(repoDir);
        String localHead = vcs.resolveRef(repoDir, "HEAD")
                .orElseThrow(() -> new IllegalStateException("Repository " + repoDir + " has no commits"));
        String remoteHead = vcs.resolveRef(repoDir, remoteRef(remote, branch))
                .orElseThrow(() -> new IllegalStateException("No fetched " + remoteRef(remote, branch) + " to merge"));
        if (vcs.isAncestor(repoDir, remoteHead, localHead)) {
            throw new IllegalStateException("Local branch already contains " + remote + "/" + branch);
        }

        enterPhase(SyncPhase.MERGING);
        String mergeCommit;
        try {
            MergeOutcome merged = vcs.merge(repoDir, remoteHead);
            if (merged.status() == MergeOutcome.Status.FAILED) {
                throw new VcsException(VcsException.Kind.OTHER, "Merge of " + remoteHead + " failed on "
                        + merged.conflictingPaths(), null);
            }
            Set<String> resolvedPaths = new LinkedHashSet<>();
            for (ResolvedFile resolved : resolvedFiles) {
                applyResolution(repoDir, resolved);
                resolvedPaths.add(resolved.filepath());
            }
            for (String path : merged.conflictingPaths()) {
                if (!resolvedPaths.contains(path)) {
                    throw new IllegalArgumentException("No resolution given for conflicting path " + path);
                }
            }
            mergeCommit = vcs.commit(repoDir, mergeMessage(remote, branch), author, List.of(localHead, remoteHead));
        } catch (RuntimeException e) {
            try {
                vcs.abortMerge(repoDir);
            } catch (RuntimeException abortError) {
                e.addSuppressed(abortError);
            }
            throw e;
        }
        logger.info("Committed merge {} for {}", mergeCommit, repoDir);

        Optional<String> remoteUrl = vcs.remoteUrl(repoDir, remote);
        LargeObjectReconciler reconciler = new LargeObjectReconciler(
                layout,
                remoteUrl.map(url -> transportFactory.create(url, credentials)).orElse(null),
                settings,
                nonFatalErrors
        );
        Set<String> pending = pointerPaths(repoDir, vcs.changedPaths(repoDir, remoteHead, mergeCommit));
        List<TransferFailure> failures = reconcileAndCommit(repoDir, reconciler, pending, author);
        return pushAndComplete(repoDir, remote, branch, credentials, failures);
    }

    private void applyResolution(Path repoDir, ResolvedFile resolved) {
        Path root = repoDir.toAbsolutePath().normalize();
        Path target = root.resolve(resolved.filepath()).normalize();
        if (!target.startsWith(root) || target.equals(root)) {
            throw new IllegalArgumentException("Resolved path escapes the repository: " + resolved.filepath());
        }
        try {
            if (resolved.isDeletion()) {
                Files.deleteIfExists(target);
                vcs.remove(repoDir, resolved.filepath());
            } else {
                Files.createDirectories(target.getParent());
                Files.write(target, resolved.content().getBytes(StandardCharsets.UTF_8));
                vcs.add(repoDir, resolved.filepath());
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to write resolution for " + resolved.filepath(), e);
        }
    }

    private List<Conflict> detectConflicts(Path repoDir, String base, String localHead, String remoteHead) {
        List<ConflictDetector.DivergentPath> divergent = ConflictDetector.divergentPaths(
                vcs.listFiles(repoDir, base),
                vcs.listFiles(repoDir, localHead),
                vcs.listFiles(repoDir, remoteHead)
        );
        if (divergent.isEmpty()) {
            return List.of();
        }
        Predicate<String> lfsPaths = LfsAttributes.matcher(repoDir, layout);
        List<Conflict> out = new ArrayList<>();
        for (ConflictDetector.DivergentPath path : divergent) {
            byte[] ours = path.oursId() == null ? null : vcs.readBlob(repoDir, localHead, path.path()).orElse(null);
            byte[] theirs = path.theirsId() == null ? null : vcs.readBlob(repoDir, remoteHead, path.path()).orElse(null);
            byte[] baseContent = base == null || path.baseId() == null
                    ? null
                    : vcs.readBlob(repoDir, base, path.path()).orElse(null);
            out.add(ConflictDetector.toConflict(path, ours, theirs, baseContent, lfsPaths.test(path.path())));
        }
        return out;
    }

    private String mergeRemote(Path repoDir, String branch, AuthorIdentity author, String localHead, String remoteHead) {
        MergeOutcome merged;
        try {
            merged = vcs.merge(repoDir, remoteHead);
            if (!merged.isSuccessful()) {
                throw new VcsException(VcsException.Kind.OTHER, "Merge of " + remoteHead + " stopped ("
                        + merged.status() + ") on " + merged.conflictingPaths(), null);
            }
            if (merged.status() == MergeOutcome.Status.MERGED_NOT_COMMITTED) {
                return vcs.commit(repoDir, mergeMessage(settings.remoteName(), branch), author,
                        List.of(localHead, remoteHead));
            }
            return merged.head();
        } catch (RuntimeException e) {
            try {
                vcs.abortMerge(repoDir);
            } catch (RuntimeException abortError) {
                e.addSuppressed(abortError);
            }
            throw e;
        }
    }

    private void commitLocalChanges(Path repoDir, AuthorIdentity author) {
        if (!vcs.isDirty(repoDir)) {
            return;
        }
        vcs.addAll(repoDir);
        if (!vcs.isDirty(repoDir)) {
            return;
        }
        String commit = vcs.commit(repoDir, LOCAL_CHANGES_MESSAGE, author);
        logger.info("Committed local changes {} in {}", commit, repoDir);
    }

    private List<TransferFailure> reconcileAndCommit(
            Path repoDir,
            LargeObjectReconciler reconciler,
            Set<String> pending,
            AuthorIdentity author
    ) {
        return reconcileStep(repoDir, reconciler, pending, author).failures();
    }

    private ReconcileStep reconcileStep(
            Path repoDir,
            LargeObjectReconciler reconciler,
            Set<String> pending,
            AuthorIdentity author
    ) {
        LargeObjectReconciler.ReconcileReport report = reconciler.reconcile(repoDir, pending);
        logger.info("Large objects for {}: uploaded={} downloaded={} skipped={} failures={}",
                repoDir, report.uploaded().size(), report.downloaded().size(), report.skipped().size(),
                report.failures().size());
        boolean committed = false;
        if (report.changedPointers()) {
            Set<String> pointers = new LinkedHashSet<>(report.rewrittenPointers());
            pointers.addAll(report.recoveredPointers());
            for (String pointer : pointers) {
                vcs.add(repoDir, pointer);
            }
            if (vcs.isDirty(repoDir)) {
                vcs.commit(repoDir, POINTER_UPDATE_MESSAGE, author);
                committed = true;
            }
        }
        return new ReconcileStep(report.failures(), committed);
    }

    private SyncResult pushAndComplete(
            Path repoDir,
            String remote,
            String branch,
            Credentials credentials,
            List<TransferFailure> failures
    ) {
        enterPhase(SyncPhase.PUSHING);
        try {
            pushWithRetry(repoDir, remote, branch, credentials);
        } catch (VcsException e) {
            if (e.kind() != VcsException.Kind.NETWORK) {
                throw e;
            }
            logger.warn("Push of {} failed after retries: {}", repoDir, e.getMessage());
            return SyncResult.completed(null, failures).withOffline("Push failed: " + e.getMessage());
        }
        String pushed = vcs.resolveRef(repoDir, "HEAD").orElse(null);
        logger.info("Pushed {} to {}/{}", pushed, remote, branch);
        return SyncResult.completed(pushed, failures);
    }

    private void fetchWithRetry(Path repoDir, String remote, Credentials credentials) {
        retryNetwork("fetch", () -> vcs.fetch(repoDir, remote, credentials, progressListener(SyncPhase.FETCHING)));
    }

    private void pushWithRetry(Path repoDir, String remote, String branch, Credentials credentials) {
        retryNetwork("push", () -> vcs.push(repoDir, remote, branch, credentials, progressListener(SyncPhase.PUSHING)));
    }

    private void retryNetwork(String operation, Runnable call) {
        int attempts = Math.max(1, settings.pushMaxAttempts());
        VcsException last = null;
        for (int attempt = 0; attempt < attempts; attempt++) {
            try {
                call.run();
                return;
            } catch (VcsException e) {
                if (!e.isRetryable()) {
                    throw e;
                }
                last = e;
                logger.warn("{} failed (attempt {}/{}): {}", operation, attempt + 1, attempts, e.getMessage());
                if (attempt + 1 < attempts) {
                    sleepBackoff(attempt);
                }
            }
        }
        throw last;
    }

    /**
     * Remote-required component versions that this installation does not meet, as a message.
     */
    private Optional<String> versionGate(Path repoDir, String remoteHead) {
        Map<String, String> installed = settings.componentVersions();
        if (installed.isEmpty()) {
            return Optional.empty();
        }
        Map<String, String> required;
        try {
            Optional<byte[]> raw = vcs.readBlob(repoDir, remoteHead, SyncLaneConfig.METADATA_FILE);
            if (raw.isEmpty()) {
                return Optional.empty();
            }
            JsonNode document = MetadataMutator.parseDocument(raw.get(), "remote " + SyncLaneConfig.METADATA_FILE);
            required = MetadataMutator.requiredVersions(document);
        } catch (MetadataCorruptionException | VcsException e) {
            nonFatalErrors.record("sync.version_gate", e);
            return Optional.empty();
        }
        Map<String, String> outdated = new LinkedHashMap<>();
        required.forEach((component, minimum) -> {
            String have = installed.get(component);
            if (have != null && Versions.compare(have, minimum) < 0) {
                outdated.put(component, minimum);
            }
        });
        if (outdated.isEmpty()) {
            return Optional.empty();
        }
        String message = "Remote requires newer versions: " + outdated;
        if (settings.allowOutdatedSync()) {
            logger.warn("{} (continuing, allowOutdatedSync=true)", message);
            return Optional.empty();
        }
        return Optional.of(message);
    }

    private Set<String> pointerPaths(Path repoDir, List<String> paths) {
        Set<String> out = new LinkedHashSet<>();
        for (String path : paths) {
            if (layout.isPointerPath(path) && Files.isRegularFile(repoDir.resolve(path))) {
                out.add(path);
            }
        }
        return out;
    }

    private VersionControl.ProgressListener progressListener(SyncPhase phase) {
        long[] lastReport = {0L};
        return (task, current, total) -> {
            long now = clock.getAsLong();
            if (now - lastReport[0] < PROGRESS_THROTTLE_MS) {
                return;
            }
            lastReport[0] = now;
            lockManager.updateHeartbeat(HeartbeatUpdate.progress(phase, new LockProgress(current, total, task)));
        };
    }

    private void enterPhase(SyncPhase phase) {
        lockManager.updateHeartbeat(HeartbeatUpdate.phase(phase));
    }

    private static void requireSuccess(MergeOutcome outcome, String operation) {
        if (!outcome.isSuccessful()) {
            throw new VcsException(VcsException.Kind.OTHER, operation + " failed (" + outcome.status() + ")", null);
        }
    }

    private static String remoteRef(String remote, String branch) {
        return "refs/remotes/" + remote + "/" + branch;
    }

    static String mergeMessage(String remote, String branch) {
        return "Merge branch '" + remote + "/" + branch + "'";
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

    private void audit(String action, Path repoDir, SyncResult result) {
        if (auditLogger == null) {
            return;
        }
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("outcome", result.outcome().name());
        details.put("conflicts", result.conflicts().size());
        details.put("transferFailures", result.transferFailures().size());
        if (result.pushedCommit() != null) {
            details.put("pushedCommit", result.pushedCommit());
        }
        String outcome = result.outcome() == SyncOutcome.COMPLETED ? "success" : result.outcome().name().toLowerCase(Locale.ROOT);
        try {
            auditLogger.log(AuditLogger.AuditEvent.of(action, repoDir.toString(), outcome, details));
        } catch (RuntimeException e) {
            nonFatalErrors.record("audit." + action, e);
        }
    }

    private record ReconcileStep(List<TransferFailure> failures, boolean committed) {
    }
}
