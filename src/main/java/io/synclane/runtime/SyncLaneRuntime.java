package io.synclane.runtime;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.synclane.config.SyncLaneConfig;
import io.synclane.config.SyncSettings;
import io.synclane.lfs.LargeObjectReconciler;
import io.synclane.lfs.LfsAttributes;
import io.synclane.lfs.LfsLayout;
import io.synclane.lfs.LfsStatus;
import io.synclane.lfs.LfsTransportFactory;
import io.synclane.lock.SyncLockManager;
import io.synclane.metadata.MetadataMutator;
import io.synclane.metadata.MetadataUpdateResult;
import io.synclane.model.AuthorIdentity;
import io.synclane.model.Credentials;
import io.synclane.model.HeartbeatUpdate;
import io.synclane.model.LockStatus;
import io.synclane.model.PackOutcome;
import io.synclane.model.ResolvedFile;
import io.synclane.model.SyncPhase;
import io.synclane.model.SyncResult;
import io.synclane.model.SyncTrigger;
import io.synclane.observability.AuditLogger;
import io.synclane.observability.NonFatalErrors;
import io.synclane.sync.ConnectivityProbe;
import io.synclane.sync.RemoteConnectivityProbe;
import io.synclane.sync.SyncLockUnavailableException;
import io.synclane.sync.SyncOrchestrator;
import io.synclane.vcs.JGitVersionControl;
import io.synclane.vcs.PackStats;
import io.synclane.vcs.VersionControl;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Function;
import java.util.function.UnaryOperator;

/**
 * Entry point for every exposed operation. Keeps one lock handle (and the collaborators built around
 * it) per normalized repository path.
 */
public final class SyncLaneRuntime {
    private static final Logger logger = LoggerFactory.getLogger(SyncLaneRuntime.class);

    private final VersionControl vcs;
    private final Function<SyncSettings, ConnectivityProbe> probeFactory;
    private final Function<SyncSettings, LfsTransportFactory> transportFactory;
    private final NonFatalErrors nonFatalErrors;
    private final ConcurrentMap<Path, RepositoryContext> contexts;

    public SyncLaneRuntime() {
        this(
                new JGitVersionControl(),
                settings -> new RemoteConnectivityProbe(Duration.ofMillis(settings.connectTimeoutMs())),
                LfsTransportFactory::http
        );
    }

    public SyncLaneRuntime(
            VersionControl vcs,
            Function<SyncSettings, ConnectivityProbe> probeFactory,
            Function<SyncSettings, LfsTransportFactory> transportFactory
    ) {
        this.vcs = vcs;
        this.probeFactory = probeFactory;
        this.transportFactory = transportFactory;
        this.nonFatalErrors = new NonFatalErrors();
        this.contexts = new ConcurrentHashMap<>();
    }

    public NonFatalErrors nonFatalErrors() {
        return nonFatalErrors;
    }

    public VersionControl versionControl() {
        return vcs;
    }

    public SyncResult syncChanges(Path repoDir, Credentials credentials, AuthorIdentity author) {
        return syncChanges(repoDir, credentials, author, SyncTrigger.MANUAL);
    }

    public SyncResult syncChanges(Path repoDir, Credentials credentials, AuthorIdentity author, SyncTrigger trigger) {
        RepositoryContext context = context(repoDir);
        return context.orchestrator().syncChanges(context.config().repoDir(), credentials, author, trigger);
    }

    public SyncResult completeMerge(
            Path repoDir,
            Credentials credentials,
            AuthorIdentity author,
            List<ResolvedFile> resolvedFiles
    ) {
        RepositoryContext context = context(repoDir);
        return context.orchestrator().completeMerge(context.config().repoDir(), credentials, author, resolvedFiles);
    }

    public boolean acquireSyncLock(Path repoDir) {
        return context(repoDir).lockManager().acquire();
    }

    public void releaseSyncLock(Path repoDir) {
        context(repoDir).lockManager().release();
    }

    public void updateLockHeartbeat(Path repoDir, HeartbeatUpdate update) {
        context(repoDir).lockManager().updateHeartbeat(update);
    }

    public LockStatus checkFilesystemLock(Path repoDir) {
        return context(repoDir).lockManager().checkStatus();
    }

    public boolean cleanupStaleLock(Path repoDir) {
        return context(repoDir).lockManager().cleanupStale();
    }

    public boolean forceReclaimLock(Path repoDir) {
        return context(repoDir).lockManager().forceReclaim();
    }

    /**
     * Packs loose objects under the sync lock. A busy lock skips the run rather than waiting.
     */
    public PackOutcome packRepository(Path repoDir, boolean silent) {
        RepositoryContext context = context(repoDir);
        SyncLockManager lock = context.lockManager();
        if (!lock.acquire()) {
            log(silent, "Pack of {} skipped: sync lock busy", context.config().repoDir());
            return PackOutcome.skipped();
        }
        try {
            lock.updateHeartbeat(HeartbeatUpdate.phase(SyncPhase.COMMITTING));
            Path dir = context.config().repoDir();
            PackStats before = vcs.statistics(dir);
            PackStats after = vcs.pack(dir);
            log(silent, "Packed {}: loose objects {} -> {}, pack files {}", dir, before.looseObjects(),
                    after.looseObjects(), after.packFiles());
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("looseBefore", before.looseObjects());
            details.put("looseAfter", after.looseObjects());
            details.put("packFiles", after.packFiles());
            audit(context, AuditLogger.AuditEvent.of("repo.pack", dir.toString(), "success", details));
            return new PackOutcome(true, false, before.looseObjects(), after.looseObjects(), after.packFiles());
        } finally {
            lock.release();
        }
    }

    public MetadataUpdateResult safeUpdateMetadata(Path repoDir, UnaryOperator<ObjectNode> transform) {
        RepositoryContext context = context(repoDir);
        MetadataUpdateResult result = context.metadata().safeUpdate(context.config().repoDir(), transform);
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("attempts", result.attempts());
        if (result.error() != null) {
            details.put("error", result.error().name());
        }
        audit(context, AuditLogger.AuditEvent.of(
                "metadata.update",
                context.config().metadataFile().toString(),
                result.success() ? "success" : "failed",
                details
        ));
        return result;
    }

    public ObjectNode metadataDocument(Path repoDir) {
        RepositoryContext context = context(repoDir);
        return context.metadata().readDocument(context.config().repoDir());
    }

    /**
     * Uploads and downloads large objects outside of a sync. Pointers changed since the fetched remote
     * head are treated as pending uploads.
     *
     * @throws SyncLockUnavailableException when a sync holds the lock
     */
    public LargeObjectReconciler.ReconcileReport reconcileLargeObjects(Path repoDir, Credentials credentials) {
        RepositoryContext context = context(repoDir);
        SyncLockManager lock = context.lockManager();
        if (!lock.acquire()) {
            throw new SyncLockUnavailableException(lock.lockFile());
        }
        try {
            Path dir = context.config().repoDir();
            SyncSettings settings = context.settings();
            String remote = settings.remoteName();
            LfsLayout layout = LfsLayout.from(settings);
            Optional<String> remoteUrl = vcs.remoteUrl(dir, remote);
            LargeObjectReconciler reconciler = new LargeObjectReconciler(
                    layout,
                    remoteUrl.map(url -> transportFactory.apply(settings).create(url, credentials)).orElse(null),
                    settings,
                    nonFatalErrors
            );
            Set<String> pending = new LinkedHashSet<>();
            Optional<String> head = vcs.resolveRef(dir, "HEAD");
            if (head.isPresent()) {
                String remoteHead = vcs.resolveRef(dir, "refs/remotes/" + remote + "/" + vcs.currentBranch(dir))
                        .orElse(null);
                for (String path : vcs.changedPaths(dir, remoteHead, head.get())) {
                    if (layout.isPointerPath(path) && Files.isRegularFile(dir.resolve(path))) {
                        pending.add(path);
                    }
                }
            }
            LargeObjectReconciler.ReconcileReport report = reconciler.reconcile(dir, pending, LargeObjectReconciler.MismatchPolicy.ADOPT_PAYLOAD);
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("uploaded", report.uploaded().size());
            details.put("downloaded", report.downloaded().size());
            details.put("failures", report.failures().size());
            audit(context, AuditLogger.AuditEvent.of(
                    "lfs.reconcile", dir.toString(), report.failures().isEmpty() ? "success" : "partial", details));
            return report;
        } finally {
            lock.release();
        }
    }

    public LfsStatus lfsStatus(Path repoDir) {
        RepositoryContext context = context(repoDir);
        LargeObjectReconciler reconciler = new LargeObjectReconciler(
                LfsLayout.from(context.settings()), null, context.settings(), nonFatalErrors);
        Path dir = context.config().repoDir();
        return LfsStatus.of(dir, reconciler.scanMissingPayloads(dir));
    }

    public boolean trackLargeObjects(Path repoDir, String pattern) {
        RepositoryContext context = context(repoDir);
        Path dir = context.config().repoDir();
        boolean added = LfsAttributes.addPattern(dir, pattern);
        LfsAttributes.ensurePointerAttributes(dir, LfsLayout.from(context.settings()));
        return added;
    }

    private RepositoryContext context(Path repoDir) {
        Path key = repoDir.toAbsolutePath().normalize();
        return contexts.computeIfAbsent(key, this::openContext);
    }

    private RepositoryContext openContext(Path repoDir) {
        SyncLaneConfig config = SyncLaneConfig.forRepository(repoDir);
        SyncSettings settings = SyncSettings.load(config.settingsFile());
        String ownerId = SyncLockManager.newOwnerId();
        AuditLogger auditLogger = new AuditLogger(config.auditFile(), ownerId);
        SyncLockManager lockManager = SyncLockManager.forRepository(config, settings, nonFatalErrors, auditLogger);
        if (lockManager.cleanupStale()) {
            logger.info("Removed stale sync lock for {} at startup", repoDir);
        }
        SyncOrchestrator orchestrator = new SyncOrchestrator(
                vcs,
                lockManager,
                settings,
                probeFactory.apply(settings),
                transportFactory.apply(settings),
                nonFatalErrors,
                auditLogger
        );
        MetadataMutator metadata = new MetadataMutator(settings, lockManager.ownerId(), nonFatalErrors);
        return new RepositoryContext(config, settings, lockManager, auditLogger, orchestrator, metadata);
    }

    private void audit(RepositoryContext context, AuditLogger.AuditEvent event) {
        try {
            context.auditLogger().log(event);
        } catch (RuntimeException e) {
            nonFatalErrors.record("audit." + event.action(), e);
        }
    }

    private static void log(boolean silent, String format, Object... args) {
        if (silent) {
            logger.debug(format, args);
        } else {
            logger.info(format, args);
        }
    }

    private record RepositoryContext(
            SyncLaneConfig config,
            SyncSettings settings,
            SyncLockManager lockManager,
            AuditLogger auditLogger,
            SyncOrchestrator orchestrator,
            MetadataMutator metadata
    ) {
    }
}
