package io.synclane.model;

import java.util.List;

public record SyncResult(
        SyncOutcome outcome,
        boolean hadConflicts,
        List<Conflict> conflicts,
        boolean offline,
        String pushedCommit,
        List<TransferFailure> transferFailures,
        List<String> changedPaths,
        List<String> remoteChangedPaths,
        String message
) {
    public SyncResult {
        conflicts = conflicts == null ? List.of() : List.copyOf(conflicts);
        transferFailures = transferFailures == null ? List.of() : List.copyOf(transferFailures);
        changedPaths = changedPaths == null ? List.of() : List.copyOf(changedPaths);
        remoteChangedPaths = remoteChangedPaths == null ? List.of() : List.copyOf(remoteChangedPaths);
    }

    public static SyncResult lockBusy() {
        return new SyncResult(SyncOutcome.LOCK_BUSY, false, List.of(), false, null, List.of(), List.of(), List.of(),
                "Sync already in progress");
    }

    public static SyncResult skipped() {
        return new SyncResult(SyncOutcome.SKIPPED, false, List.of(), false, null, List.of(), List.of(), List.of(),
                "Sync skipped: another sync in progress");
    }

    public static SyncResult offline(String message) {
        return new SyncResult(SyncOutcome.OFFLINE, false, List.of(), true, null, List.of(), List.of(), List.of(), message);
    }

    public static SyncResult versionBlocked(String message) {
        return new SyncResult(SyncOutcome.VERSION_BLOCKED, false, List.of(), false, null, List.of(), List.of(),
                List.of(), message);
    }

    public static SyncResult conflicts(List<Conflict> conflicts, List<String> changed, List<String> remoteChanged) {
        return new SyncResult(SyncOutcome.CONFLICTS, true, conflicts, false, null, List.of(), changed, remoteChanged,
                conflicts.size() + " conflicting file(s)");
    }

    public static SyncResult completed(String pushedCommit, List<TransferFailure> failures) {
        return new SyncResult(SyncOutcome.COMPLETED, false, List.of(), false, pushedCommit, failures, List.of(),
                List.of(), "Synced");
    }

    public SyncResult withOffline(String reason) {
        return new SyncResult(SyncOutcome.OFFLINE, hadConflicts, conflicts, true, pushedCommit, transferFailures,
                changedPaths, remoteChangedPaths, reason);
    }

    public SyncResult withDiagnostics(List<String> changed, List<String> remoteChanged) {
        return new SyncResult(outcome, hadConflicts, conflicts, offline, pushedCommit, transferFailures, changed,
                remoteChanged, message);
    }
}
