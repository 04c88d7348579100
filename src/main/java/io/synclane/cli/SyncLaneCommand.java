package io.synclane.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.synclane.metadata.MetadataUpdateResult;
import io.synclane.model.AuthorIdentity;
import io.synclane.model.Credentials;
import io.synclane.model.LockStatus;
import io.synclane.model.ResolvedFile;
import io.synclane.model.SyncResult;
import io.synclane.model.SyncTrigger;
import io.synclane.runtime.SyncLaneRuntime;
import io.synclane.util.Jsons;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.function.Supplier;

@Command(
        name = "synclane",
        mixinStandardHelpOptions = true,
        description = "Local-first repository sync CLI",
        subcommands = {
                SyncLaneCommand.SyncCommand.class,
                SyncLaneCommand.CompleteMergeCommand.class,
                SyncLaneCommand.LockStatusCommand.class,
                SyncLaneCommand.LockAcquireCommand.class,
                SyncLaneCommand.LockReleaseCommand.class,
                SyncLaneCommand.LockCleanupCommand.class,
                SyncLaneCommand.LockReclaimCommand.class,
                SyncLaneCommand.PackCommand.class,
                SyncLaneCommand.MetadataSetCommand.class,
                SyncLaneCommand.MetadataShowCommand.class,
                SyncLaneCommand.LfsStatusCommand.class,
                SyncLaneCommand.LfsReconcileCommand.class,
                SyncLaneCommand.LfsTrackCommand.class
        }
)
public final class SyncLaneCommand implements Runnable {
    private final Supplier<SyncLaneRuntime> runtimeFactory;

    @Option(names = {"--repo"}, description = "Repository working tree", defaultValue = ".")
    String repo;

    @Option(names = {"--username"}, description = "Remote username")
    String username;

    @Option(names = {"--password"}, description = "Remote password or token", defaultValue = "${env:SYNCLANE_PASSWORD}")
    String password;

    @Option(names = {"--author-name"}, description = "Commit author name", defaultValue = "synclane")
    String authorName;

    @Option(names = {"--author-email"}, description = "Commit author email", defaultValue = "synclane@localhost")
    String authorEmail;

    public SyncLaneCommand() {
        this(SyncLaneRuntime::new);
    }

    public SyncLaneCommand(Supplier<SyncLaneRuntime> runtimeFactory) {
        this.runtimeFactory = runtimeFactory;
    }

    @Override
    public void run() {
        System.out.println("Use subcommands: sync | complete-merge | lock-status | lock-acquire | lock-release | lock-cleanup | lock-reclaim | pack | metadata-set | metadata-show | lfs-status | lfs-reconcile | lfs-track");
    }

    SyncLaneRuntime runtime() {
        return runtimeFactory.get();
    }

    Path repoDir() {
        return Path.of(repo).toAbsolutePath().normalize();
    }

    Credentials credentials() {
        if (username == null || username.isBlank()) {
            return Credentials.none();
        }
        return new Credentials(username, password);
    }

    AuthorIdentity author() {
        return new AuthorIdentity(authorName, authorEmail);
    }

    @Command(name = "sync", description = "Commit, fetch, merge and push the repository")
    static final class SyncCommand implements Callable<Integer> {
        @ParentCommand
        SyncLaneCommand parent;

        @Option(names = {"--automatic"}, description = "Skip quietly when another sync holds the lock")
        boolean automatic;

        @Override
        public Integer call() {
            SyncTrigger trigger = automatic ? SyncTrigger.AUTOMATIC : SyncTrigger.MANUAL;
            SyncResult result = parent.runtime().syncChanges(parent.repoDir(), parent.credentials(), parent.author(), trigger);
            System.out.println(Jsons.toJson(result));
            return 0;
        }
    }

    @Command(name = "complete-merge", description = "Commit conflict resolutions and push")
    static final class CompleteMergeCommand implements Callable<Integer> {
        @ParentCommand
        SyncLaneCommand parent;

        @Option(names = {"--resolved"}, description = "Resolution as <path>=<file with resolved content>")
        Map<String, String> resolved = new LinkedHashMap<>();

        @Option(names = {"--delete"}, description = "Resolve a conflict by deleting the path")
        List<String> deleted = new ArrayList<>();

        @Override
        public Integer call() throws IOException {
            List<ResolvedFile> resolutions = new ArrayList<>();
            for (Map.Entry<String, String> entry : resolved.entrySet()) {
                String content = Files.readString(Path.of(entry.getValue()), StandardCharsets.UTF_8);
                resolutions.add(new ResolvedFile(entry.getKey(), content));
            }
            for (String path : deleted) {
                resolutions.add(ResolvedFile.deleted(path));
            }
            SyncResult result = parent.runtime().completeMerge(parent.repoDir(), parent.credentials(), parent.author(), resolutions);
            System.out.println(Jsons.toJson(result));
            return 0;
        }
    }

    @Command(name = "lock-status", description = "Show the sync lock state")
    static final class LockStatusCommand implements Callable<Integer> {
        @ParentCommand
        SyncLaneCommand parent;

        @Override
        public Integer call() {
            LockStatus status = parent.runtime().checkFilesystemLock(parent.repoDir());
            System.out.println(Jsons.toJson(status));
            return 0;
        }
    }

    @Command(name = "lock-acquire", description = "Try to take the sync lock")
    static final class LockAcquireCommand implements Callable<Integer> {
        @ParentCommand
        SyncLaneCommand parent;

        @Override
        public Integer call() {
            SyncLaneRuntime runtime = parent.runtime();
            boolean acquired = runtime.acquireSyncLock(parent.repoDir());
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("acquired", acquired);
            out.put("status", runtime.checkFilesystemLock(parent.repoDir()));
            System.out.println(Jsons.toJson(out));
            return 0;
        }
    }

    @Command(name = "lock-release", description = "Release the sync lock held by this process")
    static final class LockReleaseCommand implements Callable<Integer> {
        @ParentCommand
        SyncLaneCommand parent;

        @Override
        public Integer call() {
            SyncLaneRuntime runtime = parent.runtime();
            runtime.releaseSyncLock(parent.repoDir());
            System.out.println(Jsons.toJson(runtime.checkFilesystemLock(parent.repoDir())));
            return 0;
        }
    }

    @Command(name = "lock-cleanup", description = "Remove the sync lock if its holder is dead")
    static final class LockCleanupCommand implements Callable<Integer> {
        @ParentCommand
        SyncLaneCommand parent;

        @Override
        public Integer call() {
            boolean removed = parent.runtime().cleanupStaleLock(parent.repoDir());
            System.out.println(Jsons.toJson(Map.of("removed", removed)));
            return 0;
        }
    }

    @Command(name = "lock-reclaim", description = "Remove a stuck or dead sync lock")
    static final class LockReclaimCommand implements Callable<Integer> {
        @ParentCommand
        SyncLaneCommand parent;

        @Override
        public Integer call() {
            boolean removed = parent.runtime().forceReclaimLock(parent.repoDir());
            System.out.println(Jsons.toJson(Map.of("removed", removed)));
            return 0;
        }
    }

    @Command(name = "pack", description = "Pack loose objects unless a sync is running")
    static final class PackCommand implements Callable<Integer> {
        @ParentCommand
        SyncLaneCommand parent;

        @Option(names = {"--silent"}, description = "Log at debug level only")
        boolean silent;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.runtime().packRepository(parent.repoDir(), silent)));
            return 0;
        }
    }

    @Command(name = "metadata-set", description = "Set a value in metadata.json under the metadata lock")
    static final class MetadataSetCommand implements Callable<Integer> {
        @ParentCommand
        SyncLaneCommand parent;

        @Option(names = {"--pointer"}, required = true, description = "JSON pointer, e.g. /meta/title")
        String pointer;

        @Option(names = {"--value"}, required = true, description = "JSON value")
        String value;

        @Override
        public Integer call() throws IOException {
            JsonNode parsed = Jsons.mapper().readTree(value);
            MetadataUpdateResult result = parent.runtime().safeUpdateMetadata(parent.repoDir(),
                    document -> JsonPointers.set(document, pointer, parsed));
            System.out.println(Jsons.toJson(result));
            return result.success() ? 0 : 1;
        }
    }

    @Command(name = "metadata-show", description = "Print metadata.json")
    static final class MetadataShowCommand implements Callable<Integer> {
        @ParentCommand
        SyncLaneCommand parent;

        @Override
        public Integer call() {
            ObjectNode document = parent.runtime().metadataDocument(parent.repoDir());
            System.out.println(Jsons.toJson(document));
            return 0;
        }
    }

    @Command(name = "lfs-status", description = "Show large-object tracking and missing payloads")
    static final class LfsStatusCommand implements Callable<Integer> {
        @ParentCommand
        SyncLaneCommand parent;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.runtime().lfsStatus(parent.repoDir())));
            return 0;
        }
    }

    @Command(name = "lfs-reconcile", description = "Upload new and download missing large objects")
    static final class LfsReconcileCommand implements Callable<Integer> {
        @ParentCommand
        SyncLaneCommand parent;

        @Override
        public Integer call() {
            var report = parent.runtime().reconcileLargeObjects(parent.repoDir(), parent.credentials());
            System.out.println(Jsons.toJson(report));
            return 0;
        }
    }

    @Command(name = "lfs-track", description = "Track a path pattern as large objects")
    static final class LfsTrackCommand implements Callable<Integer> {
        @ParentCommand
        SyncLaneCommand parent;

        @Parameters(index = "0", description = "Attributes pattern, e.g. *.psd")
        String pattern;

        @Override
        public Integer call() {
            boolean added = parent.runtime().trackLargeObjects(parent.repoDir(), pattern);
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("pattern", pattern);
            out.put("added", added);
            System.out.println(Jsons.toJson(out));
            return 0;
        }
    }
}
