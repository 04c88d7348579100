package io.synclane.vcs;

import io.synclane.model.AuthorIdentity;
import io.synclane.model.Credentials;
import io.synclane.observability.SensitiveDataMasker;
import org.eclipse.jgit.api.Git;
import org.eclipse.jgit.api.GarbageCollectCommand;
import org.eclipse.jgit.api.MergeCommand;
import org.eclipse.jgit.api.MergeResult;
import org.eclipse.jgit.api.ResetCommand;
import org.eclipse.jgit.api.errors.GitAPIException;
import org.eclipse.jgit.api.errors.InvalidRemoteException;
import org.eclipse.jgit.api.errors.TransportException;
import org.eclipse.jgit.dircache.DirCache;
import org.eclipse.jgit.lib.CommitBuilder;
import org.eclipse.jgit.lib.Constants;
import org.eclipse.jgit.lib.EmptyProgressMonitor;
import org.eclipse.jgit.lib.ObjectId;
import org.eclipse.jgit.lib.ObjectInserter;
import org.eclipse.jgit.lib.PersonIdent;
import org.eclipse.jgit.lib.ProgressMonitor;
import org.eclipse.jgit.lib.Ref;
import org.eclipse.jgit.lib.RefUpdate;
import org.eclipse.jgit.lib.Repository;
import org.eclipse.jgit.merge.MergeStrategy;
import org.eclipse.jgit.revwalk.RevCommit;
import org.eclipse.jgit.revwalk.RevWalk;
import org.eclipse.jgit.revwalk.filter.RevFilter;
import org.eclipse.jgit.transport.CredentialsProvider;
import org.eclipse.jgit.transport.PushResult;
import org.eclipse.jgit.transport.RefSpec;
import org.eclipse.jgit.transport.RemoteRefUpdate;
import org.eclipse.jgit.transport.URIish;
import org.eclipse.jgit.transport.UsernamePasswordCredentialsProvider;
import org.eclipse.jgit.treewalk.TreeWalk;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Properties;
import java.util.Set;
import java.util.TreeMap;

public final class JGitVersionControl implements VersionControl {
    private static final Logger logger = LoggerFactory.getLogger(JGitVersionControl.class);

    @Override
    public void init(Path dir, String defaultBranch) {
        try (Git ignored = Git.init().setDirectory(dir.toFile()).setInitialBranch(defaultBranch).call()) {
            logger.debug("Initialized repository {}", dir);
        } catch (GitAPIException e) {
            throw classify("init", e);
        }
    }

    @Override
    public void addRemote(Path dir, String name, String url) {
        run(dir, "addRemote", git -> {
            try {
                git.remoteAdd().setName(name).setUri(new URIish(url)).call();
            } catch (URISyntaxException e) {
                throw new VcsException(VcsException.Kind.OTHER, "Invalid remote URL: " + SensitiveDataMasker.maskUrl(url), e);
            }
            return null;
        });
    }

    @Override
    public Optional<String> remoteUrl(Path dir, String remote) {
        return run(dir, "remoteUrl", git -> Optional.ofNullable(
                git.getRepository().getConfig().getString("remote", remote, "url")));
    }

    @Override
    public void add(Path dir, String filepath) {
        run(dir, "add", git -> git.add().addFilepattern(filepath).call());
    }

    @Override
    public void remove(Path dir, String filepath) {
        run(dir, "remove", git -> git.rm().addFilepattern(filepath).call());
    }

    @Override
    public void addAll(Path dir) {
        run(dir, "addAll", git -> {
            git.add().addFilepattern(".").call();
            git.add().setUpdate(true).addFilepattern(".").call();
            return null;
        });
    }

    @Override
    public boolean isDirty(Path dir) {
        return run(dir, "status", git -> !git.status().call().isClean());
    }

    @Override
    public String commit(Path dir, String message, AuthorIdentity author) {
        return run(dir, "commit", git -> {
            PersonIdent ident = ident(author);
            RevCommit commit = git.commit().setMessage(message).setAuthor(ident).setCommitter(ident).call();
            return commit.getName();
        });
    }

    @Override
    public String commit(Path dir, String message, AuthorIdentity author, List<String> parents) {
        return run(dir, "commit", git -> {
            Repository repo = git.getRepository();
            PersonIdent ident = ident(author);
            ObjectId commitId;
            try (ObjectInserter inserter = repo.newObjectInserter()) {
                DirCache index = repo.lockDirCache();
                ObjectId tree;
                try {
                    tree = index.writeTree(inserter);
                } finally {
                    index.unlock();
                }
                CommitBuilder builder = new CommitBuilder();
                builder.setTreeId(tree);
                List<ObjectId> parentIds = new ArrayList<>();
                for (String parent : parents) {
                    parentIds.add(ObjectId.fromString(parent));
                }
                builder.setParentIds(parentIds);
                builder.setAuthor(ident);
                builder.setCommitter(ident);
                builder.setMessage(message);
                commitId = inserter.insert(builder);
                inserter.flush();
            }
            RefUpdate update = repo.updateRef(Constants.HEAD);
            update.setNewObjectId(commitId);
            update.setRefLogMessage("commit: " + firstLine(message), false);
            RefUpdate.Result result = update.forceUpdate();
            if (!isRefUpdateOk(result)) {
                throw new VcsException(VcsException.Kind.OTHER, "Failed to move HEAD to new commit: " + result, null);
            }
            repo.writeMergeHeads(null);
            repo.writeMergeCommitMsg(null);
            return commitId.getName();
        });
    }

    @Override
    public void fetch(Path dir, String remote, Credentials credentials, ProgressListener progress) {
        run(dir, "fetch", git -> git.fetch()
                .setRemote(remote)
                .setCredentialsProvider(credentialsProvider(credentials))
                .setProgressMonitor(monitor(progress))
                .call());
    }

    @Override
    public void push(Path dir, String remote, String branch, Credentials credentials, ProgressListener progress) {
        run(dir, "push", git -> {
            String ref = Constants.R_HEADS + branch;
            Iterable<PushResult> results = git.push()
                    .setRemote(remote)
                    .setRefSpecs(new RefSpec(ref + ":" + ref))
                    .setCredentialsProvider(credentialsProvider(credentials))
                    .setProgressMonitor(monitor(progress))
                    .call();
            for (PushResult result : results) {
                for (RemoteRefUpdate update : result.getRemoteUpdates()) {
                    RemoteRefUpdate.Status status = update.getStatus();
                    if (status == RemoteRefUpdate.Status.OK || status == RemoteRefUpdate.Status.UP_TO_DATE) {
                        continue;
                    }
                    String detail = update.getMessage() == null ? status.name() : status.name() + ": " + update.getMessage();
                    throw new VcsException(VcsException.Kind.REJECTED, "Push of " + update.getRemoteName() + " rejected (" + detail + ")", null);
                }
            }
            return null;
        });
    }

    @Override
    public void checkout(Path dir, String ref) {
        run(dir, "checkout", git -> git.checkout().setName(ref).call());
    }

    @Override
    public String currentBranch(Path dir) {
        return run(dir, "currentBranch", git -> git.getRepository().getBranch());
    }

    @Override
    public Optional<String> resolveRef(Path dir, String ref) {
        return run(dir, "resolveRef", git -> {
            ObjectId id = git.getRepository().resolve(ref);
            return id == null ? Optional.empty() : Optional.of(id.getName());
        });
    }

    @Override
    public Optional<byte[]> readBlob(Path dir, String commitId, String filepath) {
        return run(dir, "readBlob", git -> {
            Repository repo = git.getRepository();
            try (RevWalk walk = new RevWalk(repo)) {
                RevCommit commit = walk.parseCommit(ObjectId.fromString(commitId));
                try (TreeWalk tree = TreeWalk.forPath(repo, filepath, commit.getTree())) {
                    if (tree == null) {
                        return Optional.empty();
                    }
                    return Optional.of(repo.open(tree.getObjectId(0), Constants.OBJ_BLOB).getBytes());
                }
            }
        });
    }

    @Override
    public List<CommitInfo> log(Path dir, String ref, int maxCount) {
        return run(dir, "log", git -> {
            ObjectId start = git.getRepository().resolve(ref);
            if (start == null) {
                return List.of();
            }
            List<CommitInfo> out = new ArrayList<>();
            for (RevCommit commit : git.log().add(start).setMaxCount(maxCount).call()) {
                List<String> parents = new ArrayList<>();
                for (RevCommit parent : commit.getParents()) {
                    parents.add(parent.getName());
                }
                PersonIdent author = commit.getAuthorIdent();
                out.add(new CommitInfo(commit.getName(), commit.getFullMessage(), author.getName(),
                        author.getEmailAddress(), commit.getCommitTime() * 1000L, parents));
            }
            return out;
        });
    }

    @Override
    public List<String> listBranches(Path dir) {
        return run(dir, "listBranches", git -> {
            List<String> out = new ArrayList<>();
            for (Ref ref : git.branchList().call()) {
                out.add(Repository.shortenRefName(ref.getName()));
            }
            return out;
        });
    }

    @Override
    public void writeRef(Path dir, String ref, String objectId) {
        run(dir, "writeRef", git -> {
            RefUpdate update = git.getRepository().updateRef(ref);
            update.setNewObjectId(ObjectId.fromString(objectId));
            RefUpdate.Result result = update.forceUpdate();
            if (!isRefUpdateOk(result)) {
                throw new VcsException(VcsException.Kind.OTHER, "Failed to write " + ref + ": " + result, null);
            }
            return null;
        });
    }

    @Override
    public Optional<String> mergeBase(Path dir, String a, String b) {
        return run(dir, "mergeBase", git -> {
            try (RevWalk walk = new RevWalk(git.getRepository())) {
                walk.setRevFilter(RevFilter.MERGE_BASE);
                walk.markStart(walk.parseCommit(ObjectId.fromString(a)));
                walk.markStart(walk.parseCommit(ObjectId.fromString(b)));
                RevCommit base = walk.next();
                return base == null ? Optional.empty() : Optional.of(base.getName());
            }
        });
    }

    @Override
    public boolean isAncestor(Path dir, String ancestor, String descendant) {
        return run(dir, "isAncestor", git -> {
            try (RevWalk walk = new RevWalk(git.getRepository())) {
                return walk.isMergedInto(
                        walk.parseCommit(ObjectId.fromString(ancestor)),
                        walk.parseCommit(ObjectId.fromString(descendant)));
            }
        });
    }

    @Override
    public Map<String, String> listFiles(Path dir, String commitId) {
        if (commitId == null) {
            return Map.of();
        }
        return run(dir, "listFiles", git -> {
            Repository repo = git.getRepository();
            Map<String, String> out = new TreeMap<>();
            try (RevWalk walk = new RevWalk(repo); TreeWalk tree = new TreeWalk(repo)) {
                tree.addTree(walk.parseCommit(ObjectId.fromString(commitId)).getTree());
                tree.setRecursive(true);
                while (tree.next()) {
                    out.put(tree.getPathString(), tree.getObjectId(0).getName());
                }
            }
            return out;
        });
    }

    @Override
    public List<String> changedPaths(Path dir, String fromCommit, String toCommit) {
        Map<String, String> before = listFiles(dir, fromCommit);
        Map<String, String> after = listFiles(dir, toCommit);
        Set<String> paths = new LinkedHashSet<>(before.keySet());
        paths.addAll(after.keySet());
        List<String> out = new ArrayList<>();
        for (String path : paths) {
            if (!Objects.equals(before.get(path), after.get(path))) {
                out.add(path);
            }
        }
        out.sort(null);
        return out;
    }

    @Override
    public MergeOutcome fastForward(Path dir, String targetCommit) {
        return run(dir, "fastForward", git -> toOutcome(git, git.merge()
                .include(ObjectId.fromString(targetCommit))
                .setFastForward(MergeCommand.FastForwardMode.FF_ONLY)
                .call()));
    }

    @Override
    public MergeOutcome merge(Path dir, String theirsCommit) {
        return run(dir, "merge", git -> toOutcome(git, git.merge()
                .include(ObjectId.fromString(theirsCommit))
                .setCommit(false)
                .setFastForward(MergeCommand.FastForwardMode.NO_FF)
                .setStrategy(MergeStrategy.RECURSIVE)
                .call()));
    }

    @Override
    public void abortMerge(Path dir) {
        run(dir, "abortMerge", git -> {
            git.reset().setMode(ResetCommand.ResetType.HARD).setRef(Constants.HEAD).call();
            git.getRepository().writeMergeHeads(null);
            git.getRepository().writeMergeCommitMsg(null);
            return null;
        });
    }

    @Override
    public PackStats pack(Path dir) {
        return run(dir, "pack", git -> {
            GarbageCollectCommand gc = git.gc();
            gc.call();
            return toPackStats(gc.getStatistics());
        });
    }

    @Override
    public PackStats statistics(Path dir) {
        return run(dir, "statistics", git -> toPackStats(git.gc().getStatistics()));
    }

    private static PackStats toPackStats(Properties stats) {
        return new PackStats(
                statistic(stats, "numberOfLooseObjects"),
                statistic(stats, "numberOfPackedObjects"),
                statistic(stats, "numberOfPackFiles"));
    }

    private static MergeOutcome toOutcome(Git git, MergeResult result) throws IOException {
        ObjectId head = git.getRepository().resolve(Constants.HEAD);
        String headId = head == null ? null : head.getName();
        MergeResult.MergeStatus status = result.getMergeStatus();
        return switch (status) {
            case FAST_FORWARD, FAST_FORWARD_SQUASHED -> new MergeOutcome(MergeOutcome.Status.FAST_FORWARD, headId, List.of());
            case ALREADY_UP_TO_DATE -> new MergeOutcome(MergeOutcome.Status.ALREADY_UP_TO_DATE, headId, List.of());
            case MERGED_NOT_COMMITTED, MERGED, MERGED_SQUASHED, MERGED_SQUASHED_NOT_COMMITTED ->
                    new MergeOutcome(MergeOutcome.Status.MERGED_NOT_COMMITTED, headId, List.of());
            case CONFLICTING -> new MergeOutcome(MergeOutcome.Status.CONFLICTING, headId,
                    result.getConflicts() == null ? List.of() : new ArrayList<>(result.getConflicts().keySet()));
            default -> new MergeOutcome(MergeOutcome.Status.FAILED, headId,
                    result.getFailingPaths() == null ? List.of() : new ArrayList<>(result.getFailingPaths().keySet()));
        };
    }

    private static long statistic(Properties stats, String key) {
        Object value = stats.get(key);
        if (value instanceof Number) {
            return ((Number) value).longValue();
        }
        try {
            return value == null ? 0L : Long.parseLong(value.toString());
        } catch (NumberFormatException e) {
            return 0L;
        }
    }

    private static boolean isRefUpdateOk(RefUpdate.Result result) {
        return result == RefUpdate.Result.NEW
                || result == RefUpdate.Result.FORCED
                || result == RefUpdate.Result.FAST_FORWARD
                || result == RefUpdate.Result.NO_CHANGE;
    }

    private static PersonIdent ident(AuthorIdentity author) {
        return new PersonIdent(author.name(), author.email());
    }

    private static String firstLine(String message) {
        int newline = message.indexOf('\n');
        return newline < 0 ? message : message.substring(0, newline);
    }

    private static CredentialsProvider credentialsProvider(Credentials credentials) {
        if (credentials == null || !credentials.isPresent()) {
            return null;
        }
        return new UsernamePasswordCredentialsProvider(credentials.username(),
                credentials.password() == null ? "" : credentials.password());
    }

    private static ProgressMonitor monitor(ProgressListener listener) {
        ProgressListener target = listener == null ? ProgressListener.NONE : listener;
        return new EmptyProgressMonitor() {
            private String task = "";
            private long total;
            private long done;

            @Override
            public void beginTask(String title, int totalWork) {
                task = title;
                total = Math.max(0, totalWork);
                done = 0L;
                target.onProgress(task, done, total);
            }

            @Override
            public void update(int completed) {
                done += completed;
                target.onProgress(task, done, total);
            }
        };
    }

    private <T> T run(Path dir, String operation, GitCall<T> call) {
        try (Git git = Git.open(dir.toFile())) {
            return call.apply(git);
        } catch (GitAPIException e) {
            throw classify(operation, e);
        } catch (IOException e) {
            throw new VcsException(VcsException.Kind.OTHER, "Failed to " + operation + " in " + dir + ": " + e.getMessage(), e);
        }
    }

    static VcsException classify(String operation, GitAPIException e) {
        String message = e.getMessage() == null ? "" : e.getMessage();
        String lower = message.toLowerCase(Locale.ROOT);
        VcsException.Kind kind;
        if (e instanceof TransportException) {
            boolean auth = lower.contains("not authorized")
                    || lower.contains("authentication")
                    || lower.contains("auth fail")
                    || lower.contains("401")
                    || lower.contains("403");
            kind = auth ? VcsException.Kind.AUTH : VcsException.Kind.NETWORK;
        } else if (e instanceof InvalidRemoteException) {
            kind = VcsException.Kind.NOT_FOUND;
        } else {
            kind = VcsException.Kind.OTHER;
        }
        return new VcsException(kind, "Failed to " + operation + ": " + SensitiveDataMasker.maskUrl(message), e);
    }

    @FunctionalInterface
    private interface GitCall<T> {
        T apply(Git git) throws GitAPIException, IOException;
    }
}
