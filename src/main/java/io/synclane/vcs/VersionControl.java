package io.synclane.vcs;

import io.synclane.model.AuthorIdentity;
import io.synclane.model.Credentials;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Version-control operations the sync engine relies on. Every method works on the repository whose
 * working tree is {@code dir}; ids are full hex object names.
 */
public interface VersionControl {
    void init(Path dir, String defaultBranch);

    void addRemote(Path dir, String name, String url);

    Optional<String> remoteUrl(Path dir, String remote);

    void add(Path dir, String filepath);

    void remove(Path dir, String filepath);

    /**
     * Stages every change in the working tree, deletions included.
     */
    void addAll(Path dir);

    boolean isDirty(Path dir);

    String commit(Path dir, String message, AuthorIdentity author);

    /**
     * Commits the index with explicit parents, e.g. a merge commit.
     */
    String commit(Path dir, String message, AuthorIdentity author, List<String> parents);

    void fetch(Path dir, String remote, Credentials credentials, ProgressListener progress);

    void push(Path dir, String remote, String branch, Credentials credentials, ProgressListener progress);

    void checkout(Path dir, String ref);

    String currentBranch(Path dir);

    Optional<String> resolveRef(Path dir, String ref);

    Optional<byte[]> readBlob(Path dir, String commitId, String filepath);

    List<CommitInfo> log(Path dir, String ref, int maxCount);

    List<String> listBranches(Path dir);

    void writeRef(Path dir, String ref, String objectId);

    Optional<String> mergeBase(Path dir, String a, String b);

    boolean isAncestor(Path dir, String ancestor, String descendant);

    /**
     * Path to blob id for every file in the tree of {@code commitId}; empty for a null commit.
     */
    Map<String, String> listFiles(Path dir, String commitId);

    List<String> changedPaths(Path dir, String fromCommit, String toCommit);

    MergeOutcome fastForward(Path dir, String targetCommit);

    /**
     * Merges {@code theirsCommit} into the working tree and index without committing.
     */
    MergeOutcome merge(Path dir, String theirsCommit);

    void abortMerge(Path dir);

    PackStats pack(Path dir);

    PackStats statistics(Path dir);

    @FunctionalInterface
    interface ProgressListener {
        ProgressListener NONE = (task, current, total) -> {
        };

        void onProgress(String task, long current, long total);
    }
}
