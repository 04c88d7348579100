package io.synclane.vcs;

import java.util.List;

public record MergeOutcome(Status status, String head, List<String> conflictingPaths) {
    public enum Status {
        FAST_FORWARD,
        MERGED_NOT_COMMITTED,
        ALREADY_UP_TO_DATE,
        CONFLICTING,
        FAILED
    }

    public MergeOutcome {
        conflictingPaths = conflictingPaths == null ? List.of() : List.copyOf(conflictingPaths);
    }

    public boolean isSuccessful() {
        return status != Status.CONFLICTING && status != Status.FAILED;
    }
}
