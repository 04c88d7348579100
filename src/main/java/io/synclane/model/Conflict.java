package io.synclane.model;

public record Conflict(
        String filepath,
        String ours,
        String theirs,
        String base,
        boolean isNew,
        boolean isLfs
) {
}
