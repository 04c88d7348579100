package io.synclane.vcs;

public record PackStats(long looseObjects, long packedObjects, long packFiles) {
}
