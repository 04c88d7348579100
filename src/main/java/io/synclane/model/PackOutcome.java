package io.synclane.model;

public record PackOutcome(
        boolean packed,
        boolean skippedDueToLock,
        long looseObjectsBefore,
        long looseObjectsAfter,
        long packFilesAfter
) {
    public static PackOutcome skipped() {
        return new PackOutcome(false, true, 0L, 0L, 0L);
    }
}
