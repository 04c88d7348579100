package io.synclane.model;

/**
 * Resolution for one conflicting path. A {@code null} content deletes the path.
 */
public record ResolvedFile(String filepath, String content) {
    public static ResolvedFile deleted(String filepath) {
        return new ResolvedFile(filepath, null);
    }

    public boolean isDeletion() {
        return content == null;
    }
}
