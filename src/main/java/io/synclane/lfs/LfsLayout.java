package io.synclane.lfs;

import io.synclane.config.SyncSettings;

import java.nio.file.Path;

/**
 * Maps between the pointer tree and the payload tree. Paths are repository-relative and use
 * forward slashes.
 */
public record LfsLayout(String pointerPrefix, String payloadPrefix) {
    public static LfsLayout from(SyncSettings settings) {
        return new LfsLayout(settings.pointerPrefix(), settings.payloadPrefix());
    }

    public boolean isPointerPath(String relativePath) {
        return relativePath != null && relativePath.startsWith(pointerPrefix + "/");
    }

    public boolean isPayloadPath(String relativePath) {
        return relativePath != null && relativePath.startsWith(payloadPrefix + "/");
    }

    public String payloadPathFor(String pointerPath) {
        return payloadPrefix + pointerPath.substring(pointerPrefix.length());
    }

    public String pointerPathFor(String payloadPath) {
        return pointerPrefix + payloadPath.substring(payloadPrefix.length());
    }

    public Path pointerRoot(Path repoDir) {
        return repoDir.resolve(pointerPrefix);
    }

    public Path payloadRoot(Path repoDir) {
        return repoDir.resolve(payloadPrefix);
    }

    public static String relativize(Path repoDir, Path file) {
        return repoDir.relativize(file).toString().replace('\\', '/');
    }
}
