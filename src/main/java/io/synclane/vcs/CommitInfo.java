package io.synclane.vcs;

import java.util.List;

public record CommitInfo(
        String id,
        String message,
        String authorName,
        String authorEmail,
        long commitTimeMs,
        List<String> parents
) {
}
