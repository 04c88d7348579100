package io.synclane.storage;

import io.synclane.config.SyncLaneConfig;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Maintains the repository's local exclude file ({@code .git/info/exclude}), which keeps paths out of
 * commits without touching any tracked file.
 */
public final class LocalExcludes {
    private LocalExcludes() {
    }

    /**
     * Appends the entries that are not listed yet.
     *
     * @return true when the file changed
     */
    public static boolean ensure(Path repoDir, List<String> entries) {
        Path exclude = SyncLaneConfig.forRepository(repoDir).excludeFile();
        try {
            String existing = Files.isRegularFile(exclude) ? Files.readString(exclude, StandardCharsets.UTF_8) : "";
            Set<String> present = existing.lines().map(String::trim).collect(Collectors.toSet());
            List<String> missing = new ArrayList<>();
            for (String entry : entries) {
                if (!present.contains(entry) && !missing.contains(entry)) {
                    missing.add(entry);
                }
            }
            if (missing.isEmpty()) {
                return false;
            }
            Files.createDirectories(exclude.getParent());
            StringBuilder out = new StringBuilder();
            if (!existing.isEmpty() && !existing.endsWith("\n")) {
                out.append('\n');
            }
            for (String entry : missing) {
                out.append(entry).append('\n');
            }
            Files.writeString(exclude, out.toString(), StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
            return true;
        } catch (IOException e) {
            throw new RuntimeException("Failed to update " + exclude, e);
        }
    }

    /**
     * Excludes the metadata lock, temp and backup files, which only ever belong to the process
     * currently updating {@code metadata.json}.
     */
    public static boolean ensureProcessLocalFilesExcluded(Path repoDir) {
        List<String> entries = new ArrayList<>();
        for (String name : SyncLaneConfig.processLocalFiles()) {
            entries.add("/" + name);
        }
        return ensure(repoDir, entries);
    }
}
