package io.synclane.lfs;

import io.synclane.config.SyncLaneConfig;
import io.synclane.storage.LocalExcludes;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;

/**
 * Reads and maintains the {@code filter=lfs} entries of {@code .gitattributes}.
 */
public final class LfsAttributes {
    private static final String LFS_ATTRIBUTES = "filter=lfs diff=lfs merge=lfs -text";

    private LfsAttributes() {
    }

    public static List<String> patterns(Path repoDir) {
        Path file = SyncLaneConfig.forRepository(repoDir).gitAttributesFile();
        if (!Files.isRegularFile(file)) {
            return List.of();
        }
        List<String> out = new ArrayList<>();
        try {
            for (String line : Files.readAllLines(file, StandardCharsets.UTF_8)) {
                String trimmed = line.trim();
                if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                    continue;
                }
                String[] parts = trimmed.split("\\s+");
                for (int i = 1; i < parts.length; i++) {
                    if (parts[i].equals("filter=lfs")) {
                        out.add(parts[0]);
                        break;
                    }
                }
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to read " + file, e);
        }
        return out;
    }

    public static boolean isLfsEnabled(Path repoDir) {
        return !patterns(repoDir).isEmpty();
    }

    /**
     * Tracks everything under the pointer prefix. Does nothing if an equivalent line exists.
     */
    public static boolean ensurePointerAttributes(Path repoDir, LfsLayout layout) {
        return addPattern(repoDir, layout.pointerPrefix() + "/**");
    }

    public static boolean addPattern(Path repoDir, String pattern) {
        if (pattern == null || pattern.isBlank() || pattern.contains(" ")) {
            throw new IllegalArgumentException("Invalid attributes pattern: " + pattern);
        }
        if (patterns(repoDir).contains(pattern)) {
            return false;
        }
        Path file = SyncLaneConfig.forRepository(repoDir).gitAttributesFile();
        try {
            String existing = Files.isRegularFile(file) ? Files.readString(file, StandardCharsets.UTF_8) : "";
            String prefix = existing.isEmpty() || existing.endsWith("\n") ? "" : "\n";
            Files.writeString(file, prefix + pattern + " " + LFS_ATTRIBUTES + "\n", StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
            return true;
        } catch (IOException e) {
            throw new RuntimeException("Failed to update " + file, e);
        }
    }

    /**
     * Keeps downloaded payloads out of commits by listing the payload tree in the local exclude file.
     */
    public static boolean ensurePayloadsExcluded(Path repoDir, LfsLayout layout) {
        return LocalExcludes.ensure(repoDir, List.of("/" + layout.payloadPrefix() + "/"));
    }

    /**
     * Path predicate for pointer files: anything under the pointer prefix, plus every
     * {@code filter=lfs} pattern. Patterns with a slash match the whole path, others the file name.
     */
    public static Predicate<String> matcher(Path repoDir, LfsLayout layout) {
        List<Predicate<String>> rules = new ArrayList<>();
        rules.add(layout::isPointerPath);
        for (String pattern : patterns(repoDir)) {
            String glob = pattern.startsWith("/") ? pattern.substring(1) : pattern;
            PathMatcher matcher = FileSystems.getDefault().getPathMatcher("glob:" + glob);
            if (glob.contains("/")) {
                rules.add(path -> matcher.matches(Paths.get(path)));
            } else {
                rules.add(path -> {
                    Path fileName = Paths.get(path).getFileName();
                    return fileName != null && matcher.matches(fileName);
                });
            }
        }
        return path -> rules.stream().anyMatch(rule -> rule.test(path));
    }
}
