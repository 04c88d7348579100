package io.synclane.lfs;

import io.synclane.config.SyncSettings;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.function.Predicate;
import java.util.stream.Stream;

final class LfsAttributesTest {
    @Test
    void patternsAreReadFromFilterLines() throws Exception {
        Path repo = Files.createTempDirectory("synclane-attrs-");
        try {
            Files.writeString(repo.resolve(".gitattributes"),
                    "# binaries\n*.psd filter=lfs diff=lfs merge=lfs -text\n*.txt text eol=lf\n\ndocs/*.pdf filter=lfs -text\n",
                    StandardCharsets.UTF_8);

            Assertions.assertEquals(List.of("*.psd", "docs/*.pdf"), LfsAttributes.patterns(repo));
            Assertions.assertTrue(LfsAttributes.isLfsEnabled(repo));
        } finally {
            deleteRecursively(repo);
        }
    }

    @Test
    void addPatternIsIdempotent() throws Exception {
        Path repo = Files.createTempDirectory("synclane-attrs-add-");
        try {
            Files.writeString(repo.resolve(".gitattributes"), "*.txt text", StandardCharsets.UTF_8);

            Assertions.assertTrue(LfsAttributes.addPattern(repo, "*.mov"));
            Assertions.assertFalse(LfsAttributes.addPattern(repo, "*.mov"));
            Assertions.assertEquals("*.txt text\n*.mov filter=lfs diff=lfs merge=lfs -text\n",
                    Files.readString(repo.resolve(".gitattributes"), StandardCharsets.UTF_8));
            Assertions.assertThrows(IllegalArgumentException.class, () -> LfsAttributes.addPattern(repo, "bad pattern"));
        } finally {
            deleteRecursively(repo);
        }
    }

    @Test
    void matcherCoversPointerTreeAndPatterns() throws Exception {
        Path repo = Files.createTempDirectory("synclane-attrs-match-");
        try {
            LfsLayout layout = LfsLayout.from(SyncSettings.defaults());
            LfsAttributes.ensurePointerAttributes(repo, layout);
            LfsAttributes.addPattern(repo, "*.psd");
            LfsAttributes.addPattern(repo, "media/*.mp4");

            Predicate<String> matcher = LfsAttributes.matcher(repo, layout);

            Assertions.assertTrue(matcher.test(".project/attachments/pointers/deep/file.bin"));
            Assertions.assertTrue(matcher.test("art/cover.psd"));
            Assertions.assertTrue(matcher.test("media/clip.mp4"));
            Assertions.assertFalse(matcher.test("other/clip.mp4"));
            Assertions.assertFalse(matcher.test("notes/readme.md"));
        } finally {
            deleteRecursively(repo);
        }
    }

    @Test
    void payloadTreeIsExcludedOnce() throws Exception {
        Path repo = Files.createTempDirectory("synclane-attrs-exclude-");
        try {
            LfsLayout layout = LfsLayout.from(SyncSettings.defaults());

            Assertions.assertTrue(LfsAttributes.ensurePayloadsExcluded(repo, layout));
            Assertions.assertFalse(LfsAttributes.ensurePayloadsExcluded(repo, layout));
            List<String> lines = Files.readAllLines(repo.resolve(".git/info/exclude"), StandardCharsets.UTF_8);
            Assertions.assertEquals(List.of("/.project/attachments/files/"), lines);
        } finally {
            deleteRecursively(repo);
        }
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
