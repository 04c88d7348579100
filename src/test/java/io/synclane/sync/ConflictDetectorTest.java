package io.synclane.sync;

import io.synclane.lfs.PointerFiles;
import io.synclane.model.Conflict;
import io.synclane.model.PointerRecord;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

final class ConflictDetectorTest {
    @Test
    void onlyPathsChangedDifferentlyOnBothSidesDiverge() {
        Map<String, String> base = Map.of("a", "1", "b", "1", "c", "1", "d", "1");
        Map<String, String> ours = Map.of("a", "2", "b", "2", "c", "1", "d", "3");
        Map<String, String> theirs = Map.of("a", "3", "b", "2", "c", "4", "d", "1");

        List<ConflictDetector.DivergentPath> divergent = ConflictDetector.divergentPaths(base, ours, theirs);

        Assertions.assertEquals(1, divergent.size());
        Assertions.assertEquals("a", divergent.get(0).path());
    }

    @Test
    void addAddAndDeleteModifyAreDivergent() {
        Map<String, String> base = Map.of("kept", "1");
        Map<String, String> ours = Map.of("kept", "2", "new", "x");
        Map<String, String> theirs = Map.of("new", "y");

        List<ConflictDetector.DivergentPath> divergent = ConflictDetector.divergentPaths(base, ours, theirs);

        Assertions.assertEquals(List.of("kept", "new"), divergent.stream().map(ConflictDetector.DivergentPath::path).toList());
        Assertions.assertTrue(divergent.get(0).isDeleteModify());
        Assertions.assertFalse(divergent.get(0).isNew());
        Assertions.assertTrue(divergent.get(1).isNew());
    }

    @Test
    void bothSidesDeletingIsNotAConflict() {
        Assertions.assertTrue(ConflictDetector.divergentPaths(Map.of("gone", "1"), Map.of(), Map.of()).isEmpty());
    }

    @Test
    void conflictCarriesTextAndFlagsPointers() {
        ConflictDetector.DivergentPath path = new ConflictDetector.DivergentPath("docs/scan.bin", null, "o", "t");
        String pointer = PointerFiles.format(new PointerRecord("c".repeat(64), 12L));

        Conflict conflict = ConflictDetector.toConflict(path, pointer.getBytes(StandardCharsets.UTF_8), null, null, false);

        Assertions.assertEquals(pointer, conflict.ours());
        Assertions.assertEquals("", conflict.theirs());
        Assertions.assertNull(conflict.base());
        Assertions.assertTrue(conflict.isNew());
        Assertions.assertTrue(conflict.isLfs());
    }

    @Test
    void plainTextConflictIsNotLargeObject() {
        ConflictDetector.DivergentPath path = new ConflictDetector.DivergentPath("notes.md", "b", "o", "t");

        Conflict conflict = ConflictDetector.toConflict(path, "ours".getBytes(StandardCharsets.UTF_8),
                "theirs".getBytes(StandardCharsets.UTF_8), "base".getBytes(StandardCharsets.UTF_8), false);

        Assertions.assertFalse(conflict.isLfs());
        Assertions.assertEquals("base", conflict.base());
    }
}
