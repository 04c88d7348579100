package io.synclane.storage;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LockFilesTest {
    @Test
    void exclusiveCreateHasExactlyOneWinner() throws Exception {
        Path dir = Files.createTempDirectory("synclane-lockfiles-create-");
        Path lock = dir.resolve("nested").resolve("sync.lock");

        assertTrue(LockFiles.createExclusive(lock, bytes("first")));
        assertFalse(LockFiles.createExclusive(lock, bytes("second")));
        assertEquals("first", Files.readString(lock, StandardCharsets.UTF_8));
        assertEquals(1L, countFiles(lock.getParent()));
    }

    @Test
    void deleteIfMatchesLeavesReplacedContentAlone() throws Exception {
        Path dir = Files.createTempDirectory("synclane-lockfiles-delete-");
        Path lock = dir.resolve("sync.lock");
        Files.write(lock, bytes("newer"));

        assertFalse(LockFiles.deleteIfMatches(lock, bytes("older")));
        assertArrayEquals(bytes("newer"), Files.readAllBytes(lock));
        assertEquals(1L, countFiles(dir));

        assertTrue(LockFiles.deleteIfMatches(lock, bytes("newer")));
        assertFalse(Files.exists(lock));
        assertFalse(LockFiles.deleteIfMatches(lock, bytes("newer")));
        assertEquals(0L, countFiles(dir));
    }

    @Test
    void writeAtomicallyReplacesWithoutLeftovers() throws Exception {
        Path dir = Files.createTempDirectory("synclane-lockfiles-write-");
        Path file = dir.resolve("record.json");
        LockFiles.writeAtomically(file, bytes("{\"v\":1}"));
        LockFiles.writeAtomically(file, bytes("{\"v\":2}"));

        assertEquals("{\"v\":2}", Files.readString(file, StandardCharsets.UTF_8));
        assertEquals(1L, countFiles(dir));
        assertTrue(LockFiles.readIfExists(dir.resolve("missing")).isEmpty());
    }

    @Test
    void replaceIfWritesOnlyOverOwnedContent() throws Exception {
        Path dir = Files.createTempDirectory("synclane-lockfiles-replace-");
        Path lock = dir.resolve("sync.lock");
        Files.write(lock, bytes("holder:1"));

        assertTrue(LockFiles.replaceIf(lock, raw -> new String(raw, StandardCharsets.UTF_8).startsWith("holder"), bytes("holder:2")));
        assertEquals("holder:2", Files.readString(lock, StandardCharsets.UTF_8));

        assertFalse(LockFiles.replaceIf(lock, raw -> new String(raw, StandardCharsets.UTF_8).startsWith("other"), bytes("other:1")));
        assertEquals("holder:2", Files.readString(lock, StandardCharsets.UTF_8));
        assertEquals(1L, countFiles(dir));

        Files.delete(lock);
        assertFalse(LockFiles.replaceIf(lock, raw -> true, bytes("holder:3")));
        assertFalse(Files.exists(lock));
        assertEquals(0L, countFiles(dir));
    }

    @Test
    void replaceIfLosesToALockCreatedWhileClaimed() throws Exception {
        Path dir = Files.createTempDirectory("synclane-lockfiles-replace-race-");
        Path lock = dir.resolve("sync.lock");
        Files.write(lock, bytes("holder:1"));

        boolean replaced = LockFiles.replaceIf(lock, raw -> {
            try {
                assertTrue(LockFiles.createExclusive(lock, bytes("successor:1")));
            } catch (Exception e) {
                throw new AssertionError(e);
            }
            return true;
        }, bytes("holder:2"));

        assertFalse(replaced);
        assertEquals("successor:1", Files.readString(lock, StandardCharsets.UTF_8));
        assertEquals(1L, countFiles(dir));
    }

    private static byte[] bytes(String text) {
        return text.getBytes(StandardCharsets.UTF_8);
    }

    private static long countFiles(Path dir) throws Exception {
        try (Stream<Path> list = Files.list(dir)) {
            return list.count();
        }
    }
}
