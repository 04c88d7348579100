package io.synclane.storage;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.Arrays;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Predicate;

/**
 * Filesystem primitives shared by the sync lock and the metadata lock. Lock files are published
 * complete: content is written to a private sibling first and then hard-linked (or, where links are
 * unsupported, exclusively created) at the lock path, so readers never observe a half-written lock.
 */
public final class LockFiles {
    private LockFiles() {
    }

    /**
     * Creates {@code file} with {@code content} only if it does not exist yet.
     *
     * @return false when another writer already holds the path
     */
    public static boolean createExclusive(Path file, byte[] content) throws IOException {
        Files.createDirectories(file.getParent());
        Path staged = sibling(file, "new");
        Files.write(staged, content, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
        try {
            Files.createLink(file, staged);
            return true;
        } catch (FileAlreadyExistsException e) {
            return false;
        } catch (UnsupportedOperationException | IOException linkUnsupported) {
            return createNewFallback(file, content);
        } finally {
            Files.deleteIfExists(staged);
        }
    }

    public static Optional<byte[]> readIfExists(Path file) throws IOException {
        try {
            return Optional.of(Files.readAllBytes(file));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        }
    }

    /**
     * Replaces {@code file} through a temp sibling and a rename.
     */
    public static void writeAtomically(Path file, byte[] content) throws IOException {
        Files.createDirectories(file.getParent());
        Path staged = sibling(file, "tmp");
        try {
            Files.write(staged, content, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
            moveReplacing(staged, file);
        } finally {
            Files.deleteIfExists(staged);
        }
    }

    public static void moveReplacing(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    /**
     * Deletes {@code file} only if it still holds {@code expected}. The file is first renamed to a
     * private name so a concurrent deleter cannot remove a lock that was re-created in between.
     *
     * @return true if this call removed the expected content
     */
    public static boolean deleteIfMatches(Path file, byte[] expected) throws IOException {
        Path claimed = sibling(file, "claimed");
        try {
            Files.move(file, claimed, StandardCopyOption.ATOMIC_MOVE);
        } catch (NoSuchFileException e) {
            return false;
        }
        byte[] actual = Files.readAllBytes(claimed);
        if (Arrays.equals(actual, expected)) {
            Files.deleteIfExists(claimed);
            return true;
        }
        restore(claimed, file);
        return false;
    }

    /**
     * Replaces {@code file} with {@code content} only if its current content passes {@code owned}.
     * The file is claimed by rename before the check and the new content is published with a create
     * that fails if the path was taken while it was claimed.
     *
     * @return false when the file is gone, fails the check, or was re-created by another writer
     */
    public static boolean replaceIf(Path file, Predicate<byte[]> owned, byte[] content) throws IOException {
        Path staged = sibling(file, "new");
        Files.write(staged, content, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
        Path claimed = sibling(file, "claimed");
        try {
            try {
                Files.move(file, claimed, StandardCopyOption.ATOMIC_MOVE);
            } catch (NoSuchFileException e) {
                return false;
            }
            if (!owned.test(Files.readAllBytes(claimed))) {
                restore(claimed, file);
                return false;
            }
            boolean published;
            try {
                Files.createLink(file, staged);
                published = true;
            } catch (FileAlreadyExistsException e) {
                published = false;
            } catch (UnsupportedOperationException | IOException linkUnsupported) {
                published = createNewFallback(file, content);
            }
            Files.deleteIfExists(claimed);
            return published;
        } finally {
            Files.deleteIfExists(staged);
        }
    }

    private static void restore(Path claimed, Path file) throws IOException {
        try {
            Files.createLink(file, claimed);
        } catch (FileAlreadyExistsException e) {
            // A newer lock was published meanwhile; the one moved aside is superseded.
        } catch (UnsupportedOperationException | IOException linkUnsupported) {
            try {
                Files.move(claimed, file);
                return;
            } catch (FileAlreadyExistsException e) {
                // Same as above.
            }
        }
        Files.deleteIfExists(claimed);
    }

    private static boolean createNewFallback(Path file, byte[] content) throws IOException {
        try {
            Files.write(file, content, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
            return true;
        } catch (FileAlreadyExistsException e) {
            return false;
        }
    }

    private static Path sibling(Path file, String suffix) {
        return file.resolveSibling(file.getFileName() + "." + UUID.randomUUID().toString().substring(0, 8) + "." + suffix);
    }
}
