package io.synclane.observability;

import com.fasterxml.jackson.databind.JsonNode;
import io.synclane.util.Hashing;
import io.synclane.util.Jsons;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Append-only JSON-lines audit trail of lock and sync decisions. Each row carries the hash of the
 * previous row so truncation or edits show up in {@link #verifyChain()}. Appends hold an exclusive
 * lock on the file and chain onto whatever row is last at that moment, so several processes can share
 * one log.
 */
public final class AuditLogger {
    private static final int TAIL_WINDOW = 4096;
    private static final ConcurrentMap<Path, Object> IN_PROCESS_LOCKS = new ConcurrentHashMap<>();

    private final Path auditFile;
    private final String actor;
    private final Object appendLock;

    public AuditLogger(Path auditFile, String actor) {
        this.auditFile = auditFile;
        this.actor = actor == null || actor.isBlank() ? "unknown" : actor.trim();
        this.appendLock = IN_PROCESS_LOCKS.computeIfAbsent(auditFile.toAbsolutePath().normalize(), ignored -> new Object());
        try {
            Files.createDirectories(auditFile.getParent());
            if (!Files.exists(auditFile)) {
                try {
                    Files.createFile(auditFile);
                } catch (FileAlreadyExistsException ignored) {
                    // Another process created it between exists() and createFile().
                }
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize audit log file: " + auditFile, e);
        }
    }

    public Path auditFile() {
        return auditFile;
    }

    public void log(AuditEvent event) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("timestamp", Instant.now().toString());
        row.put("action", event.action());
        row.put("actor", actor);
        row.put("resource", event.resource());
        row.put("result", event.result());
        row.put("details", sanitizeDetails(event.details()));
        synchronized (appendLock) {
            try (FileChannel channel = FileChannel.open(auditFile,
                    StandardOpenOption.CREATE, StandardOpenOption.READ, StandardOpenOption.WRITE);
                 FileLock ignored = channel.lock()) {
                row.put("prev_hash", hashOf(lastLine(channel)));
                row.put("hash", Hashing.sha256Hex(Jsons.toCompactJson(row)));
                byte[] line = (Jsons.toCompactJson(row) + System.lineSeparator()).getBytes(StandardCharsets.UTF_8);
                ByteBuffer buffer = ByteBuffer.wrap(line);
                long position = channel.size();
                while (buffer.hasRemaining()) {
                    position += channel.write(buffer, position);
                }
                channel.force(false);
            } catch (IOException e) {
                throw new RuntimeException("Failed to write audit log", e);
            }
        }
    }

    /**
     * Hash of the last row currently in the file, or an empty string for an empty log.
     */
    public String currentHash() {
        synchronized (appendLock) {
            try (FileChannel channel = FileChannel.open(auditFile, StandardOpenOption.READ)) {
                return hashOf(lastLine(channel));
            } catch (IOException e) {
                throw new RuntimeException("Failed to read audit log: " + auditFile, e);
            }
        }
    }

    /**
     * Returns true when every row's {@code prev_hash} matches the preceding row's hash and every
     * hash matches its row content.
     */
    public boolean verifyChain() {
        synchronized (appendLock) {
            return verifyLines();
        }
    }

    private boolean verifyLines() {
        try {
            String expectedPrev = "";
            List<String> lines = Files.readAllLines(auditFile, StandardCharsets.UTF_8);
            for (String line : lines) {
                if (line.isBlank()) {
                    continue;
                }
                JsonNode node = Jsons.mapper().readTree(line);
                if (!expectedPrev.equals(node.path("prev_hash").asText(""))) {
                    return false;
                }
                @SuppressWarnings("unchecked")
                Map<String, Object> row = Jsons.mapper().convertValue(node, LinkedHashMap.class);
                String hash = String.valueOf(row.remove("hash"));
                if (!hash.equals(Hashing.sha256Hex(Jsons.toCompactJson(row)))) {
                    return false;
                }
                expectedPrev = hash;
            }
            return true;
        } catch (IOException e) {
            throw new RuntimeException("Failed to read audit log", e);
        }
    }

    private static String hashOf(String line) throws IOException {
        if (line.isBlank()) {
            return "";
        }
        return Jsons.mapper().readTree(line).path("hash").asText("");
    }

    private static String lastLine(FileChannel channel) throws IOException {
        long size = channel.size();
        long window = TAIL_WINDOW;
        while (true) {
            long start = Math.max(0L, size - window);
            ByteBuffer buffer = ByteBuffer.allocate((int) (size - start));
            long position = start;
            while (buffer.hasRemaining()) {
                int read = channel.read(buffer, position);
                if (read < 0) {
                    break;
                }
                position += read;
            }
            String text = new String(buffer.array(), 0, buffer.position(), StandardCharsets.UTF_8).stripTrailing();
            int newline = text.lastIndexOf('\n');
            if (newline >= 0 || start == 0L) {
                return text.substring(newline + 1).trim();
            }
            window *= 2;
        }
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> sanitizeDetails(Map<String, Object> input) {
        if (input == null || input.isEmpty()) {
            return Map.of();
        }
        JsonNode node = Jsons.mapper().valueToTree(input);
        JsonNode masked = SensitiveDataMasker.masked(node);
        return Jsons.mapper().convertValue(masked, LinkedHashMap.class);
    }

    public record AuditEvent(String action, String resource, String result, Map<String, Object> details) {
        public static AuditEvent of(String action, String resource, String result, Map<String, Object> details) {
            return new AuditEvent(action, resource, result, details == null ? Map.of() : details);
        }
    }
}
