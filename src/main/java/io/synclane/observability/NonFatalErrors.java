package io.synclane.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Channel for failures that must not abort the operation that hit them (heartbeat writes, stale
 * lock cleanup, temp file removal). Entries are logged and kept in a bounded buffer.
 */
public final class NonFatalErrors {
    private static final Logger logger = LoggerFactory.getLogger(NonFatalErrors.class);
    private static final int MAX_ENTRIES = 256;

    private final Deque<Entry> entries = new ArrayDeque<>();

    public void record(String operation, Throwable error) {
        String message = error == null ? "" : String.valueOf(error.getMessage());
        String type = error == null ? "" : error.getClass().getSimpleName();
        append(new Entry(System.currentTimeMillis(), operation, message, type));
        logger.warn("Non-fatal failure in {}: {} ({})", operation, message, type);
    }

    public void record(String operation, String message) {
        append(new Entry(System.currentTimeMillis(), operation, message, ""));
        logger.warn("Non-fatal failure in {}: {}", operation, message);
    }

    public synchronized List<Entry> snapshot() {
        return List.copyOf(entries);
    }

    public synchronized List<Entry> forOperation(String operation) {
        List<Entry> out = new ArrayList<>();
        for (Entry entry : entries) {
            if (entry.operation().equals(operation)) {
                out.add(entry);
            }
        }
        return out;
    }

    private synchronized void append(Entry entry) {
        entries.addLast(entry);
        while (entries.size() > MAX_ENTRIES) {
            entries.removeFirst();
        }
    }

    public record Entry(long timestampMs, String operation, String message, String errorType) {
    }
}
