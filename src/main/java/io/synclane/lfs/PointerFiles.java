package io.synclane.lfs;

import io.synclane.model.PointerRecord;
import io.synclane.util.Hashing;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

public final class PointerFiles {
    public static final String SPEC_URI = "https://git-lfs.github.com/spec/v1";
    private static final String OID_PREFIX = "sha256:";

    private PointerFiles() {
    }

    public static String format(PointerRecord pointer) {
        return "version " + SPEC_URI + "\n"
                + "oid " + OID_PREFIX + pointer.oid() + "\n"
                + "size " + pointer.size() + "\n";
    }

    public static Optional<PointerRecord> parse(byte[] raw) {
        if (raw == null || raw.length == 0 || raw.length > 1024) {
            return Optional.empty();
        }
        return parse(new String(raw, StandardCharsets.UTF_8));
    }

    public static Optional<PointerRecord> parse(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        String version = null;
        String oid = null;
        Long size = null;
        for (String line : text.split("\n")) {
            String trimmed = line.strip();
            if (trimmed.isEmpty()) {
                continue;
            }
            int space = trimmed.indexOf(' ');
            if (space <= 0) {
                return Optional.empty();
            }
            String key = trimmed.substring(0, space);
            String value = trimmed.substring(space + 1).trim();
            switch (key) {
                case "version" -> version = value;
                case "oid" -> oid = value.startsWith(OID_PREFIX) ? value.substring(OID_PREFIX.length()) : null;
                case "size" -> size = parseSize(value);
                default -> {
                    // Extension keys are allowed by the pointer format.
                }
            }
        }
        if (version == null || !version.startsWith("https://git-lfs.github.com/spec/") || oid == null || size == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(new PointerRecord(oid, size));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    public static boolean isPointer(String text) {
        return parse(text).isPresent();
    }

    public static PointerRecord fromPayload(Path payload) throws IOException {
        return new PointerRecord(Hashing.sha256Hex(payload), Files.size(payload));
    }

    private static Long parseSize(String value) {
        try {
            long parsed = Long.parseLong(value);
            return parsed < 0L ? null : parsed;
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
