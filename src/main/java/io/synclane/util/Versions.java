package io.synclane.util;

public final class Versions {
    private Versions() {
    }

    /**
     * Compares dotted numeric versions such as {@code 0.14.2}. Missing segments count as zero and
     * non-numeric suffixes ({@code 1.2.0-beta}) are ignored.
     */
    public static int compare(String a, String b) {
        String[] left = segments(a);
        String[] right = segments(b);
        int length = Math.max(left.length, right.length);
        for (int i = 0; i < length; i++) {
            int l = i < left.length ? numeric(left[i]) : 0;
            int r = i < right.length ? numeric(right[i]) : 0;
            if (l != r) {
                return Integer.compare(l, r);
            }
        }
        return 0;
    }

    private static String[] segments(String raw) {
        if (raw == null || raw.isBlank()) {
            return new String[0];
        }
        String trimmed = raw.trim();
        if (trimmed.startsWith("v") || trimmed.startsWith("V")) {
            trimmed = trimmed.substring(1);
        }
        return trimmed.split("\\.");
    }

    private static int numeric(String segment) {
        int end = 0;
        while (end < segment.length() && Character.isDigit(segment.charAt(end))) {
            end++;
        }
        if (end == 0) {
            return 0;
        }
        try {
            return Integer.parseInt(segment.substring(0, end));
        } catch (NumberFormatException e) {
            return Integer.MAX_VALUE;
        }
    }
}
