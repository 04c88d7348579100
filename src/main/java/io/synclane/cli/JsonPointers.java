package io.synclane.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

final class JsonPointers {
    private JsonPointers() {
    }

    /**
     * Sets {@code value} at an object-only pointer such as {@code /meta/title}, creating missing
     * parents. Non-object parents are replaced.
     */
    static ObjectNode set(ObjectNode root, String pointer, JsonNode value) {
        if (pointer == null || !pointer.startsWith("/") || pointer.length() < 2) {
            throw new IllegalArgumentException("JSON pointer must look like /key[/key...]: " + pointer);
        }
        String[] segments = pointer.substring(1).split("/", -1);
        ObjectNode current = root;
        for (int i = 0; i < segments.length - 1; i++) {
            String key = unescape(segments[i]);
            JsonNode child = current.get(key);
            if (child == null || !child.isObject()) {
                child = current.putObject(key);
            }
            current = (ObjectNode) child;
        }
        current.set(unescape(segments[segments.length - 1]), value);
        return root;
    }

    private static String unescape(String segment) {
        return segment.replace("~1", "/").replace("~0", "~");
    }
}
