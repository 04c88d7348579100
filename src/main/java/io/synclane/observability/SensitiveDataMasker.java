package io.synclane.observability;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.synclane.util.Jsons;

import java.util.Iterator;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

public final class SensitiveDataMasker {
    private static final String MASK = "***";
    private static final Set<String> SENSITIVE_HINTS = Set.of(
            "password", "passwd", "secret", "token", "authorization", "apikey", "api_key", "credential"
    );
    private static final Pattern URL_USERINFO = Pattern.compile("^(https?://)[^@/]*@", Pattern.CASE_INSENSITIVE);
    private static final Pattern OBJECT_ID = Pattern.compile("^[0-9a-f]{40}$|^[0-9a-f]{64}$");

    private SensitiveDataMasker() {
    }

    public static JsonNode masked(JsonNode input) {
        if (input == null || input.isNull()) {
            return Jsons.mapper().nullNode();
        }
        if (input.isObject()) {
            ObjectNode out = Jsons.mapper().createObjectNode();
            Iterator<Map.Entry<String, JsonNode>> it = input.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> entry = it.next();
                if (isSensitiveKey(entry.getKey())) {
                    out.put(entry.getKey(), MASK);
                } else {
                    out.set(entry.getKey(), masked(entry.getValue()));
                }
            }
            return out;
        }
        if (input.isArray()) {
            ArrayNode out = Jsons.mapper().createArrayNode();
            for (JsonNode value : input) {
                out.add(masked(value));
            }
            return out;
        }
        if (input.isTextual()) {
            String text = input.asText("");
            if (likelySecretValue(text)) {
                return Jsons.mapper().valueToTree(MASK);
            }
            String url = maskUrl(text);
            if (!url.equals(text)) {
                return Jsons.mapper().valueToTree(url);
            }
        }
        return input;
    }

    /**
     * Replaces the user-info part of an http(s) URL: {@code https://user:pw@host/x} becomes
     * {@code https://***@host/x}.
     */
    public static String maskUrl(String url) {
        if (url == null) {
            return null;
        }
        return URL_USERINFO.matcher(url).replaceFirst("$1" + MASK + "@");
    }

    private static boolean isSensitiveKey(String rawKey) {
        if (rawKey == null || rawKey.isBlank()) {
            return false;
        }
        String key = rawKey.toLowerCase(Locale.ROOT);
        for (String hint : SENSITIVE_HINTS) {
            if (key.contains(hint)) {
                return true;
            }
        }
        return false;
    }

    private static boolean likelySecretValue(String value) {
        if (value == null) {
            return false;
        }
        String v = value.trim();
        if (v.length() < 24 || OBJECT_ID.matcher(v).matches() || v.contains("/")) {
            return false;
        }
        return v.matches("^[A-Za-z0-9+=_\\-:.]{24,}$");
    }
}
