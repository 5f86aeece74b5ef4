package com.pocketapps.common.json;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Optional;

/**
 * Minimal dot-path lookup into a JSON tree, e.g. {@code $.rates.usd} or
 * {@code items.0.price}. The leading {@code $.} is optional.
 */
public final class JsonPaths {

    private JsonPaths() {
    }

    /**
     * Walk {@code path} from {@code root}.
     *
     * @return the node at the path, or empty if any segment does not resolve or
     *         lands on JSON null
     */
    public static Optional<JsonNode> select(JsonNode root, String path) {
        if (root == null) {
            return Optional.empty();
        }
        if (path == null || path.isBlank()) {
            return Optional.of(root);
        }
        String trimmed = path.trim();
        if (trimmed.equals("$")) {
            return Optional.of(root);
        }
        if (trimmed.startsWith("$.")) {
            trimmed = trimmed.substring(2);
        }

        JsonNode current = root;
        for (String segment : trimmed.split("\\.")) {
            if (segment.isEmpty()) {
                return Optional.empty();
            }
            if (current.isObject()) {
                current = current.get(segment);
            } else if (current.isArray() && isIndex(segment)) {
                current = current.get(Integer.parseInt(segment));
            } else {
                return Optional.empty();
            }
            if (current == null || current.isNull() || current.isMissingNode()) {
                return Optional.empty();
            }
        }
        return Optional.of(current);
    }

    private static boolean isIndex(String segment) {
        if (segment.length() > 9) {
            return false;
        }
        for (int i = 0; i < segment.length(); i++) {
            if (!Character.isDigit(segment.charAt(i))) {
                return false;
            }
        }
        return true;
    }
}
