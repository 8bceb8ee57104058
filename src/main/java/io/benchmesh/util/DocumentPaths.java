package io.benchmesh.util;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Map;

/**
 * Dotted property paths ({@code design.dimensions.width}) over Jackson object trees.
 * Arrays and scalars are leaves; only objects are descended into.
 */
public final class DocumentPaths {
    private DocumentPaths() {
    }

    public static String join(String prefix, String key) {
        if (prefix == null || prefix.isBlank()) {
            return key;
        }
        return prefix + "." + key;
    }

    public static String[] split(String path) {
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("property path cannot be empty");
        }
        String[] parts = path.split("\\.");
        for (String part : parts) {
            if (part.isBlank()) {
                throw new IllegalArgumentException("invalid property path: " + path);
            }
        }
        return parts;
    }

    public static void flatten(String prefix, JsonNode node, Map<String, JsonNode> out) {
        if (node != null && node.isObject() && node.size() > 0) {
            node.fields().forEachRemaining(e -> flatten(join(prefix, e.getKey()), e.getValue(), out));
            return;
        }
        if (prefix == null || prefix.isBlank()) {
            return;
        }
        // Last write wins; re-insert so the entry moves to the end of the causal order.
        out.remove(prefix);
        out.put(prefix, node == null ? Jsons.mapper().nullNode() : node.deepCopy());
    }

    public static JsonNode get(JsonNode root, String path) {
        JsonNode current = root;
        for (String part : split(path)) {
            if (current == null || !current.isObject()) {
                return null;
            }
            current = current.get(part);
        }
        return current;
    }

    public static void set(ObjectNode root, String path, JsonNode value) {
        String[] parts = split(path);
        ObjectNode current = root;
        for (int i = 0; i < parts.length - 1; i++) {
            JsonNode child = current.get(parts[i]);
            if (child == null || !child.isObject()) {
                child = current.putObject(parts[i]);
            }
            current = (ObjectNode) child;
        }
        current.set(parts[parts.length - 1], value == null ? Jsons.mapper().nullNode() : value);
    }

    /**
     * Nearest ancestor of {@code path} holding a non-null value that is not an object, which
     * {@link #set} would replace. Null when every ancestor is an object or missing.
     */
    public static String replacedAncestor(JsonNode root, String path) {
        String[] parts = split(path);
        JsonNode current = root;
        String prefix = "";
        for (int i = 0; i < parts.length - 1; i++) {
            if (current == null || !current.isObject()) {
                return null;
            }
            current = current.get(parts[i]);
            prefix = join(prefix, parts[i]);
            if (current != null && !current.isNull() && !current.isObject()) {
                return prefix;
            }
        }
        return null;
    }

    /**
     * True when one path equals the other or is one of its ancestors.
     */
    public static boolean overlaps(String a, String b) {
        return a.equals(b) || a.startsWith(b + ".") || b.startsWith(a + ".");
    }
}
