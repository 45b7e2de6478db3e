package io.jsonlogic.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import io.jsonlogic.core.model.ValueKind;

/**
 * Resolves dotted {@code var} paths against a data context.
 *
 * <p>
 * A path segment indexes into an array when it is a non-negative integer, and looks up an object
 * key otherwise. Every structural mismatch (absent key, index out of range, stepping into a scalar)
 * degrades to "not found", which {@link #resolve} reports as a Java {@code null}. A path that
 * resolves to JSON {@code null} returns {@code NullNode}, so callers can tell the two apart.
 *
 * <p>
 * Thread-safe, stateless utility class.
 */
public final class VarResolver {

    private VarResolver() {}

    /**
     * Resolves {@code path} against {@code data}.
     *
     * @param data the context; may be {@code null}
     * @param path a string or number path, or {@code null}/{@code ""} for the context itself
     * @return the resolved node, or {@code null} when the path is not found
     */
    public static JsonNode resolve(JsonNode data, JsonNode path) {
        ValueKind kind = JsonValues.kindOf(path);
        if (kind == ValueKind.NULL) {
            return data;
        }
        if (kind == ValueKind.ARRAY || kind == ValueKind.OBJECT) {
            return null;
        }
        String text = JsonValues.toText(path);
        if (text.isEmpty()) {
            return data;
        }
        JsonNode current = data;
        for (String segment : text.split("\\.", -1)) {
            current = step(current, segment);
            if (current == null) {
                return null;
            }
        }
        return current;
    }

    /** Returns {@code true} when {@code path} resolves to a value that is neither absent nor null. */
    public static boolean isPresent(JsonNode data, JsonNode path) {
        JsonNode found = resolve(data, path);
        return found != null && !found.isNull() && !found.isMissingNode();
    }

    private static JsonNode step(JsonNode node, String segment) {
        if (node == null) {
            return null;
        }
        if (node.isObject()) {
            return node.get(segment);
        }
        if (node.isArray()) {
            int index = parseIndex(segment);
            return index < 0 ? null : node.get(index);
        }
        return null;
    }

    private static int parseIndex(String segment) {
        if (segment.isEmpty() || segment.length() > 9) {
            return -1;
        }
        for (int i = 0; i < segment.length(); i++) {
            char c = segment.charAt(i);
            if (c < '0' || c > '9') {
                return -1;
            }
        }
        return Integer.parseInt(segment);
    }
}
