package io.jsonlogic.core.model;

import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Calendar offset applied to date values by {@code +} and {@code -}. Components are applied in
 * years, months, days order by the {@link io.jsonlogic.core.spi.DateProvider}; the engine never
 * performs calendar arithmetic itself.
 *
 * <p>Immutable and thread-safe.
 *
 * @param years  whole years to add (may be negative)
 * @param months whole months to add (may be negative)
 * @param days   whole days to add (may be negative)
 */
public record RelativeDelta(long years, long months, long days) {

    /** The zero offset. */
    public static final RelativeDelta ZERO = new RelativeDelta(0, 0, 0);

    /** Returns the same offset pointing the other way. */
    public RelativeDelta negated() {
        return new RelativeDelta(-years, -months, -days);
    }

    /**
     * Returns {@code true} if the node is an object shaped like a delta: non-empty, and every key is
     * one of {@code years}, {@code months}, {@code days} holding an integral number.
     */
    public static boolean isDeltaShaped(JsonNode node) {
        if (node == null || !node.isObject() || node.isEmpty()) {
            return false;
        }
        var names = node.fieldNames();
        while (names.hasNext()) {
            String name = names.next();
            if (!name.equals("years") && !name.equals("months") && !name.equals("days")) {
                return false;
            }
            if (!node.get(name).isIntegralNumber()) {
                return false;
            }
        }
        return true;
    }

    /**
     * Reads a delta from a {@code {years, months, days}}-shaped object. Absent components are zero.
     *
     * @throws IllegalArgumentException if the node is not delta-shaped
     */
    public static RelativeDelta fromObject(JsonNode node) {
        if (!isDeltaShaped(node)) {
            throw new IllegalArgumentException("Not a {years, months, days} object: " + node);
        }
        return new RelativeDelta(
                node.path("years").asLong(0), node.path("months").asLong(0), node.path("days").asLong(0));
    }

    /** ISO-8601 period form, e.g. {@code P18Y4M4D}. Also the serialized form. */
    @JsonValue
    @Override
    public String toString() {
        return "P" + years + "Y" + months + "M" + days + "D";
    }
}
