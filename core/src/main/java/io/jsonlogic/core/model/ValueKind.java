package io.jsonlogic.core.model;

/**
 * Tag of the dynamically-typed value carried by a {@link com.fasterxml.jackson.databind.JsonNode}
 * during evaluation. Rules, data and results share this one value model.
 *
 * <p>{@link #DATE} and {@link #DELTA} are opaque values produced by the date operators and wrapped
 * in a {@link com.fasterxml.jackson.databind.node.POJONode}; only comparison and arithmetic look
 * inside them. Anything else a custom operator smuggles into the tree is {@link #OPAQUE}.
 */
public enum ValueKind {
    NULL,
    BOOLEAN,
    NUMBER,
    STRING,
    ARRAY,
    OBJECT,
    DATE,
    DELTA,
    OPAQUE;

    /** {@code true} for arrays and objects. */
    public boolean isContainer() {
        return this == ARRAY || this == OBJECT;
    }

    /** {@code true} for the kinds that may take part in numeric coercion. */
    public boolean isScalarCoercible() {
        return this == BOOLEAN || this == NUMBER || this == STRING;
    }
}
