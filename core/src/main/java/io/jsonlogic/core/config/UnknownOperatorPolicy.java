package io.jsonlogic.core.config;

import java.util.Locale;

/** What the evaluator does with a single-key object whose key is not a registered operator. */
public enum UnknownOperatorPolicy {

    /** Throw {@link io.jsonlogic.core.error.UnrecognizedOperatorException}. */
    FAIL,

    /** Return the object unchanged, as a literal. */
    LITERAL;

    /**
     * Parses a configuration value ({@code fail} or {@code literal}, case-insensitive).
     *
     * @throws IllegalArgumentException for any other value
     */
    public static UnknownOperatorPolicy fromString(String value) {
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        for (UnknownOperatorPolicy policy : values()) {
            if (policy.name().equals(normalized)) {
                return policy;
            }
        }
        throw new IllegalArgumentException("Unknown operator policy must be 'fail' or 'literal', got: '" + value + "'");
    }
}
