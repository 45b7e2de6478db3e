package io.jsonlogic.core.model;

/**
 * Result of comparing two values. {@link #UNCOMPARABLE} is returned instead of raising an error when
 * the pair has no meaningful order (e.g. an object and a number); every ordering operator treats it
 * as {@code false}.
 */
public enum Ordering {
    LESS,
    EQUAL,
    GREATER,
    UNCOMPARABLE;

    /** Maps a {@link Comparable#compareTo} result onto an ordering. */
    public static Ordering of(int comparison) {
        if (comparison < 0) {
            return LESS;
        }
        return comparison == 0 ? EQUAL : GREATER;
    }
}
