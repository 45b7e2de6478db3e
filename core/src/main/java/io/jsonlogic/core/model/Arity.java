package io.jsonlogic.core.model;

/**
 * Maximum number of operands an operator consumes. Operands beyond a fixed arity are dropped before
 * evaluation; fewer operands are always tolerated and the operator treats the missing trailing ones
 * as absent.
 *
 * @param max the maximum operand count, or {@code -1} for variadic operators
 */
public record Arity(int max) {

    /** Consumes every operand. */
    public static final Arity VARIADIC = new Arity(-1);

    public Arity {
        if (max < -1) {
            throw new IllegalArgumentException("arity must be -1 (variadic) or non-negative, got: " + max);
        }
    }

    /** Fixed arity consuming at most {@code max} operands. */
    public static Arity upTo(int max) {
        if (max < 0) {
            throw new IllegalArgumentException("fixed arity must be non-negative, got: " + max);
        }
        return new Arity(max);
    }

    public boolean isVariadic() {
        return max < 0;
    }

    /** Returns how many of {@code available} operands this arity consumes. */
    public int consumed(int available) {
        return isVariadic() ? available : Math.min(available, max);
    }

    @Override
    public String toString() {
        return isVariadic() ? "variadic" : "upTo(" + max + ")";
    }
}
