package io.jsonlogic.core.model;

import io.jsonlogic.core.spi.OperatorFunction;
import java.util.Objects;

/**
 * Registry entry describing one operator: its name, how many operands it consumes, whether they are
 * evaluated before the call, and the function itself.
 *
 * <p>Immutable and thread-safe as long as {@code function} is.
 */
public record OperatorDefinition(String name, Arity arity, EvaluationMode mode, OperatorFunction function) {

    public OperatorDefinition {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(arity, "arity must not be null");
        Objects.requireNonNull(mode, "mode must not be null");
        Objects.requireNonNull(function, "function must not be null");
        if (name.isEmpty()) {
            throw new IllegalArgumentException("operator name must not be empty");
        }
    }

    /** An eager operator that consumes every operand, the usual shape of a custom operator. */
    public static OperatorDefinition eager(String name, OperatorFunction function) {
        return new OperatorDefinition(name, Arity.VARIADIC, EvaluationMode.EAGER, function);
    }

    /** A lazy operator that consumes every operand. */
    public static OperatorDefinition lazy(String name, OperatorFunction function) {
        return new OperatorDefinition(name, Arity.VARIADIC, EvaluationMode.LAZY, function);
    }
}
