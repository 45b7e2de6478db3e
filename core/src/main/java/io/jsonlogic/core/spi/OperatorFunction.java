package io.jsonlogic.core.spi;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;

/**
 * The body of an operator. Registered with the engine via {@code LogicEngine.addOperator()} or as
 * part of an {@link io.jsonlogic.core.model.OperatorDefinition}.
 *
 * <p>For {@link io.jsonlogic.core.model.EvaluationMode#EAGER EAGER} operators {@code operands} holds
 * the already-evaluated values; for {@link io.jsonlogic.core.model.EvaluationMode#LAZY LAZY}
 * operators it holds the raw operand nodes, to be evaluated through {@code scope} as needed.
 *
 * <p>Implementations MUST NOT mutate {@code operands} or any node reachable from them, and MUST be
 * thread-safe: one function instance serves concurrent evaluations.
 */
@FunctionalInterface
public interface OperatorFunction {

    /**
     * Applies the operator.
     *
     * @param operands the operands after unary sugar and arity truncation (unmodifiable, may be
     *     shorter than the operator's nominal arity)
     * @param scope the evaluation scope of the rule being applied
     * @return the result value; {@code null} is treated as JSON {@code null}
     */
    JsonNode apply(List<JsonNode> operands, EvaluationScope scope);
}
