package io.jsonlogic.core.engine.ops;

import static io.jsonlogic.core.engine.ops.Operands.at;

import com.fasterxml.jackson.databind.JsonNode;
import io.jsonlogic.core.engine.JsonValues;
import io.jsonlogic.core.spi.EvaluationScope;
import java.util.List;

/**
 * Boolean and control-flow operators. {@code and}, {@code or}, {@code if} and {@code ?:} are lazy:
 * they receive raw operand nodes and evaluate only the ones they need, in order.
 */
final class LogicOperators {

    private LogicOperators() {}

    static JsonNode not(List<JsonNode> operands, EvaluationScope scope) {
        return JsonValues.bool(!JsonValues.isTruthy(at(operands, 0)));
    }

    static JsonNode notNot(List<JsonNode> operands, EvaluationScope scope) {
        return JsonValues.bool(JsonValues.isTruthy(at(operands, 0)));
    }

    /** Returns the first falsy operand value, or the last value when all are truthy. */
    static JsonNode and(List<JsonNode> operands, EvaluationScope scope) {
        JsonNode current = JsonValues.bool(false);
        for (JsonNode operand : operands) {
            current = scope.evaluate(operand);
            if (!JsonValues.isTruthy(current)) {
                return current;
            }
        }
        return current;
    }

    /** Returns the first truthy operand value, or the last value when none is truthy. */
    static JsonNode or(List<JsonNode> operands, EvaluationScope scope) {
        JsonNode current = JsonValues.bool(false);
        for (JsonNode operand : operands) {
            current = scope.evaluate(operand);
            if (JsonValues.isTruthy(current)) {
                return current;
            }
        }
        return current;
    }

    /**
     * {@code [cond1, then1, cond2, then2, ..., else?]}: evaluates conditions in order and only the
     * branch that is taken.
     */
    static JsonNode conditional(List<JsonNode> operands, EvaluationScope scope) {
        int i = 0;
        for (; i + 1 < operands.size(); i += 2) {
            if (JsonValues.isTruthy(scope.evaluate(operands.get(i)))) {
                return scope.evaluate(operands.get(i + 1));
            }
        }
        if (i < operands.size()) {
            return scope.evaluate(operands.get(i));
        }
        return JsonValues.nullNode();
    }
}
