package io.jsonlogic.core.engine.ops;

import static io.jsonlogic.core.engine.ops.Operands.at;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.jsonlogic.core.engine.JsonValues;
import io.jsonlogic.core.spi.EvaluationScope;
import java.util.List;

/**
 * Higher-order operators over arrays. All are lazy: the first operand is evaluated against the
 * current context, the second is evaluated once per element with that element as the narrowed
 * context ({@code reduce} narrows to {@code {current, accumulator}} instead).
 */
final class ArrayOperators {

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private ArrayOperators() {}

    static JsonNode map(List<JsonNode> operands, EvaluationScope scope) {
        ArrayNode mapped = NODES.arrayNode();
        JsonNode items = scope.evaluate(at(operands, 0));
        if (!items.isArray()) {
            return mapped;
        }
        JsonNode logic = at(operands, 1);
        for (JsonNode item : items) {
            mapped.add(scope.evaluate(logic, item));
        }
        return mapped;
    }

    static JsonNode filter(List<JsonNode> operands, EvaluationScope scope) {
        ArrayNode kept = NODES.arrayNode();
        JsonNode items = scope.evaluate(at(operands, 0));
        if (!items.isArray()) {
            return kept;
        }
        JsonNode logic = at(operands, 1);
        for (JsonNode item : items) {
            if (JsonValues.isTruthy(scope.evaluate(logic, item))) {
                kept.add(item);
            }
        }
        return kept;
    }

    /** Folds the array; the seed is the optional third operand, {@code 0} when absent. */
    static JsonNode reduce(List<JsonNode> operands, EvaluationScope scope) {
        JsonNode items = scope.evaluate(at(operands, 0));
        JsonNode accumulator = operands.size() > 2 ? scope.evaluate(operands.get(2)) : IntNode.valueOf(0);
        if (!items.isArray()) {
            return accumulator;
        }
        JsonNode logic = at(operands, 1);
        for (JsonNode item : items) {
            ObjectNode context = NODES.objectNode();
            context.set("current", item);
            context.set("accumulator", accumulator);
            accumulator = scope.evaluate(logic, context);
        }
        return accumulator;
    }

    /** {@code false} for an empty or non-array input; stops at the first falsy element. */
    static JsonNode all(List<JsonNode> operands, EvaluationScope scope) {
        JsonNode items = scope.evaluate(at(operands, 0));
        if (!items.isArray() || items.isEmpty()) {
            return JsonValues.bool(false);
        }
        JsonNode logic = at(operands, 1);
        for (JsonNode item : items) {
            if (!JsonValues.isTruthy(scope.evaluate(logic, item))) {
                return JsonValues.bool(false);
            }
        }
        return JsonValues.bool(true);
    }

    static JsonNode some(List<JsonNode> operands, EvaluationScope scope) {
        return JsonValues.bool(anyMatch(operands, scope));
    }

    static JsonNode none(List<JsonNode> operands, EvaluationScope scope) {
        return JsonValues.bool(!anyMatch(operands, scope));
    }

    private static boolean anyMatch(List<JsonNode> operands, EvaluationScope scope) {
        JsonNode items = scope.evaluate(at(operands, 0));
        if (!items.isArray()) {
            return false;
        }
        JsonNode logic = at(operands, 1);
        for (JsonNode item : items) {
            if (JsonValues.isTruthy(scope.evaluate(logic, item))) {
                return true;
            }
        }
        return false;
    }
}
