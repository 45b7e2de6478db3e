package io.jsonlogic.core.engine.ops;

import static io.jsonlogic.core.engine.ops.Operands.at;

import com.fasterxml.jackson.databind.JsonNode;
import io.jsonlogic.core.engine.JsonValues;
import io.jsonlogic.core.model.Ordering;
import io.jsonlogic.core.spi.EvaluationScope;
import java.util.List;

/**
 * Equality and ordering operators: {@code == != === !== > >= < <=}.
 *
 * <p>
 * Uncomparable pairs never raise; every ordering test on them is {@code false}, except that
 * {@code >=} and {@code <=} still hold when the pair is loosely equal.
 */
final class ComparisonOperators {

    private ComparisonOperators() {}

    static JsonNode softEquals(List<JsonNode> operands, EvaluationScope scope) {
        return JsonValues.bool(JsonValues.softEquals(at(operands, 0), at(operands, 1)));
    }

    static JsonNode softNotEquals(List<JsonNode> operands, EvaluationScope scope) {
        return JsonValues.bool(!JsonValues.softEquals(at(operands, 0), at(operands, 1)));
    }

    static JsonNode strictEquals(List<JsonNode> operands, EvaluationScope scope) {
        return JsonValues.bool(JsonValues.strictEquals(at(operands, 0), at(operands, 1)));
    }

    static JsonNode strictNotEquals(List<JsonNode> operands, EvaluationScope scope) {
        return JsonValues.bool(!JsonValues.strictEquals(at(operands, 0), at(operands, 1)));
    }

    static JsonNode greaterThan(List<JsonNode> operands, EvaluationScope scope) {
        return JsonValues.bool(JsonValues.compare(at(operands, 0), at(operands, 1)) == Ordering.GREATER);
    }

    static JsonNode greaterOrEqual(List<JsonNode> operands, EvaluationScope scope) {
        return JsonValues.bool(lessOrEqual(at(operands, 1), at(operands, 0)));
    }

    /** {@code a < b}, or the between-check {@code a < b < c} with three operands. */
    static JsonNode lessThan(List<JsonNode> operands, EvaluationScope scope) {
        boolean result = JsonValues.compare(at(operands, 0), at(operands, 1)) == Ordering.LESS;
        if (result && operands.size() > 2) {
            result = JsonValues.compare(at(operands, 1), at(operands, 2)) == Ordering.LESS;
        }
        return JsonValues.bool(result);
    }

    /** {@code a <= b}, or the inclusive between-check {@code a <= b <= c} with three operands. */
    static JsonNode lessOrEqual(List<JsonNode> operands, EvaluationScope scope) {
        boolean result = lessOrEqual(at(operands, 0), at(operands, 1));
        if (result && operands.size() > 2) {
            result = lessOrEqual(at(operands, 1), at(operands, 2));
        }
        return JsonValues.bool(result);
    }

    private static boolean lessOrEqual(JsonNode a, JsonNode b) {
        Ordering ordering = JsonValues.compare(a, b);
        if (ordering == Ordering.UNCOMPARABLE) {
            return JsonValues.softEquals(a, b);
        }
        return ordering != Ordering.GREATER;
    }
}
