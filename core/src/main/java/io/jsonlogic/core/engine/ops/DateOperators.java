package io.jsonlogic.core.engine.ops;

import static io.jsonlogic.core.engine.ops.Operands.at;

import com.fasterxml.jackson.databind.JsonNode;
import io.jsonlogic.core.engine.JsonValues;
import io.jsonlogic.core.error.MalformedOperandsException;
import io.jsonlogic.core.model.RelativeDelta;
import io.jsonlogic.core.spi.EvaluationScope;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.temporal.Temporal;
import java.util.List;

/**
 * Date operators: {@code today date datetime rdelta}. Parsing and calendar arithmetic are delegated
 * to the {@link io.jsonlogic.core.spi.DateProvider}; its exceptions reach the caller unchanged.
 */
final class DateOperators {

    private DateOperators() {}

    static JsonNode today(List<JsonNode> operands, EvaluationScope scope) {
        return JsonValues.dateNode(scope.dates().today());
    }

    static JsonNode date(List<JsonNode> operands, EvaluationScope scope) {
        JsonNode operand = at(operands, 0);
        if (operand.isTextual()) {
            return JsonValues.dateNode(scope.dates().parseDate(operand.textValue()));
        }
        Temporal existing = JsonValues.temporalOf(operand);
        if (existing instanceof LocalDate) {
            return operand;
        }
        if (existing instanceof LocalDateTime) {
            return JsonValues.dateNode(((LocalDateTime) existing).toLocalDate());
        }
        throw notADate("date", operand);
    }

    static JsonNode datetime(List<JsonNode> operands, EvaluationScope scope) {
        JsonNode operand = at(operands, 0);
        if (operand.isTextual()) {
            return JsonValues.dateNode(scope.dates().parseDatetime(operand.textValue()));
        }
        Temporal existing = JsonValues.temporalOf(operand);
        if (existing instanceof LocalDateTime) {
            return operand;
        }
        if (existing instanceof LocalDate) {
            return JsonValues.dateNode(((LocalDate) existing).atStartOfDay());
        }
        throw notADate("datetime", operand);
    }

    /** {@code [years, months?, days?]}; absent components are zero. */
    static JsonNode rdelta(List<JsonNode> operands, EvaluationScope scope) {
        long[] components = new long[3];
        for (int i = 0; i < components.length; i++) {
            JsonNode operand = at(operands, i);
            components[i] = operand.isNull() ? 0 : Operands.integer("rdelta", operand);
        }
        return JsonValues.deltaNode(new RelativeDelta(components[0], components[1], components[2]));
    }

    private static MalformedOperandsException notADate(String operator, JsonNode operand) {
        return new MalformedOperandsException(
                "'" + operator + "' expects a string or date value, got " + Operands.describe(operand), operator);
    }
}
