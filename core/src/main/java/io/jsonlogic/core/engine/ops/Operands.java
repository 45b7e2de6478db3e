package io.jsonlogic.core.engine.ops;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import io.jsonlogic.core.engine.JsonValues;
import io.jsonlogic.core.error.MalformedOperandsException;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/** Operand access and coercion helpers shared by the built-in operators. */
final class Operands {

    private Operands() {}

    /** The operand at {@code index}, or JSON null when the rule supplied fewer operands. */
    static JsonNode at(List<JsonNode> operands, int index) {
        return index < operands.size() ? operands.get(index) : NullNode.getInstance();
    }

    /** Coerces an operand to a number or fails with {@link MalformedOperandsException}. */
    static BigDecimal number(String operator, JsonNode operand) {
        return JsonValues.toNumber(operand)
                .orElseThrow(() -> new MalformedOperandsException(
                        "'" + operator + "' cannot coerce " + describe(operand) + " to a number", operator));
    }

    /** Coerces an operand to an exact integer or fails with {@link MalformedOperandsException}. */
    static long integer(String operator, JsonNode operand) {
        BigDecimal value = number(operator, operand);
        try {
            return value.stripTrailingZeros().longValueExact();
        } catch (ArithmeticException e) {
            throw new MalformedOperandsException(
                    "'" + operator + "' expects an integer, got " + describe(operand), e, operator);
        }
    }

    /** The elements of an array operand, or the operand itself as a single-element list. */
    static List<JsonNode> flatten(JsonNode operand) {
        List<JsonNode> elements = new ArrayList<>();
        if (operand.isArray()) {
            operand.forEach(elements::add);
        } else {
            elements.add(operand);
        }
        return elements;
    }

    /** Short operand description for error messages. */
    static String describe(JsonNode operand) {
        String kind = JsonValues.kindOf(operand).name().toLowerCase(Locale.ROOT);
        switch (JsonValues.kindOf(operand)) {
            case NULL:
            case ARRAY:
            case OBJECT:
                return kind;
            default:
                return kind + " '" + JsonValues.toText(operand) + "'";
        }
    }
}
