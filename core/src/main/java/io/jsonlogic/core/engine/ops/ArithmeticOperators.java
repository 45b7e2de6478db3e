package io.jsonlogic.core.engine.ops;

import static io.jsonlogic.core.engine.ops.Operands.at;
import static io.jsonlogic.core.engine.ops.Operands.number;

import com.fasterxml.jackson.databind.JsonNode;
import io.jsonlogic.core.engine.JsonValues;
import io.jsonlogic.core.error.MalformedOperandsException;
import io.jsonlogic.core.model.RelativeDelta;
import io.jsonlogic.core.spi.EvaluationScope;
import java.math.BigDecimal;
import java.math.MathContext;
import java.time.temporal.Temporal;
import java.util.List;
import java.util.function.Supplier;

/**
 * Numeric operators: {@code + - * / % min max}. Operands are coerced with
 * {@link JsonValues#toNumber}; an operand that cannot be coerced fails the rule with
 * {@link MalformedOperandsException}. {@code +} and {@code -} also handle date arithmetic.
 */
final class ArithmeticOperators {

    private ArithmeticOperators() {}

    /** Sum of all operands; unary {@code +} casts to a number. A date plus a delta shifts the date. */
    static JsonNode add(List<JsonNode> operands, EvaluationScope scope) {
        if (operands.size() == 2) {
            JsonNode shifted = shiftDate(operands.get(0), operands.get(1), scope);
            if (shifted == null) {
                shifted = shiftDate(operands.get(1), operands.get(0), scope);
            }
            if (shifted != null) {
                return shifted;
            }
        }
        return compute("+", () -> {
            BigDecimal sum = BigDecimal.ZERO;
            for (JsonNode operand : operands) {
                sum = sum.add(number("+", operand));
            }
            return sum;
        });
    }

    private static JsonNode shiftDate(JsonNode date, JsonNode delta, EvaluationScope scope) {
        Temporal temporal = JsonValues.temporalOf(date);
        RelativeDelta offset = JsonValues.deltaOf(delta);
        if (temporal == null || offset == null) {
            return null;
        }
        return JsonValues.dateNode(scope.dates().addDelta(temporal, offset));
    }

    /**
     * Binary subtraction or unary negation. Date minus delta shifts the date back; date minus date
     * is the number of days between them.
     */
    static JsonNode subtract(List<JsonNode> operands, EvaluationScope scope) {
        if (operands.isEmpty()) {
            throw new MalformedOperandsException("'-' expects one or two operands, got none", "-");
        }
        JsonNode a = operands.get(0);
        if (operands.size() == 1) {
            return compute("-", () -> number("-", a).negate());
        }
        JsonNode b = operands.get(1);
        Temporal start = JsonValues.temporalOf(a);
        if (start != null) {
            Temporal end = JsonValues.temporalOf(b);
            if (end != null) {
                return JsonValues.numberNode(BigDecimal.valueOf(scope.dates().daysBetween(end, start)));
            }
            RelativeDelta delta = JsonValues.deltaOf(b);
            if (delta != null) {
                return JsonValues.dateNode(scope.dates().addDelta(start, delta.negated()));
            }
        }
        return compute("-", () -> number("-", a).subtract(number("-", b)));
    }

    static JsonNode multiply(List<JsonNode> operands, EvaluationScope scope) {
        return compute("*", () -> {
            BigDecimal product = BigDecimal.ONE;
            for (JsonNode operand : operands) {
                product = product.multiply(number("*", operand));
            }
            return product;
        });
    }

    static JsonNode divide(List<JsonNode> operands, EvaluationScope scope) {
        return compute("/", () -> {
            BigDecimal dividend = number("/", at(operands, 0));
            BigDecimal divisor = number("/", at(operands, 1));
            if (divisor.signum() == 0) {
                throw new MalformedOperandsException("'/' division by zero", "/");
            }
            return dividend.divide(divisor, MathContext.DECIMAL64);
        });
    }

    /** Floored remainder: a non-zero result takes the sign of the divisor. */
    static JsonNode modulo(List<JsonNode> operands, EvaluationScope scope) {
        return compute("%", () -> {
            BigDecimal dividend = number("%", at(operands, 0));
            BigDecimal divisor = number("%", at(operands, 1));
            if (divisor.signum() == 0) {
                throw new MalformedOperandsException("'%' modulo by zero", "%");
            }
            BigDecimal remainder = dividend.remainder(divisor);
            if (remainder.signum() != 0 && remainder.signum() != divisor.signum()) {
                remainder = remainder.add(divisor);
            }
            return remainder;
        });
    }

    static JsonNode min(List<JsonNode> operands, EvaluationScope scope) {
        return extreme("min", operands, -1);
    }

    static JsonNode max(List<JsonNode> operands, EvaluationScope scope) {
        return extreme("max", operands, 1);
    }

    private static JsonNode extreme(String operator, List<JsonNode> operands, int direction) {
        if (operands.isEmpty()) {
            return JsonValues.nullNode();
        }
        return compute(operator, () -> {
            BigDecimal best = null;
            for (JsonNode operand : operands) {
                BigDecimal value = number(operator, operand);
                if (best == null || value.compareTo(best) * direction > 0) {
                    best = value;
                }
            }
            return best;
        });
    }

    private static JsonNode compute(String operator, Supplier<BigDecimal> calculation) {
        try {
            return JsonValues.numberNode(calculation.get());
        } catch (ArithmeticException e) {
            throw new MalformedOperandsException("'" + operator + "' overflow: " + e.getMessage(), e, operator);
        }
    }
}
