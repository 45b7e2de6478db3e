package io.jsonlogic.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.BooleanNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.POJONode;
import io.jsonlogic.core.model.DateValue;
import io.jsonlogic.core.model.Ordering;
import io.jsonlogic.core.model.RelativeDelta;
import io.jsonlogic.core.model.ValueKind;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.temporal.Temporal;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;

/**
 * Value model shared by the evaluator and every operator: classification, truthiness, equality,
 * ordering and coercion of {@link JsonNode} values.
 *
 * <p>
 * Thread-safe, stateless utility class.
 */
public final class JsonValues {

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    /** Integral results with more digits than this fall back to a double. */
    private static final int MAX_INTEGER_DIGITS = 308;

    private JsonValues() {}

    /**
     * Classifies a node.
     *
     * <ul>
     * <li>Java {@code null}, {@code NullNode}, {@code MissingNode} → {@link ValueKind#NULL}</li>
     * <li>{@code POJONode} wrapping a {@link DateValue} → {@link ValueKind#DATE}</li>
     * <li>{@code POJONode} wrapping {@link RelativeDelta} → {@link ValueKind#DELTA}</li>
     * <li>any other POJO or binary node → {@link ValueKind#OPAQUE}</li>
     * </ul>
     */
    public static ValueKind kindOf(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return ValueKind.NULL;
        }
        if (node.isBoolean()) {
            return ValueKind.BOOLEAN;
        }
        if (node.isNumber()) {
            return ValueKind.NUMBER;
        }
        if (node.isTextual()) {
            return ValueKind.STRING;
        }
        if (node.isArray()) {
            return ValueKind.ARRAY;
        }
        if (node.isObject()) {
            return ValueKind.OBJECT;
        }
        if (node.isPojo()) {
            Object pojo = ((POJONode) node).getPojo();
            if (pojo instanceof DateValue) {
                return ValueKind.DATE;
            }
            if (pojo instanceof RelativeDelta) {
                return ValueKind.DELTA;
            }
        }
        return ValueKind.OPAQUE;
    }

    /**
     * Returns {@code true} if the node is an operator application: an object with exactly one key.
     */
    public static boolean isOperation(JsonNode node) {
        return node != null && node.isObject() && node.size() == 1;
    }

    /** The operator name of an operator application, or empty for any other value. */
    public static Optional<String> operatorOf(JsonNode node) {
        if (!isOperation(node)) {
            return Optional.empty();
        }
        return Optional.of(node.fieldNames().next());
    }

    /**
     * Determines if a value is truthy.
     *
     * <ul>
     * <li>null → falsy</li>
     * <li>boolean → itself</li>
     * <li>number → falsy when zero or NaN</li>
     * <li>string, array, object → falsy when empty</li>
     * <li>date, delta, opaque → truthy</li>
     * </ul>
     */
    public static boolean isTruthy(JsonNode node) {
        switch (kindOf(node)) {
            case NULL:
                return false;
            case BOOLEAN:
                return node.booleanValue();
            case NUMBER:
                return isNonZero(node);
            case STRING:
                return !node.textValue().isEmpty();
            case ARRAY:
            case OBJECT:
                return node.size() > 0;
            default:
                return true;
        }
    }

    private static boolean isNonZero(JsonNode number) {
        if (number.isFloatingPointNumber() && !number.isBigDecimal()) {
            double value = number.doubleValue();
            return value != 0.0 && !Double.isNaN(value);
        }
        return number.decimalValue().signum() != 0;
    }

    /**
     * Loose equality. Values of the same kind compare by value (containers deeply). A mixed pair of
     * booleans, numbers and strings is compared numerically; any other mixed pair is unequal.
     */
    public static boolean softEquals(JsonNode a, JsonNode b) {
        ValueKind left = kindOf(a);
        ValueKind right = kindOf(b);
        if (left == right) {
            return sameKindEquals(left, a, b);
        }
        if (left.isScalarCoercible() && right.isScalarCoercible()) {
            Optional<BigDecimal> x = toNumber(a);
            Optional<BigDecimal> y = toNumber(b);
            return x.isPresent() && y.isPresent() && x.get().compareTo(y.get()) == 0;
        }
        return false;
    }

    /** Strict equality: identical kinds, numbers by value, containers deeply, no coercion. */
    public static boolean strictEquals(JsonNode a, JsonNode b) {
        ValueKind kind = kindOf(a);
        return kind == kindOf(b) && sameKindEquals(kind, a, b);
    }

    private static boolean sameKindEquals(ValueKind kind, JsonNode a, JsonNode b) {
        switch (kind) {
            case NULL:
                return true;
            case BOOLEAN:
                return a.booleanValue() == b.booleanValue();
            case NUMBER:
                return numericEquals(a, b);
            case STRING:
                return a.textValue().equals(b.textValue());
            case ARRAY:
                return arrayEquals(a, b);
            case OBJECT:
                return objectEquals(a, b);
            default:
                return a.equals(b);
        }
    }

    private static boolean numericEquals(JsonNode a, JsonNode b) {
        Optional<BigDecimal> x = numberValue(a);
        Optional<BigDecimal> y = numberValue(b);
        if (x.isPresent() && y.isPresent()) {
            return x.get().compareTo(y.get()) == 0;
        }
        // NaN never equals anything; infinities equal themselves
        return a.doubleValue() == b.doubleValue();
    }

    private static boolean arrayEquals(JsonNode a, JsonNode b) {
        if (a.size() != b.size()) {
            return false;
        }
        for (int i = 0; i < a.size(); i++) {
            if (!strictEquals(a.get(i), b.get(i))) {
                return false;
            }
        }
        return true;
    }

    private static boolean objectEquals(JsonNode a, JsonNode b) {
        if (a.size() != b.size()) {
            return false;
        }
        Iterator<Map.Entry<String, JsonNode>> fields = a.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode other = b.get(field.getKey());
            if (other == null || !strictEquals(field.getValue(), other)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Orders two values. Strings compare lexicographically, dates of the same class
     * chronologically, other boolean/number/string pairs numerically. Everything else is
     * {@link Ordering#UNCOMPARABLE}.
     */
    public static Ordering compare(JsonNode a, JsonNode b) {
        ValueKind left = kindOf(a);
        ValueKind right = kindOf(b);
        if (left == ValueKind.STRING && right == ValueKind.STRING) {
            return Ordering.of(a.textValue().compareTo(b.textValue()));
        }
        if (left == ValueKind.DATE && right == ValueKind.DATE) {
            return compareTemporal(temporalOf(a), temporalOf(b));
        }
        if (left.isScalarCoercible() && right.isScalarCoercible()) {
            Optional<BigDecimal> x = toNumber(a);
            Optional<BigDecimal> y = toNumber(b);
            if (x.isPresent() && y.isPresent()) {
                return Ordering.of(x.get().compareTo(y.get()));
            }
        }
        return Ordering.UNCOMPARABLE;
    }

    private static Ordering compareTemporal(Temporal a, Temporal b) {
        if (a instanceof LocalDate && b instanceof LocalDate) {
            return Ordering.of(((LocalDate) a).compareTo((LocalDate) b));
        }
        if (a instanceof LocalDateTime && b instanceof LocalDateTime) {
            return Ordering.of(((LocalDateTime) a).compareTo((LocalDateTime) b));
        }
        return Ordering.UNCOMPARABLE;
    }

    /**
     * Numeric coercion. Numbers yield their value, booleans 1 or 0, strings are trimmed and parsed
     * with {@link BigDecimal} grammar. Anything else, NaN and infinities yield empty.
     */
    public static Optional<BigDecimal> toNumber(JsonNode node) {
        switch (kindOf(node)) {
            case NUMBER:
                return numberValue(node);
            case BOOLEAN:
                return Optional.of(node.booleanValue() ? BigDecimal.ONE : BigDecimal.ZERO);
            case STRING:
                return parseNumber(node.textValue());
            default:
                return Optional.empty();
        }
    }

    private static Optional<BigDecimal> numberValue(JsonNode number) {
        if (number.isFloatingPointNumber() && !number.isBigDecimal()) {
            double value = number.doubleValue();
            if (Double.isNaN(value) || Double.isInfinite(value)) {
                return Optional.empty();
            }
        }
        return Optional.of(number.decimalValue());
    }

    private static Optional<BigDecimal> parseNumber(String text) {
        String trimmed = text.trim();
        if (trimmed.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(new BigDecimal(trimmed));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    /**
     * Normalizes an arithmetic result: integral values become the smallest of {@code IntNode},
     * {@code LongNode}, {@code BigIntegerNode}; everything else (and integral values too large to
     * print sensibly) becomes a {@code DoubleNode}.
     */
    public static JsonNode numberNode(BigDecimal value) {
        BigDecimal stripped = value.stripTrailingZeros();
        if (stripped.scale() > 0) {
            return NODES.numberNode(stripped.doubleValue());
        }
        if (stripped.precision() - stripped.scale() > MAX_INTEGER_DIGITS) {
            return NODES.numberNode(stripped.doubleValue());
        }
        BigInteger integral = stripped.toBigIntegerExact();
        if (integral.bitLength() < Integer.SIZE) {
            return NODES.numberNode(integral.intValue());
        }
        if (integral.bitLength() < Long.SIZE) {
            return NODES.numberNode(integral.longValue());
        }
        return NODES.numberNode(integral);
    }

    /** String form used by {@code cat}, {@code in}, {@code substr} and {@code var} paths. */
    public static String toText(JsonNode node) {
        switch (kindOf(node)) {
            case NULL:
                return "null";
            case BOOLEAN:
                return node.booleanValue() ? "true" : "false";
            case NUMBER:
                return numberText(node);
            case STRING:
                return node.textValue();
            case ARRAY:
                return arrayText(node);
            case OBJECT:
                return objectText(node);
            case DATE:
            case DELTA:
                return String.valueOf(((POJONode) node).getPojo());
            default:
                return node.isPojo() ? String.valueOf(((POJONode) node).getPojo()) : node.asText();
        }
    }

    private static String numberText(JsonNode number) {
        Optional<BigDecimal> value = numberValue(number);
        if (value.isEmpty()) {
            return String.valueOf(number.doubleValue());
        }
        BigDecimal stripped = value.get().stripTrailingZeros();
        return stripped.scale() < 0 ? stripped.setScale(0).toPlainString() : stripped.toPlainString();
    }

    private static String arrayText(JsonNode array) {
        StringBuilder text = new StringBuilder();
        for (int i = 0; i < array.size(); i++) {
            if (i > 0) {
                text.append(',');
            }
            JsonNode element = array.get(i);
            // nested nulls print as empty, like Array.prototype.join
            if (kindOf(element) != ValueKind.NULL) {
                text.append(toText(element));
            }
        }
        return text.toString();
    }

    // Compact JSON, with date and delta values as their ISO text.
    private static String objectText(JsonNode object) {
        StringBuilder text = new StringBuilder("{");
        Iterator<Map.Entry<String, JsonNode>> fields = object.fields();
        boolean first = true;
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (!first) {
                text.append(',');
            }
            first = false;
            text.append(NODES.textNode(field.getKey())).append(':').append(jsonText(field.getValue()));
        }
        return text.append('}').toString();
    }

    private static String jsonText(JsonNode node) {
        switch (kindOf(node)) {
            case ARRAY: {
                StringBuilder text = new StringBuilder("[");
                for (int i = 0; i < node.size(); i++) {
                    if (i > 0) {
                        text.append(',');
                    }
                    text.append(jsonText(node.get(i)));
                }
                return text.append(']').toString();
            }
            case OBJECT:
                return objectText(node);
            case DATE:
            case DELTA:
            case OPAQUE:
                return NODES.textNode(toText(node)).toString();
            case NULL:
                return "null";
            default:
                return node.toString();
        }
    }

    /** Wraps a boolean result. */
    public static JsonNode bool(boolean value) {
        return BooleanNode.valueOf(value);
    }

    /** The JSON null value. */
    public static JsonNode nullNode() {
        return NullNode.getInstance();
    }

    /** Wraps a {@code LocalDate} or {@code LocalDateTime} as a date value. */
    public static JsonNode dateNode(Temporal value) {
        return NODES.pojoNode(new DateValue(value));
    }

    /** Wraps a relative delta as a delta value. */
    public static JsonNode deltaNode(RelativeDelta delta) {
        return NODES.pojoNode(delta);
    }

    /** The temporal a date value wraps, or {@code null} when the node is not a date. */
    public static Temporal temporalOf(JsonNode node) {
        return kindOf(node) == ValueKind.DATE ? ((DateValue) ((POJONode) node).getPojo()).temporal() : null;
    }

    /**
     * The delta a value denotes: a delta value, or a {@code {years, months, days}} object. Returns
     * {@code null} for anything else.
     */
    public static RelativeDelta deltaOf(JsonNode node) {
        ValueKind kind = kindOf(node);
        if (kind == ValueKind.DELTA) {
            return (RelativeDelta) ((POJONode) node).getPojo();
        }
        if (kind == ValueKind.OBJECT && RelativeDelta.isDeltaShaped(node)) {
            return RelativeDelta.fromObject(node);
        }
        return null;
    }
}
