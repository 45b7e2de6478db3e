package io.jsonlogic.core.engine.ops;

import io.jsonlogic.core.model.Arity;
import io.jsonlogic.core.model.EvaluationMode;
import io.jsonlogic.core.model.OperatorDefinition;
import io.jsonlogic.core.spi.OperatorFunction;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * The closed set of built-in operators.
 *
 * <p>
 * Reserved operators are the data-access and control forms ({@code var}, {@code if},
 * {@code and}, {@code map}, ...). Custom operators may replace any other built-in, but never a
 * reserved one.
 */
public enum BuiltinOperator {
    SOFT_EQUALS("==", Arity.upTo(2), EvaluationMode.EAGER, false, ComparisonOperators::softEquals),
    SOFT_NOT_EQUALS("!=", Arity.upTo(2), EvaluationMode.EAGER, false, ComparisonOperators::softNotEquals),
    STRICT_EQUALS("===", Arity.upTo(2), EvaluationMode.EAGER, false, ComparisonOperators::strictEquals),
    STRICT_NOT_EQUALS("!==", Arity.upTo(2), EvaluationMode.EAGER, false, ComparisonOperators::strictNotEquals),
    GREATER_THAN(">", Arity.upTo(2), EvaluationMode.EAGER, false, ComparisonOperators::greaterThan),
    GREATER_OR_EQUAL(">=", Arity.upTo(2), EvaluationMode.EAGER, false, ComparisonOperators::greaterOrEqual),
    LESS_THAN("<", Arity.upTo(3), EvaluationMode.EAGER, false, ComparisonOperators::lessThan),
    LESS_OR_EQUAL("<=", Arity.upTo(3), EvaluationMode.EAGER, false, ComparisonOperators::lessOrEqual),

    NOT("!", Arity.upTo(1), EvaluationMode.EAGER, false, LogicOperators::not),
    NOT_NOT("!!", Arity.upTo(1), EvaluationMode.EAGER, false, LogicOperators::notNot),
    AND("and", Arity.VARIADIC, EvaluationMode.LAZY, true, LogicOperators::and),
    OR("or", Arity.VARIADIC, EvaluationMode.LAZY, true, LogicOperators::or),
    IF("if", Arity.VARIADIC, EvaluationMode.LAZY, true, LogicOperators::conditional),
    TERNARY("?:", Arity.upTo(3), EvaluationMode.LAZY, true, LogicOperators::conditional),

    ADD("+", Arity.VARIADIC, EvaluationMode.EAGER, false, ArithmeticOperators::add),
    SUBTRACT("-", Arity.upTo(2), EvaluationMode.EAGER, false, ArithmeticOperators::subtract),
    MULTIPLY("*", Arity.VARIADIC, EvaluationMode.EAGER, false, ArithmeticOperators::multiply),
    DIVIDE("/", Arity.upTo(2), EvaluationMode.EAGER, false, ArithmeticOperators::divide),
    MODULO("%", Arity.upTo(2), EvaluationMode.EAGER, false, ArithmeticOperators::modulo),
    MIN("min", Arity.VARIADIC, EvaluationMode.EAGER, false, ArithmeticOperators::min),
    MAX("max", Arity.VARIADIC, EvaluationMode.EAGER, false, ArithmeticOperators::max),

    IN("in", Arity.upTo(2), EvaluationMode.EAGER, false, StringOperators::in),
    CAT("cat", Arity.VARIADIC, EvaluationMode.EAGER, false, StringOperators::cat),
    SUBSTR("substr", Arity.upTo(3), EvaluationMode.EAGER, false, StringOperators::substr),
    MERGE("merge", Arity.VARIADIC, EvaluationMode.EAGER, false, StringOperators::merge),

    VAR("var", Arity.upTo(2), EvaluationMode.EAGER, true, DataOperators::var),
    MISSING("missing", Arity.VARIADIC, EvaluationMode.EAGER, true, DataOperators::missing),
    MISSING_SOME("missing_some", Arity.upTo(2), EvaluationMode.EAGER, true, DataOperators::missingSome),

    MAP("map", Arity.upTo(2), EvaluationMode.LAZY, true, ArrayOperators::map),
    FILTER("filter", Arity.upTo(2), EvaluationMode.LAZY, true, ArrayOperators::filter),
    REDUCE("reduce", Arity.upTo(3), EvaluationMode.LAZY, true, ArrayOperators::reduce),
    ALL("all", Arity.upTo(2), EvaluationMode.LAZY, true, ArrayOperators::all),
    SOME("some", Arity.upTo(2), EvaluationMode.LAZY, true, ArrayOperators::some),
    NONE("none", Arity.upTo(2), EvaluationMode.LAZY, true, ArrayOperators::none),

    TODAY("today", Arity.upTo(0), EvaluationMode.EAGER, false, DateOperators::today),
    DATE("date", Arity.upTo(1), EvaluationMode.EAGER, false, DateOperators::date),
    DATETIME("datetime", Arity.upTo(1), EvaluationMode.EAGER, false, DateOperators::datetime),
    RDELTA("rdelta", Arity.upTo(3), EvaluationMode.EAGER, false, DateOperators::rdelta),

    LOG("log", Arity.upTo(1), EvaluationMode.EAGER, false, DebugOperators::log);

    private static final Map<String, BuiltinOperator> BY_SYMBOL;

    static {
        Map<String, BuiltinOperator> bySymbol = new HashMap<>();
        for (BuiltinOperator operator : values()) {
            bySymbol.put(operator.symbol, operator);
        }
        BY_SYMBOL = Collections.unmodifiableMap(bySymbol);
    }

    private final String symbol;
    private final boolean reserved;
    private final OperatorDefinition definition;

    BuiltinOperator(String symbol, Arity arity, EvaluationMode mode, boolean reserved, OperatorFunction function) {
        this.symbol = symbol;
        this.reserved = reserved;
        this.definition = new OperatorDefinition(symbol, arity, mode, function);
    }

    /** The operator name as written in rules, e.g. {@code "=="}. */
    public String symbol() {
        return symbol;
    }

    /** Reserved operators cannot be replaced by custom operators. */
    public boolean isReserved() {
        return reserved;
    }

    public OperatorDefinition definition() {
        return definition;
    }

    /** Looks up a built-in by the name used in rules. */
    public static Optional<BuiltinOperator> bySymbol(String symbol) {
        return Optional.ofNullable(BY_SYMBOL.get(symbol));
    }
}
