package io.jsonlogic.core.meta;

import com.fasterxml.jackson.databind.JsonNode;
import io.jsonlogic.core.engine.JsonValues;
import io.jsonlogic.core.engine.OperatorRegistry;
import io.jsonlogic.core.error.RuleStructureException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Builds {@link RuleNode} trees from rules without evaluating them. Operators are checked against
 * a registry so that a typo surfaces as a {@link RuleStructureException} at parse time.
 */
public final class RuleParser {

    private final OperatorRegistry registry;

    public RuleParser(OperatorRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
    }

    /** Parser that accepts the built-in operators. */
    public static RuleParser standard() {
        return new RuleParser(OperatorRegistry.standard());
    }

    /**
     * Parses a rule.
     *
     * @throws RuleStructureException if the rule applies an operator the registry does not know
     */
    public RuleNode parse(JsonNode rule) {
        if (rule == null) {
            return new RuleNode.Literal(JsonValues.nullNode());
        }
        if (rule.isArray()) {
            return new RuleNode.Sequence(parseAll(rule));
        }
        if (!JsonValues.isOperation(rule)) {
            return new RuleNode.Literal(rule);
        }
        Map.Entry<String, JsonNode> application = rule.fields().next();
        String operator = application.getKey();
        JsonNode raw = application.getValue();
        List<RuleNode> arguments = raw.isArray() ? parseAll(raw) : List.of(parse(raw));

        if (operator.equals("var")) {
            return new RuleNode.Var(arguments);
        }
        if (!registry.contains(operator)) {
            throw new RuleStructureException("Unrecognized operation '" + operator + "'", operator);
        }
        if (operator.equals("if")) {
            return new RuleNode.Conditional(arguments);
        }
        return new RuleNode.Operation(operator, arguments);
    }

    private List<RuleNode> parseAll(JsonNode array) {
        List<RuleNode> nodes = new ArrayList<>(array.size());
        for (JsonNode element : array) {
            nodes.add(parse(element));
        }
        return nodes;
    }
}
