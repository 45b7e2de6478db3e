package io.jsonlogic.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.NullNode;
import io.jsonlogic.core.config.EngineConfig;
import io.jsonlogic.core.config.UnknownOperatorPolicy;
import io.jsonlogic.core.error.EvalDepthExceededException;
import io.jsonlogic.core.error.UnrecognizedOperatorException;
import io.jsonlogic.core.model.EvaluationMode;
import io.jsonlogic.core.model.OperatorDefinition;
import io.jsonlogic.core.spi.DateProvider;
import io.jsonlogic.core.spi.EvaluationScope;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Recursive rule walker bound to one registry snapshot. Each call is pure: the only state is the
 * data context and nesting depth carried through the {@link EvaluationScope} of each operator call.
 */
final class Evaluator {

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private final OperatorRegistry registry;
    private final DateProvider dates;
    private final int maxDepth;
    private final UnknownOperatorPolicy unknownOperatorPolicy;

    Evaluator(OperatorRegistry registry, DateProvider dates, EngineConfig config) {
        this.registry = registry;
        this.dates = dates;
        this.maxDepth = config.maxDepth();
        this.unknownOperatorPolicy = config.unknownOperatorPolicy();
    }

    JsonNode evaluate(JsonNode rule, JsonNode data) {
        return evaluate(rule, data, 0);
    }

    private JsonNode evaluate(JsonNode rule, JsonNode data, int depth) {
        if (rule == null) {
            return NullNode.getInstance();
        }
        if (rule.isArray()) {
            return evaluateArray(rule, data, depth);
        }
        if (!JsonValues.isOperation(rule)) {
            return rule;
        }
        Map.Entry<String, JsonNode> application = rule.fields().next();
        String operator = application.getKey();
        checkDepth(operator, depth);

        Optional<OperatorDefinition> resolved = registry.resolve(operator);
        if (resolved.isEmpty()) {
            if (unknownOperatorPolicy == UnknownOperatorPolicy.LITERAL) {
                return rule;
            }
            throw new UnrecognizedOperatorException(operator, depth);
        }
        OperatorDefinition definition = resolved.get();
        List<JsonNode> operands = operands(application.getValue(), definition);
        if (definition.mode() == EvaluationMode.EAGER) {
            List<JsonNode> values = new ArrayList<>(operands.size());
            for (JsonNode operand : operands) {
                values.add(evaluate(operand, data, depth + 1));
            }
            operands = Collections.unmodifiableList(values);
        }
        JsonNode result = definition.function().apply(operands, new Scope(data, depth));
        return result != null ? result : NullNode.getInstance();
    }

    private JsonNode evaluateArray(JsonNode rules, JsonNode data, int depth) {
        checkDepth(null, depth);
        ArrayNode results = NODES.arrayNode(rules.size());
        for (JsonNode element : rules) {
            results.add(evaluate(element, data, depth + 1));
        }
        return results;
    }

    private void checkDepth(String operator, int depth) {
        if (depth > maxDepth) {
            throw new EvalDepthExceededException(operator, depth, maxDepth);
        }
    }

    /** Unary sugar: a non-array operand is a single operand. Extra operands beyond arity are dropped. */
    private static List<JsonNode> operands(JsonNode raw, OperatorDefinition definition) {
        List<JsonNode> operands = new ArrayList<>();
        if (raw.isArray()) {
            raw.forEach(operands::add);
        } else {
            operands.add(raw);
        }
        int consumed = definition.arity().consumed(operands.size());
        return Collections.unmodifiableList(operands.subList(0, consumed));
    }

    private final class Scope implements EvaluationScope {

        private final JsonNode data;
        private final int depth;

        Scope(JsonNode data, int depth) {
            this.data = data;
            this.depth = depth;
        }

        @Override
        public JsonNode data() {
            return data;
        }

        @Override
        public JsonNode evaluate(JsonNode rule) {
            return Evaluator.this.evaluate(rule, data, depth + 1);
        }

        @Override
        public JsonNode evaluate(JsonNode rule, JsonNode narrowedData) {
            return Evaluator.this.evaluate(rule, narrowedData, depth + 1);
        }

        @Override
        public DateProvider dates() {
            return dates;
        }
    }
}
