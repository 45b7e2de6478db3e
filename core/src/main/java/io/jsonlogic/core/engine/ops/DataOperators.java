package io.jsonlogic.core.engine.ops;

import static io.jsonlogic.core.engine.ops.Operands.at;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import io.jsonlogic.core.engine.JsonValues;
import io.jsonlogic.core.engine.VarResolver;
import io.jsonlogic.core.spi.EvaluationScope;
import java.util.List;

/** Data access operators: {@code var missing missing_some}. */
final class DataOperators {

    private DataOperators() {}

    /**
     * {@code [path, default?]}. The default replaces both a path that is not found and one that
     * resolves to {@code null}.
     */
    static JsonNode var(List<JsonNode> operands, EvaluationScope scope) {
        JsonNode path = operands.isEmpty() ? null : operands.get(0);
        JsonNode found = VarResolver.resolve(scope.data(), path);
        if (found == null || found.isNull() || found.isMissingNode()) {
            return operands.size() > 1 ? operands.get(1) : JsonValues.nullNode();
        }
        return found;
    }

    /**
     * Names of the given paths that are absent, {@code null} or {@code ""}, in operand order. The
     * names are the first operand when it is an array, otherwise every operand.
     */
    static JsonNode missing(List<JsonNode> operands, EvaluationScope scope) {
        List<JsonNode> names = !operands.isEmpty() && operands.get(0).isArray()
                ? Operands.flatten(operands.get(0))
                : operands;
        return missingOf(names, scope.data());
    }

    /** {@code [need, names]}: empty when at least {@code need} names are present. */
    static JsonNode missingSome(List<JsonNode> operands, EvaluationScope scope) {
        long need = Operands.integer("missing_some", at(operands, 0));
        JsonNode nameOperand = at(operands, 1);
        List<JsonNode> names = nameOperand.isNull() ? List.of() : Operands.flatten(nameOperand);
        ArrayNode missing = missingOf(names, scope.data());
        if (names.size() - missing.size() >= need) {
            return JsonNodeFactory.instance.arrayNode();
        }
        return missing;
    }

    private static ArrayNode missingOf(List<JsonNode> names, JsonNode data) {
        ArrayNode missing = JsonNodeFactory.instance.arrayNode();
        for (JsonNode name : names) {
            JsonNode found = VarResolver.resolve(data, name);
            if (found == null || found.isNull() || (found.isTextual() && found.textValue().isEmpty())) {
                missing.add(name);
            }
        }
        return missing;
    }
}
