package io.jsonlogic.core.meta;

import com.fasterxml.jackson.databind.JsonNode;
import io.jsonlogic.core.engine.JsonValues;
import io.jsonlogic.core.model.ValueKind;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/** Static questions about a rule that can be answered without evaluating it. */
public final class RuleInspector {

    private RuleInspector() {}

    /** Returns {@code true} if {@code value} is an operator application rather than a literal. */
    public static boolean isLogic(JsonNode value) {
        return JsonValues.isOperation(value);
    }

    /**
     * The data paths a rule reads through {@code var}, in first-seen order without duplicates. Paths
     * computed at runtime (a {@code var} whose path is itself a rule) are not included.
     */
    public static List<String> usesData(JsonNode rule) {
        Set<String> paths = new LinkedHashSet<>();
        collect(rule, paths);
        return new ArrayList<>(paths);
    }

    private static void collect(JsonNode node, Set<String> paths) {
        if (node == null) {
            return;
        }
        if (node.isArray()) {
            node.forEach(element -> collect(element, paths));
            return;
        }
        if (!isLogic(node)) {
            return;
        }
        Map.Entry<String, JsonNode> application = node.fields().next();
        JsonNode operands = application.getValue();
        if (application.getKey().equals("var")) {
            JsonNode path = operands.isArray() ? operands.path(0) : operands;
            ValueKind kind = JsonValues.kindOf(path);
            if (kind == ValueKind.STRING || kind == ValueKind.NUMBER) {
                paths.add(JsonValues.toText(path));
            }
        }
        collect(operands, paths);
    }
}
