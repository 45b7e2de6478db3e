package io.jsonlogic.core.engine.ops;

import static io.jsonlogic.core.engine.ops.Operands.at;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.TextNode;
import io.jsonlogic.core.engine.JsonValues;
import io.jsonlogic.core.spi.EvaluationScope;
import java.util.List;

/** String and array construction operators: {@code in cat substr merge}. */
final class StringOperators {

    private StringOperators() {}

    /** Substring test when the haystack is a string, strict membership when it is an array. */
    static JsonNode in(List<JsonNode> operands, EvaluationScope scope) {
        JsonNode needle = at(operands, 0);
        JsonNode haystack = at(operands, 1);
        if (haystack.isTextual()) {
            return JsonValues.bool(haystack.textValue().contains(JsonValues.toText(needle)));
        }
        if (haystack.isArray()) {
            for (JsonNode element : haystack) {
                if (JsonValues.strictEquals(needle, element)) {
                    return JsonValues.bool(true);
                }
            }
        }
        return JsonValues.bool(false);
    }

    static JsonNode cat(List<JsonNode> operands, EvaluationScope scope) {
        StringBuilder text = new StringBuilder();
        for (JsonNode operand : operands) {
            text.append(JsonValues.toText(operand));
        }
        return TextNode.valueOf(text.toString());
    }

    /**
     * {@code [source, start, length?]} on code points. A negative start counts from the end; a
     * negative length drops that many code points from the end.
     */
    static JsonNode substr(List<JsonNode> operands, EvaluationScope scope) {
        int[] codePoints = JsonValues.toText(at(operands, 0)).codePoints().toArray();
        int size = codePoints.length;
        long start = operands.size() > 1 ? Operands.integer("substr", operands.get(1)) : 0;
        if (start < 0) {
            start = Math.max(0, size + start);
        }
        start = Math.min(start, size);
        long end = size;
        JsonNode lengthOperand = at(operands, 2);
        if (!lengthOperand.isNull()) {
            long length = Operands.integer("substr", lengthOperand);
            end = length >= 0 ? start + Math.min(length, size - start) : Math.max(start, size + length);
        }
        return TextNode.valueOf(new String(codePoints, (int) start, (int) (end - start)));
    }

    /** Flattens array operands one level and appends everything else as is. */
    static JsonNode merge(List<JsonNode> operands, EvaluationScope scope) {
        ArrayNode merged = JsonNodeFactory.instance.arrayNode();
        for (JsonNode operand : operands) {
            if (operand.isArray()) {
                merged.addAll((ArrayNode) operand);
            } else {
                merged.add(operand);
            }
        }
        return merged;
    }
}
