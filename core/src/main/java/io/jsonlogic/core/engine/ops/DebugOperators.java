package io.jsonlogic.core.engine.ops;

import static io.jsonlogic.core.engine.ops.Operands.at;

import com.fasterxml.jackson.databind.JsonNode;
import io.jsonlogic.core.engine.JsonValues;
import io.jsonlogic.core.spi.EvaluationScope;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** The {@code log} operator: writes its operand at INFO and passes it through. */
final class DebugOperators {

    private static final Logger LOG = LoggerFactory.getLogger(DebugOperators.class);

    private DebugOperators() {}

    static JsonNode log(List<JsonNode> operands, EvaluationScope scope) {
        JsonNode value = at(operands, 0);
        LOG.info("log: {}", JsonValues.toText(value));
        return value;
    }
}
