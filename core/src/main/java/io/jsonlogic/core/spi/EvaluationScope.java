package io.jsonlogic.core.spi;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * The view an operator gets of the evaluation in progress: the current data context, a way to
 * evaluate operand nodes (lazily, or against a narrowed context) and the date collaborator.
 *
 * <p>A scope is only valid for the duration of the operator call it was passed to.
 */
public interface EvaluationScope {

    /** The data context {@code var} resolves against at this point of the rule. */
    JsonNode data();

    /** Evaluates {@code rule} against the current data context. */
    JsonNode evaluate(JsonNode rule);

    /**
     * Evaluates {@code rule} against a narrowed context that shadows the current one for this
     * subtree only (e.g. the current element inside {@code map}).
     */
    JsonNode evaluate(JsonNode rule, JsonNode narrowedData);

    /** The date provider configured for the engine. */
    DateProvider dates();
}
