package io.jsonlogic.core.error;

/**
 * Thrown when a rule names an operator that is not in the engine's registry. URN: {@code
 * urn:jsonlogic:error:unrecognized-operator}
 */
public final class UnrecognizedOperatorException extends LogicEvalException {

    private static final long serialVersionUID = 1L;

    public static final String URN = "urn:jsonlogic:error:unrecognized-operator";

    public UnrecognizedOperatorException(String operator, int depth) {
        super("Unrecognized operation '" + operator + "'", operator, depth);
    }
}
