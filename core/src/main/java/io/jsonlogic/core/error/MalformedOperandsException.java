package io.jsonlogic.core.error;

/**
 * Thrown when an operator receives operands it cannot coerce, e.g. a non-numeric string passed to
 * an arithmetic operator or a division by zero. URN: {@code urn:jsonlogic:error:malformed-operands}
 */
public final class MalformedOperandsException extends LogicEvalException {

    private static final long serialVersionUID = 1L;

    public static final String URN = "urn:jsonlogic:error:malformed-operands";

    public MalformedOperandsException(String message, String operator) {
        super(message, operator, null);
    }

    public MalformedOperandsException(String message, Throwable cause, String operator) {
        super(message, cause, operator, null);
    }
}
