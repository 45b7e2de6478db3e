package io.jsonlogic.core.error;

/**
 * Thrown when a rule cannot be converted into an introspection tree, e.g. because it references an
 * operator that is not registered. URN: {@code urn:jsonlogic:error:rule-structure}
 */
public final class RuleStructureException extends LogicLoadException {

    private static final long serialVersionUID = 1L;

    public static final String URN = "urn:jsonlogic:error:rule-structure";

    public RuleStructureException(String message, String operator) {
        super(message, operator, null);
    }
}
