package io.jsonlogic.core.error;

/**
 * Abstract base for all jsonlogic exceptions. Never thrown directly; use the concrete subclasses
 * under {@link LogicLoadException} or {@link LogicEvalException}.
 */
public abstract class LogicException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Phase in which the error occurred. */
    public enum Phase {
        LOAD,
        EVALUATION
    }

    private final String operator;
    private final Phase phase;

    protected LogicException(String message, String operator, Phase phase) {
        super(message);
        this.operator = operator;
        this.phase = phase;
    }

    protected LogicException(String message, Throwable cause, String operator, Phase phase) {
        super(message, cause);
        this.operator = operator;
        this.phase = phase;
    }

    /** The operator that triggered the error, or {@code null} if not tied to one. */
    public String operator() {
        return operator;
    }

    /** Human-readable error description (alias for {@link #getMessage()}). */
    public String detail() {
        return getMessage();
    }

    /** The phase in which the error occurred. */
    public Phase phase() {
        return phase;
    }
}
