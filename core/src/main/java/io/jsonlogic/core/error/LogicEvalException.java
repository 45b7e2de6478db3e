package io.jsonlogic.core.error;

/**
 * Abstract parent for per-call evaluation errors. Thrown from {@code LogicEngine.evaluate()} and
 * surfaced to the caller unchanged; the engine never retries. Carries the nesting {@code depth} at
 * which the failing rule was found (0 for the top-level rule), when known.
 */
public abstract class LogicEvalException extends LogicException {

    private static final long serialVersionUID = 1L;

    private final Integer depth;

    protected LogicEvalException(String message, String operator, Integer depth) {
        super(message, operator, Phase.EVALUATION);
        this.depth = depth;
    }

    protected LogicEvalException(String message, Throwable cause, String operator, Integer depth) {
        super(message, cause, operator, Phase.EVALUATION);
        this.depth = depth;
    }

    /** Rule nesting depth at which evaluation failed, or {@code null} if not known. */
    public Integer depth() {
        return depth;
    }
}
