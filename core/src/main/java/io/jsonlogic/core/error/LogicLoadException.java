package io.jsonlogic.core.error;

/**
 * Abstract parent for configuration-time errors: engine configuration that cannot be loaded, or a
 * rule that cannot be turned into an introspection tree. Carries the {@code source} the problem was
 * read from (a file path, or {@code null} for in-memory input).
 */
public abstract class LogicLoadException extends LogicException {

    private static final long serialVersionUID = 1L;

    private final String source;

    protected LogicLoadException(String message, String operator, String source) {
        super(message, operator, Phase.LOAD);
        this.source = source;
    }

    protected LogicLoadException(String message, Throwable cause, String operator, String source) {
        super(message, cause, operator, Phase.LOAD);
        this.source = source;
    }

    /** Where the failing input came from, or {@code null} if unknown. */
    public String source() {
        return source;
    }
}
