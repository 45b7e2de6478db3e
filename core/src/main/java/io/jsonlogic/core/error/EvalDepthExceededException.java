package io.jsonlogic.core.error;

/**
 * Thrown when rule nesting exceeds the configured {@code max-depth}. URN: {@code
 * urn:jsonlogic:error:eval-depth-exceeded}
 */
public final class EvalDepthExceededException extends LogicEvalException {

    private static final long serialVersionUID = 1L;

    public static final String URN = "urn:jsonlogic:error:eval-depth-exceeded";

    private final int maxDepth;

    public EvalDepthExceededException(String operator, int depth, int maxDepth) {
        super("Rule nesting depth " + depth + " exceeds max-depth " + maxDepth, operator, depth);
        this.maxDepth = maxDepth;
    }

    /** The limit that was exceeded. */
    public int maxDepth() {
        return maxDepth;
    }
}
