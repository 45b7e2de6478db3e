package io.jsonlogic.core.spi;

/**
 * SPI interface for observability hooks. Hosts provide implementations that bridge to their metrics
 * or tracing stack; the core has no telemetry dependencies.
 *
 * <p>Implementations MUST be thread-safe and non-blocking. Exceptions thrown by listeners are caught
 * by the engine and logged; they do NOT affect evaluation.
 */
public interface EvaluationListener {

    /** Called when {@code evaluate} returns normally. */
    void onEvaluationCompleted(EvaluationCompletedEvent event);

    /** Called when {@code evaluate} throws, before the exception reaches the caller. */
    void onEvaluationFailed(EvaluationFailedEvent event);

    /** Listener that ignores every event. */
    EvaluationListener NOOP = new EvaluationListener() {
        @Override
        public void onEvaluationCompleted(EvaluationCompletedEvent event) {}

        @Override
        public void onEvaluationFailed(EvaluationFailedEvent event) {}
    };

    // --- Event records ---

    /**
     * Event emitted after a successful evaluation.
     *
     * @param rootOperator operator of the top-level rule, or {@code null} for a literal
     * @param durationNanos wall-clock evaluation time
     */
    record EvaluationCompletedEvent(String rootOperator, long durationNanos) {}

    /**
     * Event emitted after a failed evaluation.
     *
     * @param rootOperator operator of the top-level rule, or {@code null} for a literal
     * @param durationNanos wall-clock time until the failure
     * @param errorType simple class name of the exception
     * @param errorDetail the exception message
     */
    record EvaluationFailedEvent(String rootOperator, long durationNanos, String errorType, String errorDetail) {}
}
