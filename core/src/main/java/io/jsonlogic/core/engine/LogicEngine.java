package io.jsonlogic.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import io.jsonlogic.core.config.EngineConfig;
import io.jsonlogic.core.date.IsoDateProvider;
import io.jsonlogic.core.model.OperatorDefinition;
import io.jsonlogic.core.spi.DateProvider;
import io.jsonlogic.core.spi.EvaluationListener;
import io.jsonlogic.core.spi.OperatorFunction;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Public entry point: evaluates JsonLogic rules against data and manages the engine's operators.
 *
 * <p>
 * Each engine owns its operator registry. {@link #addOperator} and {@link #removeOperator} swap in a
 * new immutable {@link OperatorRegistry} snapshot; an evaluation already in progress keeps the
 * snapshot it started with. The engine is thread-safe and can be shared without locking.
 */
public final class LogicEngine {

    private static final Logger LOG = LoggerFactory.getLogger(LogicEngine.class);

    private final AtomicReference<OperatorRegistry> registry;
    private final EngineConfig config;
    private final DateProvider dates;
    private final EvaluationListener listener;

    /** Engine with the default configuration. */
    public LogicEngine() {
        this(EngineConfig.DEFAULT);
    }

    /** Engine using an {@link IsoDateProvider} in the configured zone and no listener. */
    public LogicEngine(EngineConfig config) {
        this(config, new IsoDateProvider(config.dateZone()), EvaluationListener.NOOP);
    }

    /**
     * @param config   engine configuration
     * @param dates    date collaborator for the date operators
     * @param listener observability hook; use {@link EvaluationListener#NOOP} for none
     * @throws IllegalArgumentException if {@code config} disables an operator that is not a built-in,
     *     or a reserved control form
     */
    public LogicEngine(EngineConfig config, DateProvider dates, EvaluationListener listener) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.dates = Objects.requireNonNull(dates, "dates must not be null");
        this.listener = Objects.requireNonNull(listener, "listener must not be null");
        this.registry =
                new AtomicReference<>(OperatorRegistry.standard().withoutBuiltins(config.disabledOperators()));
    }

    /** Evaluates {@code rule} against an empty data object. */
    public JsonNode evaluate(JsonNode rule) {
        return evaluate(rule, null);
    }

    /**
     * Evaluates {@code rule} against {@code data}.
     *
     * @param rule the rule; any JSON value (non-rules evaluate to themselves)
     * @param data the data context; {@code null} means an empty object
     * @return the result, detached from both {@code rule} and {@code data}
     * @throws io.jsonlogic.core.error.LogicEvalException if the rule cannot be evaluated
     */
    public JsonNode evaluate(JsonNode rule, JsonNode data) {
        JsonNode context = data != null ? data : JsonNodeFactory.instance.objectNode();
        String rootOperator = JsonValues.operatorOf(rule).orElse(null);
        long startNanos = System.nanoTime();
        try {
            JsonNode result = new Evaluator(registry.get(), dates, config).evaluate(rule, context);
            JsonNode detached = result.isContainerNode() ? result.deepCopy() : result;
            long durationNanos = System.nanoTime() - startNanos;
            LOG.debug("Rule evaluated: root_operator={}, duration_us={}", rootOperator, durationNanos / 1_000);
            notifyCompleted(rootOperator, durationNanos);
            return detached;
        } catch (RuntimeException e) {
            long durationNanos = System.nanoTime() - startNanos;
            LOG.debug("Rule evaluation failed: root_operator={}, error={}", rootOperator, e.getMessage());
            notifyFailed(rootOperator, durationNanos, e);
            throw e;
        }
    }

    /**
     * Registers an eager, variadic custom operator. Replaces a custom operator of the same name and
     * shadows a non-reserved built-in.
     *
     * @throws IllegalArgumentException if {@code name} is a reserved control form
     */
    public void addOperator(String name, OperatorFunction function) {
        addOperator(OperatorDefinition.eager(name, function));
    }

    /**
     * Registers a custom operator with an explicit arity and evaluation mode.
     *
     * @throws IllegalArgumentException if the name is a reserved control form
     */
    public void addOperator(OperatorDefinition definition) {
        Objects.requireNonNull(definition, "definition must not be null");
        registry.updateAndGet(current -> current.with(definition));
        LOG.info(
                "Registered operator: name={}, arity={}, mode={}",
                definition.name(),
                definition.arity(),
                definition.mode());
    }

    /**
     * Removes the custom operator registered under {@code name}, restoring the built-in it shadowed.
     * Without a custom entry, disables the built-in of that name. Unknown names and reserved control
     * forms are ignored.
     */
    public void removeOperator(String name) {
        OperatorRegistry before = registry.getAndUpdate(current -> current.without(name));
        OperatorRegistry after = before.without(name);
        if (before == after) {
            LOG.debug("removeOperator ignored, nothing removable: name={}", name);
        } else {
            LOG.info("Removed operator: name={}, restored_builtin={}", name, after.contains(name));
        }
    }

    /** The current registry snapshot. */
    public OperatorRegistry registry() {
        return registry.get();
    }

    public EngineConfig config() {
        return config;
    }

    // --- Listener notification helpers ---
    // Listener exceptions are caught and logged; they never affect evaluation.

    private void notifyCompleted(String rootOperator, long durationNanos) {
        try {
            listener.onEvaluationCompleted(new EvaluationListener.EvaluationCompletedEvent(rootOperator, durationNanos));
        } catch (Exception e) {
            LOG.warn("EvaluationListener.onEvaluationCompleted failed", e);
        }
    }

    private void notifyFailed(String rootOperator, long durationNanos, RuntimeException cause) {
        try {
            listener.onEvaluationFailed(new EvaluationListener.EvaluationFailedEvent(
                    rootOperator, durationNanos, cause.getClass().getSimpleName(), cause.getMessage()));
        } catch (Exception e) {
            LOG.warn("EvaluationListener.onEvaluationFailed failed", e);
        }
    }
}
