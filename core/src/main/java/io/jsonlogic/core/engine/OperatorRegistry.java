package io.jsonlogic.core.engine;

import io.jsonlogic.core.engine.ops.BuiltinOperator;
import io.jsonlogic.core.model.OperatorDefinition;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Immutable snapshot of the operators an engine dispatches to: the built-in operators minus any
 * disabled ones, plus a table of custom operators.
 *
 * <p>
 * A custom operator shadows the built-in of the same name unless that built-in is reserved.
 * Mutations return a new snapshot; {@link LogicEngine} swaps snapshots atomically so an in-flight
 * evaluation never sees a half-applied change. Thread-safe.
 */
public final class OperatorRegistry {

    private static final OperatorRegistry STANDARD =
            new OperatorRegistry(Map.of(), EnumSet.noneOf(BuiltinOperator.class));

    private final Map<String, OperatorDefinition> custom;
    private final Set<BuiltinOperator> disabled;

    private OperatorRegistry(Map<String, OperatorDefinition> custom, Set<BuiltinOperator> disabled) {
        this.custom = custom;
        this.disabled = disabled;
    }

    /** Registry containing every built-in operator and no custom ones. */
    public static OperatorRegistry standard() {
        return STANDARD;
    }

    /**
     * Resolves an operator name. Reserved built-ins always win; otherwise a custom operator is
     * preferred over the built-in of the same name.
     *
     * @return the definition, or empty if nothing is registered under {@code name}
     */
    public Optional<OperatorDefinition> resolve(String name) {
        Optional<BuiltinOperator> builtin = BuiltinOperator.bySymbol(name);
        if (builtin.isPresent() && builtin.get().isReserved()) {
            return active(builtin.get());
        }
        OperatorDefinition definition = custom.get(name);
        if (definition != null) {
            return Optional.of(definition);
        }
        return builtin.flatMap(this::active);
    }

    private Optional<OperatorDefinition> active(BuiltinOperator builtin) {
        return disabled.contains(builtin) ? Optional.empty() : Optional.of(builtin.definition());
    }

    /**
     * Looks up an operator by name, throwing if not found.
     *
     * @throws IllegalArgumentException if no operator is registered under {@code name}
     */
    public OperatorDefinition require(String name) {
        return resolve(name)
                .orElseThrow(() -> new IllegalArgumentException("No operator registered for name: '" + name + "'"));
    }

    /** Returns {@code true} if an operator is registered under {@code name}. */
    public boolean contains(String name) {
        return resolve(name).isPresent();
    }

    /** Returns {@code true} if {@code name} resolves to a custom operator. */
    public boolean isCustom(String name) {
        return custom.containsKey(name) && !isReserved(name);
    }

    /** Returns {@code true} if {@code name} is a reserved control form. */
    public static boolean isReserved(String name) {
        return BuiltinOperator.bySymbol(name).map(BuiltinOperator::isReserved).orElse(false);
    }

    /** The names of every resolvable operator, sorted. */
    public Set<String> names() {
        Set<String> names = new TreeSet<>(custom.keySet());
        for (BuiltinOperator builtin : BuiltinOperator.values()) {
            if (!disabled.contains(builtin)) {
                names.add(builtin.symbol());
            }
        }
        return Collections.unmodifiableSet(names);
    }

    /** Returns the number of resolvable operators. */
    public int size() {
        return names().size();
    }

    /**
     * Returns a snapshot with {@code definition} registered. If a custom operator with the same name
     * is already registered, it is replaced (last-write-wins semantics).
     *
     * @throws IllegalArgumentException if the name is a reserved control form
     */
    public OperatorRegistry with(OperatorDefinition definition) {
        if (isReserved(definition.name())) {
            throw new IllegalArgumentException(
                    "Operator '" + definition.name() + "' is a reserved control form and cannot be replaced");
        }
        Map<String, OperatorDefinition> updated = new HashMap<>(custom);
        updated.put(definition.name(), definition);
        return new OperatorRegistry(Collections.unmodifiableMap(updated), disabled);
    }

    /**
     * Returns a snapshot without the operator registered under {@code name}. A custom operator is
     * removed first, which restores any built-in it shadowed; with no custom entry, the built-in of
     * that name is disabled. Unknown names and reserved control forms leave the registry unchanged,
     * and so does a built-in that is already disabled: the same instance is returned.
     */
    public OperatorRegistry without(String name) {
        if (custom.containsKey(name)) {
            Map<String, OperatorDefinition> updated = new HashMap<>(custom);
            updated.remove(name);
            return new OperatorRegistry(Collections.unmodifiableMap(updated), disabled);
        }
        Optional<BuiltinOperator> builtin = BuiltinOperator.bySymbol(name);
        if (builtin.isEmpty() || builtin.get().isReserved() || disabled.contains(builtin.get())) {
            return this;
        }
        EnumSet<BuiltinOperator> updated = EnumSet.noneOf(BuiltinOperator.class);
        updated.addAll(disabled);
        updated.add(builtin.get());
        return new OperatorRegistry(custom, Collections.unmodifiableSet(updated));
    }

    /**
     * Returns a snapshot with the named built-in operators disabled.
     *
     * @throws IllegalArgumentException if a name is not a built-in operator, or is a reserved
     *     control form
     */
    public OperatorRegistry withoutBuiltins(Collection<String> names) {
        OperatorRegistry registry = this;
        for (String name : names) {
            Optional<BuiltinOperator> builtin = BuiltinOperator.bySymbol(name);
            if (builtin.isEmpty()) {
                throw new IllegalArgumentException("Cannot disable unknown built-in operator: '" + name + "'");
            }
            if (builtin.get().isReserved()) {
                throw new IllegalArgumentException(
                        "Cannot disable reserved control form: '" + name + "'");
            }
            registry = registry.without(name);
        }
        return registry;
    }
}
