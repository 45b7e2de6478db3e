package io.jsonlogic.core.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.jsonlogic.core.engine.ops.BuiltinOperator;
import io.jsonlogic.core.model.OperatorDefinition;
import io.jsonlogic.core.spi.OperatorFunction;
import java.util.List;
import org.junit.jupiter.api.Test;

/** Tests for {@link OperatorRegistry}. */
class OperatorRegistryTest {

    private static final OperatorFunction CONSTANT = (operands, scope) -> JsonValues.bool(true);

    @Test
    void standardRegistryResolvesEveryBuiltin() {
        OperatorRegistry registry = OperatorRegistry.standard();

        for (BuiltinOperator builtin : BuiltinOperator.values()) {
            assertThat(registry.resolve(builtin.symbol())).hasValue(builtin.definition());
        }
        assertThat(registry.size()).isEqualTo(BuiltinOperator.values().length);
    }

    @Test
    void resolveReturnsEmptyForUnknownName() {
        assertThat(OperatorRegistry.standard().resolve("nonexistent")).isEmpty();
    }

    @Test
    void requireThrowsForUnknownName() {
        assertThatThrownBy(() -> OperatorRegistry.standard().require("nonexistent"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("nonexistent");
    }

    @Test
    void withReturnsNewSnapshotAndLeavesOriginalUntouched() {
        OperatorRegistry original = OperatorRegistry.standard();
        OperatorDefinition custom = OperatorDefinition.eager("plus_one", CONSTANT);

        OperatorRegistry updated = original.with(custom);

        assertThat(updated.resolve("plus_one")).hasValue(custom);
        assertThat(original.contains("plus_one")).isFalse();
        assertThat(updated.size()).isEqualTo(original.size() + 1);
    }

    @Test
    void registerDuplicateNameReplacesOperator() {
        OperatorDefinition first = OperatorDefinition.eager("custom", CONSTANT);
        OperatorDefinition second = OperatorDefinition.eager("custom", CONSTANT);

        OperatorRegistry registry = OperatorRegistry.standard().with(first).with(second);

        assertThat(registry.require("custom")).isSameAs(second);
    }

    @Test
    void customOperatorShadowsNonReservedBuiltin() {
        OperatorDefinition custom = OperatorDefinition.eager("+", CONSTANT);

        OperatorRegistry registry = OperatorRegistry.standard().with(custom);

        assertThat(registry.require("+")).isSameAs(custom);
        assertThat(registry.isCustom("+")).isTrue();
    }

    @Test
    void reservedNamesCannotBeReplaced() {
        for (String name : List.of("var", "missing", "missing_some", "if", "?:", "and", "or", "map", "filter",
                "reduce", "all", "some", "none")) {
            assertThatThrownBy(() -> OperatorRegistry.standard().with(OperatorDefinition.eager(name, CONSTANT)))
                    .as(name)
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("reserved");
        }
    }

    @Test
    void withoutCustomRestoresShadowedBuiltin() {
        OperatorRegistry registry = OperatorRegistry.standard()
                .with(OperatorDefinition.eager("+", CONSTANT))
                .without("+");

        assertThat(registry.require("+")).isSameAs(BuiltinOperator.ADD.definition());
    }

    @Test
    void withoutBuiltinDisablesIt() {
        OperatorRegistry registry = OperatorRegistry.standard().without("cat");

        assertThat(registry.contains("cat")).isFalse();
        assertThat(registry.names()).doesNotContain("cat");
    }

    @Test
    void withoutUnknownNameIsNoOp() {
        OperatorRegistry registry = OperatorRegistry.standard();

        assertThat(registry.without("nonexistent")).isSameAs(registry);
    }

    @Test
    void withoutBuiltinsRejectsUnknownNames() {
        assertThatThrownBy(() -> OperatorRegistry.standard().withoutBuiltins(List.of("cat", "bogus")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("bogus");
    }

    @Test
    void withoutReservedFormIsNoOp() {
        OperatorRegistry registry = OperatorRegistry.standard();

        assertThat(registry.without("var")).isSameAs(registry);
        assertThat(registry.without("reduce")).isSameAs(registry);
    }

    @Test
    void withoutBuiltinsRejectsReservedForms() {
        assertThatThrownBy(() -> OperatorRegistry.standard().withoutBuiltins(List.of("log", "var")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("reserved")
                .hasMessageContaining("'var'");
    }

    @Test
    void namesAreSorted() {
        assertThat(List.copyOf(OperatorRegistry.standard().names())).isSorted().contains("==", "var", "log", "rdelta");
    }
}
