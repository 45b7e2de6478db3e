package io.jsonlogic.core.engine;

import static io.jsonlogic.core.testkit.TestJson.json;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.jsonlogic.core.config.EngineConfig;
import io.jsonlogic.core.config.UnknownOperatorPolicy;
import io.jsonlogic.core.error.EvalDepthExceededException;
import io.jsonlogic.core.error.UnrecognizedOperatorException;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

/** End-to-end tests for {@link LogicEngine#evaluate}. */
class LogicEngineTest {

    private final LogicEngine engine = new LogicEngine();

    @Nested
    @DisplayName("Literals")
    class Literals {

        @ParameterizedTest
        @ValueSource(strings = {"true", "false", "17", "3.14", "\"apple\"", "null", "{}", "{\"a\": 1, \"b\": 2}"})
        void nonRulesEvaluateToThemselves(String literal) {
            JsonNode value = json(literal);

            assertThat(engine.evaluate(value, json("{\"x\": 1}"))).isEqualTo(value);
        }

        @Test
        void arrayOfLiteralsEvaluatesToEqualArray() {
            assertThat(engine.evaluate(json("[\"a\", 1, null]"))).isEqualTo(json("[\"a\", 1, null]"));
        }

        @Test
        void arrayElementsAreEvaluatedAsRules() {
            JsonNode result = engine.evaluate(json("[{\"var\": \"a\"}, {\"+\": [1, 1]}]"), json("{\"a\": \"x\"}"));

            assertThat(result).isEqualTo(json("[\"x\", 2]"));
        }
    }

    @Nested
    @DisplayName("Data context")
    class DataContext {

        @Test
        void emptyVarReturnsWholeContext() {
            JsonNode data = json("{\"a\": [1, 2], \"b\": {\"c\": true}}");

            assertThat(engine.evaluate(json("{\"var\": []}"), data)).isEqualTo(data);
        }

        @Test
        void defaultAppliesToNullAndAbsentValues() {
            JsonNode rule = json("{\"var\": [\"a\", \"fallback\"]}");

            assertThat(engine.evaluate(rule, json("{\"a\": null}")).textValue()).isEqualTo("fallback");
            assertThat(engine.evaluate(rule, json("{}")).textValue()).isEqualTo("fallback");
            assertThat(engine.evaluate(rule, json("{\"a\": 0}")).intValue()).isZero();
        }

        @Test
        void numericPathIndexesIntoArrayData() {
            JsonNode result = engine.evaluate(json("{\"var\": 1}"), json("[\"apple\", \"banana\", \"carrot\"]"));

            assertThat(result.textValue()).isEqualTo("banana");
        }

        @Test
        void javaNullDataBehavesLikeEmptyObject() {
            assertThat(engine.evaluate(json("{\"var\": []}"), null)).isEqualTo(json("{}"));
            assertThat(engine.evaluate(json("{\"missing\": [\"a\"]}"))).isEqualTo(json("[\"a\"]"));
        }

        @Test
        void reduceOverObjectsSumsField() {
            JsonNode rule = json("""
                    {"reduce": [
                        {"var": "cars"},
                        {"+": [{"var": "accumulator"}, {"var": "current.price"}]},
                        0
                    ]}
                    """);
            JsonNode data = json("""
                    {"cars": [
                        {"price": 1000, "color": "red"},
                        {"price": 2500, "color": "blue"},
                        {"price": 1500, "color": "red"}
                    ]}
                    """);

            assertThat(engine.evaluate(rule, data).intValue()).isEqualTo(5000);
        }
    }

    @Nested
    @DisplayName("Equality")
    class Equality {

        @Test
        void softEqualityCoercesButStrictDoesNot() {
            assertThat(engine.evaluate(json("{\"==\": [\"1\", 1]}")).booleanValue()).isTrue();
            assertThat(engine.evaluate(json("{\"===\": [\"1\", 1]}")).booleanValue()).isFalse();
        }

        @Test
        void compoundComparison() {
            JsonNode rule = json("{\"and\": [{\">\": [3, 1]}, {\"<\": [1, 3]}]}");

            assertThat(engine.evaluate(rule).booleanValue()).isTrue();
        }
    }

    @Nested
    @DisplayName("Purity")
    class Purity {

        @Test
        void evaluationDoesNotMutateRuleOrData() {
            JsonNode rule = json("{\"map\": [{\"var\": \"xs\"}, {\"merge\": [{\"var\": \"\"}, 1]}]}");
            JsonNode data = json("{\"xs\": [[0], [2]]}");
            JsonNode ruleCopy = rule.deepCopy();
            JsonNode dataCopy = data.deepCopy();

            engine.evaluate(rule, data);

            assertThat(rule).isEqualTo(ruleCopy);
            assertThat(data).isEqualTo(dataCopy);
        }

        @Test
        void evaluationIsIdempotent() {
            JsonNode rule = json("{\"filter\": [{\"var\": \"xs\"}, {\">\": [{\"var\": \"\"}, 1]}]}");
            JsonNode data = json("{\"xs\": [1, 2, 3]}");

            JsonNode first = engine.evaluate(rule, data);
            JsonNode second = engine.evaluate(rule, data);

            assertThat(first).isEqualTo(second).isEqualTo(json("[2, 3]"));
        }

        @Test
        void containerResultIsDetachedFromData() {
            JsonNode data = json("{\"obj\": {\"k\": 1}}");

            ObjectNode result = (ObjectNode) engine.evaluate(json("{\"var\": \"obj\"}"), data);
            result.put("k", 2);

            assertThat(data.at("/obj/k").intValue()).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("Unknown operators")
    class UnknownOperators {

        @Test
        void failPolicyThrowsWithOperatorName() {
            assertThatThrownBy(() -> engine.evaluate(json("{\"fubar\": [1]}")))
                    .isInstanceOf(UnrecognizedOperatorException.class)
                    .hasMessageContaining("fubar")
                    .satisfies(e -> assertThat(((UnrecognizedOperatorException) e).operator())
                            .isEqualTo("fubar"));
        }

        @Test
        void nestedUnknownOperatorReportsDepth() {
            assertThatThrownBy(() -> engine.evaluate(json("{\"!\": {\"fubar\": 1}}")))
                    .isInstanceOfSatisfying(
                            UnrecognizedOperatorException.class, e -> assertThat(e.depth()).isEqualTo(1));
        }

        @Test
        void literalPolicyReturnsRuleUnchanged() {
            LogicEngine lenient = new LogicEngine(EngineConfig.builder()
                    .unknownOperatorPolicy(UnknownOperatorPolicy.LITERAL)
                    .build());

            assertThat(lenient.evaluate(json("{\"fubar\": [1]}"))).isEqualTo(json("{\"fubar\": [1]}"));
        }

        @Test
        void unknownOperatorInUntakenBranchIsNeverSeen() {
            JsonNode rule = json("{\"if\": [true, \"ok\", {\"fubar\": 1}]}");

            assertThat(engine.evaluate(rule).textValue()).isEqualTo("ok");
        }
    }

    @Nested
    @DisplayName("Depth guard")
    class DepthGuard {

        private JsonNode nestedNot(int levels) {
            JsonNode rule = json("true");
            for (int i = 0; i < levels; i++) {
                ObjectNode wrapper = json("{}").deepCopy();
                wrapper.set("!", rule);
                rule = wrapper;
            }
            return rule;
        }

        @Test
        void deepRuleWithinLimitEvaluates() {
            LogicEngine shallow = new LogicEngine(EngineConfig.builder().maxDepth(10).build());

            assertThat(shallow.evaluate(nestedNot(10)).booleanValue()).isTrue();
        }

        @Test
        void ruleBeyondLimitFails() {
            LogicEngine shallow = new LogicEngine(EngineConfig.builder().maxDepth(10).build());

            assertThatThrownBy(() -> shallow.evaluate(nestedNot(12)))
                    .isInstanceOfSatisfying(EvalDepthExceededException.class, e -> {
                        assertThat(e.maxDepth()).isEqualTo(10);
                        assertThat(e.depth()).isEqualTo(11);
                    });
        }

        @Test
        void defaultLimitAllowsOrdinaryNesting() {
            assertThat(engine.evaluate(nestedNot(200)).booleanValue()).isTrue();
        }
    }

    @Test
    void disabledBuiltinIsUnrecognized() {
        LogicEngine restricted = new LogicEngine(
                EngineConfig.builder().disabledOperators(List.of("log")).build());

        assertThatThrownBy(() -> restricted.evaluate(json("{\"log\": 1}")))
                .isInstanceOf(UnrecognizedOperatorException.class);
        assertThat(restricted.registry().contains("log")).isFalse();
    }

    @Test
    void disablingUnknownBuiltinIsRejected() {
        EngineConfig config = EngineConfig.builder().disabledOperators(List.of("nope")).build();

        assertThatThrownBy(() -> new LogicEngine(config))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("nope");
    }
}
