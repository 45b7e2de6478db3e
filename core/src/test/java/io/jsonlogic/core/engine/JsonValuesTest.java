package io.jsonlogic.core.engine;

import static io.jsonlogic.core.testkit.TestJson.json;
import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.BigIntegerNode;
import com.fasterxml.jackson.databind.node.DoubleNode;
import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.LongNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.fasterxml.jackson.databind.node.TextNode;
import io.jsonlogic.core.model.Ordering;
import io.jsonlogic.core.model.RelativeDelta;
import io.jsonlogic.core.model.ValueKind;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

/** Tests for the {@link JsonValues} value model. */
class JsonValuesTest {

    private static final JsonNode DATE = JsonValues.dateNode(LocalDate.of(2021, 10, 1));

    @Nested
    @DisplayName("kindOf")
    class KindOf {

        @Test
        void classifiesJsonKinds() {
            assertThat(JsonValues.kindOf(null)).isEqualTo(ValueKind.NULL);
            assertThat(JsonValues.kindOf(MissingNode.getInstance())).isEqualTo(ValueKind.NULL);
            assertThat(JsonValues.kindOf(json("null"))).isEqualTo(ValueKind.NULL);
            assertThat(JsonValues.kindOf(json("true"))).isEqualTo(ValueKind.BOOLEAN);
            assertThat(JsonValues.kindOf(json("1.5"))).isEqualTo(ValueKind.NUMBER);
            assertThat(JsonValues.kindOf(json("\"x\""))).isEqualTo(ValueKind.STRING);
            assertThat(JsonValues.kindOf(json("[]"))).isEqualTo(ValueKind.ARRAY);
            assertThat(JsonValues.kindOf(json("{}"))).isEqualTo(ValueKind.OBJECT);
        }

        @Test
        void classifiesWrappedValues() {
            assertThat(JsonValues.kindOf(DATE)).isEqualTo(ValueKind.DATE);
            assertThat(JsonValues.kindOf(JsonValues.dateNode(LocalDateTime.of(2021, 1, 1, 0, 0))))
                    .isEqualTo(ValueKind.DATE);
            assertThat(JsonValues.kindOf(JsonValues.deltaNode(RelativeDelta.ZERO))).isEqualTo(ValueKind.DELTA);
            assertThat(JsonValues.kindOf(JsonNodeFactory.instance.pojoNode(new Object())))
                    .isEqualTo(ValueKind.OPAQUE);
        }

        @Test
        void operatorApplicationIsSingleKeyObject() {
            assertThat(JsonValues.operatorOf(json("{\"var\": \"a\"}"))).hasValue("var");
            assertThat(JsonValues.operatorOf(json("{\"a\": 1, \"b\": 2}"))).isEmpty();
            assertThat(JsonValues.operatorOf(json("{}"))).isEmpty();
            assertThat(JsonValues.operatorOf(json("[{\"var\": \"a\"}]"))).isEmpty();
        }
    }

    @Nested
    @DisplayName("isTruthy")
    class Truthiness {

        @ParameterizedTest
        @ValueSource(strings = {"null", "false", "0", "0.0", "-0", "\"\"", "[]", "{}"})
        void falsyValues(String literal) {
            assertThat(JsonValues.isTruthy(json(literal))).isFalse();
        }

        @ParameterizedTest
        @ValueSource(strings = {"true", "1", "-1", "0.1", "\"0\"", "\"false\"", "[0]", "[[]]", "{\"a\": null}"})
        void truthyValues(String literal) {
            assertThat(JsonValues.isTruthy(json(literal))).isTrue();
        }

        @Test
        void nanAndJavaNullAreFalsy() {
            assertThat(JsonValues.isTruthy(DoubleNode.valueOf(Double.NaN))).isFalse();
            assertThat(JsonValues.isTruthy(null)).isFalse();
        }

        @Test
        void datesAreTruthy() {
            assertThat(JsonValues.isTruthy(DATE)).isTrue();
        }
    }

    @Nested
    @DisplayName("Equality")
    class Equality {

        @ParameterizedTest
        @CsvSource(
                delimiter = '|',
                value = {
                    "1        | 1        | true",
                    "1        | 1.0      | true",
                    "1        | \"1\"    | true",
                    "0        | false    | true",
                    "1        | true     | true",
                    "\"1\"    | true     | true",
                    "\"\"     | 0        | false",
                    "\"abc\"  | 1        | false",
                    "null     | null     | true",
                    "null     | 0        | false",
                    "null     | false    | false",
                    "[1, 2]   | [1.0, 2] | true",
                    "[1]      | 1        | false",
                    "{\"a\": 1} | {\"a\": 1.0} | true",
                    "{\"a\": 1} | {\"b\": 1} | false"
                })
        void softEquals(String left, String right, boolean expected) {
            assertThat(JsonValues.softEquals(json(left), json(right))).isEqualTo(expected);
            assertThat(JsonValues.softEquals(json(right), json(left))).isEqualTo(expected);
        }

        @ParameterizedTest
        @CsvSource(
                delimiter = '|',
                value = {
                    "1       | 1.0     | true",
                    "1       | \"1\"   | false",
                    "0       | false   | false",
                    "null    | null    | true",
                    "[1, [2]] | [1, [2]] | true",
                    "[1, 2]  | [2, 1]  | false",
                    "\"a\"   | \"a\"   | true"
                })
        void strictEquals(String left, String right, boolean expected) {
            assertThat(JsonValues.strictEquals(json(left), json(right))).isEqualTo(expected);
        }

        @Test
        void nanNeverEqualsItself() {
            DoubleNode nan = DoubleNode.valueOf(Double.NaN);

            assertThat(JsonValues.strictEquals(nan, nan)).isFalse();
        }

        @Test
        void datesCompareByValue() {
            assertThat(JsonValues.strictEquals(DATE, JsonValues.dateNode(LocalDate.of(2021, 10, 1)))).isTrue();
            assertThat(JsonValues.softEquals(DATE, TextNode.valueOf("2021-10-01"))).isFalse();
        }
    }

    @Nested
    @DisplayName("compare")
    class Compare {

        @Test
        void stringsCompareLexicographically() {
            assertThat(JsonValues.compare(json("\"10\""), json("\"9\""))).isEqualTo(Ordering.LESS);
        }

        @Test
        void mixedScalarsCompareNumerically() {
            assertThat(JsonValues.compare(json("\"10\""), json("9"))).isEqualTo(Ordering.GREATER);
            assertThat(JsonValues.compare(json("true"), json("1"))).isEqualTo(Ordering.EQUAL);
        }

        @Test
        void nonNumericStringAgainstNumberIsUncomparable() {
            assertThat(JsonValues.compare(json("\"abc\""), json("1"))).isEqualTo(Ordering.UNCOMPARABLE);
        }

        @Test
        void nullAndContainersAreUncomparable() {
            assertThat(JsonValues.compare(json("null"), json("0"))).isEqualTo(Ordering.UNCOMPARABLE);
            assertThat(JsonValues.compare(json("[1]"), json("[2]"))).isEqualTo(Ordering.UNCOMPARABLE);
        }

        @Test
        void datesCompareChronologically() {
            JsonNode later = JsonValues.dateNode(LocalDate.of(2022, 1, 1));

            assertThat(JsonValues.compare(DATE, later)).isEqualTo(Ordering.LESS);
            assertThat(JsonValues.compare(DATE, JsonValues.dateNode(LocalDateTime.of(2022, 1, 1, 0, 0))))
                    .isEqualTo(Ordering.UNCOMPARABLE);
        }
    }

    @Nested
    @DisplayName("toNumber")
    class ToNumber {

        @ParameterizedTest
        @CsvSource({"'42', 42", "' 42 ', 42", "'3.14', 3.14", "'1e3', 1000", "'-0.5', -0.5", "'+7', 7"})
        void parsesNumericStrings(String text, BigDecimal expected) {
            assertThat(JsonValues.toNumber(TextNode.valueOf(text)))
                    .hasValueSatisfying(value -> assertThat(value).isEqualByComparingTo(expected));
        }

        @ParameterizedTest
        @ValueSource(strings = {"", "   ", "abc", "0x1A", "NaN", "Infinity", "1,000", "12abc"})
        void rejectsNonNumericStrings(String text) {
            assertThat(JsonValues.toNumber(TextNode.valueOf(text))).isEmpty();
        }

        @Test
        void booleansAreOneAndZero() {
            assertThat(JsonValues.toNumber(json("true"))).hasValue(BigDecimal.ONE);
            assertThat(JsonValues.toNumber(json("false"))).hasValue(BigDecimal.ZERO);
        }

        @Test
        void nullContainersAndDatesAreNotNumbers() {
            assertThat(JsonValues.toNumber(json("null"))).isEmpty();
            assertThat(JsonValues.toNumber(json("[1]"))).isEmpty();
            assertThat(JsonValues.toNumber(DATE)).isEmpty();
        }
    }

    @Nested
    @DisplayName("numberNode")
    class NumberNode {

        @Test
        void integralResultsUseSmallestIntegralNode() {
            assertThat(JsonValues.numberNode(new BigDecimal("1.0"))).isEqualTo(IntNode.valueOf(1));
            assertThat(JsonValues.numberNode(new BigDecimal("5000000000"))).isEqualTo(LongNode.valueOf(5000000000L));
            assertThat(JsonValues.numberNode(new BigDecimal("1e20"))).isInstanceOf(BigIntegerNode.class);
        }

        @Test
        void fractionalResultsAreDoubles() {
            assertThat(JsonValues.numberNode(new BigDecimal("0.5"))).isEqualTo(DoubleNode.valueOf(0.5));
        }

        @Test
        void hugeResultsFallBackToDouble() {
            assertThat(JsonValues.numberNode(new BigDecimal("1e400"))).isInstanceOf(DoubleNode.class);
        }
    }

    @Nested
    @DisplayName("toText")
    class ToText {

        @ParameterizedTest
        @CsvSource(
                delimiter = '|',
                value = {
                    "null              | null",
                    "true              | true",
                    "1                 | 1",
                    "1.0               | 1",
                    "0.5               | 0.5",
                    "1e3               | 1000",
                    "\"abc\"           | abc",
                    "[1, \"a\", [2, 3]] | 1,a,2,3",
                    "[null, 1]         | ',1'",
                    "{\"a\": [1, true]} | '{\"a\":[1,true]}'"
                })
        void rendersLikeJavaScript(String literal, String expected) {
            assertThat(JsonValues.toText(json(literal))).isEqualTo(expected);
        }

        @Test
        void datesAndDeltasUseIsoForms() {
            assertThat(JsonValues.toText(DATE)).isEqualTo("2021-10-01");
            assertThat(JsonValues.toText(JsonValues.deltaNode(new RelativeDelta(1, 2, 3)))).isEqualTo("P1Y2M3D");
        }

        @Test
        void objectsContainingDatesRender() {
            var object = JsonNodeFactory.instance.objectNode();
            object.set("when", DATE);

            assertThat(JsonValues.toText(object)).isEqualTo("{\"when\":\"2021-10-01\"}");
        }
    }
}
