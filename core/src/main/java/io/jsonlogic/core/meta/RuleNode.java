package io.jsonlogic.core.meta;

import com.fasterxml.jackson.databind.JsonNode;
import io.jsonlogic.core.engine.JsonValues;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Parsed, read-only view of a rule for inspection and display. Produced by {@link RuleParser};
 * {@link #render()} draws the tree with box-drawing characters.
 */
public sealed interface RuleNode permits RuleNode.Literal, RuleNode.Sequence, RuleNode.Var, RuleNode.Operation,
        RuleNode.Conditional {

    /** Multi-line tree rendering, one element per line. */
    List<String> lines();

    /** The tree rendering joined with newlines. */
    default String render() {
        return String.join("\n", lines());
    }

    /** A value that is not an operator application. */
    record Literal(JsonNode value) implements RuleNode {
        public Literal {
            Objects.requireNonNull(value, "value must not be null");
        }

        @Override
        public List<String> lines() {
            return List.of(value.isTextual() ? value.toString() : JsonValues.toText(value));
        }
    }

    /** An array in rule position; each element is a rule in its own right. */
    record Sequence(List<RuleNode> elements) implements RuleNode {
        public Sequence {
            elements = List.copyOf(elements);
        }

        @Override
        public List<String> lines() {
            return Trees.branch("Array", elements);
        }
    }

    /** A {@code var} lookup, rendered as {@code $path}. */
    record Var(List<RuleNode> arguments) implements RuleNode {
        public Var {
            arguments = List.copyOf(arguments);
        }

        /** The path as written, or {@code ""} for the whole context. */
        public String path() {
            if (arguments.isEmpty()) {
                return "";
            }
            RuleNode first = arguments.get(0);
            if (first instanceof Literal) {
                JsonNode value = ((Literal) first).value();
                return value.isNull() ? "" : JsonValues.toText(value);
            }
            return first.render();
        }

        @Override
        public List<String> lines() {
            if (arguments.size() > 1) {
                return Trees.branch("$" + path(), arguments.subList(1, arguments.size()));
            }
            return List.of("$" + path());
        }
    }

    /** Any other operator application. */
    record Operation(String operator, List<RuleNode> arguments) implements RuleNode {
        public Operation {
            Objects.requireNonNull(operator, "operator must not be null");
            arguments = List.copyOf(arguments);
        }

        @Override
        public List<String> lines() {
            return Trees.branch("Operation(" + operator + ")", arguments);
        }
    }

    /**
     * An {@code if} with at least one condition/branch pair, rendered as an If/Elif/Else ladder.
     */
    record Conditional(List<RuleNode> arguments) implements RuleNode {
        public Conditional {
            arguments = List.copyOf(arguments);
        }

        @Override
        public List<String> lines() {
            if (arguments.size() < 3) {
                return Trees.branch("Operation(if)", arguments);
            }
            List<String> lines = new ArrayList<>();
            lines.add("Conditional");
            int i = 0;
            for (; i + 1 < arguments.size(); i += 2) {
                lines.add(i == 0 ? "  If" : "  Elif");
                List<String> condition = arguments.get(i).lines();
                lines.add("  ├─ " + condition.get(0));
                condition.subList(1, condition.size()).forEach(line -> lines.add("  │  " + line));
                lines.add("  └─ Then");
                List<String> outcome = arguments.get(i + 1).lines();
                lines.add("       └─ " + outcome.get(0));
                outcome.subList(1, outcome.size()).forEach(line -> lines.add("          " + line));
            }
            if (i < arguments.size()) {
                lines.add("  Else");
                List<String> otherwise = arguments.get(i).lines();
                lines.add("  └─ " + otherwise.get(0));
                otherwise.subList(1, otherwise.size()).forEach(line -> lines.add("     " + line));
            }
            return lines;
        }
    }
}
