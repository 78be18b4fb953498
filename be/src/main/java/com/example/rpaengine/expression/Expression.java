package com.example.rpaengine.expression;

import com.example.rpaengine.variables.Value;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Parsed expression tree. Instances are immutable and compare structurally.
 */
public sealed interface Expression {

    /**
     * Canonical source form, used in IR listings.
     */
    String render();

    record Literal(Value value) implements Expression {
        public Literal {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public String render() {
            return value instanceof Value.Str s ? "\"" + s.value() + "\"" : value.display();
        }
    }

    record Variable(String name) implements Expression {
        public Variable {
            Objects.requireNonNull(name, "name");
        }

        @Override
        public String render() {
            return "{" + name + "}";
        }
    }

    record Unary(Operator op, Expression operand) implements Expression {
        @Override
        public String render() {
            return op.symbol() + operand.render();
        }
    }

    record Binary(Operator op, Expression left, Expression right) implements Expression {
        @Override
        public String render() {
            return "(" + left.render() + " " + op.symbol() + " " + right.render() + ")";
        }
    }

    /**
     * Text with interpolated variables; evaluates to the concatenated display strings.
     */
    record Template(List<Expression> parts) implements Expression {
        public Template {
            parts = List.copyOf(parts);
        }

        @Override
        public String render() {
            return parts.stream()
                    .map(p -> p instanceof Literal l ? l.value().display() : p.render())
                    .collect(Collectors.joining("", "`", "`"));
        }
    }
}
