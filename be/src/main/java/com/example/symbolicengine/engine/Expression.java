package com.example.symbolicengine.engine;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Immutable arithmetic expression tree: a {@link Literal}, a {@link Symbol} or an {@link Operator}.
 * <p>
 * Two expressions are equal when their canonical renderings are identical, so {@code x + y} and
 * {@code y + x} are different expressions. Nodes are never mutated; transforms build new trees that
 * share every unchanged subtree with the original.
 * </p>
 */
public sealed interface Expression {

    /**
     * Canonical rendering, used for display and for equality.
     */
    String render();

    static Literal number(long value) {
        return new Literal(value);
    }

    static Literal number(double value) {
        return new Literal(value);
    }

    static Symbol symbol(String name) {
        return new Symbol(name);
    }

    static Operator add(Expression... operands) {
        return new Operator(OperatorKind.ADD, Arrays.asList(operands));
    }

    static Operator subtract(Expression left, Expression right) {
        return new Operator(OperatorKind.SUBTRACT, Arrays.asList(left, right));
    }

    static Operator multiply(Expression... operands) {
        return new Operator(OperatorKind.MULTIPLY, Arrays.asList(operands));
    }

    static Operator divide(Expression numerator, Expression denominator) {
        return new Operator(OperatorKind.DIVIDE, Arrays.asList(numerator, denominator));
    }

    static Operator power(Expression base, Expression exponent) {
        return new Operator(OperatorKind.POWER, Arrays.asList(base, exponent));
    }

    /**
     * Finite numeric constant. The value is held as a {@link Long} for integers and a {@link Double} for reals.
     */
    record Literal(Number value) implements Expression {

        public Literal {
            value = Numbers.normalize(Objects.requireNonNull(value, "value"));
            if (!Double.isFinite(value.doubleValue())) {
                throw new IllegalArgumentException("Literal must be finite: " + value);
            }
        }

        public boolean isIntegral() {
            return value instanceof Long;
        }

        public boolean isZero() {
            return value.doubleValue() == 0;
        }

        public boolean isOne() {
            return value.doubleValue() == 1;
        }

        @Override
        public String render() {
            return Numbers.render(value);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Expression other && render().equals(other.render());
        }

        @Override
        public int hashCode() {
            return render().hashCode();
        }

        @Override
        public String toString() {
            return render();
        }
    }

    /**
     * Unbound variable, identified by its name.
     */
    record Symbol(String name) implements Expression {

        public Symbol {
            Objects.requireNonNull(name, "name");
            if (!Tokenizer.isIdentifier(name)) {
                throw new IllegalArgumentException("Invalid symbol name: '" + name + "'");
            }
        }

        @Override
        public String render() {
            return name;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Expression other && render().equals(other.render());
        }

        @Override
        public int hashCode() {
            return render().hashCode();
        }

        @Override
        public String toString() {
            return render();
        }
    }

    /**
     * Operator node over an ordered operand list. Binary kinds must have exactly two operands.
     */
    record Operator(OperatorKind kind, List<Expression> operands) implements Expression {

        public Operator {
            Objects.requireNonNull(kind, "kind");
            operands = List.copyOf(Objects.requireNonNull(operands, "operands"));
            if (operands.isEmpty()) {
                throw new IllegalArgumentException(kind + " requires at least one operand");
            }
            if (!kind.isVariadic() && operands.size() != 2) {
                throw new IllegalArgumentException(kind + " requires exactly two operands, got " + operands.size());
            }
        }

        public Expression left() {
            return operands.get(0);
        }

        public Expression right() {
            return operands.get(operands.size() - 1);
        }

        /**
         * Returns an operator of the same kind over the given operands, or this node when every operand
         * is the same instance as before.
         */
        public Operator withOperands(List<Expression> replacement) {
            if (replacement.size() == operands.size()) {
                boolean unchanged = true;
                for (int i = 0; i < operands.size() && unchanged; i++) {
                    unchanged = operands.get(i) == replacement.get(i);
                }
                if (unchanged) {
                    return this;
                }
            }
            return new Operator(kind, replacement);
        }

        @Override
        public String render() {
            return switch (kind) {
                case ADD, MULTIPLY -> operands.stream()
                        .map(Operator::renderOperand)
                        .collect(Collectors.joining(" " + kind.symbol() + " "));
                case SUBTRACT, DIVIDE -> "(" + left().render() + ") " + kind.symbol() + " (" + right().render() + ")";
                case POWER -> "(" + left().render() + ")^(" + right().render() + ")";
            };
        }

        private static String renderOperand(Expression operand) {
            return operand instanceof Operator ? "(" + operand.render() + ")" : operand.render();
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Expression other && render().equals(other.render());
        }

        @Override
        public int hashCode() {
            return render().hashCode();
        }

        @Override
        public String toString() {
            return render();
        }
    }
}
