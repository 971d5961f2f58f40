package com.example.symbolicengine.engine;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("Evaluator")
class EvaluatorTest {

    private final ExpressionEngine engine = new ExpressionEngine();
    private final Evaluator evaluator = new Evaluator();

    private Expression parse(String text) {
        return engine.parse(text);
    }

    private Number valueOf(Expression expression) {
        return assertInstanceOf(Expression.Literal.class, expression).value();
    }

    @Nested
    @DisplayName("evaluate")
    class Evaluate {

        @Test
        @DisplayName("computes a fully bound expression with exact integers")
        void fullyBound() {
            Expression result = evaluator.evaluate(parse("x + 2 * y"), Map.of("x", 3, "y", 4));
            assertEquals(11L, valueOf(result));
        }

        @Test
        @DisplayName("honours right-associative power and parentheses")
        void powerAndParentheses() {
            assertEquals(512L, valueOf(evaluator.evaluate(parse("2^3^2"), Map.of())));
            assertEquals(9L, valueOf(evaluator.evaluate(parse("(x + 2) * y"), Map.of("x", 1, "y", 3))));
        }

        @Test
        @DisplayName("leaves a residual tree when some symbols are unbound")
        void partialEvaluation() {
            Expression result = evaluator.evaluate(parse("x * 2 + y"), Map.of("y", 1));
            assertEquals("(x * 2) + 1", result.render());
        }

        @Test
        @DisplayName("returns the same instance when nothing can be evaluated")
        void sharesUnchangedTree() {
            Expression expression = parse("x + y * z");
            assertSame(expression, evaluator.evaluate(expression, Map.of()));
            assertSame(expression, evaluator.evaluate(expression, null));
        }

        @Test
        @DisplayName("division always yields a real")
        void divisionIsReal() {
            assertEquals(3.5, valueOf(evaluator.evaluate(parse("7 / 2"), Map.of())));
            assertEquals(2.0, valueOf(evaluator.evaluate(parse("6 / 3"), Map.of())));
        }

        @Test
        @DisplayName("a real operand makes the result real")
        void realContagion() {
            assertEquals(8.0, valueOf(evaluator.evaluate(parse("2.0 ^ 3"), Map.of())));
            assertEquals(2.5, valueOf(evaluator.evaluate(parse("x + 2"), Map.of("x", 0.5))));
        }

        @Test
        @DisplayName("integer overflow is promoted to a real")
        void overflowPromotes() {
            Number result = valueOf(evaluator.evaluate(parse("9223372036854775807 + 1"), Map.of()));
            assertInstanceOf(Double.class, result);
            assertEquals(9.223372036854775808E18, result.doubleValue());
        }

        @Test
        @DisplayName("ignores unused bindings, whatever their type")
        void unusedBindingsIgnored() {
            Expression result = evaluator.evaluate(parse("x + 1"), Map.of("x", 1, "unused", "text"));
            assertEquals(2L, valueOf(result));
        }
    }

    @Nested
    @DisplayName("evaluate errors")
    class EvaluateErrors {

        @Test
        @DisplayName("division by a zero binding fails")
        void divisionByZero() {
            DivisionByZeroException e = assertThrows(DivisionByZeroException.class,
                    () -> evaluator.evaluate(parse("1/x"), Map.of("x", 0)));
            assertTrue(e.getMessage().contains("(1) / (x)"), e.getMessage());
            assertThrows(DivisionByZeroException.class, () -> evaluator.evaluate(parse("1/x"), Map.of("x", 0.0)));
        }

        @Test
        @DisplayName("non-numeric binding fails with the symbol name")
        void nonNumericBinding() {
            BindingTypeException e = assertThrows(BindingTypeException.class,
                    () -> evaluator.evaluate(parse("x + 1"), Map.of("x", "a")));
            assertEquals("x", e.getSymbol());
        }

        @Test
        @DisplayName("null and non-finite bindings fail")
        void nullAndNonFiniteBinding() {
            Map<String, Object> bindings = new HashMap<>();
            bindings.put("x", null);
            assertThrows(BindingTypeException.class, () -> evaluator.evaluate(parse("x"), bindings));
            assertThrows(BindingTypeException.class, () -> evaluator.evaluate(parse("x"), Map.of("x", Double.NaN)));
            assertThrows(BindingTypeException.class,
                    () -> evaluator.evaluate(parse("x"), Map.of("x", Double.POSITIVE_INFINITY)));
        }

        @Test
        @DisplayName("power without a real result fails")
        void numericDomain() {
            assertThrows(NumericDomainException.class, () -> evaluator.evaluate(parse("(0 - 8)^0.5"), Map.of()));
            assertThrows(NumericDomainException.class, () -> evaluator.evaluate(parse("0^(0 - 1)"), Map.of()));
            assertThrows(NumericDomainException.class, () -> evaluator.evaluate(parse("10^400"), Map.of()));
        }
    }

    @Nested
    @DisplayName("simplify")
    class Simplify {

        @Test
        @DisplayName("drops additive zero")
        void additiveZero() {
            Expression simplified = evaluator.simplify(Expression.add(Expression.number(0), Expression.symbol("x")));
            assertEquals(Expression.symbol("x").render(), simplified.render());
        }

        @Test
        @DisplayName("drops multiplicative one")
        void multiplicativeOne() {
            Expression simplified = evaluator.simplify(Expression.multiply(Expression.symbol("x"), Expression.number(1)));
            assertEquals(Expression.symbol("x").render(), simplified.render());
        }

        @Test
        @DisplayName("multiplication by zero collapses to zero")
        void multiplicativeZero() {
            assertEquals("0", evaluator.simplify(parse("x * y * 0")).render());
        }

        @Test
        @DisplayName("applies power identities")
        void powerIdentities() {
            assertEquals("x", evaluator.simplify(parse("x ^ 1")).render());
            assertEquals("1", evaluator.simplify(parse("x ^ 0")).render());
            assertEquals("1", evaluator.simplify(parse("1 ^ x")).render());
        }

        @Test
        @DisplayName("simplifies children before their parent")
        void bottomUp() {
            assertEquals("y", evaluator.simplify(parse("0 * x + y ^ 1")).render());
            assertEquals("x", evaluator.simplify(parse("x * (1 + 0)")).render());
        }

        @Test
        @DisplayName("does not fold constants or rewrite subtraction and division")
        void leavesOtherNodes() {
            assertEquals("2 + 3", evaluator.simplify(parse("2 + 3")).render());
            assertEquals("(x) - (0)", evaluator.simplify(parse("x - 0")).render());
            assertEquals("(x) / (1)", evaluator.simplify(parse("x / 1")).render());
            assertEquals("(x) - (y)", evaluator.simplify(parse("(x + 0) - y")).render());
        }

        @Test
        @DisplayName("returns the same instance when no rule applies")
        void sharesUnchangedTree() {
            Expression expression = parse("x + y * z");
            assertSame(expression, evaluator.simplify(expression));
        }
    }

    @Nested
    @DisplayName("substitute")
    class Substitute {

        @Test
        @DisplayName("replaces a symbol with another expression")
        void replacesSymbol() {
            Expression result = evaluator.substitute(parse("x + y"), Map.of("x", Expression.symbol("z")));
            assertEquals("z + y", result.render());
        }

        @Test
        @DisplayName("numbers become literals")
        void numberReplacement() {
            assertEquals("2 * 2", evaluator.substitute(parse("x * x"), Map.of("x", 2)).render());
        }

        @Test
        @DisplayName("replacements are not substituted again")
        void simultaneousReplacement() {
            Expression result = evaluator.substitute(parse("x - y"),
                    Map.of("x", Expression.symbol("y"), "y", Expression.symbol("x")));
            assertEquals("(y) - (x)", result.render());
        }

        @Test
        @DisplayName("keeps operator kinds and operand counts")
        void keepsStructure() {
            Expression result = evaluator.substitute(parse("x ^ 2 / x"), Map.of("x", parse("a + b")));
            Expression.Operator division = assertInstanceOf(Expression.Operator.class, result);
            assertEquals(OperatorKind.DIVIDE, division.kind());
            assertEquals("((a + b)^(2)) / (a + b)", result.render());
        }

        @Test
        @DisplayName("rejects a replacement that is neither expression nor number")
        void invalidReplacement() {
            BindingTypeException e = assertThrows(BindingTypeException.class,
                    () -> evaluator.substitute(parse("x + 1"), Map.of("x", "z")));
            assertEquals("x", e.getSymbol());
        }

        @Test
        @DisplayName("returns the same instance when no symbol is replaced")
        void sharesUnchangedTree() {
            Expression expression = parse("x + y");
            assertSame(expression, evaluator.substitute(expression, Map.of("w", 1)));
        }
    }
}
