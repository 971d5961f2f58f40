package com.example.symbolicengine.geometry;

import com.example.symbolicengine.engine.Expression;
import com.example.symbolicengine.engine.ExpressionEngine;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

@DisplayName("GoldenRatio")
class GoldenRatioTest {

    @Test
    @DisplayName("numeric ratio (a + b) / a is phi for a golden split and infinite for a = 0")
    void numericRatio() {
        assertEquals(GoldenRatio.VALUE, GoldenRatio.ratio(1, GoldenRatio.VALUE - 1), 1e-15);
        assertEquals(2.0, GoldenRatio.ratio(3, 3));
        assertEquals(Double.POSITIVE_INFINITY, GoldenRatio.ratio(0, 1));
    }

    @Test
    @DisplayName("symbolic ratio builds a division tree that the engine evaluates")
    void symbolicRatio() {
        Expression ratio = GoldenRatio.ratio(Expression.symbol("a"), Expression.symbol("b"));
        assertEquals("(a + b) / (a)", ratio.render());

        ExpressionEngine engine = new ExpressionEngine();
        assertEquals(Double.valueOf(2.0), engine.evaluateToNumber(ratio, Map.of("a", 1, "b", 1)));
        assertEquals("(2 + b) / (2)", engine.evaluate(ratio, Map.of("a", 2)).render());
    }

    @Test
    @DisplayName("Fibonacci ratios approach phi")
    void nthFibonacciRatio() {
        assertEquals(Double.POSITIVE_INFINITY, GoldenRatio.nthFibonacciRatio(1));
        assertEquals(1.0, GoldenRatio.nthFibonacciRatio(2));
        assertEquals(2.0, GoldenRatio.nthFibonacciRatio(3));
        assertEquals(GoldenRatio.VALUE, GoldenRatio.nthFibonacciRatio(40), 1e-12);
        assertThrows(IllegalArgumentException.class, () -> GoldenRatio.nthFibonacciRatio(0));
        assertThrows(IllegalArgumentException.class, () -> GoldenRatio.nthFibonacciRatio(Fibonacci.MAX_TERMS));
    }

    @Test
    @DisplayName("transform scales a point by phi times the factor")
    void transform() {
        Point scaled = GoldenRatio.transform(new Point(1, 2), 2);
        assertEquals(2 * GoldenRatio.VALUE, scaled.x(), 1e-12);
        assertEquals(4 * GoldenRatio.VALUE, scaled.y(), 1e-12);
    }
}
