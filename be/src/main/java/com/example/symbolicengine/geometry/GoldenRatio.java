package com.example.symbolicengine.geometry;

import com.example.symbolicengine.engine.Expression;

import java.util.List;

/**
 * Golden ratio calculations, numeric and symbolic.
 */
public final class GoldenRatio {

    public static final double VALUE = GeometryConstants.PHI;

    private GoldenRatio() {
    }

    /**
     * {@code (a + b) / a}, which equals phi exactly when {@code a / b} does. Infinite when {@code a} is zero.
     */
    public static double ratio(double a, double b) {
        return a != 0 ? (a + b) / a : Double.POSITIVE_INFINITY;
    }

    /**
     * The same ratio as an expression tree {@code (a + b) / a}; nothing is evaluated.
     */
    public static Expression ratio(Expression a, Expression b) {
        return Expression.divide(Expression.add(a, b), a);
    }

    /**
     * Approximates phi by {@code F(n) / F(n-1)}. Infinite for {@code n = 1}, where the divisor is {@code F(0) = 0}.
     *
     * @throws IllegalArgumentException if {@code n} is below 1 or above {@link Fibonacci#MAX_TERMS} - 1
     */
    public static double nthFibonacciRatio(int n) {
        if (n < 1 || n >= Fibonacci.MAX_TERMS) {
            throw new IllegalArgumentException("n must be between 1 and " + (Fibonacci.MAX_TERMS - 1));
        }
        List<Long> sequence = Fibonacci.generate(n + 1);
        long divisor = sequence.get(n - 1);
        return divisor != 0 ? (double) sequence.get(n) / divisor : Double.POSITIVE_INFINITY;
    }

    /**
     * Scales a point away from the origin by {@code phi * scale}.
     */
    public static Point transform(Point point, double scale) {
        return point.scale(VALUE * scale);
    }
}
