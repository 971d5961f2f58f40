package com.example.symbolicengine.geometry;

import com.example.symbolicengine.engine.Expression;

import java.util.ArrayList;
import java.util.List;

/**
 * Fibonacci sequences, numeric and symbolic, and the ratio of consecutive terms converging to phi.
 */
public final class Fibonacci {

    /** Largest term count whose last term still fits in a {@code long}. */
    public static final int MAX_TERMS = 93;

    /** Symbolic terms render with exponential length, so they are capped much lower. */
    public static final int MAX_SYMBOLIC_TERMS = 20;

    private Fibonacci() {
    }

    /**
     * First {@code n} terms starting at {@code 0, 1}.
     */
    public static List<Long> generate(int n) {
        checkCount(n);
        List<Long> sequence = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            sequence.add(i < 2 ? i : sequence.get(i - 1) + sequence.get(i - 2));
        }
        return sequence;
    }

    /**
     * First {@code n} terms over the symbols {@code F0} and {@code F1}: each further term is the sum
     * of the two before it, e.g. {@code F1 + F0}.
     */
    public static List<Expression> symbolicGenerate(int n) {
        checkCount(n);
        if (n > MAX_SYMBOLIC_TERMS) {
            throw new IllegalArgumentException("n must be at most " + MAX_SYMBOLIC_TERMS + " for symbolic terms");
        }
        List<Expression> sequence = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            if (i < 2) {
                sequence.add(Expression.symbol("F" + i));
            } else {
                sequence.add(Expression.add(sequence.get(i - 1), sequence.get(i - 2)));
            }
        }
        return sequence;
    }

    /**
     * Ratios {@code F(i+1) / F(i)} for {@code i} in {@code 1..n-1}.
     */
    public static List<Double> ratioConvergence(int n) {
        List<Long> sequence = generate(Math.min(n + 1, MAX_TERMS));
        List<Double> ratios = new ArrayList<>();
        for (int i = 1; i < n && i + 1 < sequence.size(); i++) {
            ratios.add((double) sequence.get(i + 1) / sequence.get(i));
        }
        return ratios;
    }

    private static void checkCount(int n) {
        if (n < 0) {
            throw new IllegalArgumentException("n must be non-negative.");
        }
        if (n > MAX_TERMS) {
            throw new IllegalArgumentException("n must be at most " + MAX_TERMS);
        }
    }
}
