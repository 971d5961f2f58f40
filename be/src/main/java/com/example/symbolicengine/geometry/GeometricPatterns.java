package com.example.symbolicengine.geometry;

import java.util.ArrayList;
import java.util.List;

/**
 * Point and line patterns: Fibonacci and golden spirals and a binary fractal tree.
 * <p>
 * Spirals turn a quarter turn per point, starting on the positive x axis. The tree grows upwards from the
 * origin; each branch splits into two children at {@code +angle} and {@code -angle}, each
 * {@link #BRANCH_SHRINK} times as long.
 * </p>
 */
public final class GeometricPatterns {

    public static final double BRANCH_SHRINK = 0.7;

    /** A tree of depth d has 2^d - 1 segments. */
    public static final int MAX_TREE_DEPTH = 16;

    /** phi^n overflows a double a little above n = 1470. */
    public static final int MAX_SPIRAL_POINTS = 1000;

    private static final double QUARTER_TURN = Math.PI / 2;

    private GeometricPatterns() {
    }

    /**
     * One point per Fibonacci term after {@code F(0)}: term {@code i} at distance {@code F(i) * scale}, angle
     * {@code (i - 1)} quarter turns. {@code n} terms give {@code n - 1} points.
     */
    public static List<Point> fibonacciSpiral(int n, double scale) {
        List<Long> sequence = Fibonacci.generate(n);
        List<Point> points = new ArrayList<>(Math.max(0, n - 1));
        double angle = 0;
        for (int i = 1; i < sequence.size(); i++) {
            points.add(polar(sequence.get(i) * scale, angle));
            angle += QUARTER_TURN;
        }
        return points;
    }

    /**
     * {@code n} points whose distance from the origin starts at {@code scale} and grows by phi per quarter turn.
     */
    public static List<Point> goldenSpiral(int n, double scale) {
        if (n < 0 || n > MAX_SPIRAL_POINTS) {
            throw new IllegalArgumentException("n must be between 0 and " + MAX_SPIRAL_POINTS);
        }
        List<Point> points = new ArrayList<>(n);
        double radius = 1;
        double angle = 0;
        for (int i = 0; i < n; i++) {
            points.add(polar(radius * scale, angle));
            radius *= GoldenRatio.VALUE;
            angle += QUARTER_TURN;
        }
        return points;
    }

    /**
     * Segments of a fractal tree in depth-first order: each branch is followed by its left subtree, then its
     * right subtree. Depth 0 gives no segments.
     */
    public static List<Segment> fractalTree(int depth, double length, double angleDegrees) {
        if (depth < 0 || depth > MAX_TREE_DEPTH) {
            throw new IllegalArgumentException("depth must be between 0 and " + MAX_TREE_DEPTH);
        }
        List<Segment> segments = new ArrayList<>((1 << depth) - 1);
        branch(Point.ORIGIN, Math.PI / 2, length, Math.toRadians(angleDegrees), depth, segments);
        return segments;
    }

    private static void branch(Point start, double direction, double length, double spread, int depth,
                               List<Segment> segments) {
        if (depth == 0) {
            return;
        }
        Point end = new Point(start.x() + length * Math.cos(direction), start.y() + length * Math.sin(direction));
        segments.add(new Segment(start, end));
        double childLength = length * BRANCH_SHRINK;
        branch(end, direction + spread, childLength, spread, depth - 1, segments);
        branch(end, direction - spread, childLength, spread, depth - 1, segments);
    }

    private static Point polar(double radius, double angle) {
        return new Point(radius * Math.cos(angle), radius * Math.sin(angle));
    }
}
