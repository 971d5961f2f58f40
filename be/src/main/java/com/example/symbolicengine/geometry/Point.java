package com.example.symbolicengine.geometry;

/**
 * A point in the plane.
 */
public record Point(double x, double y) {

    public static final Point ORIGIN = new Point(0, 0);

    public Point scale(double factor) {
        return new Point(x * factor, y * factor);
    }
}
