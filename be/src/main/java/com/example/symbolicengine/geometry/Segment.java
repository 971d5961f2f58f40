package com.example.symbolicengine.geometry;

/**
 * A line segment between two points.
 */
public record Segment(Point start, Point end) {

    public double length() {
        return Math.hypot(end.x() - start.x(), end.y() - start.y());
    }
}
