package com.example.symbolicengine.geometry;

import java.util.Locale;
import java.util.Optional;

/**
 * Characteristic angles of regular figures, in degrees.
 */
public enum SacredAngle {
    PENTAGON(72),
    PENTAGRAM(36),
    HEXAGON(60),
    OCTAGON(45),
    DECAGON(36);

    private final double degrees;

    SacredAngle(double degrees) {
        this.degrees = degrees;
    }

    public double degrees() {
        return degrees;
    }

    public double radians() {
        return Math.toRadians(degrees);
    }

    /**
     * Rotates {@code point} counter-clockwise by this angle around {@code center}.
     */
    public Point rotate(Point point, Point center) {
        return rotate(degrees, point, center);
    }

    /**
     * Rotates {@code point} counter-clockwise by {@code angleDegrees} around {@code center}.
     */
    public static Point rotate(double angleDegrees, Point point, Point center) {
        double radians = Math.toRadians(angleDegrees);
        double cos = Math.cos(radians);
        double sin = Math.sin(radians);
        double dx = point.x() - center.x();
        double dy = point.y() - center.y();
        return new Point(
                center.x() + dx * cos - dy * sin,
                center.y() + dx * sin + dy * cos
        );
    }

    public static Optional<SacredAngle> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(valueOf(name.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
