package com.example.symbolicengine.geometry;

import java.util.Map;

/**
 * Constants used by the geometry formulas, also available as evaluation bindings.
 */
public final class GeometryConstants {

    public static final double PHI = (1 + Math.sqrt(5)) / 2;
    public static final double PI = Math.PI;
    public static final double E = Math.E;
    public static final double SQRT_2 = Math.sqrt(2);
    public static final double SQRT_3 = Math.sqrt(3);
    public static final double SQRT_5 = Math.sqrt(5);

    private static final Map<String, Double> BINDINGS = Map.of(
            "phi", PHI,
            "pi", PI,
            "e", E,
            "sqrt2", SQRT_2,
            "sqrt3", SQRT_3,
            "sqrt5", SQRT_5
    );

    private GeometryConstants() {
    }

    /**
     * Symbol name to value, e.g. {@code phi}, {@code pi}, {@code sqrt5}.
     */
    public static Map<String, Double> bindings() {
        return BINDINGS;
    }
}
