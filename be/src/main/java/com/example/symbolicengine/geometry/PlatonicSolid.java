package com.example.symbolicengine.geometry;

import com.example.symbolicengine.engine.Expression;
import com.example.symbolicengine.engine.ExpressionEngine;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * The five Platonic solids with their vertex, edge and face counts and their volume and surface-area
 * formulas over the edge length {@value #EDGE_SYMBOL}.
 */
public enum PlatonicSolid {
    TETRAHEDRON(4, 6, 4, "2^0.5 / 12 * a^3", "3^0.5 * a^2"),
    CUBE(8, 12, 6, "a^3", "6 * a^2"),
    OCTAHEDRON(6, 12, 8, "2^0.5 / 3 * a^3", "2 * 3^0.5 * a^2"),
    DODECAHEDRON(20, 30, 12, "(15 + 7 * 5^0.5) / 4 * a^3", "3 * (25 + 10 * 5^0.5)^0.5 * a^2"),
    ICOSAHEDRON(12, 30, 20, "5 * (3 + 5^0.5) / 12 * a^3", "5 * 3^0.5 * a^2");

    public static final String EDGE_SYMBOL = "a";

    private final int vertices;
    private final int edges;
    private final int faces;
    private final String volumeFormula;
    private final String surfaceAreaFormula;

    PlatonicSolid(int vertices, int edges, int faces, String volumeFormula, String surfaceAreaFormula) {
        this.vertices = vertices;
        this.edges = edges;
        this.faces = faces;
        this.volumeFormula = volumeFormula;
        this.surfaceAreaFormula = surfaceAreaFormula;
    }

    public int vertices() {
        return vertices;
    }

    public int edges() {
        return edges;
    }

    public int faces() {
        return faces;
    }

    public String volumeFormula() {
        return volumeFormula;
    }

    public String surfaceAreaFormula() {
        return surfaceAreaFormula;
    }

    public Expression volume(ExpressionEngine engine) {
        return engine.parse(volumeFormula);
    }

    public Expression surfaceArea(ExpressionEngine engine) {
        return engine.parse(surfaceAreaFormula);
    }

    /**
     * Volume of a solid scaled by {@code factor}: the edge symbol is replaced by {@code a * factor}.
     */
    public Expression scaledVolume(ExpressionEngine engine, Expression factor) {
        Expression scaledEdge = Expression.multiply(Expression.symbol(EDGE_SYMBOL), factor);
        return engine.substitute(volume(engine), Map.of(EDGE_SYMBOL, scaledEdge));
    }

    public static Optional<PlatonicSolid> fromName(String name) {
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
