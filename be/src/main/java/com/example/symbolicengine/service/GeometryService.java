package com.example.symbolicengine.service;

import com.example.symbolicengine.api.v1.dto.AngleResponse;
import com.example.symbolicengine.api.v1.dto.FibonacciResponse;
import com.example.symbolicengine.api.v1.dto.GoldenRatioResponse;
import com.example.symbolicengine.api.v1.dto.PointDto;
import com.example.symbolicengine.api.v1.dto.RotationResponse;
import com.example.symbolicengine.api.v1.dto.SegmentDto;
import com.example.symbolicengine.api.v1.dto.SolidResponse;
import com.example.symbolicengine.engine.Expression;
import com.example.symbolicengine.engine.ExpressionEngine;
import com.example.symbolicengine.geometry.Fibonacci;
import com.example.symbolicengine.geometry.GeometricPatterns;
import com.example.symbolicengine.geometry.GoldenRatio;
import com.example.symbolicengine.geometry.PlatonicSolid;
import com.example.symbolicengine.geometry.Point;
import com.example.symbolicengine.geometry.SacredAngle;
import com.example.symbolicengine.geometry.Segment;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import org.springframework.stereotype.Service;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Geometry for the REST layer: Platonic solids and the golden ratio evaluated through the engine, Fibonacci
 * sequences, named angles and generated patterns.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class GeometryService {

    private final ExpressionEngine engine;
    private final ExpressionService expressionService;

    public List<SolidResponse> listSolids() {
        return Arrays.stream(PlatonicSolid.values())
                .map(solid -> describe(solid, null))
                .toList();
    }

    /**
     * Describes one solid; when {@code edgeLength} is given, volume and surface area are evaluated for it.
     *
     * @throws IllegalArgumentException if the solid name is unknown or the edge length is not positive
     */
    public SolidResponse solid(String name, Double edgeLength) {
        PlatonicSolid solid = PlatonicSolid.fromName(name)
                .orElseThrow(() -> new IllegalArgumentException("Unknown solid: " + name));
        if (edgeLength != null && !(edgeLength > 0)) {
            throw new IllegalArgumentException("edgeLength must be positive");
        }
        log.debug("Describing solid={} edgeLength={}", solid, edgeLength);
        return describe(solid, edgeLength);
    }

    public FibonacciResponse fibonacci(int count) {
        List<Long> sequence = Fibonacci.generate(count);
        List<String> symbolic = count <= Fibonacci.MAX_SYMBOLIC_TERMS
                ? Fibonacci.symbolicGenerate(count).stream().map(Expression::render).toList()
                : null;
        return new FibonacciResponse(count, sequence, symbolic, Fibonacci.ratioConvergence(count));
    }

    /**
     * Builds {@code (a + b) / a} from two expressions and evaluates it; numeric inputs give a number.
     */
    public GoldenRatioResponse goldenRatio(String a, String b) {
        Expression ratio = GoldenRatio.ratio(expressionService.parseChecked(a), expressionService.parseChecked(b));
        log.debug("Golden ratio of a={} b={}", a, b);
        return new GoldenRatioResponse(ratio.render(), expressionService.evaluate(ratio, Map.of()));
    }

    public List<AngleResponse> listAngles() {
        return Arrays.stream(SacredAngle.values())
                .map(GeometryService::toAngle)
                .toList();
    }

    /**
     * Rotates a point by the named shape's angle around a center.
     *
     * @throws IllegalArgumentException if the shape is unknown
     */
    public RotationResponse rotate(String shape, Point point, Point center) {
        SacredAngle angle = SacredAngle.fromName(shape)
                .orElseThrow(() -> new IllegalArgumentException("Unknown shape: " + shape));
        Point rotated = angle.rotate(point, center);
        log.debug("Rotated {} by {} around {} to {}", point, angle, center, rotated);
        return new RotationResponse(toAngle(angle), toPoint(center), toPoint(point), toPoint(rotated));
    }

    public List<PointDto> fibonacciSpiral(int count, double scale) {
        return GeometricPatterns.fibonacciSpiral(count, scale).stream()
                .map(GeometryService::toPoint)
                .toList();
    }

    public List<PointDto> goldenSpiral(int count, double scale) {
        return GeometricPatterns.goldenSpiral(count, scale).stream()
                .map(GeometryService::toPoint)
                .toList();
    }

    public List<SegmentDto> fractalTree(int depth, double length, double angle) {
        List<Segment> segments = GeometricPatterns.fractalTree(depth, length, angle);
        log.debug("Fractal tree depth={} segments={}", depth, segments.size());
        return segments.stream()
                .map(segment -> new SegmentDto(toPoint(segment.start()), toPoint(segment.end())))
                .toList();
    }

    private static AngleResponse toAngle(SacredAngle angle) {
        return new AngleResponse(angle.name().toLowerCase(Locale.ROOT), angle.degrees(), angle.radians());
    }

    private static PointDto toPoint(Point point) {
        return new PointDto(point.x(), point.y());
    }

    private SolidResponse describe(PlatonicSolid solid, Double edgeLength) {
        Expression volume = solid.volume(engine);
        Expression surfaceArea = solid.surfaceArea(engine);
        Number volumeValue = null;
        Number surfaceAreaValue = null;
        if (edgeLength != null) {
            Map<String, Double> bindings = Map.of(PlatonicSolid.EDGE_SYMBOL, edgeLength);
            volumeValue = engine.evaluateToNumber(volume, bindings);
            surfaceAreaValue = engine.evaluateToNumber(surfaceArea, bindings);
        }
        return new SolidResponse(
                solid.name().toLowerCase(Locale.ROOT),
                solid.vertices(),
                solid.edges(),
                solid.faces(),
                volume.render(),
                surfaceArea.render(),
                edgeLength,
                volumeValue,
                surfaceAreaValue
        );
    }
}
