package com.example.symbolicengine.api.v1;

import com.example.symbolicengine.api.v1.dto.AngleResponse;
import com.example.symbolicengine.api.v1.dto.FibonacciResponse;
import com.example.symbolicengine.api.v1.dto.GoldenRatioResponse;
import com.example.symbolicengine.api.v1.dto.PointDto;
import com.example.symbolicengine.api.v1.dto.RotationResponse;
import com.example.symbolicengine.api.v1.dto.SegmentDto;
import com.example.symbolicengine.api.v1.dto.SolidResponse;
import com.example.symbolicengine.geometry.GeometryConstants;
import com.example.symbolicengine.geometry.Point;
import com.example.symbolicengine.service.GeometryService;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * Geometry endpoints: Platonic solids, named constants, Fibonacci sequences, the golden ratio, named angles
 * and point patterns.
 */
@RestController
@RequestMapping("/api/v1/geometry")
@RequiredArgsConstructor
@Slf4j
public class GeometryController {

    private final GeometryService service;

    @GetMapping("/solids")
    public ResponseEntity<List<SolidResponse>> solids() {
        log.debug("Listing Platonic solids");
        return ResponseEntity.ok(service.listSolids());
    }

    @GetMapping("/solids/{solid}")
    public ResponseEntity<SolidResponse> solid(@PathVariable String solid, @RequestParam(required = false) Double edgeLength) {
        log.info("Describing solid={} edgeLength={}", solid, edgeLength);
        return ResponseEntity.ok(service.solid(solid, edgeLength));
    }

    @GetMapping("/constants")
    public ResponseEntity<Map<String, Double>> constants() {
        return ResponseEntity.ok(GeometryConstants.bindings());
    }

    @GetMapping("/fibonacci")
    public ResponseEntity<FibonacciResponse> fibonacci(@RequestParam(defaultValue = "10") int count) {
        log.debug("Generating Fibonacci count={}", count);
        return ResponseEntity.ok(service.fibonacci(count));
    }

    @GetMapping("/golden-ratio")
    public ResponseEntity<GoldenRatioResponse> goldenRatio(@RequestParam String a, @RequestParam String b) {
        return ResponseEntity.ok(service.goldenRatio(a, b));
    }

    @GetMapping("/angles")
    public ResponseEntity<List<AngleResponse>> angles() {
        return ResponseEntity.ok(service.listAngles());
    }

    @GetMapping("/angles/{shape}/rotate")
    public ResponseEntity<RotationResponse> rotate(
            @PathVariable String shape,
            @RequestParam double x,
            @RequestParam double y,
            @RequestParam(defaultValue = "0") double cx,
            @RequestParam(defaultValue = "0") double cy) {
        return ResponseEntity.ok(service.rotate(shape, new Point(x, y), new Point(cx, cy)));
    }

    @GetMapping("/patterns/fibonacci-spiral")
    public ResponseEntity<List<PointDto>> fibonacciSpiral(
            @RequestParam(defaultValue = "10") int count,
            @RequestParam(defaultValue = "1") double scale) {
        return ResponseEntity.ok(service.fibonacciSpiral(count, scale));
    }

    @GetMapping("/patterns/golden-spiral")
    public ResponseEntity<List<PointDto>> goldenSpiral(
            @RequestParam(defaultValue = "10") int count,
            @RequestParam(defaultValue = "1") double scale) {
        return ResponseEntity.ok(service.goldenSpiral(count, scale));
    }

    @GetMapping("/patterns/fractal-tree")
    public ResponseEntity<List<SegmentDto>> fractalTree(
            @RequestParam(defaultValue = "5") int depth,
            @RequestParam(defaultValue = "100") double length,
            @RequestParam(defaultValue = "25") double angle) {
        log.debug("Generating fractal tree depth={} length={} angle={}", depth, length, angle);
        return ResponseEntity.ok(service.fractalTree(depth, length, angle));
    }
}
